package com.mlorenc.project.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

public record FieldMetadata(String id,
                            String name,
                            @JsonProperty("dataType") String rawDataType,
                            List<Option> options,
                            List<Iteration> activeIterations,
                            List<Iteration> completedIterations) {

    public FieldMetadata {
        options = options == null ? List.of() : List.copyOf(options);
        activeIterations = activeIterations == null ? List.of() : List.copyOf(activeIterations);
        completedIterations = completedIterations == null ? List.of() : List.copyOf(completedIterations);
    }

    public static FieldMetadata simple(String id, String name, String rawDataType) {
        return new FieldMetadata(id, name, rawDataType, List.of(), List.of(), List.of());
    }

    public Optional<FieldDataType> dataType() {
        return FieldDataType.fromWire(rawDataType);
    }

    public record Option(String id, String name, String color, String description) {
    }

    public record Iteration(String id, String title, String startDate, int duration) {
    }
}
