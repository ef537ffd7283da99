package com.mlorenc.project.board.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.model.FieldMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Selection set and mapping for {@code ProjectV2FieldConfiguration} nodes, shared by the
 * field list query and the field schema mutations.
 */
final class FieldNodes {

    static final String FIELD_SELECTION = """
            ... on ProjectV2Field { id name dataType }
            ... on ProjectV2SingleSelectField {
              id name dataType
              options { id name color description }
            }
            ... on ProjectV2IterationField {
              id name dataType
              configuration {
                iterations { id title startDate duration }
                completedIterations { id title startDate duration }
              }
            }
            """;

    private FieldNodes() {
    }

    static Optional<FieldMetadata> toFieldMetadata(JsonNode node) {
        String id = text(node.path("id"));
        String name = text(node.path("name"));
        if (id == null || name == null) {
            return Optional.empty();
        }

        List<FieldMetadata.Option> options = new ArrayList<>();
        for (JsonNode option : node.path("options")) {
            options.add(new FieldMetadata.Option(
                    text(option.path("id")),
                    text(option.path("name")),
                    text(option.path("color")),
                    text(option.path("description"))));
        }

        JsonNode configuration = node.path("configuration");
        return Optional.of(new FieldMetadata(id, name, text(node.path("dataType")), options,
                iterations(configuration.path("iterations")),
                iterations(configuration.path("completedIterations"))));
    }

    static String text(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static List<FieldMetadata.Iteration> iterations(JsonNode nodes) {
        List<FieldMetadata.Iteration> iterations = new ArrayList<>();
        for (JsonNode iteration : nodes) {
            iterations.add(new FieldMetadata.Iteration(
                    text(iteration.path("id")),
                    text(iteration.path("title")),
                    text(iteration.path("startDate")),
                    iteration.path("duration").asInt(0)));
        }
        return iterations;
    }
}
