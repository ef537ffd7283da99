package com.mlorenc.project.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ItemFieldValue(String fieldId, String fieldName, FieldValue value) {

    @JsonProperty("dataType")
    public FieldDataType dataType() {
        return value.dataType();
    }

    @JsonProperty("displayValue")
    public String displayValue() {
        return value.displayValue();
    }
}
