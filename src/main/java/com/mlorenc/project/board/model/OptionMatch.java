package com.mlorenc.project.board.model;

/**
 * Identifier found for an option or iteration name inside a field.
 */
public record OptionMatch(String fieldId, String fieldName, FieldDataType dataType, String name, String id) {
}
