package com.mlorenc.project.board.model;

/**
 * Outcome of a single-item set or clear. {@code value} is null for clears.
 */
public record FieldUpdate(String projectId,
                          String itemId,
                          String fieldId,
                          String fieldName,
                          FieldValue value,
                          boolean dryRun) {
}
