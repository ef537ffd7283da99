package com.mlorenc.project.board.model;

import java.util.Optional;

/**
 * Field kinds that accept value updates. The remote schema has more (assignees, labels,
 * milestones, ...); those stay as raw strings on {@link FieldMetadata}.
 */
public enum FieldDataType {
    TEXT,
    NUMBER,
    DATE,
    SINGLE_SELECT,
    ITERATION;

    public static Optional<FieldDataType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FieldDataType type : values()) {
            if (type.name().equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
