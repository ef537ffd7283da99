package com.mlorenc.project.board.model;

import java.util.List;

public record ItemValues(String itemId, String title, List<ItemFieldValue> values) {

    public ItemValues {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
