package com.mlorenc.project.board.model;

/**
 * One {@code item_id,field_name,value} line of a bulk update.
 */
public record BulkRow(long rowNumber, String itemId, String fieldName, String value) {

    public boolean isSkippable() {
        return itemId == null || itemId.isBlank() || itemId.strip().startsWith("#");
    }

    public BulkRow normalized() {
        return new BulkRow(rowNumber, clean(itemId), clean(fieldName), clean(value));
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.strip();
        if (cleaned.startsWith("\"")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned.strip();
    }
}
