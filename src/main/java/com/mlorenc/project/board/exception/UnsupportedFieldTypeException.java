package com.mlorenc.project.board.exception;

public class UnsupportedFieldTypeException extends BoardException {

    private final String fieldName;
    private final String dataType;

    public UnsupportedFieldTypeException(String fieldName, String dataType) {
        super(ErrorKind.UNSUPPORTED_FIELD_TYPE,
                "Unsupported field type " + dataType + " for field '" + fieldName + "'");
        this.fieldName = fieldName;
        this.dataType = dataType;
    }

    public String fieldName() {
        return fieldName;
    }

    public String dataType() {
        return dataType;
    }
}
