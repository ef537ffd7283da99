package com.mlorenc.project.board.model;

import java.util.Map;

/**
 * A single typed field value. Each variant belongs to exactly one {@link FieldDataType}
 * and renders the matching {@code ProjectV2FieldValue} input object.
 */
public sealed interface FieldValue permits FieldValue.TextValue,
        FieldValue.NumberValue,
        FieldValue.DateValue,
        FieldValue.SingleSelectValue,
        FieldValue.IterationValue {

    FieldDataType dataType();

    Map<String, Object> mutationInput();

    String displayValue();

    record TextValue(String text) implements FieldValue {
        @Override
        public FieldDataType dataType() {
            return FieldDataType.TEXT;
        }

        @Override
        public Map<String, Object> mutationInput() {
            return Map.of("text", text);
        }

        @Override
        public String displayValue() {
            return text;
        }
    }

    record NumberValue(double number) implements FieldValue {
        @Override
        public FieldDataType dataType() {
            return FieldDataType.NUMBER;
        }

        @Override
        public Map<String, Object> mutationInput() {
            return Map.of("number", number);
        }

        @Override
        public String displayValue() {
            return number == Math.rint(number) && !Double.isInfinite(number)
                    ? String.valueOf((long) number)
                    : String.valueOf(number);
        }
    }

    record DateValue(String date) implements FieldValue {
        @Override
        public FieldDataType dataType() {
            return FieldDataType.DATE;
        }

        @Override
        public Map<String, Object> mutationInput() {
            return Map.of("date", date);
        }

        @Override
        public String displayValue() {
            return date;
        }
    }

    record SingleSelectValue(String optionId, String name) implements FieldValue {
        @Override
        public FieldDataType dataType() {
            return FieldDataType.SINGLE_SELECT;
        }

        @Override
        public Map<String, Object> mutationInput() {
            return Map.of("singleSelectOptionId", optionId);
        }

        @Override
        public String displayValue() {
            return name;
        }
    }

    record IterationValue(String iterationId, String title, String startDate, int duration) implements FieldValue {
        @Override
        public FieldDataType dataType() {
            return FieldDataType.ITERATION;
        }

        @Override
        public Map<String, Object> mutationInput() {
            return Map.of("iterationId", iterationId);
        }

        @Override
        public String displayValue() {
            return title;
        }
    }
}
