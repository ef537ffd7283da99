package com.mlorenc.project.board.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.core.CallResult;
import com.mlorenc.project.board.core.GraphQlRequest;
import com.mlorenc.project.board.core.RemoteCallExecutor;
import com.mlorenc.project.board.exception.NotFoundException;
import com.mlorenc.project.board.exception.RemoteLogicalException;
import com.mlorenc.project.board.exception.UnsupportedFieldTypeException;
import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates raw values against a field's type and issues the matching update or clear mutation.
 */
@Service
public class FieldValueMutator {

    private static final Logger log = LoggerFactory.getLogger(FieldValueMutator.class);

    private static final Pattern NUMBER_PATTERN = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    static final String UPDATE_MUTATION = """
            mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!, $value: ProjectV2FieldValue!) {
              updateProjectV2ItemFieldValue(input: {
                projectId: $projectId
                itemId: $itemId
                fieldId: $fieldId
                value: $value
              }) {
                projectV2Item { id }
              }
            }
            """;

    static final String CLEAR_MUTATION = """
            mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!) {
              clearProjectV2ItemFieldValue(input: {
                projectId: $projectId
                itemId: $itemId
                fieldId: $fieldId
              }) {
                projectV2Item { id }
              }
            }
            """;

    private final ProjectFieldResolver resolver;
    private final RemoteCallExecutor executor;

    public FieldValueMutator(ProjectFieldResolver resolver, RemoteCallExecutor executor) {
        this.resolver = resolver;
        this.executor = executor;
    }

    /**
     * Validates {@code rawValue} for the field and resolves option or iteration names.
     * Issues no mutation.
     */
    public FieldValue prepare(FieldMetadata field, String rawValue) {
        String value = rawValue == null ? "" : rawValue;
        FieldDataType type = supportedType(field);
        return switch (type) {
            case TEXT -> new FieldValue.TextValue(value);
            case NUMBER -> {
                if (!NUMBER_PATTERN.matcher(value).matches()) {
                    throw new ValidationException("Invalid number format for field '%s': '%s'", field.name(), value);
                }
                double number = Double.parseDouble(value);
                if (Double.isInfinite(number)) {
                    throw new ValidationException("Number out of range for field '%s': '%s'", field.name(), value);
                }
                yield new FieldValue.NumberValue(number);
            }
            case DATE -> {
                if (!DATE_PATTERN.matcher(value).matches()) {
                    throw new ValidationException("Invalid date format for field '%s': '%s' (expected YYYY-MM-DD)",
                            field.name(), value);
                }
                yield new FieldValue.DateValue(value);
            }
            case SINGLE_SELECT -> {
                FieldMetadata.Option option = resolver.resolveSelectOption(field, value);
                yield new FieldValue.SingleSelectValue(option.id(), option.name());
            }
            case ITERATION -> {
                FieldMetadata.Iteration iteration = resolver.resolveIteration(field, value);
                yield new FieldValue.IterationValue(iteration.id(), iteration.title(),
                        iteration.startDate(), iteration.duration());
            }
        };
    }

    public void apply(String projectId, String itemId, FieldMetadata field, FieldValue value) {
        FieldDataType type = supportedType(field);
        if (value.dataType() != type) {
            throw new ValidationException("Field '%s' is %s, cannot set a %s value",
                    field.name(), type, value.dataType());
        }
        update(projectId, itemId, field.id(), value.mutationInput());

        log.atInfo().addKeyValue("event", "board.field.updated")
                .addKeyValue("projectId", projectId)
                .addKeyValue("itemId", itemId)
                .addKeyValue("field", field.name())
                .addKeyValue("dataType", type)
                .log("Updated field value");
    }

    public FieldValue setField(String projectId, String itemId, FieldMetadata field, String rawValue) {
        FieldValue value = prepare(field, rawValue);
        apply(projectId, itemId, field, value);
        return value;
    }

    /**
     * Sets a single-select field addressed purely by ids, without resolution.
     */
    public void setSingleSelectById(String projectId, String itemId, String fieldId, String optionId) {
        if (fieldId == null || fieldId.isBlank() || optionId == null || optionId.isBlank()) {
            throw new ValidationException("Field id and option id are required");
        }
        update(projectId, itemId, fieldId, new FieldValue.SingleSelectValue(optionId, null).mutationInput());

        log.atInfo().addKeyValue("event", "board.field.updated_by_id")
                .addKeyValue("projectId", projectId)
                .addKeyValue("itemId", itemId)
                .addKeyValue("fieldId", fieldId)
                .addKeyValue("optionId", optionId)
                .log("Updated single-select field by id");
    }

    public void clearField(String projectId, String itemId, FieldMetadata field) {
        Map<String, Object> variables = Map.of("projectId", projectId, "itemId", itemId, "fieldId", field.id());
        CallResult result = executor.execute(GraphQlRequest.of("clearItemFieldValue", CLEAR_MUTATION, variables));
        requireItem(result, "clearProjectV2ItemFieldValue", itemId);

        log.atInfo().addKeyValue("event", "board.field.cleared")
                .addKeyValue("projectId", projectId)
                .addKeyValue("itemId", itemId)
                .addKeyValue("field", field.name())
                .log("Cleared field value");
    }

    private void update(String projectId, String itemId, String fieldId, Map<String, Object> input) {
        Map<String, Object> variables = Map.of(
                "projectId", projectId,
                "itemId", itemId,
                "fieldId", fieldId,
                "value", input);
        CallResult result = executor.execute(GraphQlRequest.of("updateItemFieldValue", UPDATE_MUTATION, variables));
        requireItem(result, "updateProjectV2ItemFieldValue", itemId);
    }

    private static void requireItem(CallResult result, String payloadField, String itemId) {
        if (result.isNotFound()) {
            throw new NotFoundException("Item %s not found: %s", itemId,
                    result.error().map(Throwable::getMessage).orElse(""));
        }
        JsonNode data = result.getOrThrow();
        String updatedId = FieldNodes.text(data.path(payloadField).path("projectV2Item").path("id"));
        if (updatedId == null || updatedId.isBlank()) {
            throw new RemoteLogicalException(payloadField, List.of("No item id returned for " + itemId), List.of());
        }
    }

    private static FieldDataType supportedType(FieldMetadata field) {
        return field.dataType()
                .orElseThrow(() -> new UnsupportedFieldTypeException(field.name(), field.rawDataType()));
    }
}
