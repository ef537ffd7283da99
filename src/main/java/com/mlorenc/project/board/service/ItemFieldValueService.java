package com.mlorenc.project.board.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.core.CallResult;
import com.mlorenc.project.board.core.GraphQlRequest;
import com.mlorenc.project.board.core.RemoteCallExecutor;
import com.mlorenc.project.board.exception.NotFoundException;
import com.mlorenc.project.board.model.FieldValue;
import com.mlorenc.project.board.model.ItemFieldValue;
import com.mlorenc.project.board.model.ItemValues;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ItemFieldValueService {

    private static final String FIELD_REF = "field { ... on ProjectV2FieldCommon { id name } }";

    static final String ITEM_VALUES_QUERY = """
            query($itemId: ID!) {
              node(id: $itemId) {
                ... on ProjectV2Item {
                  id
                  content {
                    ... on Issue { title }
                    ... on PullRequest { title }
                    ... on DraftIssue { title }
                  }
                  fieldValues(first: 50) {
                    nodes {
                      __typename
                      ... on ProjectV2ItemFieldTextValue { text %1$s }
                      ... on ProjectV2ItemFieldNumberValue { number %1$s }
                      ... on ProjectV2ItemFieldDateValue { date %1$s }
                      ... on ProjectV2ItemFieldSingleSelectValue { optionId name %1$s }
                      ... on ProjectV2ItemFieldIterationValue { iterationId title startDate duration %1$s }
                    }
                  }
                }
              }
            }
            """.formatted(FIELD_REF);

    private final RemoteCallExecutor executor;

    public ItemFieldValueService(RemoteCallExecutor executor) {
        this.executor = executor;
    }

    /**
     * Values currently set on an item. Value kinds other than the five editable ones are skipped.
     */
    public ItemValues readValues(String itemId) {
        CallResult result = executor.execute(GraphQlRequest.of("readItemFieldValues", ITEM_VALUES_QUERY, Map.of("itemId", itemId)));
        if (result.isNotFound()) {
            throw new NotFoundException("Item %s not found or not accessible", itemId);
        }
        JsonNode item = result.getOrThrow().path("node");
        if (!item.isObject() || FieldNodes.text(item.path("id")) == null) {
            throw new NotFoundException("Item %s not found or not accessible", itemId);
        }

        List<ItemFieldValue> values = new ArrayList<>();
        for (JsonNode node : item.path("fieldValues").path("nodes")) {
            toItemFieldValue(node).ifPresent(values::add);
        }
        return new ItemValues(itemId, FieldNodes.text(item.path("content").path("title")), values);
    }

    static Optional<ItemFieldValue> toItemFieldValue(JsonNode node) {
        String fieldId = FieldNodes.text(node.path("field").path("id"));
        String fieldName = FieldNodes.text(node.path("field").path("name"));
        if (fieldId == null) {
            return Optional.empty();
        }
        FieldValue value = switch (node.path("__typename").asText("")) {
            case "ProjectV2ItemFieldTextValue" -> new FieldValue.TextValue(FieldNodes.text(node.path("text")));
            case "ProjectV2ItemFieldNumberValue" -> new FieldValue.NumberValue(node.path("number").asDouble());
            case "ProjectV2ItemFieldDateValue" -> new FieldValue.DateValue(FieldNodes.text(node.path("date")));
            case "ProjectV2ItemFieldSingleSelectValue" -> new FieldValue.SingleSelectValue(
                    FieldNodes.text(node.path("optionId")), FieldNodes.text(node.path("name")));
            case "ProjectV2ItemFieldIterationValue" -> new FieldValue.IterationValue(
                    FieldNodes.text(node.path("iterationId")), FieldNodes.text(node.path("title")),
                    FieldNodes.text(node.path("startDate")), node.path("duration").asInt(0));
            default -> null;
        };
        return value == null ? Optional.empty() : Optional.of(new ItemFieldValue(fieldId, fieldName, value));
    }
}
