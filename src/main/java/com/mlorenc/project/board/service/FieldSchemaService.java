package com.mlorenc.project.board.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.core.GraphQlRequest;
import com.mlorenc.project.board.core.RemoteCallExecutor;
import com.mlorenc.project.board.exception.RemoteLogicalException;
import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Creates, extends and deletes project fields.
 */
@Service
public class FieldSchemaService {

    private static final Logger log = LoggerFactory.getLogger(FieldSchemaService.class);

    static final String DEFAULT_OPTION_COLOR = "GRAY";
    private static final Set<String> OPTION_COLORS =
            Set.of("GRAY", "BLUE", "GREEN", "YELLOW", "ORANGE", "RED", "PINK", "PURPLE");

    static final String CREATE_FIELD_MUTATION = """
            mutation($projectId: ID!, $name: String!, $dataType: ProjectV2CustomFieldType!,
                     $options: [ProjectV2SingleSelectFieldOptionInput!]) {
              createProjectV2Field(input: {
                projectId: $projectId
                name: $name
                dataType: $dataType
                singleSelectOptions: $options
              }) {
                projectV2Field {
            %s
                }
              }
            }
            """.formatted(FieldNodes.FIELD_SELECTION);

    static final String UPDATE_OPTIONS_MUTATION = """
            mutation($fieldId: ID!, $options: [ProjectV2SingleSelectFieldOptionInput!]) {
              updateProjectV2Field(input: { fieldId: $fieldId, singleSelectOptions: $options }) {
                projectV2Field {
            %s
                }
              }
            }
            """.formatted(FieldNodes.FIELD_SELECTION);

    static final String DELETE_FIELD_MUTATION = """
            mutation($fieldId: ID!) {
              deleteProjectV2Field(input: { fieldId: $fieldId }) {
                projectV2Field {
                  ... on ProjectV2Field { id name }
                  ... on ProjectV2SingleSelectField { id name }
                  ... on ProjectV2IterationField { id name }
                }
              }
            }
            """;

    private final ProjectFieldResolver resolver;
    private final RemoteCallExecutor executor;

    public FieldSchemaService(ProjectFieldResolver resolver, RemoteCallExecutor executor) {
        this.resolver = resolver;
        this.executor = executor;
    }

    public FieldMetadata createField(String projectId, String name, FieldDataType dataType, List<String> options) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Field name is required");
        }
        List<String> optionNames = options == null ? List.of() : options.stream()
                .map(String::strip)
                .filter(option -> !option.isEmpty())
                .toList();
        if (dataType == FieldDataType.SINGLE_SELECT && optionNames.isEmpty()) {
            throw new ValidationException("Single select field '%s' needs at least one option", name);
        }
        if (dataType != FieldDataType.SINGLE_SELECT && !optionNames.isEmpty()) {
            throw new ValidationException("Only single select fields take options, '%s' is %s", name, dataType);
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("projectId", projectId);
        variables.put("name", name.strip());
        variables.put("dataType", dataType.name());
        variables.put("options", optionNames.isEmpty() ? null : optionNames.stream()
                .map(option -> optionInput(option, DEFAULT_OPTION_COLOR, option))
                .toList());

        JsonNode data = executor.execute(GraphQlRequest.of("createField", CREATE_FIELD_MUTATION, variables)).getOrThrow();
        FieldMetadata created = FieldNodes.toFieldMetadata(data.path("createProjectV2Field").path("projectV2Field"))
                .orElseThrow(() -> new RemoteLogicalException("createField", List.of("No field returned for '" + name + "'"), List.of()));

        log.atInfo().addKeyValue("event", "board.schema.field.created")
                .addKeyValue("projectId", projectId)
                .addKeyValue("field", created.name())
                .addKeyValue("fieldId", created.id())
                .addKeyValue("dataType", dataType)
                .log("Created project field");
        return created;
    }

    /**
     * Adds an option to a single-select field. The remote replaces the whole option list, so
     * the existing options are sent along with the new one.
     */
    public FieldMetadata.Option addSelectOption(String projectId, String fieldName, String optionName, String color) {
        if (optionName == null || optionName.isBlank()) {
            throw new ValidationException("Option name is required");
        }
        String optionColor = color == null || color.isBlank() ? DEFAULT_OPTION_COLOR : color.strip().toUpperCase(Locale.ROOT);
        if (!OPTION_COLORS.contains(optionColor)) {
            throw new ValidationException("Unknown option color %s, expected one of %s", optionColor, OPTION_COLORS);
        }

        FieldMetadata field = resolver.resolveField(projectId, fieldName);
        if (field.dataType().orElse(null) != FieldDataType.SINGLE_SELECT) {
            throw new ValidationException("Field '%s' is %s, options can only be added to SINGLE_SELECT fields",
                    fieldName, field.rawDataType());
        }
        String name = optionName.strip();
        if (field.options().stream().anyMatch(option -> name.equals(option.name()))) {
            throw new ValidationException("Option '%s' already exists in field '%s'", name, fieldName);
        }

        List<Map<String, Object>> options = new ArrayList<>();
        for (FieldMetadata.Option existing : field.options()) {
            options.add(optionInput(existing.name(),
                    existing.color() == null ? DEFAULT_OPTION_COLOR : existing.color(),
                    existing.description() == null ? "" : existing.description()));
        }
        options.add(optionInput(name, optionColor, name));

        Map<String, Object> variables = Map.of("fieldId", field.id(), "options", options);
        JsonNode data = executor.execute(GraphQlRequest.of("addSelectOption", UPDATE_OPTIONS_MUTATION, variables)).getOrThrow();
        FieldMetadata updated = FieldNodes.toFieldMetadata(data.path("updateProjectV2Field").path("projectV2Field"))
                .orElseThrow(() -> new RemoteLogicalException("addSelectOption", List.of("No field returned for '" + fieldName + "'"), List.of()));
        FieldMetadata.Option added = resolver.resolveSelectOption(updated, name);

        log.atInfo().addKeyValue("event", "board.schema.option.added")
                .addKeyValue("projectId", projectId)
                .addKeyValue("field", fieldName)
                .addKeyValue("option", name)
                .addKeyValue("optionId", added.id())
                .log("Added single select option");
        return added;
    }

    public String deleteField(String projectId, String fieldName) {
        FieldMetadata field = resolver.resolveField(projectId, fieldName);
        JsonNode data = executor.execute(GraphQlRequest.of("deleteField", DELETE_FIELD_MUTATION, Map.of("fieldId", field.id())))
                .getOrThrow();
        String deletedId = FieldNodes.text(data.path("deleteProjectV2Field").path("projectV2Field").path("id"));
        if (deletedId == null) {
            throw new RemoteLogicalException("deleteField", List.of("No field id returned for '" + fieldName + "'"), List.of());
        }

        log.atInfo().addKeyValue("event", "board.schema.field.deleted")
                .addKeyValue("projectId", projectId)
                .addKeyValue("field", fieldName)
                .addKeyValue("fieldId", deletedId)
                .log("Deleted project field");
        return deletedId;
    }

    private static Map<String, Object> optionInput(String name, String color, String description) {
        return Map.of("name", name, "color", color, "description", description);
    }
}
