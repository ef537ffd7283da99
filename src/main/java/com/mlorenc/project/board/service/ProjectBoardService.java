package com.mlorenc.project.board.service;

import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.BatchReport;
import com.mlorenc.project.board.model.BulkRow;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.FieldUpdate;
import com.mlorenc.project.board.model.FieldValue;
import com.mlorenc.project.board.model.ItemValues;
import com.mlorenc.project.board.model.OptionMatch;
import com.mlorenc.project.board.model.ProjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Project-level operations addressed by owner and number. Each call resolves the project id
 * first and reads field metadata fresh.
 */
@Service
public class ProjectBoardService {

    private static final Logger log = LoggerFactory.getLogger(ProjectBoardService.class);

    private final ProjectFieldResolver resolver;
    private final FieldValueMutator mutator;
    private final ItemFieldValueService itemValues;
    private final FieldSchemaService schema;
    private final BulkUpdateService bulk;

    public ProjectBoardService(ProjectFieldResolver resolver,
                               FieldValueMutator mutator,
                               ItemFieldValueService itemValues,
                               FieldSchemaService schema,
                               BulkUpdateService bulk) {
        this.resolver = resolver;
        this.mutator = mutator;
        this.itemValues = itemValues;
        this.schema = schema;
        this.bulk = bulk;
    }

    public List<FieldMetadata> listFields(ProjectRef project) {
        return resolver.listFields(resolver.resolveProject(project));
    }

    public FieldMetadata fieldDetails(ProjectRef project, String fieldName) {
        return resolver.resolveField(resolver.resolveProject(project), fieldName);
    }

    public OptionMatch findOption(ProjectRef project, String fieldName, String optionName) {
        FieldMetadata field = fieldDetails(project, fieldName);
        String id = resolver.resolveOption(field, optionName);
        return new OptionMatch(field.id(), field.name(), field.dataType().orElse(null), optionName, id);
    }

    /**
     * Sets a field by name. In a dry run the value is validated and resolved but not written.
     */
    public FieldUpdate setField(ProjectRef project, String itemId, String fieldName, String rawValue, boolean dryRun) {
        requireItemId(itemId);
        String projectId = resolver.resolveProject(project);
        FieldMetadata field = resolver.resolveField(projectId, fieldName);
        FieldValue value = mutator.prepare(field, rawValue);
        if (dryRun) {
            log.atInfo().addKeyValue("event", "board.field.would_update")
                    .addKeyValue("projectId", projectId)
                    .addKeyValue("itemId", itemId)
                    .addKeyValue("field", field.name())
                    .log("Dry run, field not updated");
        } else {
            mutator.apply(projectId, itemId, field, value);
        }
        return new FieldUpdate(projectId, itemId, field.id(), field.name(), value, dryRun);
    }

    public FieldUpdate setSingleSelectById(ProjectRef project, String itemId, String fieldId, String optionId) {
        requireItemId(itemId);
        String projectId = resolver.resolveProject(project);
        mutator.setSingleSelectById(projectId, itemId, fieldId, optionId);
        return new FieldUpdate(projectId, itemId, fieldId, null, new FieldValue.SingleSelectValue(optionId, null), false);
    }

    public FieldUpdate clearField(ProjectRef project, String itemId, String fieldName, boolean dryRun) {
        requireItemId(itemId);
        String projectId = resolver.resolveProject(project);
        FieldMetadata field = resolver.resolveField(projectId, fieldName);
        if (!dryRun) {
            mutator.clearField(projectId, itemId, field);
        }
        return new FieldUpdate(projectId, itemId, field.id(), field.name(), null, dryRun);
    }

    public ItemValues readItemValues(String itemId) {
        requireItemId(itemId);
        return itemValues.readValues(itemId);
    }

    public BatchReport bulkUpdate(ProjectRef project, List<BulkRow> rows, boolean dryRun) {
        String projectId = resolver.resolveProject(project);
        return bulk.processBatch(projectId, project.owner(), rows, dryRun);
    }

    public FieldMetadata createField(ProjectRef project, String name, String dataType, List<String> options) {
        FieldDataType type = FieldDataType.fromWire(dataType == null ? null : dataType.strip().toUpperCase(Locale.ROOT))
                .orElseThrow(() -> new ValidationException("Unknown field data type %s", dataType));
        return schema.createField(resolver.resolveProject(project), name, type, options);
    }

    public FieldMetadata.Option addSelectOption(ProjectRef project, String fieldName, String optionName, String color) {
        return schema.addSelectOption(resolver.resolveProject(project), fieldName, optionName, color);
    }

    public String deleteField(ProjectRef project, String fieldName) {
        return schema.deleteField(resolver.resolveProject(project), fieldName);
    }

    private static void requireItemId(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            throw new ValidationException("Item id is required");
        }
    }
}
