package com.mlorenc.project.board.service;

import com.mlorenc.project.board.config.BoardProperties;
import com.mlorenc.project.board.core.Sleeper;
import com.mlorenc.project.board.exception.BoardException;
import com.mlorenc.project.board.exception.ErrorKind;
import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.BatchReport;
import com.mlorenc.project.board.model.BulkRow;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Applies bulk rows one by one, in input order. A failing row is recorded and the run moves on.
 */
@Service
public class BulkUpdateService {

    private static final Logger log = LoggerFactory.getLogger(BulkUpdateService.class);

    static final String NOT_ATTEMPTED = "Interrupted before attempt";

    private final ProjectFieldResolver resolver;
    private final FieldValueMutator mutator;
    private final Sleeper sleeper;
    private final Duration rowDelay;

    public BulkUpdateService(ProjectFieldResolver resolver,
                             FieldValueMutator mutator,
                             Sleeper sleeper,
                             BoardProperties properties) {
        this.resolver = resolver;
        this.mutator = mutator;
        this.sleeper = sleeper;
        this.rowDelay = properties.bulk().rowDelay();
    }

    public BatchReport processBatch(String projectId, String owner, List<BulkRow> rows, boolean dryRun) {
        FieldLookup fields = resolver.snapshot();
        BatchReport.Builder report = BatchReport.builder(dryRun);

        log.atInfo().addKeyValue("event", "board.bulk.started")
                .addKeyValue("projectId", projectId)
                .addKeyValue("owner", owner)
                .addKeyValue("rows", rows.size())
                .addKeyValue("dryRun", dryRun)
                .log(dryRun ? "Bulk update dry run started" : "Bulk update started");

        boolean firstAttempt = true;
        boolean interrupted = false;
        for (BulkRow raw : rows) {
            if (raw.isSkippable()) {
                continue;
            }
            if (!interrupted && !dryRun && !firstAttempt && !pauseBetweenRows()) {
                interrupted = true;
                log.atWarn().addKeyValue("event", "board.bulk.interrupted")
                        .addKeyValue("projectId", projectId)
                        .addKeyValue("rowNumber", raw.rowNumber())
                        .log("Bulk update interrupted, remaining rows are reported as failed");
            }
            firstAttempt = false;
            if (interrupted) {
                report.failed(raw.normalized(), ErrorKind.UNEXPECTED, NOT_ATTEMPTED);
                continue;
            }
            processRow(projectId, raw.normalized(), dryRun, fields, report);
        }

        BatchReport result = report.build();
        log.atInfo().addKeyValue("event", "board.bulk.completed")
                .addKeyValue("projectId", projectId)
                .addKeyValue("attempted", result.attempted())
                .addKeyValue("updated", result.updated())
                .addKeyValue("failed", result.failed())
                .addKeyValue("dryRun", dryRun)
                .log(dryRun ? "Dry run complete: {} would be updated, {} would fail" : "Bulk update complete: {} updated, {} failed",
                        result.updated(), result.failed());
        return result;
    }

    private void processRow(String projectId, BulkRow row, boolean dryRun, FieldLookup fields, BatchReport.Builder report) {
        try {
            if (row.fieldName().isBlank()) {
                throw new ValidationException("Field name is required");
            }
            FieldMetadata field = fields.resolveField(projectId, row.fieldName());
            FieldValue value = mutator.prepare(field, row.value());

            if (dryRun) {
                log.atInfo().addKeyValue("event", "board.bulk.row.would_update")
                        .addKeyValue("rowNumber", row.rowNumber())
                        .addKeyValue("itemId", row.itemId())
                        .addKeyValue("field", row.fieldName())
                        .addKeyValue("value", row.value())
                        .log("Would update {} -> {} = {}", row.itemId(), row.fieldName(), row.value());
                report.succeeded(row);
                return;
            }

            mutator.apply(projectId, row.itemId(), field, value);
            report.succeeded(row);
        } catch (BoardException ex) {
            rowFailed(row, ex.kind(), ex.getMessage(), report);
        } catch (RuntimeException ex) {
            log.atError().setCause(ex)
                    .addKeyValue("event", "board.bulk.row.unexpected")
                    .addKeyValue("rowNumber", row.rowNumber())
                    .log("Unexpected failure while processing bulk row");
            rowFailed(row, ErrorKind.UNEXPECTED, ex.getMessage(), report);
        }
    }

    private static void rowFailed(BulkRow row, ErrorKind kind, String message, BatchReport.Builder report) {
        log.atWarn().addKeyValue("event", "board.bulk.row.failed")
                .addKeyValue("rowNumber", row.rowNumber())
                .addKeyValue("itemId", row.itemId())
                .addKeyValue("field", row.fieldName())
                .addKeyValue("value", row.value())
                .addKeyValue("errorKind", kind)
                .log("Row {} failed: {}", row.rowNumber(), message);
        report.failed(row, kind, message);
    }

    private boolean pauseBetweenRows() {
        if (rowDelay == null || rowDelay.isZero() || rowDelay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(rowDelay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
