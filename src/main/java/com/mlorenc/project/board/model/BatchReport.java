package com.mlorenc.project.board.model;

import com.mlorenc.project.board.exception.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts and per-row outcomes of one bulk run. In a dry run {@code updated} counts the rows
 * that would have been updated.
 */
public record BatchReport(boolean dryRun, int attempted, int updated, int failed, List<RowOutcome> outcomes) {

    public BatchReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public List<RowOutcome> failures() {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == Status.FAILED)
                .toList();
    }

    public List<BulkRow> failedRows() {
        return failures().stream()
                .map(outcome -> new BulkRow(outcome.rowNumber(), outcome.itemId(), outcome.fieldName(), outcome.value()))
                .toList();
    }

    public static Builder builder(boolean dryRun) {
        return new Builder(dryRun);
    }

    public enum Status {
        UPDATED,
        WOULD_UPDATE,
        FAILED
    }

    public record RowOutcome(long rowNumber,
                             String itemId,
                             String fieldName,
                             String value,
                             Status status,
                             ErrorKind errorKind,
                             String message) {
    }

    public static final class Builder {

        private final boolean dryRun;
        private final List<RowOutcome> outcomes = new ArrayList<>();
        private int updated;
        private int failed;

        private Builder(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public Builder succeeded(BulkRow row) {
            updated++;
            Status status = dryRun ? Status.WOULD_UPDATE : Status.UPDATED;
            outcomes.add(new RowOutcome(row.rowNumber(), row.itemId(), row.fieldName(), row.value(), status, null, null));
            return this;
        }

        public Builder failed(BulkRow row, ErrorKind kind, String message) {
            failed++;
            outcomes.add(new RowOutcome(row.rowNumber(), row.itemId(), row.fieldName(), row.value(), Status.FAILED, kind, message));
            return this;
        }

        public BatchReport build() {
            return new BatchReport(dryRun, updated + failed, updated, failed, outcomes);
        }
    }
}
