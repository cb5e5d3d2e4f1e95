package com.property.reconciliation.bulk;

import java.util.List;
import java.util.Objects;

/**
 * Result of processing one row. {@link Fatal} is the only variant that
 * aborts the batch; all others are recorded and the batch moves on.
 */
public interface RowOutcome {

    int rowNumber();

    default List<RowDiagnostic> warnings() {
        return List.of();
    }

    /** Label used for metrics and logs. */
    String kind();

    /**
     * @param sections sub-records written by the row, for sheets that carry several
     */
    record Created(int rowNumber, String entityId, List<RowDiagnostic> warnings, List<String> sections)
            implements RowOutcome {
        public Created {
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
            sections = sections != null ? List.copyOf(sections) : List.of();
        }

        public Created(int rowNumber, String entityId, List<RowDiagnostic> warnings) {
            this(rowNumber, entityId, warnings, List.of());
        }

        @Override
        public String kind() {
            return "created";
        }
    }

    record Updated(int rowNumber, String entityId, List<RowDiagnostic> warnings, List<String> sections)
            implements RowOutcome {
        public Updated {
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
            sections = sections != null ? List.copyOf(sections) : List.of();
        }

        public Updated(int rowNumber, String entityId, List<RowDiagnostic> warnings) {
            this(rowNumber, entityId, warnings, List.of());
        }

        @Override
        public String kind() {
            return "updated";
        }
    }

    record Skipped(int rowNumber, String reason, List<RowDiagnostic> warnings) implements RowOutcome {
        public Skipped {
            Objects.requireNonNull(reason, "reason is required");
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        @Override
        public String kind() {
            return "skipped";
        }
    }

    record Failed(int rowNumber, List<RowDiagnostic> errors, List<RowDiagnostic> warnings) implements RowOutcome {
        public Failed {
            if (errors == null || errors.isEmpty()) {
                throw new IllegalArgumentException("A failed row needs at least one error");
            }
            errors = List.copyOf(errors);
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        public static Failed of(int rowNumber, String message) {
            return new Failed(rowNumber, List.of(RowDiagnostic.of(rowNumber, message)), List.of());
        }

        public static Failed of(int rowNumber, String message, String field, List<RowDiagnostic> warnings) {
            return new Failed(rowNumber, List.of(RowDiagnostic.of(rowNumber, message, field)), warnings);
        }

        @Override
        public String kind() {
            return "failed";
        }
    }

    record Fatal(int rowNumber, Throwable cause) implements RowOutcome {
        public Fatal {
            Objects.requireNonNull(cause, "cause is required");
        }

        @Override
        public String kind() {
            return "fatal";
        }
    }
}
