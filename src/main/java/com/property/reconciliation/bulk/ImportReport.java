package com.property.reconciliation.bulk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one bulk import, returned once the batch has committed or rolled back.
 *
 * @param batchId       id shared by the log lines and spans of the batch
 * @param totalRows     rows handed to the reconciler
 * @param imported      rows that created their record
 * @param updated       rows that updated an existing record
 * @param skipped       rows left alone on purpose
 * @param failed        rows blocked by an error
 * @param errors        diagnostics of failed rows, ordered by row
 * @param warnings      caveats on rows that still went through, ordered by row
 * @param sectionCounts records written per section of a combined sheet
 * @param aborted       true when the whole batch was rolled back
 */
public record ImportReport(
        String batchId,
        ImportTarget target,
        ImportMode mode,
        int totalRows,
        int imported,
        int updated,
        int skipped,
        int failed,
        List<RowDiagnostic> errors,
        List<RowDiagnostic> warnings,
        Map<String, Integer> sectionCounts,
        boolean aborted
) {
    public ImportReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        sectionCounts = sectionCounts != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sectionCounts))
                : Map.of();
    }

    /**
     * True when at least one row did not fail and the batch was not rolled back.
     */
    public boolean success() {
        return !aborted && totalRows > 0 && failed < totalRows;
    }

    public int successCount() {
        return imported + updated;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static ImportReport aborted(String batchId, ImportTarget target, ImportMode mode, int totalRows,
                                       String message) {
        return new ImportReport(batchId, target, mode, totalRows, 0, 0, 0, 0,
                List.of(RowDiagnostic.of(0, message)), List.of(), Map.of(), true);
    }

    public static ImportReport empty(String batchId, ImportTarget target, ImportMode mode) {
        return new ImportReport(batchId, target, mode, 0, 0, 0, 0, 0,
                List.of(RowDiagnostic.of(0, "No rows to import")), List.of(), Map.of(), false);
    }

    /**
     * Folds row outcomes into a report. Outcomes may arrive in any order;
     * diagnostics are sorted by row number, stable within a row.
     */
    public static ImportReport from(String batchId, ImportTarget target, ImportMode mode, int totalRows,
                                    List<RowOutcome> outcomes) {
        int imported = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        List<RowDiagnostic> errors = new ArrayList<>();
        List<RowDiagnostic> warnings = new ArrayList<>();
        Map<String, Integer> sections = new LinkedHashMap<>();

        for (RowOutcome outcome : outcomes) {
            warnings.addAll(outcome.warnings());
            if (outcome instanceof RowOutcome.Created created) {
                imported++;
                created.sections().forEach(section -> sections.merge(section, 1, Integer::sum));
            } else if (outcome instanceof RowOutcome.Updated updatedRow) {
                updated++;
                updatedRow.sections().forEach(section -> sections.merge(section, 1, Integer::sum));
            } else if (outcome instanceof RowOutcome.Skipped) {
                skipped++;
            } else if (outcome instanceof RowOutcome.Failed failedRow) {
                failed++;
                errors.addAll(failedRow.errors());
            } else {
                throw new IllegalArgumentException("Row " + outcome.rowNumber()
                        + " aborted the batch; it cannot be reported as a row outcome");
            }
        }
        errors.sort(Comparator.comparingInt(RowDiagnostic::row));
        warnings.sort(Comparator.comparingInt(RowDiagnostic::row));
        return new ImportReport(batchId, target, mode, totalRows, imported, updated, skipped, failed,
                errors, warnings, sections, false);
    }

    @Override
    public String toString() {
        return "ImportReport{target=" + target +
                ", mode=" + mode +
                ", total=" + totalRows +
                ", imported=" + imported +
                ", updated=" + updated +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                ", aborted=" + aborted + '}';
    }
}
