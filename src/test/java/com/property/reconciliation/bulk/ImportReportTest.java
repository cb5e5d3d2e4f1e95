package com.property.reconciliation.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportReport Tests")
class ImportReportTest {

    @Test
    @DisplayName("Should count outcomes and sort diagnostics by row")
    void folding() {
        List<RowOutcome> outcomes = List.of(
                RowOutcome.Failed.of(7, "Start date is required"),
                new RowOutcome.Created(3, "p-1", List.of(RowDiagnostic.of(3, "late warning")), List.of("booking")),
                new RowOutcome.Skipped(5, "No sections to import", List.of(RowDiagnostic.of(5, "skipped"))),
                new RowOutcome.Updated(2, "p-2", List.of(RowDiagnostic.of(2, "early warning")), List.of("booking")),
                RowOutcome.Failed.of(4, "Property name is required"));

        ImportReport report = ImportReport.from("batch-1", ImportTarget.COMBINED, ImportMode.BOTH, 5, outcomes);

        assertEquals(1, report.imported());
        assertEquals(1, report.updated());
        assertEquals(1, report.skipped());
        assertEquals(2, report.failed());
        assertEquals(2, report.successCount());
        assertEquals(List.of(4, 7), report.errors().stream().map(RowDiagnostic::row).toList());
        assertEquals(List.of(2, 3, 5), report.warnings().stream().map(RowDiagnostic::row).toList());
        assertEquals(Map.of("booking", 2), report.sectionCounts());
        assertTrue(report.success());
        assertTrue(report.hasErrors());
    }

    @Test
    @DisplayName("Should refuse a fatal outcome")
    void fatal() {
        List<RowOutcome> outcomes = List.of(new RowOutcome.Fatal(2, new IOException("gone")));

        assertThrows(IllegalArgumentException.class,
                () -> ImportReport.from("batch-1", ImportTarget.PROPERTIES, ImportMode.CREATE, 1, outcomes));
    }

    @Test
    @DisplayName("Should not be a success when every row failed")
    void allFailed() {
        ImportReport report = ImportReport.from("batch-1", ImportTarget.PROPERTIES, ImportMode.CREATE, 1,
                List.of(RowOutcome.Failed.of(2, "Property name is required")));

        assertFalse(report.success());
    }

    @Test
    @DisplayName("Should carry a single batch-level error when aborted")
    void aborted() {
        ImportReport report = ImportReport.aborted("batch-1", ImportTarget.BOOKINGS, ImportMode.CREATE, 12,
                "Import aborted at row 4: connection reset");

        assertTrue(report.aborted());
        assertFalse(report.success());
        assertEquals(0, report.successCount());
        assertEquals(12, report.totalRows());
        assertEquals("Row 0: Import aborted at row 4: connection reset", report.errors().get(0).toString());
    }

    @Test
    @DisplayName("Failed outcomes need at least one error")
    void failedNeedsError() {
        assertThrows(IllegalArgumentException.class, () -> new RowOutcome.Failed(2, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> RowDiagnostic.of(-1, "negative"));
    }
}
