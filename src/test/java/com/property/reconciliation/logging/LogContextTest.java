package com.property.reconciliation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forBatch should set batchId, target, mode and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-1", "bookings", "create")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("bookings", MDC.get("importTarget"));
            assertEquals("create", MDC.get("importMode"));
            assertEquals("import", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forRow should restore captured entries on another thread")
    void forRowOnWorker() throws InterruptedException {
        Map<String, String> captured;
        try (LogContext ctx = LogContext.forBatch("batch-1", "bookings", "create")) {
            captured = LogContext.capture();
        }
        String[] seen = new String[2];

        Thread worker = new Thread(() -> {
            try (LogContext row = LogContext.forRow(captured, 7)) {
                seen[0] = MDC.get("batchId");
                seen[1] = MDC.get("rowNumber");
            }
            assertNull(MDC.get("batchId"));
        });
        worker.start();
        worker.join();

        assertEquals("batch-1", seen[0]);
        assertEquals("7", seen[1]);
    }

    @Test
    @DisplayName("Nested contexts should give back the outer values on close")
    void nestedRestoresOuter() {
        try (LogContext batch = LogContext.forBatch("batch-1", "combined", "both")) {
            try (LogContext row = LogContext.forRow(LogContext.capture(), 3)) {
                assertEquals("3", MDC.get("rowNumber"));
            }
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("import", MDC.get("operation"));
            assertNull(MDC.get("rowNumber"));

            try (LogContext booking = LogContext.forBooking("b-1", "create")) {
                assertEquals("create", MDC.get("operation"));
            }
            assertEquals("import", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBooking should label unsaved bookings as new")
    void forBookingNew() {
        try (LogContext ctx = LogContext.forBooking(null, "create").with("propertyId", "p-1")) {
            assertEquals("new", MDC.get("bookingId"));
            assertEquals("p-1", MDC.get("propertyId"));
        }
        assertNull(MDC.get("propertyId"));
    }

    @Test
    @DisplayName("capture should return an empty map when MDC is empty")
    void captureEmpty() {
        assertTrue(LogContext.capture().isEmpty());
    }

    @Test
    @DisplayName("generateBatchId should produce unique ids")
    void uniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateBatchId());
        }
        assertEquals(100, ids.size());
    }
}
