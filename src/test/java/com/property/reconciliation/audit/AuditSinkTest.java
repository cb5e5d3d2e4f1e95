package com.property.reconciliation.audit;

import com.property.reconciliation.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Audit Sink Tests")
class AuditSinkTest {

    private static AuditEntry entry(AuditAction action, EntityType type, String entityId) {
        return AuditEntry.builder()
                .action(action)
                .entityType(type)
                .entityId(entityId)
                .actorId("admin-1")
                .summary(action + " " + entityId)
                .build();
    }

    @Nested
    @DisplayName("InMemoryAuditSink")
    class InMemory {

        @Test
        @DisplayName("Should keep entries in append order and filter them")
        void filters() {
            InMemoryAuditSink sink = new InMemoryAuditSink();
            sink.append(List.of(
                    entry(AuditAction.ENTITY_CREATED, EntityType.PROPERTY, "p-1"),
                    entry(AuditAction.ENTITY_AUTO_CREATED, EntityType.DESTINATION, "d-1")));
            sink.append(List.of(entry(AuditAction.ENTITY_UPDATED, EntityType.PROPERTY, "p-1")));

            assertEquals(3, sink.count());
            assertEquals("p-1", sink.findAll().get(0).entityId());
            assertEquals(2, sink.findByEntityId("p-1").size());
            assertEquals(1, sink.findByAction(AuditAction.ENTITY_AUTO_CREATED).size());
            assertEquals(1, sink.findByEntityType(EntityType.DESTINATION).size());
        }

        @Test
        @DisplayName("Should return a detached copy")
        void copy() {
            InMemoryAuditSink sink = new InMemoryAuditSink();
            List<AuditEntry> snapshot = sink.findAll();
            sink.append(List.of(entry(AuditAction.ENTITY_CREATED, EntityType.PROPERTY, "p-1")));

            assertTrue(snapshot.isEmpty());
            assertThrows(UnsupportedOperationException.class, () -> sink.findAll().clear());
        }
    }

    @Test
    @DisplayName("LoggingAuditSink should accept entries without failing")
    void loggingSink() {
        assertDoesNotThrow(() -> new LoggingAuditSink().append(List.of(
                entry(AuditAction.ENTITY_DELETED, EntityType.BOOKING, "b-1"))));
    }

    @Test
    @DisplayName("AuditEntry should require its identifying fields")
    void entryValidation() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder()
                .entityType(EntityType.PROPERTY).entityId("p-1").build());
        assertNull(AuditEntry.builder().action(AuditAction.ENTITY_CREATED)
                .entityType(EntityType.PROPERTY).entityId("p-1").build().before());
    }
}
