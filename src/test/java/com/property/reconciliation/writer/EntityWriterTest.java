package com.property.reconciliation.writer;

import com.property.reconciliation.audit.AuditAction;
import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.audit.InMemoryAuditSink;
import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.BookingType;
import com.property.reconciliation.core.model.Destination;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.store.ConstraintViolationException;
import com.property.reconciliation.store.InMemoryEntityStore;
import com.property.reconciliation.store.StoreTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("EntityWriter Tests")
class EntityWriterTest {

    private InMemoryAuditSink auditSink;
    private InMemoryEntityStore store;
    private EntityWriter writer;

    @BeforeEach
    void setUp() {
        auditSink = new InMemoryAuditSink();
        store = new InMemoryEntityStore(auditSink);
        writer = new EntityWriter();
        store.inTransaction(tx -> writer.create(tx, new Destination("d-1", "Mallorca", "Spain"), "admin-1"));
    }

    @Test
    @DisplayName("Should write one audit entry per create with the after image")
    void create() {
        store.inTransaction(tx -> writer.create(tx,
                Property.builder().id("p-1").name("Villa Azure").destinationId("d-1").maxGuests(6).build(),
                "admin-1"));

        List<AuditEntry> entries = auditSink.findByEntityId("p-1");
        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals(AuditAction.ENTITY_CREATED, entry.action());
        assertEquals(EntityType.PROPERTY, entry.entityType());
        assertEquals("Created property \"Villa Azure\"", entry.summary());
        assertNull(entry.before());
        assertEquals("Villa Azure", entry.after().get("name"));
        assertEquals(6, entry.after().get("maxGuests"));
    }

    @Test
    @DisplayName("Should capture both images on update")
    void update() {
        store.inTransaction(tx -> writer.create(tx,
                Property.builder().id("p-1").name("Villa Azure").destinationId("d-1").build(), "admin-1"));

        store.inTransaction(tx -> writer.update(tx,
                Property.builder().id("p-1").name("Villa Azzurra").destinationId("d-1").build(), "admin-2"));

        AuditEntry entry = auditSink.findByAction(AuditAction.ENTITY_UPDATED).get(0);
        assertEquals("Villa Azure", entry.before().get("name"));
        assertEquals("Villa Azzurra", entry.after().get("name"));
        assertEquals("admin-2", entry.actorId());
    }

    @Test
    @DisplayName("Should write dates as ISO strings in snapshots")
    void isoDates() {
        store.inTransaction(tx -> {
            writer.create(tx, Property.builder().id("p-1").name("Villa Azure").destinationId("d-1").build(),
                    "admin-1");
            return writer.create(tx, Booking.builder().id("b-1").propertyId("p-1").type(BookingType.OWNER)
                    .startDate(LocalDate.of(2024, 6, 1)).endDate(LocalDate.of(2024, 6, 8)).build(), "admin-1");
        });

        AuditEntry entry = auditSink.findByEntityId("b-1").get(0);
        assertEquals("2024-06-01", entry.after().get("startDate"));
        assertFalse(entry.after().containsKey("guestName"));
        assertFalse(entry.after().containsKey("cancelled"));
    }

    @Test
    @DisplayName("Should summarise cascaded deletes in a single entry")
    void deleteCascade() {
        store.inTransaction(tx -> writer.create(tx,
                Property.builder().id("p-1").name("Villa Azure").destinationId("d-1").build(), "admin-1"));

        store.inTransaction(tx -> writer.delete(tx, EntityType.DESTINATION, "d-1", "admin-1"));

        List<AuditEntry> deletes = auditSink.findByAction(AuditAction.ENTITY_DELETED);
        assertEquals(1, deletes.size());
        assertEquals("Deleted destination \"Mallorca\" and 1 dependent record(s)", deletes.get(0).summary());
        assertNull(deletes.get(0).after());
    }

    @Test
    @DisplayName("Should not audit a delete that removed nothing")
    void deleteMissing() {
        int before = auditSink.count();

        assertTrue(store.inTransaction(tx -> writer.delete(tx, EntityType.BOOKING, "nope", "admin-1")).isEmpty());
        assertEquals(before, auditSink.count());
    }

    @Test
    @DisplayName("Should let constraint violations propagate without auditing")
    void constraintPropagates() {
        StoreTransaction tx = mock(StoreTransaction.class);
        doThrow(new ConstraintViolationException("foreign_key", "missing destination")).when(tx).insert(any());

        assertThrows(ConstraintViolationException.class, () -> writer.create(tx,
                Property.builder().id("p-1").name("Villa Azure").destinationId("d-404").build(), "admin-1"));
        verify(tx, never()).appendAudit(any());
    }
}
