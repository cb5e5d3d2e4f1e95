package com.property.reconciliation.store;

import com.property.reconciliation.audit.AuditAction;
import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.audit.AuditSink;
import com.property.reconciliation.audit.InMemoryAuditSink;
import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.Contact;
import com.property.reconciliation.core.model.ContactPropertyLink;
import com.property.reconciliation.core.model.Destination;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("InMemoryEntityStore Tests")
class InMemoryEntityStoreTest {

    private InMemoryAuditSink auditSink;
    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        auditSink = new InMemoryAuditSink();
        store = new InMemoryEntityStore(auditSink);
        store.inTransaction(tx -> {
            tx.insert(new Destination("d-1", "Mallorca", "Spain"));
            tx.insert(Property.builder().id("p-1").name("Villa Azure").destinationId("d-1").build());
            return null;
        });
    }

    private static Contact contact(String id, String email) {
        return new Contact(id, "Ana", "Pons", email, null, null, null, null);
    }

    private static AuditEntry audit(String entityId) {
        return AuditEntry.builder()
                .action(AuditAction.ENTITY_CREATED)
                .entityType(EntityType.CONTACT)
                .entityId(entityId)
                .build();
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("Should commit every write when the callback returns")
        void commit() {
            store.inTransaction(tx -> {
                tx.insert(contact("c-1", "ana@example.com"));
                tx.appendAudit(audit("c-1"));
                return null;
            });

            assertTrue(store.committedById(EntityType.CONTACT, "c-1").isPresent());
            assertEquals(1, auditSink.count());
        }

        @Test
        @DisplayName("Should discard writes and audit entries when the callback throws")
        void rollback() {
            StoreException thrown = assertThrows(StoreException.class, () -> store.inTransaction(tx -> {
                tx.insert(contact("c-1", "ana@example.com"));
                tx.appendAudit(audit("c-1"));
                throw new IllegalStateException("boom");
            }));

            assertEquals("Transaction rolled back: boom", thrown.getMessage());
            assertInstanceOf(IllegalStateException.class, thrown.getCause());
            assertEquals(0, store.count(EntityType.CONTACT));
            assertEquals(0, auditSink.count());
        }

        @Test
        @DisplayName("Should rethrow store exceptions unchanged")
        void storeExceptionUnchanged() {
            StoreException original = new StoreException("disk gone");

            StoreException thrown = assertThrows(StoreException.class,
                    () -> store.inTransaction(tx -> {
                        throw original;
                    }));

            assertSame(original, thrown);
        }

        @Test
        @DisplayName("Should keep uncommitted writes invisible to readers")
        void isolation() {
            store.inTransaction(tx -> {
                tx.insert(contact("c-1", "ana@example.com"));
                assertTrue(tx.findById(EntityType.CONTACT, "c-1").isPresent());
                assertTrue(store.committedById(EntityType.CONTACT, "c-1").isEmpty());
                return null;
            });
        }

        @Test
        @DisplayName("Should reject nested transactions")
        void nested() {
            StoreException thrown = assertThrows(StoreException.class,
                    () -> store.inTransaction(tx -> store.inTransaction(inner -> null)));

            assertInstanceOf(IllegalStateException.class, thrown.getCause());
        }

        @Test
        @DisplayName("Should refuse a handle used after its transaction ended")
        void closedHandle() {
            StoreTransaction leaked = store.inTransaction(tx -> tx);

            assertThrows(StoreException.class, () -> leaked.findById(EntityType.PROPERTY, "p-1"));
        }

        @Test
        @DisplayName("Should fail the commit when the audit sink rejects the entries")
        void auditFailure() {
            AuditSink failing = mock(AuditSink.class);
            doThrow(new IllegalStateException("sink down")).when(failing).append(anyList());
            InMemoryEntityStore strict = new InMemoryEntityStore(failing);

            assertThrows(StoreException.class, () -> strict.inTransaction(tx -> {
                tx.insert(new Destination("d-1", "Mallorca", "Spain"));
                tx.appendAudit(audit("d-1"));
                return null;
            }));
            assertEquals(0, strict.count(EntityType.DESTINATION));
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        @DisplayName("Should reject a duplicate email regardless of case")
        void uniqueEmail() {
            store.inTransaction(tx -> {
                tx.insert(contact("c-1", "ana@example.com"));
                return null;
            });

            StoreException thrown = assertThrows(StoreException.class, () -> store.inTransaction(tx -> {
                tx.insert(contact("c-2", " ANA@example.com"));
                return null;
            }));

            ConstraintViolationException cause = assertInstanceOf(ConstraintViolationException.class,
                    thrown.getCause());
            assertEquals("contact_email_unique", cause.getConstraint());
        }

        @Test
        @DisplayName("Should let a contact keep its own email on update")
        void updateOwnEmail() {
            store.inTransaction(tx -> {
                tx.insert(contact("c-1", "ana@example.com"));
                tx.update(new Contact("c-1", "Ana", "Pons-Ferrer", "ana@example.com", null, null, null, null));
                return null;
            });

            assertEquals("Pons-Ferrer",
                    ((Contact) store.committedById(EntityType.CONTACT, "c-1").orElseThrow()).lastName());
        }

        @Test
        @DisplayName("Should reject a dangling foreign key")
        void foreignKey() {
            ConstraintViolationException violation = store.inTransaction(tx -> assertThrows(
                    ConstraintViolationException.class,
                    () -> tx.insert(Property.builder().id("p-2").name("Casa").destinationId("d-404").build())));

            assertEquals("foreign_key", violation.getConstraint());
        }

        @Test
        @DisplayName("Should reject duplicate ids and updates of missing records")
        void primaryKey() {
            store.inTransaction(tx -> {
                assertThrows(ConstraintViolationException.class,
                        () -> tx.insert(new Destination("d-1", "Again", null)));
                assertThrows(ConstraintViolationException.class,
                        () -> tx.update(new Destination("d-2", "Nowhere", null)));
                return null;
            });
        }
    }

    @Test
    @DisplayName("Should cascade deletes to dependent records")
    void cascade() {
        store.inTransaction(tx -> {
            tx.insert(contact("c-1", "ana@example.com"));
            tx.insert(new ContactPropertyLink("l-1", "c-1", "p-1", null));
            tx.insert(Booking.builder().id("b-1").propertyId("p-1")
                    .startDate(LocalDate.of(2024, 6, 1)).endDate(LocalDate.of(2024, 6, 5)).build());
            return null;
        });

        List<CanonicalEntity> removed = store.inTransaction(tx -> tx.delete(EntityType.DESTINATION, "d-1"));

        assertEquals("d-1", removed.get(0).id());
        assertEquals(4, removed.size());
        assertEquals(0, store.count(EntityType.PROPERTY));
        assertEquals(0, store.count(EntityType.BOOKING));
        assertEquals(0, store.count(EntityType.CONTACT_PROPERTY_LINK));
        assertEquals(1, store.count(EntityType.CONTACT));
        assertTrue(store.inTransaction(tx -> tx.delete(EntityType.DESTINATION, "d-1")).isEmpty());
    }
}
