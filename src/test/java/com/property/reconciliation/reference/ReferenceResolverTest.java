package com.property.reconciliation.reference;

import com.property.reconciliation.audit.AuditAction;
import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.audit.InMemoryAuditSink;
import com.property.reconciliation.core.model.Destination;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.store.InMemoryEntityStore;
import com.property.reconciliation.writer.EntityWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ReferenceResolver Tests")
class ReferenceResolverTest {

    private InMemoryAuditSink auditSink;
    private InMemoryEntityStore store;
    private ReferenceResolver resolver;
    private ReferenceIndex properties;

    @BeforeEach
    void setUp() {
        auditSink = new InMemoryAuditSink();
        store = new InMemoryEntityStore(auditSink);
        resolver = new ReferenceResolver(new EntityWriter(), DestinationCountryLookup.standard());
        properties = ReferenceIndex.of(ReferenceKind.PROPERTY, List.of(
                property("p-1", "Villa Azure"),
                property("p-2", "Villa Azul"),
                property("p-3", "Casa Rosa"),
                property("p-4", "Villa Verde"),
                property("p-5", "Villa Blanca")));
    }

    private static Property property(String id, String name) {
        return Property.builder().id(id).name(name).build();
    }

    @Nested
    @DisplayName("Exact matches")
    class ExactMatches {

        @Test
        @DisplayName("Should resolve a known id")
        void byId() {
            ReferenceResolution resolution = resolver.resolve("p-3", properties);

            assertTrue(resolution.isResolved());
            assertEquals("p-3", resolution.id());
            assertEquals("Casa Rosa", resolution.reference().name());
            assertEquals(ResolutionMethod.EXACT_ID, resolution.method());
        }

        @Test
        @DisplayName("Should resolve names case-insensitively")
        void byName() {
            ReferenceResolution resolution = resolver.resolve("  villa AZURE ", properties);

            assertEquals("p-1", resolution.id());
            assertEquals(ResolutionMethod.EXACT_NAME_MATCH, resolution.method());
        }

        @Test
        @DisplayName("Should only look up names after the name: prefix")
        void namePrefix() {
            ReferenceIndex tricky = ReferenceIndex.of(ReferenceKind.PROPERTY, List.of(
                    property("p-1", "Villa Azure"),
                    property("p-9", "p-1")));

            assertEquals("p-1", resolver.resolve("p-1", tricky).id());
            assertEquals("p-9", resolver.resolve("name:p-1", tricky).id());
            assertEquals("p-1", resolver.resolve("NAME: Villa Azure", tricky).id());
        }

        @Test
        @DisplayName("Should keep the first id for names that collide")
        void firstIdWins() {
            ReferenceIndex duplicates = ReferenceIndex.of(ReferenceKind.PROPERTY, List.of(
                    property("p-1", "Villa"),
                    property("p-2", "VILLA")));

            assertEquals("p-1", resolver.resolve("villa", duplicates).id());
        }
    }

    @Nested
    @DisplayName("Misses")
    class Misses {

        @Test
        @DisplayName("Should suggest at most three similar names in load order")
        void suggestions() {
            ReferenceResolution resolution = resolver.resolve("Villa", properties);

            assertFalse(resolution.isResolved());
            assertEquals(List.of("Villa Azure", "Villa Azul", "Villa Verde"), resolution.suggestions());
            assertEquals(ResolutionMethod.FUZZY_SUGGESTION_ONLY, resolution.method());
            assertEquals("Property \"Villa\" not found. Please import properties first. "
                    + "Similar properties: Villa Azure, Villa Azul, Villa Verde", resolution.notFoundMessage());
        }

        @Test
        @DisplayName("Should report no method when nothing comes close")
        void nothingClose() {
            ReferenceResolution resolution = resolver.resolve("Chalet", properties);

            assertNull(resolution.method());
            assertEquals("Property \"Chalet\" not found. Please import properties first.",
                    resolution.notFoundMessage());
        }

        @Test
        @DisplayName("Should not resolve blank input")
        void blank() {
            assertFalse(resolver.resolve("   ", properties).isResolved());
            assertFalse(resolver.resolve(null, properties).isResolved());
            assertFalse(resolver.resolve("name:", properties).isResolved());
        }

        @Test
        @DisplayName("Should word destination misses without the import hint")
        void destinationMessage() {
            ReferenceIndex destinations = ReferenceIndex.of(ReferenceKind.DESTINATION,
                    List.of(new Destination("d-1", "Ibiza", "Spain")));

            assertEquals("Destination \"Menorca\" not found.",
                    resolver.resolve("Menorca", destinations).notFoundMessage());
        }
    }

    @Nested
    @DisplayName("Auto-creation")
    class AutoCreation {

        @Test
        @DisplayName("Should create a destination with the inferred country and audit it")
        void createsDestination() {
            ReferenceIndex destinations = ReferenceIndex.empty(ReferenceKind.DESTINATION);

            ReferenceResolution resolution = store.inTransaction(tx ->
                    resolver.resolve("Mallorca", destinations, resolver.destinationFactory(tx, "admin-1"), 3));

            assertTrue(resolution.reference().wasAutoCreated());
            Destination destination = (Destination) store.committedById(EntityType.DESTINATION, resolution.id())
                    .orElseThrow();
            assertEquals("Mallorca", destination.name());
            assertEquals("Spain", destination.country());

            List<AuditEntry> audit = auditSink.findByAction(AuditAction.ENTITY_AUTO_CREATED);
            assertEquals(1, audit.size());
            assertEquals(resolution.id(), audit.get(0).entityId());
            assertEquals("admin-1", audit.get(0).actorId());
        }

        @Test
        @DisplayName("Should reuse the entity created earlier in the batch")
        void createsOnce() {
            ReferenceIndex destinations = ReferenceIndex.empty(ReferenceKind.DESTINATION);

            List<ReferenceResolution> results = store.inTransaction(tx -> {
                ReferenceFactory factory = resolver.destinationFactory(tx, "admin-1");
                return List.of(
                        resolver.resolve("Cannes", destinations, factory, 3),
                        resolver.resolve("cannes", destinations, factory, 3));
            });

            assertEquals(results.get(0).id(), results.get(1).id());
            assertEquals(ResolutionMethod.EXACT_NAME_MATCH, results.get(1).method());
            assertEquals(1, store.count(EntityType.DESTINATION));
        }

        @Test
        @DisplayName("Should fall back to the given country for unknown places")
        void fallbackCountry() {
            ReferenceIndex destinations = ReferenceIndex.empty(ReferenceKind.DESTINATION);

            String id = store.inTransaction(tx -> resolver.resolve("Somewhere Quiet", destinations,
                    resolver.destinationFactory(tx, "admin-1", "Portugal"), 3).id());

            assertEquals("Portugal",
                    ((Destination) store.committedById(EntityType.DESTINATION, id).orElseThrow()).country());
        }

        @Test
        @DisplayName("Should record the auto-creation metric")
        void metric() {
            MetricsService metrics = mock(MetricsService.class);
            ReferenceResolver counted = new ReferenceResolver(new EntityWriter(),
                    DestinationCountryLookup.standard(), metrics);
            ReferenceIndex destinations = ReferenceIndex.empty(ReferenceKind.DESTINATION);

            store.inTransaction(tx -> counted.resolve("Nice", destinations,
                    counted.destinationFactory(tx, "admin-1"), 3));

            verify(metrics).incrementReferenceAutoCreated(EntityType.DESTINATION);
        }
    }

    @Test
    @DisplayName("Should infer countries from the first matching place")
    void countryLookup() {
        DestinationCountryLookup lookup = DestinationCountryLookup.standard();

        assertEquals("Spain", lookup.countryFor("Port de Mallorca"));
        assertEquals("Greece", lookup.countryFor("SANTORINI"));
        assertEquals(DestinationCountryLookup.UNKNOWN_COUNTRY, lookup.countryFor("Atlantis"));
        assertEquals("Spain", new DestinationCountryLookup("Spain").countryFor(null));
    }
}
