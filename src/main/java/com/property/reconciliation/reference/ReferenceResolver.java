package com.property.reconciliation.reference;

import com.property.reconciliation.audit.AuditAction;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.Destination;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.store.StoreTransaction;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Maps free-text property and destination references to canonical ids.
 *
 * <p>Resolution order for an input string:</p>
 * <ol>
 *   <li>{@code name:} prefix: name lookup only, on the text after the prefix.</li>
 *   <li>A known id: {@link ResolutionMethod#EXACT_ID}.</li>
 *   <li>A case-insensitive name match: {@link ResolutionMethod#EXACT_NAME_MATCH}.</li>
 *   <li>A miss with a {@link ReferenceFactory}: the entity is created, registered
 *       in the batch index and returned as {@link ResolutionMethod#AUTO_CREATED}.</li>
 *   <li>A miss without one: not found, with similar names found by substring containment.</li>
 * </ol>
 *
 * <p>Creation is serialized per index, so two rows naming the same missing
 * entity in one batch get the same id.</p>
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final String NAME_PREFIX = "name:";
    public static final int DEFAULT_SUGGESTION_LIMIT = 3;

    private final EntityWriter writer;
    private final DestinationCountryLookup countryLookup;
    private final MetricsService metricsService;

    public ReferenceResolver(EntityWriter writer, DestinationCountryLookup countryLookup) {
        this(writer, countryLookup, new NoOpMetricsService());
    }

    public ReferenceResolver(EntityWriter writer, DestinationCountryLookup countryLookup,
                             MetricsService metricsService) {
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.countryLookup = Objects.requireNonNull(countryLookup, "countryLookup is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ReferenceResolution resolve(String input, ReferenceIndex index) {
        return resolve(input, index, null, DEFAULT_SUGGESTION_LIMIT);
    }

    /**
     * @param factory         creates the entity on a miss; null disables auto-creation
     * @param suggestionLimit maximum number of similar names reported on a miss
     */
    public ReferenceResolution resolve(String input, ReferenceIndex index, ReferenceFactory factory,
                                       int suggestionLimit) {
        Objects.requireNonNull(index, "index is required");
        ReferenceKind kind = index.getKind();
        String trimmed = input != null ? input.trim() : "";
        if (trimmed.isEmpty()) {
            return ReferenceResolution.notFound(kind, trimmed, List.of());
        }

        boolean nameOnly = trimmed.regionMatches(true, 0, NAME_PREFIX, 0, NAME_PREFIX.length());
        String name = nameOnly ? trimmed.substring(NAME_PREFIX.length()).trim() : trimmed;
        if (name.isEmpty()) {
            return ReferenceResolution.notFound(kind, trimmed, List.of());
        }

        if (!nameOnly && index.containsId(name)) {
            return ReferenceResolution.resolved(input, new ResolvedReference(name,
                    index.nameForId(name).orElse(name), kind, ResolutionMethod.EXACT_ID));
        }

        var byName = index.idForName(name);
        if (byName.isPresent()) {
            return ReferenceResolution.resolved(input, new ResolvedReference(byName.get(),
                    index.nameForId(byName.get()).orElse(name), kind, ResolutionMethod.EXACT_NAME_MATCH));
        }

        if (factory != null) {
            return autoCreate(input, name, index, factory);
        }

        List<String> suggestions = index.similarNames(name, suggestionLimit);
        log.debug("reference.not_found kind={} input='{}' suggestions={}", kind, name, suggestions.size());
        return ReferenceResolution.notFound(kind, name, suggestions);
    }

    private ReferenceResolution autoCreate(String input, String name, ReferenceIndex index,
                                           ReferenceFactory factory) {
        synchronized (index) {
            var existing = index.idForName(name);
            if (existing.isPresent()) {
                return ReferenceResolution.resolved(input, new ResolvedReference(existing.get(),
                        index.nameForId(existing.get()).orElse(name), index.getKind(),
                        ResolutionMethod.EXACT_NAME_MATCH));
            }
            CanonicalEntity created = factory.create(name);
            index.register(created.id(), created.displayName());
            metricsService.incrementReferenceAutoCreated(created.entityType());
            log.debug("reference.auto_created kind={} id={} name='{}'", index.getKind(), created.id(), name);
            return ReferenceResolution.resolved(input, new ResolvedReference(created.id(),
                    created.displayName(), index.getKind(), ResolutionMethod.AUTO_CREATED));
        }
    }

    /**
     * Factory creating a destination named after the reference, with the
     * country inferred from the name.
     */
    public ReferenceFactory destinationFactory(StoreTransaction tx, String actorId) {
        return destinationFactory(tx, actorId, countryLookup.getDefaultCountry());
    }

    public ReferenceFactory destinationFactory(StoreTransaction tx, String actorId, String fallbackCountry) {
        return name -> {
            Destination destination = new Destination(UUID.randomUUID().toString(), name,
                    countryLookup.countryFor(name, fallbackCountry));
            return writer.create(tx, destination, actorId, AuditAction.ENTITY_AUTO_CREATED,
                    "Auto-created destination \"" + name + "\" (" + destination.country() + ") during import");
        };
    }

    /**
     * Factory creating a hidden placeholder property attached to the
     * destination supplied at creation time.
     */
    public ReferenceFactory propertyFactory(StoreTransaction tx, String actorId, Supplier<String> destinationId) {
        return name -> {
            Property property = Property.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .destinationId(destinationId.get())
                    .status(PropertyStatus.HIDDEN)
                    .build();
            return writer.create(tx, property, actorId, AuditAction.ENTITY_AUTO_CREATED,
                    "Auto-created property \"" + name + "\" during import");
        };
    }

    public DestinationCountryLookup getCountryLookup() {
        return countryLookup;
    }
}
