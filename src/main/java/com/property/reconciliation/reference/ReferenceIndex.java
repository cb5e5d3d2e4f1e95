package com.property.reconciliation.reference;

import com.property.reconciliation.core.model.CanonicalEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Id and lower-cased name maps for one reference kind, loaded once per batch.
 * Names that collide case-insensitively keep the first id loaded.
 * Safe for concurrent readers; entities created during the batch are added
 * through {@link #register(String, String)}.
 */
public final class ReferenceIndex {

    private final ReferenceKind kind;
    private final Map<String, String> namesById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByName = new ConcurrentHashMap<>();
    private final List<String> namesInLoadOrder = new CopyOnWriteArrayList<>();

    private ReferenceIndex(ReferenceKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public static ReferenceIndex empty(ReferenceKind kind) {
        return new ReferenceIndex(kind);
    }

    public static ReferenceIndex of(ReferenceKind kind, Collection<? extends CanonicalEntity> entities) {
        ReferenceIndex index = new ReferenceIndex(kind);
        for (CanonicalEntity entity : entities) {
            if (entity.entityType() != kind.getEntityType()) {
                throw new IllegalArgumentException("Expected " + kind.getEntityType() + " but got "
                        + entity.entityType());
            }
            index.register(entity.id(), entity.displayName());
        }
        return index;
    }

    public synchronized void register(String id, String name) {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        if (namesById.putIfAbsent(id, name) == null) {
            idsByName.putIfAbsent(key(name), id);
            namesInLoadOrder.add(name);
        }
    }

    public ReferenceKind getKind() {
        return kind;
    }

    public boolean containsId(String id) {
        return id != null && namesById.containsKey(id);
    }

    public Optional<String> idForName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(idsByName.get(key(name)));
    }

    public Optional<String> nameForId(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(namesById.get(id));
    }

    /**
     * Names containing the fragment case-insensitively, in load order.
     */
    public List<String> similarNames(String fragment, int limit) {
        List<String> matches = new ArrayList<>();
        if (fragment == null || fragment.isBlank() || limit <= 0) {
            return matches;
        }
        String needle = key(fragment);
        for (String name : namesInLoadOrder) {
            if (key(name).contains(needle)) {
                matches.add(name);
                if (matches.size() == limit) {
                    break;
                }
            }
        }
        return matches;
    }

    public int size() {
        return namesById.size();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
