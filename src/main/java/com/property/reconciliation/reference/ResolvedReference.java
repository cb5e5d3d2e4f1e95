package com.property.reconciliation.reference;

import java.util.Objects;

/**
 * A canonical id together with the way it was found. Lives for the duration
 * of one row and is never persisted.
 */
public record ResolvedReference(String id, String name, ReferenceKind kind, ResolutionMethod method) {

    public ResolvedReference {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(method, "method is required");
        if (method == ResolutionMethod.FUZZY_SUGGESTION_ONLY) {
            throw new IllegalArgumentException("A suggestion is not a resolved reference");
        }
    }

    public boolean wasAutoCreated() {
        return method == ResolutionMethod.AUTO_CREATED;
    }
}
