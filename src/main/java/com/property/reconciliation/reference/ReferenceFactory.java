package com.property.reconciliation.reference;

import com.property.reconciliation.core.model.CanonicalEntity;

/**
 * Creates and persists a minimal canonical entity for a name that did not
 * resolve. Supplying one to the resolver is what allows auto-creation.
 */
@FunctionalInterface
public interface ReferenceFactory {

    CanonicalEntity create(String name);
}
