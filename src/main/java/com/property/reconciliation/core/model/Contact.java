package com.property.reconciliation.core.model;

import java.util.Objects;

/**
 * A person or organisation in the address book. The store keys contact
 * uniqueness on email when one is present.
 */
public record Contact(
        String id,
        String firstName,
        String lastName,
        String email,
        String phone,
        ContactCategory category,
        String language,
        String comments
) implements CanonicalEntity {

    public static final String DEFAULT_LANGUAGE = "English";

    public Contact {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(firstName, "firstName is required");
        Objects.requireNonNull(lastName, "lastName is required");
        category = category != null ? category : ContactCategory.OTHER;
        language = language != null ? language : DEFAULT_LANGUAGE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.CONTACT;
    }

    @Override
    public String displayName() {
        return firstName + " " + lastName;
    }
}
