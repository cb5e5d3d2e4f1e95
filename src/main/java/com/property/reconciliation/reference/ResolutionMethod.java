package com.property.reconciliation.reference;

/**
 * How a reference string was matched to a canonical entity.
 */
public enum ResolutionMethod {
    EXACT_ID("exact-id"),
    EXACT_NAME_MATCH("exact-name-match"),
    /** Nothing matched; the result only carries similar names. */
    FUZZY_SUGGESTION_ONLY("fuzzy-suggestion-only"),
    AUTO_CREATED("auto-created");

    private final String label;

    ResolutionMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
