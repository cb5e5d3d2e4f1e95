package com.property.reconciliation.reference;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving one reference: either a {@link ResolvedReference} or a
 * not-found diagnostic with up to a handful of similar names.
 */
public record ReferenceResolution(ReferenceKind kind, String input, ResolvedReference reference,
                                  List<String> suggestions) {

    public ReferenceResolution {
        Objects.requireNonNull(kind, "kind is required");
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static ReferenceResolution resolved(String input, ResolvedReference reference) {
        return new ReferenceResolution(reference.kind(), input, reference, List.of());
    }

    public static ReferenceResolution notFound(ReferenceKind kind, String input, List<String> suggestions) {
        return new ReferenceResolution(kind, input, null, suggestions);
    }

    public boolean isResolved() {
        return reference != null;
    }

    /**
     * The method used, or {@link ResolutionMethod#FUZZY_SUGGESTION_ONLY} when
     * nothing matched but similar names exist; null when nothing came close.
     */
    public ResolutionMethod method() {
        if (reference != null) {
            return reference.method();
        }
        return suggestions.isEmpty() ? null : ResolutionMethod.FUZZY_SUGGESTION_ONLY;
    }

    public String id() {
        return reference != null ? reference.id() : null;
    }

    public String notFoundMessage() {
        if (reference != null) {
            throw new IllegalStateException("Reference was resolved");
        }
        StringBuilder message = new StringBuilder()
                .append(kind.getDisplayName()).append(" \"").append(input).append("\" not found.");
        if (kind == ReferenceKind.PROPERTY) {
            message.append(" Please import properties first.");
        }
        if (!suggestions.isEmpty()) {
            message.append(" Similar ").append(kind.getPluralName()).append(": ")
                    .append(String.join(", ", suggestions));
        }
        return message.toString();
    }
}
