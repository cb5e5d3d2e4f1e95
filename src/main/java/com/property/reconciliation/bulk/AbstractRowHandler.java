package com.property.reconciliation.bulk;

import com.property.reconciliation.reference.ReferenceFactory;
import com.property.reconciliation.reference.ReferenceResolution;
import com.property.reconciliation.reference.ReferenceResolver;
import com.property.reconciliation.validation.FieldError;
import com.property.reconciliation.validation.ImportRow;
import com.property.reconciliation.validation.RowValidator;
import com.property.reconciliation.validation.ValidationResult;
import com.property.reconciliation.writer.EntityWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plumbing shared by the handlers: validation diagnostics and reference lookups.
 */
abstract class AbstractRowHandler implements RowHandler {

    protected final RowValidator validator;
    protected final ReferenceResolver resolver;
    protected final EntityWriter writer;

    protected AbstractRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer) {
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.writer = Objects.requireNonNull(writer, "writer is required");
    }

    protected static List<RowDiagnostic> warningsOf(ValidationResult result) {
        List<RowDiagnostic> warnings = new ArrayList<>();
        for (FieldError warning : result.warnings()) {
            warnings.add(RowDiagnostic.from(warning));
        }
        return warnings;
    }

    protected static RowOutcome.Failed invalid(ValidationResult result) {
        List<RowDiagnostic> errors = new ArrayList<>();
        for (FieldError error : result.errors()) {
            errors.add(RowDiagnostic.from(error));
        }
        return new RowOutcome.Failed(errors.get(0).row(), errors, warningsOf(result));
    }

    /**
     * Resolves a destination name, creating it when the batch options allow.
     */
    protected ReferenceResolution resolveDestination(String reference, BatchContext context) {
        ImportOptions options = context.getOptions();
        ReferenceFactory factory = options.isAutoCreateDestinations()
                ? resolver.destinationFactory(context.transaction(), context.getActorId(), options.getDefaultCountry())
                : null;
        return resolver.resolve(reference, context.destinations(), factory, options.getSuggestionLimit());
    }

    /**
     * Resolves a property reference. Properties are only created on the fly
     * when the batch options allow it, attached to the fallback destination.
     */
    protected ReferenceResolution resolveProperty(String reference, BatchContext context) {
        ImportOptions options = context.getOptions();
        ReferenceFactory factory = options.isAutoCreateProperties()
                ? resolver.propertyFactory(context.transaction(), context.getActorId(),
                        () -> fallbackDestinationId(context))
                : null;
        return resolver.resolve(reference, context.properties(), factory, options.getSuggestionLimit());
    }

    /**
     * Id of the destination used for properties imported without one,
     * named after the default country and created on first use.
     */
    protected String fallbackDestinationId(BatchContext context) {
        ImportOptions options = context.getOptions();
        return resolver.resolve(options.getDefaultCountry(), context.destinations(),
                resolver.destinationFactory(context.transaction(), context.getActorId(), options.getDefaultCountry()),
                0).id();
    }

    protected static String autoCreatedDestinationWarning(ReferenceResolution destination, String country) {
        return "Auto-created destination: \"" + destination.reference().name() + "\" (" + country + ")";
    }

    protected static boolean present(ImportRow row, String column) {
        return row.hasValue(column);
    }
}
