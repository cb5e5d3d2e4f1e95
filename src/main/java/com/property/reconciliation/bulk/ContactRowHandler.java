package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.Contact;
import com.property.reconciliation.core.model.ContactCategory;
import com.property.reconciliation.core.model.ContactPropertyLink;
import com.property.reconciliation.core.model.ContactPropertyRelationship;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.reference.ReferenceResolution;
import com.property.reconciliation.reference.ReferenceResolver;
import com.property.reconciliation.validation.ImportRow;
import com.property.reconciliation.validation.ImportSchemas;
import com.property.reconciliation.validation.RowValidator;
import com.property.reconciliation.validation.ValidatedRow;
import com.property.reconciliation.validation.ValidationResult;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Contact sheet. Identity is the email address, compared case-insensitively.
 * Linked properties are resolved by id or name; a link that cannot be resolved
 * is reported as a warning and does not block the contact.
 */
public class ContactRowHandler extends AbstractRowHandler {
    private static final Logger log = LoggerFactory.getLogger(ContactRowHandler.class);

    static final String DUPLICATE_IN_FILE = "Duplicate contact email within import file";

    public ContactRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer) {
        super(validator, resolver, writer);
    }

    @Override
    public ImportTarget target() {
        return ImportTarget.CONTACTS;
    }

    @Override
    public void prepare(List<ImportRow> rows, BatchContext context) {
        for (ImportRow row : rows) {
            String email = row.value("email");
            context.noteIdentity(email != null ? "email:" + BatchContext.emailKey(email) : null, row.rowNumber());
        }
    }

    @Override
    public RowOutcome handle(ImportRow row, BatchContext context) {
        ValidationResult result = validator.validate(row, ImportSchemas.CONTACT);
        if (!result.isValid()) {
            return invalid(result);
        }
        ValidatedRow data = result.row();
        List<RowDiagnostic> warnings = warningsOf(result);
        int rowNumber = row.rowNumber();
        String email = data.getString("email");

        if (email != null && !context.isFirstOccurrence("email:" + BatchContext.emailKey(email), rowNumber)) {
            if (context.getOptions().isSkipDuplicateContacts()) {
                return new RowOutcome.Skipped(rowNumber, DUPLICATE_IN_FILE, warnings);
            }
            return RowOutcome.Failed.of(rowNumber, DUPLICATE_IN_FILE, "email", warnings);
        }

        Optional<String> existingId = context.contactIdForEmail(email);
        ImportMode mode = context.getMode();
        if (existingId.isPresent() && mode == ImportMode.CREATE) {
            String message = "Contact with email " + email + " already exists";
            if (context.getOptions().isSkipDuplicateContacts()) {
                warnings.add(RowDiagnostic.of(rowNumber, message + ", skipped", "email"));
                return new RowOutcome.Skipped(rowNumber, message, warnings);
            }
            return RowOutcome.Failed.of(rowNumber, message, "email", warnings);
        }
        if (existingId.isEmpty() && mode == ImportMode.UPDATE) {
            String message = email == null
                    ? "An email is required to update a contact"
                    : "No contact found with email " + email;
            return RowOutcome.Failed.of(rowNumber, message, "email", warnings);
        }

        Contact contact;
        boolean created;
        if (existingId.isPresent()) {
            Contact existing = (Contact) context.transaction()
                    .findById(EntityType.CONTACT, existingId.get())
                    .orElseThrow(() -> new IllegalStateException("Contact " + existingId.get()
                            + " vanished from the transaction"));
            contact = new Contact(existing.id(),
                    data.getString("firstName"),
                    data.getString("lastName"),
                    email,
                    data.has("phone") ? data.getString("phone") : existing.phone(),
                    row.hasValue("category") ? data.getEnum("category", ContactCategory.class) : existing.category(),
                    data.has("language") ? data.getString("language") : existing.language(),
                    data.has("comments") ? data.getString("comments") : existing.comments());
            writer.update(context.transaction(), contact, context.getActorId());
            created = false;
        } else {
            contact = new Contact(UUID.randomUUID().toString(),
                    data.getString("firstName"),
                    data.getString("lastName"),
                    email,
                    data.getString("phone"),
                    data.getEnum("category", ContactCategory.class),
                    data.getString("language"),
                    data.getString("comments"));
            writer.create(context.transaction(), contact, context.getActorId());
            context.registerContact(email, contact.id());
            created = true;
        }

        ContactPropertyRelationship relationship = data.getEnum("relationship", ContactPropertyRelationship.class);
        int linked = 0;
        for (String reference : data.getList("linkedProperties")) {
            ReferenceResolution property = resolver.resolve(reference, context.properties(), null,
                    context.getOptions().getSuggestionLimit());
            if (!property.isResolved()) {
                warnings.add(RowDiagnostic.of(rowNumber, property.notFoundMessage(), "linkedProperties"));
                continue;
            }
            if (context.addContactPropertyLink(contact.id(), property.id())) {
                writer.create(context.transaction(), new ContactPropertyLink(UUID.randomUUID().toString(),
                        contact.id(), property.id(), relationship), context.getActorId());
                linked++;
            }
        }

        log.debug("contact.{} row={} id={} links={}", created ? "created" : "updated", rowNumber, contact.id(),
                linked);
        return created
                ? new RowOutcome.Created(rowNumber, contact.id(), warnings)
                : new RowOutcome.Updated(rowNumber, contact.id(), warnings);
    }
}
