package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.overlap.DateRangeIndex;
import com.property.reconciliation.reference.ReferenceIndex;
import com.property.reconciliation.store.StoreTransaction;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Everything one batch invocation shares between its rows: the open
 * transaction, the reference maps and date-range index preloaded before the
 * row loop, and the identity maps that grow as rows create records.
 *
 * <p>Lives exactly as long as one call to {@link BatchReconciler}; nothing in
 * it is shared with other batches. The booking index is a snapshot of what was
 * persisted before the batch started and does not see sibling rows. The price
 * calendar also holds the periods written by earlier rows; the sheets that
 * write prices run their rows sequentially.</p>
 */
public final class BatchContext {

    private final String batchId;
    private final ImportTarget target;
    private final ImportMode mode;
    private final ImportOptions options;
    private final String actorId;
    private final StoreTransaction transaction;
    private final ReferenceIndex properties;
    private final ReferenceIndex destinations;
    private final DateRangeIndex bookings;
    private volatile DateRangeIndex priceRanges;
    private final Map<String, String> contactIdsByEmail;
    private final Map<String, String> bookingIdsByExternalId;
    private final Set<String> contactPropertyLinks;
    private final Map<String, Integer> firstRowByIdentity = new ConcurrentHashMap<>();

    BatchContext(String batchId, ImportTarget target, ImportMode mode, ImportOptions options, String actorId,
                 StoreTransaction transaction, ReferenceIndex properties, ReferenceIndex destinations,
                 DateRangeIndex bookings, DateRangeIndex priceRanges, Map<String, String> contactIdsByEmail,
                 Map<String, String> bookingIdsByExternalId, Set<String> contactPropertyLinks) {
        this.batchId = Objects.requireNonNull(batchId, "batchId is required");
        this.target = Objects.requireNonNull(target, "target is required");
        this.mode = Objects.requireNonNull(mode, "mode is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.actorId = actorId;
        this.transaction = Objects.requireNonNull(transaction, "transaction is required");
        this.properties = properties;
        this.destinations = destinations;
        this.bookings = bookings;
        this.priceRanges = priceRanges != null ? priceRanges : DateRangeIndex.empty();
        this.contactIdsByEmail = new ConcurrentHashMap<>(contactIdsByEmail);
        this.bookingIdsByExternalId = new ConcurrentHashMap<>(bookingIdsByExternalId);
        this.contactPropertyLinks = ConcurrentHashMap.newKeySet();
        this.contactPropertyLinks.addAll(contactPropertyLinks);
    }

    public String getBatchId() {
        return batchId;
    }

    public ImportTarget getTarget() {
        return target;
    }

    public ImportMode getMode() {
        return mode;
    }

    public ImportOptions getOptions() {
        return options;
    }

    public String getActorId() {
        return actorId;
    }

    public StoreTransaction transaction() {
        return transaction;
    }

    public ReferenceIndex properties() {
        return properties;
    }

    public ReferenceIndex destinations() {
        return destinations;
    }

    public DateRangeIndex bookings() {
        return bookings;
    }

    public DateRangeIndex priceRanges() {
        return priceRanges;
    }

    /**
     * Adds a written pricing period to the calendar, replacing its previous dates.
     */
    public synchronized void recordPriceRange(PriceRange priceRange) {
        PriceCalendar.entry(priceRange).ifPresent(entry -> priceRanges = priceRanges.with(entry));
    }

    public Optional<String> contactIdForEmail(String email) {
        return email == null ? Optional.empty() : Optional.ofNullable(contactIdsByEmail.get(emailKey(email)));
    }

    public void registerContact(String email, String contactId) {
        if (email != null) {
            contactIdsByEmail.putIfAbsent(emailKey(email), contactId);
        }
    }

    public Optional<String> bookingIdForExternalId(String externalId) {
        return externalId == null ? Optional.empty() : Optional.ofNullable(bookingIdsByExternalId.get(externalId));
    }

    public void registerBooking(String externalId, String bookingId) {
        if (externalId != null) {
            bookingIdsByExternalId.putIfAbsent(externalId, bookingId);
        }
    }

    /**
     * Records a contact/property link; false if the pair was already linked.
     */
    public boolean addContactPropertyLink(String contactId, String propertyId) {
        return contactPropertyLinks.add(contactId + "|" + propertyId);
    }

    /**
     * Remembers the first row carrying an identity key. Must be called in
     * source order, before the rows are processed concurrently.
     */
    public void noteIdentity(String identityKey, int rowNumber) {
        if (identityKey != null) {
            firstRowByIdentity.putIfAbsent(identityKey, rowNumber);
        }
    }

    public boolean isFirstOccurrence(String identityKey, int rowNumber) {
        Integer first = identityKey == null ? null : firstRowByIdentity.get(identityKey);
        return first == null || first == rowNumber;
    }

    static String emailKey(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
