package com.property.reconciliation.bulk;

import com.property.reconciliation.reference.DestinationCountryLookup;

/**
 * Tunables of a bulk import: chunking, limits and reference policies.
 */
public class ImportOptions {

    private static final int DEFAULT_CHUNK_SIZE = 10;
    private static final int DEFAULT_MAX_ROWS = 10_000;
    private static final int DEFAULT_SUGGESTION_LIMIT = 3;
    private static final long DEFAULT_ROW_TIMEOUT_MS = 30_000;
    private static final int DEFAULT_MAX_ALTERNATIVE_SUGGESTIONS = 5;

    private final int chunkSize;
    private final int maxRows;
    private final int suggestionLimit;
    private final boolean autoCreateDestinations;
    private final boolean autoCreateProperties;
    private final boolean skipDuplicateContacts;
    private final boolean skipPriceConflicts;
    private final String defaultCountry;
    private final long rowTimeoutMillis;
    private final int gracePeriodDays;
    private final int maxAlternativeSuggestions;

    private ImportOptions(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.maxRows = builder.maxRows;
        this.suggestionLimit = builder.suggestionLimit;
        this.autoCreateDestinations = builder.autoCreateDestinations;
        this.autoCreateProperties = builder.autoCreateProperties;
        this.skipDuplicateContacts = builder.skipDuplicateContacts;
        this.skipPriceConflicts = builder.skipPriceConflicts;
        this.defaultCountry = builder.defaultCountry;
        this.rowTimeoutMillis = builder.rowTimeoutMillis;
        this.gracePeriodDays = builder.gracePeriodDays;
        this.maxAlternativeSuggestions = builder.maxAlternativeSuggestions;
    }

    /** Rows processed concurrently before the next chunk starts. */
    public int getChunkSize() {
        return chunkSize;
    }

    /** Batches with more rows are refused as a whole. */
    public int getMaxRows() {
        return maxRows;
    }

    public int getSuggestionLimit() {
        return suggestionLimit;
    }

    public boolean isAutoCreateDestinations() {
        return autoCreateDestinations;
    }

    public boolean isAutoCreateProperties() {
        return autoCreateProperties;
    }

    public boolean isSkipDuplicateContacts() {
        return skipDuplicateContacts;
    }

    /**
     * Pricing periods overlapping an existing period are skipped instead of
     * failing (create mode) or replacing it (update and both modes).
     */
    public boolean isSkipPriceConflicts() {
        return skipPriceConflicts;
    }

    public String getDefaultCountry() {
        return defaultCountry;
    }

    /** Time one chunk may take before the batch is aborted. */
    public long getRowTimeoutMillis() {
        return rowTimeoutMillis;
    }

    public int getGracePeriodDays() {
        return gracePeriodDays;
    }

    public int getMaxAlternativeSuggestions() {
        return maxAlternativeSuggestions;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    /**
     * Options that never create reference entities on the fly.
     */
    public static ImportOptions strict() {
        return builder()
                .autoCreateDestinations(false)
                .autoCreateProperties(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .chunkSize(chunkSize)
                .maxRows(maxRows)
                .suggestionLimit(suggestionLimit)
                .autoCreateDestinations(autoCreateDestinations)
                .autoCreateProperties(autoCreateProperties)
                .skipDuplicateContacts(skipDuplicateContacts)
                .skipPriceConflicts(skipPriceConflicts)
                .defaultCountry(defaultCountry)
                .rowTimeoutMillis(rowTimeoutMillis)
                .gracePeriodDays(gracePeriodDays)
                .maxAlternativeSuggestions(maxAlternativeSuggestions);
    }

    public static class Builder {
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxRows = DEFAULT_MAX_ROWS;
        private int suggestionLimit = DEFAULT_SUGGESTION_LIMIT;
        private boolean autoCreateDestinations = true;
        private boolean autoCreateProperties = false;
        private boolean skipDuplicateContacts = false;
        private boolean skipPriceConflicts = false;
        private String defaultCountry = DestinationCountryLookup.UNKNOWN_COUNTRY;
        private long rowTimeoutMillis = DEFAULT_ROW_TIMEOUT_MS;
        private int gracePeriodDays = 0;
        private int maxAlternativeSuggestions = DEFAULT_MAX_ALTERNATIVE_SUGGESTIONS;

        public Builder chunkSize(int chunkSize) {
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be > 0");
            }
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder maxRows(int maxRows) {
            if (maxRows <= 0) {
                throw new IllegalArgumentException("maxRows must be > 0");
            }
            this.maxRows = maxRows;
            return this;
        }

        public Builder suggestionLimit(int suggestionLimit) {
            if (suggestionLimit < 0) {
                throw new IllegalArgumentException("suggestionLimit must be >= 0");
            }
            this.suggestionLimit = suggestionLimit;
            return this;
        }

        public Builder autoCreateDestinations(boolean autoCreateDestinations) {
            this.autoCreateDestinations = autoCreateDestinations;
            return this;
        }

        public Builder autoCreateProperties(boolean autoCreateProperties) {
            this.autoCreateProperties = autoCreateProperties;
            return this;
        }

        public Builder skipDuplicateContacts(boolean skipDuplicateContacts) {
            this.skipDuplicateContacts = skipDuplicateContacts;
            return this;
        }

        public Builder skipPriceConflicts(boolean skipPriceConflicts) {
            this.skipPriceConflicts = skipPriceConflicts;
            return this;
        }

        public Builder defaultCountry(String defaultCountry) {
            if (defaultCountry == null || defaultCountry.isBlank()) {
                throw new IllegalArgumentException("defaultCountry must not be blank");
            }
            this.defaultCountry = defaultCountry;
            return this;
        }

        public Builder rowTimeoutMillis(long rowTimeoutMillis) {
            if (rowTimeoutMillis <= 0) {
                throw new IllegalArgumentException("rowTimeoutMillis must be > 0");
            }
            this.rowTimeoutMillis = rowTimeoutMillis;
            return this;
        }

        public Builder gracePeriodDays(int gracePeriodDays) {
            if (gracePeriodDays < 0) {
                throw new IllegalArgumentException("gracePeriodDays must be >= 0");
            }
            this.gracePeriodDays = gracePeriodDays;
            return this;
        }

        public Builder maxAlternativeSuggestions(int maxAlternativeSuggestions) {
            if (maxAlternativeSuggestions < 0) {
                throw new IllegalArgumentException("maxAlternativeSuggestions must be >= 0");
            }
            this.maxAlternativeSuggestions = maxAlternativeSuggestions;
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ImportOptions{chunkSize=" + chunkSize +
                ", maxRows=" + maxRows +
                ", suggestionLimit=" + suggestionLimit +
                ", autoCreateDestinations=" + autoCreateDestinations +
                ", autoCreateProperties=" + autoCreateProperties +
                ", skipDuplicateContacts=" + skipDuplicateContacts +
                ", skipPriceConflicts=" + skipPriceConflicts + '}';
    }
}
