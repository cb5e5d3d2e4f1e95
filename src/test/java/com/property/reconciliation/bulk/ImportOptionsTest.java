package com.property.reconciliation.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportOptions Tests")
class ImportOptionsTest {

    @Test
    @DisplayName("Should expose the documented defaults")
    void defaults() {
        ImportOptions options = ImportOptions.defaults();

        assertEquals(10, options.getChunkSize());
        assertEquals(10_000, options.getMaxRows());
        assertEquals(3, options.getSuggestionLimit());
        assertTrue(options.isAutoCreateDestinations());
        assertFalse(options.isAutoCreateProperties());
        assertFalse(options.isSkipDuplicateContacts());
        assertFalse(options.isSkipPriceConflicts());
        assertEquals("Unknown", options.getDefaultCountry());
        assertEquals(30_000, options.getRowTimeoutMillis());
    }

    @Test
    @DisplayName("Strict options never auto-create")
    void strict() {
        ImportOptions options = ImportOptions.strict();

        assertFalse(options.isAutoCreateDestinations());
        assertFalse(options.isAutoCreateProperties());
    }

    @Test
    @DisplayName("toBuilder should copy every setting")
    void toBuilder() {
        ImportOptions original = ImportOptions.builder()
                .chunkSize(4)
                .skipDuplicateContacts(true)
                .skipPriceConflicts(true)
                .defaultCountry("Spain")
                .gracePeriodDays(2)
                .build();

        ImportOptions copy = original.toBuilder().maxRows(50).build();

        assertEquals(4, copy.getChunkSize());
        assertEquals(50, copy.getMaxRows());
        assertTrue(copy.isSkipDuplicateContacts());
        assertTrue(copy.isSkipPriceConflicts());
        assertEquals("Spain", copy.getDefaultCountry());
        assertEquals(2, copy.getGracePeriodDays());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject non-positive sizes")
    void rejectsInvalidSizes(int value) {
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().chunkSize(value));
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().maxRows(value));
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().rowTimeoutMillis(value));
    }

    @Test
    @DisplayName("Should reject a blank default country")
    void blankCountry() {
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().defaultCountry(" "));
    }

    @Test
    @DisplayName("Should parse modes case-insensitively")
    void modes() {
        assertEquals(ImportMode.UPDATE, ImportMode.fromString(" UPDATE "));
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> ImportMode.fromString(null));
        assertEquals("Unsupported import mode: null", error.getMessage());
    }
}
