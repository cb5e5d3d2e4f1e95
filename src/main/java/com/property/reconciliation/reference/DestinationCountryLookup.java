package com.property.reconciliation.reference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Infers the country of an auto-created destination from well-known place
 * names. The first place whose name appears in the destination name wins, so
 * table order matters.
 */
public final class DestinationCountryLookup {

    public static final String UNKNOWN_COUNTRY = "Unknown";

    private static final Map<String, String> COMMON_PLACES;

    static {
        Map<String, String> places = new LinkedHashMap<>();
        places.put("mallorca", "Spain");
        places.put("palma", "Spain");
        places.put("ibiza", "Spain");
        places.put("barcelona", "Spain");
        places.put("marbella", "Spain");
        places.put("valencia", "Spain");
        places.put("madrid", "Spain");
        places.put("seville", "Spain");
        places.put("cannes", "France");
        places.put("nice", "France");
        places.put("paris", "France");
        places.put("monaco", "Monaco");
        places.put("london", "United Kingdom");
        places.put("edinburgh", "United Kingdom");
        places.put("dublin", "Ireland");
        places.put("rome", "Italy");
        places.put("florence", "Italy");
        places.put("venice", "Italy");
        places.put("milan", "Italy");
        places.put("athens", "Greece");
        places.put("mykonos", "Greece");
        places.put("santorini", "Greece");
        places.put("crete", "Greece");
        places.put("lisbon", "Portugal");
        places.put("porto", "Portugal");
        places.put("algarve", "Portugal");
        COMMON_PLACES = Collections.unmodifiableMap(places);
    }

    private final Map<String, String> places;
    private final String defaultCountry;

    public DestinationCountryLookup(String defaultCountry) {
        this(COMMON_PLACES, defaultCountry);
    }

    public DestinationCountryLookup(Map<String, String> places, String defaultCountry) {
        this.places = new LinkedHashMap<>(Objects.requireNonNull(places, "places is required"));
        this.defaultCountry = defaultCountry != null ? defaultCountry : UNKNOWN_COUNTRY;
    }

    public static DestinationCountryLookup standard() {
        return new DestinationCountryLookup(UNKNOWN_COUNTRY);
    }

    public String countryFor(String destinationName) {
        return countryFor(destinationName, defaultCountry);
    }

    public String countryFor(String destinationName, String fallback) {
        if (destinationName == null) {
            return fallback;
        }
        String lower = destinationName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> place : places.entrySet()) {
            if (lower.contains(place.getKey())) {
                return place.getValue();
            }
        }
        return fallback;
    }

    public String getDefaultCountry() {
        return defaultCountry;
    }
}
