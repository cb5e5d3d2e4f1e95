package com.property.reconciliation.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, case-insensitive mapping from raw cell text to an enum constant.
 * Unknown values fall back to the declared default instead of failing the row.
 *
 * @param <E> the target enum
 */
public final class EnumMapping<E extends Enum<E>> {

    private final String name;
    private final Class<E> enumType;
    private final E defaultValue;
    private final Map<String, E> aliases;

    private EnumMapping(String name, Class<E> enumType, E defaultValue, Map<String, E> aliases) {
        this.name = name;
        this.enumType = enumType;
        this.defaultValue = defaultValue;
        this.aliases = aliases;
    }

    public static <E extends Enum<E>> EnumMapping<E> of(String name, Class<E> enumType, E defaultValue) {
        return new EnumMapping<>(name, enumType, defaultValue, Map.of());
    }

    /**
     * Returns a copy that also accepts {@code alias} (case-insensitive) for {@code target}.
     */
    public EnumMapping<E> withAlias(String alias, E target) {
        Objects.requireNonNull(alias, "alias is required");
        Objects.requireNonNull(target, "target is required");
        Map<String, E> copy = new LinkedHashMap<>(aliases);
        copy.put(alias.trim().toUpperCase(Locale.ROOT), target);
        return new EnumMapping<>(name, enumType, defaultValue, Collections.unmodifiableMap(copy));
    }

    /**
     * Maps a raw value to a constant without falling back.
     */
    public Optional<E> lookup(String raw) {
        String value = ValueCoercer.trimToNull(raw);
        if (value == null) {
            return Optional.empty();
        }
        String key = value.toUpperCase(Locale.ROOT);
        for (E constant : enumType.getEnumConstants()) {
            if (constant.name().equals(key)) {
                return Optional.of(constant);
            }
        }
        return Optional.ofNullable(aliases.get(key));
    }

    /**
     * Maps a raw value, returning the default for blank or unrecognised input.
     */
    public E map(String raw) {
        return lookup(raw).orElse(defaultValue);
    }

    public boolean recognizes(String raw) {
        return lookup(raw).isPresent();
    }

    public E getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return "EnumMapping{" + name + ", default=" + defaultValue + ", aliases=" + aliases + '}';
    }
}
