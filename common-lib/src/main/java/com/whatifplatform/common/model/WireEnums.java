package com.whatifplatform.common.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lookup helpers shared by every {@link WireEnum}.
 *
 * <p>Stateless. No logging.
 */
public final class WireEnums {

    private WireEnums() {}

    public static <E extends Enum<E> & WireEnum> Optional<E> find(Class<E> type, String value) {
        if (value == null) return Optional.empty();
        for (E constant : type.getEnumConstants()) {
            if (constant.value().equals(value)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    public static <E extends Enum<E> & WireEnum> E parse(Class<E> type, String value) {
        return find(type, value).orElseThrow(() -> new IllegalArgumentException(
            "Unknown " + type.getSimpleName() + " value '" + value + "'. Valid values: " + describe(type)));
    }

    public static <E extends Enum<E> & WireEnum> boolean isValid(Class<E> type, String value) {
        return find(type, value).isPresent();
    }

    /**
     * Sorted, comma-separated list of the wire values, used in guidance texts.
     */
    public static <E extends Enum<E> & WireEnum> String describe(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
            .map(WireEnum::value)
            .sorted()
            .collect(Collectors.joining(", "));
    }
}
