package com.arincdelta.jdbc.loader;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

final class FilterLists {

    private FilterLists() {}

    /** Comma-separated, trimmed, upper-cased; {@code null} when nothing is left. */
    static Set<String> parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Set<String> values = new LinkedHashSet<>();
        for (String token : value.split(",")) {
            String trimmed = token.strip();
            if (!trimmed.isEmpty()) {
                values.add(trimmed.toUpperCase(Locale.ROOT));
            }
        }
        return values.isEmpty() ? null : values;
    }
}
