package com.arincdelta.jdbc.record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Continuation number extraction and the length-then-value order used wherever continuations are listed. */
public final class ContinuationNumbers {

    public static final String PRIMARY = "";

    /** Orders "2" before "10": shorter identifiers first, then lexicographic. */
    public static final Comparator<String> ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private ContinuationNumbers() {}

    /** Returns {@link #PRIMARY} for blank, "0" and "1"; any other character is a continuation number. */
    public static String of(ArincLine line, int column) {
        String value = line.slice(column, column);
        if (value.isEmpty() || " ".equals(value) || "0".equals(value) || "1".equals(value)) {
            return PRIMARY;
        }
        return value;
    }

    public static String applicationType(ArincLine line, int column) {
        if (column <= 0) {
            return "";
        }
        return line.slice(column, column).strip().toUpperCase(Locale.ROOT);
    }

    public static List<String> sorted(Collection<String> numbers) {
        List<String> sorted = new ArrayList<>(numbers);
        sorted.sort(ORDER);
        return sorted;
    }
}
