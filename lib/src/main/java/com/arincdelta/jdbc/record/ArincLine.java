package com.arincdelta.jdbc.record;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One fixed-width ARINC-424 record, always exactly {@link #WIDTH} characters. Column addressing is
 * 1-indexed and inclusive throughout, matching the ARINC column tables.
 */
public final class ArincLine {

    public static final int WIDTH = 132;
    public static final int MIN_RECORD_LENGTH = 70;
    /** Last column that takes part in comparison; 124..132 hold the file record number and cycle. */
    public static final int PAYLOAD_END = 123;
    public static final int IDENTIFIER_END = 21;

    private static final Pattern HEADER_OR_FOOTER = Pattern.compile("^\\s*(HDR|EOF)\\d", Pattern.CASE_INSENSITIVE);

    private final String text;

    private ArincLine(String text) {
        this.text = text;
    }

    public static ArincLine of(String raw) {
        Objects.requireNonNull(raw, "raw");
        return new ArincLine(normalize(raw));
    }

    public static String normalize(String raw) {
        String stripped = stripLineEnd(raw);
        if (stripped.length() >= WIDTH) {
            return stripped.substring(0, WIDTH);
        }
        StringBuilder padded = new StringBuilder(WIDTH).append(stripped);
        while (padded.length() < WIDTH) {
            padded.append(' ');
        }
        return padded.toString();
    }

    public static boolean isRecord(String raw) {
        return raw != null && stripLineEnd(raw).length() >= MIN_RECORD_LENGTH;
    }

    public static boolean isHeaderOrFooter(String raw) {
        return raw != null && HEADER_OR_FOOTER.matcher(raw.strip()).find();
    }

    public String slice(int start, int end) {
        if (start < 1 || end > WIDTH || end < start - 1) {
            throw new IndexOutOfBoundsException("Invalid column range " + start + ".." + end);
        }
        return text.substring(start - 1, end);
    }

    public char charAt(int column) {
        return text.charAt(column - 1);
    }

    public String payload() {
        return text.substring(0, PAYLOAD_END);
    }

    public String identifier() {
        return text.substring(0, IDENTIFIER_END);
    }

    public TypeTuple typeTuple() {
        return new TypeTuple(slice(5, 5), slice(13, 13));
    }

    public String typeCode() {
        return TypeCodes.resolve(typeTuple());
    }

    public String icao() {
        return slice(7, 10).strip().toUpperCase(Locale.ROOT);
    }

    public String areaCode() {
        return slice(2, 4).strip().toUpperCase(Locale.ROOT);
    }

    public String text() {
        return text;
    }

    private static String stripLineEnd(String raw) {
        int end = raw.length();
        while (end > 0 && (raw.charAt(end - 1) == '\n' || raw.charAt(end - 1) == '\r')) {
            end--;
        }
        return raw.substring(0, end);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ArincLine line && text.equals(line.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
