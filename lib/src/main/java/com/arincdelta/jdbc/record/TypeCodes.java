package com.arincdelta.jdbc.record;

import java.util.Map;

/** Maps a raw section/subsection pair onto its canonical two-character type code. */
public final class TypeCodes {

    private static final Map<String, String> ALIASES = Map.of("D ", "DV");

    private TypeCodes() {}

    public static String resolve(TypeTuple tuple) {
        String raw = tuple.rawCode();
        return ALIASES.getOrDefault(raw, raw);
    }
}
