package com.arincdelta.jdbc.record;

import java.util.Objects;

/** Section (column 5) and subsection (column 13) of a record, before alias resolution. */
public record TypeTuple(String section, String subsection) {

    public TypeTuple {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(subsection, "subsection");
        if (section.length() != 1 || subsection.length() != 1) {
            throw new IllegalArgumentException("Section and subsection must be single characters");
        }
    }

    public static TypeTuple of(String section, String subsection) {
        return new TypeTuple(section, subsection);
    }

    public String rawCode() {
        return section + subsection;
    }
}
