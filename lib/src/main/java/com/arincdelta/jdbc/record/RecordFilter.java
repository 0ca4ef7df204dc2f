package com.arincdelta.jdbc.record;

import java.util.Objects;
import java.util.Set;

/**
 * Line-level allow-sets applied while a snapshot is read. A {@code null} ICAO or area set accepts
 * every value for that dimension.
 */
public final class RecordFilter {
    private final Set<TypeTuple> typeTuples;
    private final Set<String> icaoCodes;
    private final Set<String> areaCodes;

    public RecordFilter(Set<TypeTuple> typeTuples, Set<String> icaoCodes, Set<String> areaCodes) {
        this.typeTuples = Set.copyOf(Objects.requireNonNull(typeTuples, "typeTuples"));
        this.icaoCodes = icaoCodes == null ? null : Set.copyOf(icaoCodes);
        this.areaCodes = areaCodes == null ? null : Set.copyOf(areaCodes);
    }

    public boolean accepts(ArincLine line) {
        if (!typeTuples.contains(line.typeTuple())) {
            return false;
        }
        if (icaoCodes != null && !icaoCodes.contains(line.icao())) {
            return false;
        }
        return areaCodes == null || areaCodes.contains(line.areaCode());
    }

    public Set<TypeTuple> getTypeTuples() {
        return typeTuples;
    }

    public Set<String> getIcaoCodes() {
        return icaoCodes;
    }

    public Set<String> getAreaCodes() {
        return areaCodes;
    }
}
