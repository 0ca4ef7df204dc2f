package com.arincdelta.jdbc.report;

import com.arincdelta.jdbc.output.OutputTable;
import com.arincdelta.jdbc.output.TypeDelta;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Everything one run produced, in requested type order. */
public final class DeltaReport {
    private final List<String> discardedAirports;
    private final List<TypeDelta> typeDeltas;
    private final List<TypeSummary> summaries;

    public DeltaReport(List<String> discardedAirports, List<TypeDelta> typeDeltas, List<TypeSummary> summaries) {
        this.discardedAirports = List.copyOf(discardedAirports);
        this.typeDeltas = List.copyOf(typeDeltas);
        this.summaries = List.copyOf(summaries);
    }

    /** Sorted ICAO codes excluded from both snapshots. */
    public List<String> getDiscardedAirports() {
        return discardedAirports;
    }

    public List<TypeDelta> getTypeDeltas() {
        return typeDeltas;
    }

    public Optional<TypeDelta> getTypeDelta(String typeCode) {
        for (TypeDelta delta : typeDeltas) {
            if (delta.getTypeCode().equals(typeCode)) {
                return Optional.of(delta);
            }
        }
        return Optional.empty();
    }

    public List<TypeSummary> getSummaries() {
        return summaries;
    }

    public List<OutputTable> getOutputTables() {
        List<OutputTable> tables = new ArrayList<>();
        for (TypeDelta delta : typeDeltas) {
            tables.addAll(delta.getOutputTables());
        }
        return tables;
    }
}
