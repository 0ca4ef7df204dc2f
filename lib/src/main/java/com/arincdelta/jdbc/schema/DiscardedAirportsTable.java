package com.arincdelta.jdbc.schema;

import java.util.ArrayList;
import java.util.List;

/** Airports dropped from both snapshots because one of them had continuations without any primary. */
public final class DiscardedAirportsTable {
    public static final String NAME = "discarded_airports";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "TABLE",
                    "Airports with continuation records but no primary record",
                    List.of(ColumnDescriptor.varchar("icao")));

    private DiscardedAirportsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<String> icaoCodes) {
        List<Object[]> rows = new ArrayList<>(icaoCodes.size());
        for (String icao : icaoCodes) {
            rows.add(new Object[] {icao});
        }
        return rows;
    }
}
