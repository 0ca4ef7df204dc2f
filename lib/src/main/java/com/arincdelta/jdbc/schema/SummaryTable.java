package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.report.TypeSummary;
import java.util.ArrayList;
import java.util.List;

/** One row per requested record type with its current/added/removed/modified counts. */
public final class SummaryTable {
    public static final String NAME = "summary";

    private static final TableDefinition DEFINITION = createDefinition();

    private SummaryTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<TypeSummary> summaries) {
        List<Object[]> rows = new ArrayList<>(summaries.size());
        for (TypeSummary summary : summaries) {
            rows.add(
                    new Object[] {
                        summary.typeCode(), summary.current(), summary.added(), summary.removed(), summary.modified()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(ColumnDescriptor.varchar("type"));
        columns.add(ColumnDescriptor.integer("current"));
        columns.add(ColumnDescriptor.integer("added"));
        columns.add(ColumnDescriptor.integer("removed"));
        columns.add(ColumnDescriptor.integer("modified"));
        return new TableDefinition(NAME, "TABLE", "Per-type delta counts", columns);
    }
}
