package com.arincdelta.jdbc.output;

import com.arincdelta.jdbc.schema.TableDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A named, ordered header plus its rows; the unit written as one CSV file or exposed as one SQL table. */
public final class OutputTable {
    private final String name;
    private final List<String> header;
    private final List<Row> rows;

    public OutputTable(String name, List<String> header, List<Row> rows) {
        this.name = Objects.requireNonNull(name, "name");
        this.header = List.copyOf(header);
        this.rows = List.copyOf(rows);
    }

    public String getName() {
        return name;
    }

    public List<String> getHeader() {
        return header;
    }

    public List<Row> getRows() {
        return rows;
    }

    public TableDefinition toDefinition(String remarks) {
        return TableDefinition.ofHeader(name, remarks, header);
    }

    public List<Object[]> materializeRows() {
        List<Object[]> materialized = new ArrayList<>(rows.size());
        for (Row row : rows) {
            materialized.add(row.toArray(header));
        }
        return materialized;
    }
}
