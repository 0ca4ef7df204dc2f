package com.arincdelta.jdbc.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class TableDefinition {
    private final String name;
    private final String type;
    private final String remarks;
    private final List<ColumnDescriptor> columns;

    public TableDefinition(String name, String type, String remarks, List<ColumnDescriptor> columns) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.remarks = remarks;
        this.columns = List.copyOf(columns);
    }

    /** Table whose every column is a non-null string, one per header field. */
    public static TableDefinition ofHeader(String name, String remarks, List<String> header) {
        List<ColumnDescriptor> columns = new ArrayList<>(header.size());
        for (String field : header) {
            columns.add(ColumnDescriptor.varchar(field));
        }
        return new TableDefinition(name, "TABLE", remarks, columns);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getRemarks() {
        return remarks;
    }

    public List<ColumnDescriptor> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnDescriptor column : columns) {
            names.add(column.getName());
        }
        return names;
    }
}
