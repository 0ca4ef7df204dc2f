package com.arincdelta.jdbc.schema;

import java.sql.Types;
import java.util.Objects;

/** SQL-facing description of one output column. Delta fields are strings; summary counts are integers. */
public final class ColumnDescriptor {
    private final String name;
    private final int jdbcType;
    private final boolean nullable;

    public ColumnDescriptor(String name, int jdbcType, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.nullable = nullable;
    }

    public static ColumnDescriptor varchar(String name) {
        return new ColumnDescriptor(name, Types.VARCHAR, false);
    }

    public static ColumnDescriptor integer(String name) {
        return new ColumnDescriptor(name, Types.INTEGER, false);
    }

    public String getName() {
        return name;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public boolean isNullable() {
        return nullable;
    }
}
