package com.arincdelta.jdbc.calcite;

import com.arincdelta.jdbc.schema.ColumnDescriptor;
import com.arincdelta.jdbc.schema.TableDefinition;
import java.util.List;
import java.util.Objects;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.impl.AbstractTable;

/** Scannable view over rows that were materialized once for a {@link TableDefinition}. */
final class DeltaCalciteTable extends AbstractTable implements ScannableTable {

    private final TableDefinition definition;
    private final List<Object[]> rows;

    DeltaCalciteTable(TableDefinition definition, List<Object[]> rows) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.rows = List.copyOf(rows);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        RelDataTypeFactory.Builder builder = typeFactory.builder();
        for (ColumnDescriptor column : definition.getColumns()) {
            builder.add(column.getName(), CalciteTypeMapper.toRelDataType(typeFactory, column));
        }
        return builder.build();
    }

    @Override
    public Schema.TableType getJdbcTableType() {
        return Schema.TableType.valueOf(definition.getType());
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return Linq4j.asEnumerable(rows);
    }
}
