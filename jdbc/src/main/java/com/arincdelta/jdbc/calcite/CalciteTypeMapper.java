package com.arincdelta.jdbc.calcite;

import com.arincdelta.jdbc.schema.ColumnDescriptor;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType toRelDataType(RelDataTypeFactory factory, ColumnDescriptor column) {
        RelDataType baseType = factory.createSqlType(mapSqlType(column.getJdbcType()));
        return column.isNullable() ? factory.createTypeWithNullability(baseType, true) : baseType;
    }

    private static SqlTypeName mapSqlType(int jdbcType) {
        return switch (jdbcType) {
            case java.sql.Types.INTEGER -> SqlTypeName.INTEGER;
            case java.sql.Types.VARCHAR -> SqlTypeName.VARCHAR;
            default -> SqlTypeName.ANY;
        };
    }
}
