package com.arincdelta.jdbc.calcite;

import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} entry point for model files. Operands: {@code old}, {@code new}
 * (snapshot paths, at least one), and optionally {@code types}, {@code airport}, {@code area},
 * {@code region}.
 */
public final class DeltaSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new DeltaSchema(operand);
    }
}
