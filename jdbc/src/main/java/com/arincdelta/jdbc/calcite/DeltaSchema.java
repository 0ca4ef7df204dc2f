package com.arincdelta.jdbc.calcite;

import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.output.OutputTable;
import com.arincdelta.jdbc.output.TypeDelta;
import com.arincdelta.jdbc.report.DeltaReport;
import com.arincdelta.jdbc.report.DeltaRunner;
import com.arincdelta.jdbc.schema.DiscardedAirportsTable;
import com.arincdelta.jdbc.schema.SummaryTable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/**
 * Calcite schema over one computed delta. Every output table of the run becomes a SQL table with a
 * lower-cased name ({@code current_pg}, {@code modified_dv_ils_dme}, ...), next to {@code summary}
 * and {@code discarded_airports}. The delta is computed on first access.
 */
public final class DeltaSchema extends AbstractSchema {

    public static final String OLD_OPERAND = "old";
    public static final String NEW_OPERAND = "new";

    private final Path oldPath;
    private final Path newPath;
    private final Properties requestProperties;
    private volatile DeltaReport report;
    private volatile Map<String, Table> tables;

    DeltaSchema(Map<String, Object> operand) {
        Objects.requireNonNull(operand, "operand");
        this.oldPath = resolvePath(operand.get(OLD_OPERAND));
        this.newPath = resolvePath(operand.get(NEW_OPERAND));
        this.requestProperties = new Properties();
        for (String key : new String[] {DeltaRequest.TYPES, DeltaRequest.AIRPORT, DeltaRequest.AREA, DeltaRequest.REGION}) {
            Object value = operand.get(key);
            if (value != null) {
                requestProperties.setProperty(key, value.toString());
            }
        }
    }

    DeltaSchema(DeltaReport report) {
        this.oldPath = null;
        this.newPath = null;
        this.requestProperties = new Properties();
        this.report = Objects.requireNonNull(report, "report");
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            synchronized (this) {
                local = tables;
                if (local == null) {
                    local = buildTables(loadReport());
                    tables = local;
                }
            }
        }
        return local;
    }

    DeltaReport loadReport() {
        DeltaReport current = report;
        if (current == null) {
            synchronized (this) {
                current = report;
                if (current == null) {
                    try {
                        DeltaRequest request = DeltaRequest.fromProperties(requestProperties);
                        current = new DeltaRunner(request).run(oldPath, newPath);
                    } catch (DeltaRequestException ex) {
                        throw new IllegalStateException("Invalid delta request: " + ex.getMessage(), ex);
                    } catch (LoaderException ex) {
                        throw new IllegalStateException("Failed to load snapshots: " + ex.getMessage(), ex);
                    }
                    report = current;
                }
            }
        }
        return current;
    }

    private static Map<String, Table> buildTables(DeltaReport report) {
        Map<String, Table> map = new LinkedHashMap<>();
        for (TypeDelta delta : report.getTypeDeltas()) {
            String remarks = delta.getTable().getTitle() + " (" + delta.getTypeCode() + ")";
            for (OutputTable table : delta.getOutputTables()) {
                String name = table.getName().toLowerCase(Locale.ROOT);
                map.put(name, new DeltaCalciteTable(table.toDefinition(remarks), table.materializeRows()));
            }
        }
        map.put(
                SummaryTable.NAME,
                new DeltaCalciteTable(
                        SummaryTable.getDefinition(), SummaryTable.materializeRows(report.getSummaries())));
        map.put(
                DiscardedAirportsTable.NAME,
                new DeltaCalciteTable(
                        DiscardedAirportsTable.getDefinition(),
                        DiscardedAirportsTable.materializeRows(report.getDiscardedAirports())));
        return Map.copyOf(map);
    }

    private static Path resolvePath(Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return Paths.get(value.toString()).toAbsolutePath().normalize();
    }
}
