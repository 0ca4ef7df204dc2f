package com.arincdelta.jdbc.calcite;

import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.report.DeltaReport;
import com.arincdelta.jdbc.report.DeltaRunner;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Helper for opening Calcite connections that are pre-wired with a delta schema.
 */
public final class CalciteConnectionFactory {

    public static final String SCHEMA_NAME = "delta";

    private static final Set<String> REQUEST_KEYS =
            Set.of(
                    DeltaSchema.OLD_OPERAND,
                    DeltaSchema.NEW_OPERAND,
                    DeltaRequest.TYPES,
                    DeltaRequest.AIRPORT,
                    DeltaRequest.AREA,
                    DeltaRequest.REGION);

    private CalciteConnectionFactory() {}

    /** Computes the delta eagerly; request and load failures surface as {@link SQLException}. */
    public static Connection connect(Path oldPath, Path newPath, Properties properties) throws SQLException {
        DeltaReport report;
        try {
            DeltaRequest request = DeltaRequest.fromProperties(properties == null ? new Properties() : properties);
            report = new DeltaRunner(request).run(oldPath, newPath);
        } catch (DeltaRequestException ex) {
            throw new SQLException("Invalid delta request: " + ex.getMessage(), ex);
        } catch (LoaderException ex) {
            throw new SQLException("Failed to load snapshots: " + ex.getMessage(), ex);
        }
        return connect(report, properties);
    }

    public static Connection connect(DeltaReport report, Properties properties) throws SQLException {
        Objects.requireNonNull(report, "report");
        Properties calciteProps = new Properties();
        if (properties != null) {
            for (String key : properties.stringPropertyNames()) {
                if (!REQUEST_KEYS.contains(key)) {
                    calciteProps.setProperty(key, properties.getProperty(key));
                }
            }
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");

        return installSchema(DriverManager.getConnection("jdbc:calcite:", calciteProps), report);
    }

    /** Registers the delta schema as the current schema; the connection is closed if that fails. */
    static Connection installSchema(Connection connection, DeltaReport report) throws SQLException {
        try {
            CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
            SchemaPlus root = calcite.getRootSchema();
            root.add(SCHEMA_NAME, new DeltaSchema(report));
            calcite.setSchema(SCHEMA_NAME);
            return connection;
        } catch (SQLException | RuntimeException ex) {
            try {
                connection.close();
            } catch (SQLException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
