package com.arincdelta.jdbc;

import com.arincdelta.jdbc.calcite.CalciteConnectionFactory;
import com.arincdelta.jdbc.loader.DebugFlags;
import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.report.DeltaReport;
import com.arincdelta.jdbc.report.DeltaRunner;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC driver that computes an ARINC 424 delta on connect and exposes its output tables through
 * Calcite. URL form: {@code jdbc:arincdelta:?old=<path>&new=<path>&types=PG,PI&region=EU}.
 */
public final class ArincDeltaDriver implements Driver {

    static final String URL_PREFIX = "jdbc:arincdelta:";
    static final String OLD = "old";
    static final String NEW = "new";
    private static final Logger LOGGER = Logger.getLogger(ArincDeltaDriver.class.getName());

    static {
        DebugFlags.applyLogging();
        try {
            DriverManager.registerDriver(new ArincDeltaDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url, info);
        DeltaReport report;
        try {
            DeltaRequest request = DeltaRequest.fromProperties(parsed.properties());
            report = new DeltaRunner(request).run(parsed.oldPath(), parsed.newPath());
        } catch (DeltaRequestException ex) {
            throw new SQLException("Invalid delta request: " + ex.getMessage(), ex);
        } catch (LoaderException ex) {
            throw new SQLException("Failed to load snapshots: " + ex.getMessage(), ex);
        }
        Connection connection = CalciteConnectionFactory.connect(report, parsed.properties());
        logWarnings(report.getDiscardedAirports());
        return wrapCalciteConnection(connection, buildWarningChain(report.getDiscardedAirports()));
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo oldProperty = new DriverPropertyInfo(OLD, null);
        oldProperty.description = "Path to the older ARINC 424 snapshot. Optional if 'new' is given.";
        DriverPropertyInfo newProperty = new DriverPropertyInfo(NEW, null);
        newProperty.description = "Path to the newer ARINC 424 snapshot. Optional if 'old' is given.";
        DriverPropertyInfo types = new DriverPropertyInfo(DeltaRequest.TYPES, null);
        types.description = "Comma-separated record type codes; empty means all registered types.";
        DriverPropertyInfo airport = new DriverPropertyInfo(DeltaRequest.AIRPORT, null);
        airport.description = "Comma-separated ICAO airport filter.";
        DriverPropertyInfo area = new DriverPropertyInfo(DeltaRequest.AREA, null);
        area.description = "Comma-separated area code filter; overrides region.";
        DriverPropertyInfo region = new DriverPropertyInfo(DeltaRequest.REGION, null);
        region.description = "Comma-separated region aliases or area codes.";
        return new DriverPropertyInfo[] {oldProperty, newProperty, types, airport, area, region};
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    static ParsedUrl parseUrl(String url, Properties info) throws SQLException {
        Properties props = new Properties();
        if (info != null) {
            for (String key : info.stringPropertyNames()) {
                props.setProperty(key, info.getProperty(key));
            }
        }
        String remainder = url.substring(URL_PREFIX.length());
        int paramIndex = remainder.indexOf('?');
        String query = paramIndex >= 0 ? remainder.substring(paramIndex + 1) : "";
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            props.setProperty(key, value);
        }

        Path oldPath = resolveSnapshot(props.getProperty(OLD));
        Path newPath = resolveSnapshot(props.getProperty(NEW));
        if (oldPath == null && newPath == null) {
            throw new SQLException("At least one of 'old' or 'new' snapshot paths is required in the JDBC URL.");
        }
        return new ParsedUrl(oldPath, newPath, props);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static Path resolveSnapshot(String value) throws SQLException {
        if (value == null || value.isBlank()) {
            return null;
        }
        Path path;
        if (value.startsWith("file:")) {
            try {
                path = Paths.get(java.net.URI.create(value));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + value, ex);
            }
        } else {
            path = Paths.get(value);
        }
        path = path.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new SQLException("Snapshot file not found: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new SQLException("Snapshot file is not readable: " + path);
        }
        return path;
    }

    static SQLWarning buildWarningChain(List<String> discardedAirports) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (String icao : discardedAirports) {
            SQLWarning warning =
                    new SQLWarning("[ARINC Delta] Airport " + icao + " discarded: continuation records without a primary");
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logWarnings(List<String> discardedAirports) {
        if (!discardedAirports.isEmpty()) {
            LOGGER.log(
                    Level.WARNING,
                    "[ARINC Delta] Discarded airports: {0}",
                    String.join(", ", discardedAirports));
        }
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                if ("getMetaData".equals(method.getName()) && args == null) {
                                    DatabaseMetaData meta = delegate.getMetaData();
                                    return wrapCalciteMetaData(meta);
                                } else if ("getWarnings".equals(method.getName())) {
                                    return localWarnings;
                                } else if ("clearWarnings".equals(method.getName())) {
                                    localWarnings = null;
                                    return null;
                                }
                                return super.handle(proxy, method, args);
                            }
                        });
    }

    private DatabaseMetaData wrapCalciteMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "ARINC 424 Delta";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "ARINC Delta JDBC Driver (Calcite)";
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    record ParsedUrl(Path oldPath, Path newPath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            try {
                if (method.getDeclaringClass() == Object.class) {
                    return method.invoke(delegate, args);
                }
                return handle(proxy, method, args);
            } catch (InvocationTargetException ex) {
                throw ex.getCause();
            }
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return method.invoke(delegate, args);
        }
    }
}
