package com.arincdelta.jdbc.calcite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.report.DeltaReport;
import com.arincdelta.jdbc.testing.TestResources;
import java.lang.reflect.Proxy;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CalciteConnectionFactoryTest {

    @Test
    void opensConnectionFromSnapshotPaths() throws Exception {
        try (Connection connection =
                        CalciteConnectionFactory.connect(
                                TestResources.snapshot("old.pc"), TestResources.snapshot("new.pc"), new Properties());
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM summary")) {
            assertEquals(CalciteConnectionFactory.SCHEMA_NAME, connection.getSchema());
            assertTrue(rs.next());
            assertEquals(4, rs.getInt(1));
        }
    }

    @Test
    void requestPropertiesNarrowTheSchema() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("types", "PG");
        try (Connection connection =
                        CalciteConnectionFactory.connect(
                                TestResources.snapshot("old.pc"), TestResources.snapshot("new.pc"), properties);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT \"type\", \"removed\" FROM summary")) {
            assertTrue(rs.next());
            assertEquals("PG", rs.getString(1));
            assertEquals(1, rs.getInt(2));
            assertFalse(rs.next());
        }
    }

    @Test
    void unknownTypeCodeIsReportedAsSqlException() {
        Properties properties = new Properties();
        properties.setProperty("types", "XX");

        SQLException ex =
                assertThrows(
                        SQLException.class,
                        () -> CalciteConnectionFactory.connect(
                                TestResources.snapshot("old.pc"), TestResources.snapshot("new.pc"), properties));
        assertInstanceOf(DeltaRequestException.class, ex.getCause());
    }

    @Test
    void unreadableSnapshotIsReportedAsSqlException(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.pc");

        SQLException ex =
                assertThrows(
                        SQLException.class,
                        () -> CalciteConnectionFactory.connect(missing, TestResources.snapshot("new.pc"), null));
        assertInstanceOf(LoaderException.class, ex.getCause());
    }

    @Test
    void connectionIsClosedWhenSchemaCannotBeInstalled() {
        AtomicBoolean closed = new AtomicBoolean();
        Connection connection =
                (Connection)
                        Proxy.newProxyInstance(
                                Connection.class.getClassLoader(),
                                new Class<?>[] {Connection.class},
                                (proxy, method, args) -> {
                                    switch (method.getName()) {
                                        case "unwrap":
                                            throw new SQLException("not a Calcite connection");
                                        case "close":
                                            closed.set(true);
                                            return null;
                                        default:
                                            throw new UnsupportedOperationException(method.getName());
                                    }
                                });
        DeltaReport report = new DeltaReport(List.of(), List.of(), List.of());

        SQLException ex =
                assertThrows(SQLException.class, () -> CalciteConnectionFactory.installSchema(connection, report));
        assertEquals("not a Calcite connection", ex.getMessage());
        assertTrue(closed.get());
    }
}
