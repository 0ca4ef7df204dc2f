package com.arincdelta.jdbc.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.testing.TestResources;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DeltaCliTest {

    @TempDir
    Path tempDir;

    @Test
    void writesDeltaFilesWithDefaultRegion() throws Exception {
        Path out = tempDir.resolve("out");
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        int exit =
                DeltaCli.run(
                        new String[] {
                            TestResources.snapshot("old.pc").toString(),
                            TestResources.snapshot("new.pc").toString(),
                            "--out",
                            out.toString()
                        },
                        new PrintStream(stdout, true, StandardCharsets.UTF_8),
                        new PrintStream(stderr, true, StandardCharsets.UTF_8));

        assertEquals(0, exit, stderr.toString(StandardCharsets.UTF_8));
        String printed = stdout.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Discarded ICAOs: LTFM"), printed);
        assertTrue(printed.contains("PG: current=2 added=0 removed=1 modified=1"), printed);
        assertTrue(Files.exists(out.resolve("modified_PG.csv")));
        assertTrue(Files.exists(out.resolve("added_dv_vor.csv")));
        assertTrue(Files.exists(out.resolve("summary.csv")));
        assertFalse(Files.exists(out.resolve("current_DV.csv")));
    }

    @Test
    void emptyRegionDisablesVorView() throws Exception {
        Path out = tempDir.resolve("out");
        int exit =
                DeltaCli.run(
                        new String[] {
                            TestResources.snapshot("old.pc").toString(),
                            TestResources.snapshot("new.pc").toString(),
                            "--out=" + out,
                            "--region=",
                            "--types",
                            "DV"
                        },
                        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertEquals(0, exit);
        assertTrue(Files.exists(out.resolve("current_dv_ils_dme.csv")));
        assertFalse(Files.exists(out.resolve("current_dv_vor.csv")));
    }

    @Test
    void badTypeExitsWithUsageError() {
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        int exit =
                DeltaCli.run(
                        new String[] {"old.pc", "new.pc", "--types", "XX"},
                        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                        new PrintStream(stderr, true, StandardCharsets.UTF_8));

        assertEquals(2, exit);
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Unknown type 'XX'"));
    }

    @Test
    void parsesOptionsAndDefaults() {
        DeltaCli.Arguments arguments = DeltaCli.Arguments.parse(new String[] {"a.pc", "b.pc", "--airport", "ltac"});

        assertEquals(DeltaCli.DEFAULT_REGION, arguments.requestProperties().getProperty(DeltaRequest.REGION));
        assertEquals("ltac", arguments.requestProperties().getProperty(DeltaRequest.AIRPORT));
        assertEquals(Path.of(DeltaCli.DEFAULT_OUT), arguments.outputDirectory());
        assertThrows(IllegalArgumentException.class, () -> DeltaCli.Arguments.parse(new String[] {"a.pc"}));
        assertThrows(
                IllegalArgumentException.class,
                () -> DeltaCli.Arguments.parse(new String[] {"a.pc", "b.pc", "--bogus", "1"}));
    }
}
