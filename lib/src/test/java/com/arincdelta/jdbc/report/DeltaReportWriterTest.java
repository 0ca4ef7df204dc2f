package com.arincdelta.jdbc.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.testing.ArincLines;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DeltaReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesPerTypeFilesSummaryAndDiscardedList() throws Exception {
        DeltaReport report =
                new DeltaRunner(DeltaRequest.builder().types("PG").build())
                        .compare(
                                List.of(
                                        ArincLines.runway("LTAC", "RWY01", "0", "09000").build(),
                                        ArincLines.runway("LTFM", "RWY16", "2", "A").build(),
                                        ArincLines.runway("LTBA", "RWY05", "3", "A").build()),
                                List.of(ArincLines.runway("LTAC", "RWY01", "0", "09500").build()));
        Path out = tempDir.resolve("out");

        List<Path> written = new DeltaReportWriter(out).write(report);

        assertEquals(6, written.size());
        for (String name : List.of("current_PG.csv", "added_PG.csv", "removed_PG.csv", "modified_PG.csv")) {
            assertTrue(Files.exists(out.resolve(name)), name);
        }
        assertEquals("LTBA\nLTFM", Files.readString(out.resolve(DeltaReportWriter.DISCARDED_FILE)));
        assertEquals(
                "type,current,added,removed,modified\r\nPG,1,0,0,1\r\n",
                Files.readString(out.resolve(DeltaReportWriter.SUMMARY_FILE), StandardCharsets.UTF_8));

        List<String> modified = Files.readAllLines(out.resolve("modified_PG.csv"), StandardCharsets.UTF_8);
        assertEquals(2, modified.size());
        assertTrue(modified.get(0).endsWith(",changed_field_count,changed_fields"));
        assertTrue(modified.get(1).endsWith(",1,rwy_length_ft"));
    }

    @Test
    void removesStaleNavaidOutputs() throws Exception {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("current_DV.csv"), "stale");
        Files.writeString(out.resolve("current_dv_vor.csv"), "stale");
        Files.writeString(out.resolve(DeltaReportWriter.DISCARDED_FILE), "LTXX");
        DeltaReport report =
                new DeltaRunner(DeltaRequest.builder().types("DV").build())
                        .compare(List.of(), List.of(ArincLines.vhfNavaid("LTAC", "IAC", "ID").at(29, "I").build()));

        new DeltaReportWriter(out).write(report);

        assertFalse(Files.exists(out.resolve("current_DV.csv")));
        assertFalse(Files.exists(out.resolve("current_dv_vor.csv")));
        assertFalse(Files.exists(out.resolve(DeltaReportWriter.DISCARDED_FILE)));
        assertTrue(Files.exists(out.resolve("added_dv_ils_dme.csv")));
        assertEquals(2, Files.readAllLines(out.resolve("added_dv_ils_dme.csv")).size());
    }
}
