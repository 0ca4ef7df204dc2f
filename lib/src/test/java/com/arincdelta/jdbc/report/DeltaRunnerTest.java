package com.arincdelta.jdbc.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.SnapshotLoader;
import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.output.TypeDelta;
import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.testing.ArincLines;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DeltaRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void runwayLengthChangeIsOneModifiedField() throws Exception {
        DeltaRunner runner = new DeltaRunner(DeltaRequest.builder().types("PG").build());

        DeltaReport report =
                runner.compare(
                        List.of(ArincLines.runway("LTAC", "RWY01", "0", "09000").build()),
                        List.of(ArincLines.runway("LTAC", "RWY01", "0", "09500").build()));

        assertEquals(List.of(new TypeSummary("PG", 1, 0, 0, 1)), report.getSummaries());
        Row modified = report.getTypeDelta("PG").orElseThrow().getModified().get(0);
        assertEquals(List.of("rwy_length_ft"), modified.getChangedFields());
        assertEquals("1", modified.get(Row.CHANGED_FIELD_COUNT));
        assertEquals("rwy_length_ft", modified.get(Row.CHANGED_FIELDS));
        assertEquals("09500", modified.get("rwy_length_ft"));
    }

    @Test
    void singleByteChangeReportsOnlyTheCoveringField() {
        ArincLine before = ArincLines.runway("LTAC", "RWY01", "0", "09000").at(52, "+0100").build();
        ArincLine after = ArincLines.runway("LTAC", "RWY01", "0", "09000").at(52, "+0150").build();
        DeltaReport report = runnerFor("PG").compare(List.of(before), List.of(after));

        assertEquals(
                List.of("rwy_grad_pct100"),
                report.getTypeDelta("PG").orElseThrow().getModified().get(0).getChangedFields());
    }

    @Test
    void changeInUnprojectedColumnIsModifiedWithoutFields() {
        ArincLine before = ArincLines.runway("LTAC", "RWY01", "0", "09000").at(60, "A").build();
        ArincLine after = ArincLines.runway("LTAC", "RWY01", "0", "09000").at(60, "B").build();
        DeltaReport report = runnerFor("PG").compare(List.of(before), List.of(after));

        TypeDelta delta = report.getTypeDelta("PG").orElseThrow();
        assertEquals(1, delta.getModified().size());
        assertTrue(delta.getModified().get(0).getChangedFields().isEmpty());
        assertEquals("0", delta.getModified().get(0).get(Row.CHANGED_FIELD_COUNT));
    }

    @Test
    void orphanContinuationDiscardsItsAirport() {
        ArincLine orphan = ArincLines.airport("EUR", "LTBA", 'I').at(14, "LOC01").at(22, "2").at(23, "A").build();
        ArincLine runway = ArincLines.runway("LTAC", "RWY01", "0", "09000").build();

        DeltaReport report = runnerFor("PG,PI").compare(List.of(orphan, runway), List.of(runway));

        assertEquals(List.of("LTBA"), report.getDiscardedAirports());
        TypeDelta localizers = report.getTypeDelta("PI").orElseThrow();
        assertTrue(localizers.getAdded().isEmpty());
        assertTrue(localizers.getRemoved().isEmpty());
        assertTrue(localizers.getModified().isEmpty());
        assertEquals(new TypeSummary("PG", 1, 0, 0, 0), report.getSummaries().get(0));
    }

    @Test
    void addedAndRemovedRowsShareTheUnionHeader() {
        ArincLine removed = ArincLines.runway("LTAC", "RWY01", "0", "09000").build();
        ArincLine added = ArincLines.runway("LTFM", "RWY16", "0", "12000").build();
        ArincLine addedNotes = ArincLines.runway("LTFM", "RWY16", "2", "A").build();

        TypeDelta delta =
                runnerFor("PG").compare(List.of(removed), List.of(added, addedNotes)).getTypeDelta("PG").orElseThrow();

        assertTrue(delta.getHeader().contains("cont#2_1_123"));
        assertEquals("", delta.getRemoved().get(0).get("cont#2_1_123"));
        assertEquals(addedNotes.payload(), delta.getAdded().get(0).get("cont#2_1_123"));
        assertEquals(1, delta.getCurrent().size());
    }

    @Test
    void navaidViewsFollowRegionRequest() {
        List<ArincLine> oldLines = List.of(ArincLines.vhfNavaid("LTAC", "IAC", "ID").build());
        List<ArincLine> newLines =
                List.of(
                        ArincLines.vhfNavaid("LTAC", "IAC", "ID").at(29, "I").build(),
                        ArincLines.vhfNavaid("LTAC", "ANK", "VDHW").build());

        DeltaReport regional = runnerFor("DV", "EU").compare(oldLines, newLines);
        List<String> names = regional.getOutputTables().stream().map(t -> t.getName()).toList();
        assertTrue(names.contains("added_dv_vor"));
        assertTrue(names.contains("current_dv_ils_dme"));
        assertTrue(!names.contains("current_DV"));
        assertEquals(new TypeSummary("DV", 2, 1, 0, 1), regional.getSummaries().get(0));

        DeltaReport global = runnerFor("DV").compare(oldLines, newLines);
        assertTrue(global.getOutputTables().stream().noneMatch(t -> t.getName().endsWith("_vor")));
    }

    @Test
    void runLoadsFilesAndAcceptsOneMissingSide() throws Exception {
        Path newFile = tempDir.resolve("new.pc");
        Files.write(
                newFile,
                List.of(ArincLines.runway("LTAC", "RWY01", "0", "09000").text()),
                SnapshotLoader.CHARSET);

        DeltaReport report = runnerFor("PG").run(null, newFile);

        assertEquals(new TypeSummary("PG", 1, 1, 0, 0), report.getSummaries().get(0));
    }

    @Test
    void runWithoutAnySnapshotIsRejected() {
        assertThrows(DeltaRequestException.class, () -> runnerFor("PG").run(null, null));
    }

    private static DeltaRunner runnerFor(String types) {
        return runnerFor(types, null);
    }

    private static DeltaRunner runnerFor(String types, String region) {
        try {
            return new DeltaRunner(DeltaRequest.builder().types(types).region(region).build());
        } catch (DeltaRequestException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
