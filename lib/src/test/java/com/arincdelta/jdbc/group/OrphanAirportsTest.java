package com.arincdelta.jdbc.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.schema.RecordTypeRegistry;
import com.arincdelta.jdbc.testing.ArincLines;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class OrphanAirportsTest {

    private final OrphanAirports orphans =
            new OrphanAirports(new GroupCombiner(RecordTypeRegistry.defaultRegistry()));

    @Test
    void airportWithOnlyContinuationsIsOrphaned() {
        List<ArincLine> lines =
                List.of(
                        ArincLines.runway("LTBA", "RW05 ", "2", "A").build(),
                        ArincLines.runway("LTAC", "RW03R", "0", "09000").build(),
                        ArincLines.runway("LTAC", "RW03R", "2", "A").build());

        assertEquals(Set.of("LTBA"), orphans.find(lines));
    }

    @Test
    void anyPrimaryAtTheAirportKeepsIt() {
        List<ArincLine> lines =
                List.of(
                        ArincLines.runway("LTAC", "RW21L", "2", "A").build(),
                        ArincLines.runway("LTAC", "RW03R", "0", "09000").build());

        assertTrue(orphans.find(lines).isEmpty());
    }

    @Test
    void unionAcrossSnapshotsAndSymmetricExclusion() {
        List<ArincLine> oldLines =
                List.of(
                        ArincLines.runway("LTBA", "RW05 ", "2", "A").build(),
                        ArincLines.runway("LTAC", "RW03R", "0", "09000").build());
        List<ArincLine> newLines =
                List.of(
                        ArincLines.runway("LTBA", "RW05 ", "0", "09000").build(),
                        ArincLines.runway("LTFM", "RW16 ", "3", "A").build(),
                        ArincLines.runway("LTAC", "RW03R", "0", "09000").build());

        Set<String> discarded = orphans.find(oldLines, newLines);
        assertEquals(List.of("LTBA", "LTFM"), List.copyOf(discarded));

        List<ArincLine> keptNew = OrphanAirports.exclude(newLines, discarded);
        assertEquals(1, keptNew.size());
        assertEquals("LTAC", keptNew.get(0).icao());
        assertEquals(1, OrphanAirports.exclude(oldLines, discarded).size());
    }
}
