package com.arincdelta.jdbc.group;

import com.arincdelta.jdbc.record.ArincLine;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds airports whose data in a snapshot has continuations but no primary record at all. Such an
 * airport is dropped from both snapshots so the comparison stays symmetric.
 */
public final class OrphanAirports {

    private final GroupCombiner combiner;

    public OrphanAirports(GroupCombiner combiner) {
        this.combiner = Objects.requireNonNull(combiner, "combiner");
    }

    public SortedSet<String> find(List<ArincLine> lines) {
        Map<String, int[]> countsByIcao = new HashMap<>();
        for (RecordGroup group : combiner.combine(lines).values()) {
            String icao = group.getIcao();
            if (icao.isEmpty()) {
                continue;
            }
            // [0] groups with a primary, [1] groups with at least one continuation
            int[] counts = countsByIcao.computeIfAbsent(icao, k -> new int[2]);
            if (group.hasPrimary()) {
                counts[0]++;
            }
            if (group.hasContinuations()) {
                counts[1]++;
            }
        }
        SortedSet<String> orphans = new TreeSet<>();
        for (Map.Entry<String, int[]> entry : countsByIcao.entrySet()) {
            int[] counts = entry.getValue();
            if (counts[0] == 0 && counts[1] > 0) {
                orphans.add(entry.getKey());
            }
        }
        return orphans;
    }

    /** Union of the orphans found independently in each snapshot. */
    public SortedSet<String> find(List<ArincLine> oldLines, List<ArincLine> newLines) {
        SortedSet<String> orphans = find(oldLines);
        orphans.addAll(find(newLines));
        return orphans;
    }

    public static List<ArincLine> exclude(List<ArincLine> lines, Set<String> icaos) {
        if (icaos.isEmpty()) {
            return lines;
        }
        List<ArincLine> kept = new ArrayList<>(lines.size());
        for (ArincLine line : lines) {
            if (!icaos.contains(line.icao())) {
                kept.add(line);
            }
        }
        return List.copyOf(kept);
    }
}
