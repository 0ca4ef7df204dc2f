package com.arincdelta.jdbc.delta;

import com.arincdelta.jdbc.group.EntityKey;
import com.arincdelta.jdbc.group.RecordGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/** Matches record groups of two snapshots by key and classifies the differences. Neither map is modified. */
public final class DeltaEngine {

    private DeltaEngine() {}

    public static DeltaResult compute(Map<EntityKey, RecordGroup> oldGroups, Map<EntityKey, RecordGroup> newGroups) {
        SortedSet<EntityKey> oldKeys = new TreeSet<>(oldGroups.keySet());
        SortedSet<EntityKey> newKeys = new TreeSet<>(newGroups.keySet());

        List<EntityKey> added = new ArrayList<>();
        List<EntityKey> modified = new ArrayList<>();
        for (EntityKey key : newKeys) {
            RecordGroup previous = oldGroups.get(key);
            if (previous == null) {
                added.add(key);
            } else if (!CanonicalPayload.structurallyEqual(previous, newGroups.get(key))) {
                modified.add(key);
            }
        }
        List<EntityKey> removed = new ArrayList<>();
        for (EntityKey key : oldKeys) {
            if (!newGroups.containsKey(key)) {
                removed.add(key);
            }
        }
        return new DeltaResult(added, removed, modified);
    }
}
