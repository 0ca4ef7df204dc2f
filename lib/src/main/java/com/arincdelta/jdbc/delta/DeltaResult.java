package com.arincdelta.jdbc.delta;

import com.arincdelta.jdbc.group.EntityKey;
import java.util.List;

/** Keys classified by {@link DeltaEngine}, each list in ascending key order. */
public final class DeltaResult {
    private final List<EntityKey> added;
    private final List<EntityKey> removed;
    private final List<EntityKey> modified;

    public DeltaResult(List<EntityKey> added, List<EntityKey> removed, List<EntityKey> modified) {
        this.added = List.copyOf(added);
        this.removed = List.copyOf(removed);
        this.modified = List.copyOf(modified);
    }

    public List<EntityKey> getAdded() {
        return added;
    }

    public List<EntityKey> getRemoved() {
        return removed;
    }

    public List<EntityKey> getModified() {
        return modified;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
