package com.arincdelta.jdbc.output;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of an {@link ExtraViewHandler}: the derived tables, whether they replace the type's default
 * four tables, and names of tables that are not applicable to this run and must not be left behind
 * from an earlier one.
 */
public final class ExtraViews {
    private static final ExtraViews NONE = new ExtraViews(List.of(), false, Set.of());

    private final List<OutputTable> tables;
    private final boolean replacesDefaultTables;
    private final Set<String> obsoleteTableNames;

    public ExtraViews(List<OutputTable> tables, boolean replacesDefaultTables, Set<String> obsoleteTableNames) {
        this.tables = List.copyOf(tables);
        this.replacesDefaultTables = replacesDefaultTables;
        this.obsoleteTableNames = Collections.unmodifiableSet(new LinkedHashSet<>(obsoleteTableNames));
    }

    public static ExtraViews none() {
        return NONE;
    }

    public List<OutputTable> getTables() {
        return tables;
    }

    public boolean replacesDefaultTables() {
        return replacesDefaultTables;
    }

    public Set<String> getObsoleteTableNames() {
        return obsoleteTableNames;
    }
}
