package com.arincdelta.jdbc.output;

import com.arincdelta.jdbc.schema.RecordTypeTable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Projected rows of one record type: every current group plus the added, removed and modified ones. */
public final class TypeDelta {

    public enum State {
        CURRENT("current"),
        ADDED("added"),
        REMOVED("removed"),
        MODIFIED("modified");

        private final String prefix;

        State(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }

        public String tableName(String suffix) {
            return prefix + "_" + suffix;
        }
    }

    private final RecordTypeTable table;
    private final List<String> header;
    private final List<String> modifiedHeader;
    private final List<Row> current;
    private final List<Row> added;
    private final List<Row> removed;
    private final List<Row> modified;
    private final ExtraViews extraViews;

    public TypeDelta(
            RecordTypeTable table,
            List<String> header,
            List<Row> current,
            List<Row> added,
            List<Row> removed,
            List<Row> modified) {
        this(table, header, current, added, removed, modified, ExtraViews.none());
    }

    private TypeDelta(
            RecordTypeTable table,
            List<String> header,
            List<Row> current,
            List<Row> added,
            List<Row> removed,
            List<Row> modified,
            ExtraViews extraViews) {
        this.table = Objects.requireNonNull(table, "table");
        this.header = List.copyOf(header);
        this.modifiedHeader = RowProjector.modifiedHeader(this.header);
        this.current = List.copyOf(current);
        this.added = List.copyOf(added);
        this.removed = List.copyOf(removed);
        this.modified = List.copyOf(modified);
        this.extraViews = Objects.requireNonNull(extraViews, "extraViews");
    }

    public TypeDelta withExtraViews(ExtraViews views) {
        return new TypeDelta(table, header, current, added, removed, modified, views);
    }

    public RecordTypeTable getTable() {
        return table;
    }

    public String getTypeCode() {
        return table.getTypeCode();
    }

    public List<String> getHeader() {
        return header;
    }

    public List<String> getModifiedHeader() {
        return modifiedHeader;
    }

    public List<String> getHeader(State state) {
        return state == State.MODIFIED ? modifiedHeader : header;
    }

    public List<Row> getRows(State state) {
        return switch (state) {
            case CURRENT -> current;
            case ADDED -> added;
            case REMOVED -> removed;
            case MODIFIED -> modified;
        };
    }

    public List<Row> getCurrent() {
        return current;
    }

    public List<Row> getAdded() {
        return added;
    }

    public List<Row> getRemoved() {
        return removed;
    }

    public List<Row> getModified() {
        return modified;
    }

    public ExtraViews getExtraViews() {
        return extraViews;
    }

    /** {@code current_PG}, {@code added_PG}, ... in state order. */
    public List<OutputTable> getDefaultTables() {
        List<OutputTable> tables = new ArrayList<>(State.values().length);
        for (State state : State.values()) {
            tables.add(new OutputTable(state.tableName(getTypeCode()), getHeader(state), getRows(state)));
        }
        return tables;
    }

    /** Tables to publish for this type once extra views have been applied. */
    public List<OutputTable> getOutputTables() {
        List<OutputTable> tables = new ArrayList<>();
        if (!extraViews.replacesDefaultTables()) {
            tables.addAll(getDefaultTables());
        }
        tables.addAll(extraViews.getTables());
        return tables;
    }

    /** Table names a writer must remove if an earlier run left them behind. */
    public Set<String> getObsoleteTableNames() {
        Set<String> names = new LinkedHashSet<>();
        if (extraViews.replacesDefaultTables()) {
            for (State state : State.values()) {
                names.add(state.tableName(getTypeCode()));
            }
        }
        names.addAll(extraViews.getObsoleteTableNames());
        return names;
    }
}
