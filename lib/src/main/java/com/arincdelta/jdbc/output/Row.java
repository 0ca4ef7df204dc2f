package com.arincdelta.jdbc.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattened record group: field name to string value. Absent fields read as the empty string. A
 * row produced for a modified group also carries its changed-field list.
 */
public final class Row {
    public static final String CHANGED_FIELD_COUNT = "changed_field_count";
    public static final String CHANGED_FIELDS = "changed_fields";

    private final Map<String, String> values;
    private final List<String> changedFields;

    public Row() {
        this(new LinkedHashMap<>(), null);
    }

    private Row(Map<String, String> values, List<String> changedFields) {
        this.values = values;
        this.changedFields = changedFields;
    }

    public String get(String field) {
        return values.getOrDefault(field, "");
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public void put(String field, String value) {
        values.put(Objects.requireNonNull(field, "field"), value == null ? "" : value);
    }

    public void putIfAbsent(String field, String value) {
        values.putIfAbsent(Objects.requireNonNull(field, "field"), value == null ? "" : value);
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isModified() {
        return changedFields != null;
    }

    public List<String> getChangedFields() {
        return changedFields == null ? List.of() : changedFields;
    }

    /** Copy of this row annotated with {@value #CHANGED_FIELD_COUNT} and {@value #CHANGED_FIELDS}. */
    public Row withChangedFields(List<String> changed) {
        List<String> copy = List.copyOf(changed);
        Map<String, String> annotated = new LinkedHashMap<>(values);
        annotated.put(CHANGED_FIELD_COUNT, Integer.toString(copy.size()));
        annotated.put(CHANGED_FIELDS, String.join(",", copy));
        return new Row(annotated, copy);
    }

    /** Copy of this row with {@code from} renamed to {@code to}, including inside the changed-field list. */
    public Row renamed(String from, String to) {
        Map<String, String> renamedValues = new LinkedHashMap<>(values);
        if (renamedValues.containsKey(from)) {
            renamedValues.put(to, renamedValues.remove(from));
        }
        List<String> renamedChanged = null;
        if (changedFields != null) {
            renamedChanged = new ArrayList<>(changedFields.size());
            for (String field : changedFields) {
                renamedChanged.add(field.equals(from) ? to : field);
            }
            renamedChanged = List.copyOf(renamedChanged);
            renamedValues.put(CHANGED_FIELDS, String.join(",", renamedChanged));
        }
        return new Row(renamedValues, renamedChanged);
    }

    public Object[] toArray(List<String> header) {
        Object[] row = new Object[header.size()];
        for (int i = 0; i < header.size(); i++) {
            row[i] = get(header.get(i));
        }
        return row;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
