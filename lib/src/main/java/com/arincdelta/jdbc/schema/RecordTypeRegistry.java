package com.arincdelta.jdbc.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registered record types keyed by type code, in registration order. This is the only place a new
 * record type has to be added.
 */
public final class RecordTypeRegistry {

    private static final RecordTypeRegistry DEFAULT =
            new RecordTypeRegistry(
                    List.of(new RunwayTable(), new LocalizerTable(), new AirportCommunicationTable(), new VhfNavaidTable()));

    private final Map<String, RecordTypeTable> tables;

    public RecordTypeRegistry(List<? extends RecordTypeTable> tables) {
        Map<String, RecordTypeTable> map = new LinkedHashMap<>();
        for (RecordTypeTable table : tables) {
            if (map.putIfAbsent(table.getTypeCode(), table) != null) {
                throw new IllegalArgumentException("Duplicate record type: " + table.getTypeCode());
            }
        }
        this.tables = Collections.unmodifiableMap(map);
    }

    public static RecordTypeRegistry defaultRegistry() {
        return DEFAULT;
    }

    public Optional<RecordTypeTable> find(String typeCode) {
        if (typeCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(typeCode.toUpperCase(Locale.ROOT)));
    }

    public Collection<RecordTypeTable> getTables() {
        return tables.values();
    }

    public List<String> getTypeCodes() {
        return List.copyOf(tables.keySet());
    }

    public int continuationColumnFor(String typeCode) {
        return find(typeCode)
                .map(RecordTypeTable::getContinuationColumn)
                .orElse(RecordTypeTable.DEFAULT_CONTINUATION_COLUMN);
    }

    public int applicationTypeColumnFor(String typeCode) {
        return find(typeCode)
                .map(RecordTypeTable::getApplicationTypeColumn)
                .orElse(RecordTypeTable.NO_APPLICATION_TYPE_COLUMN);
    }
}
