package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.output.ExtraViewHandler;
import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.record.TypeTuple;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Layout and behaviour of one ARINC record type. Subclasses declare their columns as data and
 * override {@link #postProcess(Row)} or {@link #getExtraViewHandler()} where the type needs it;
 * grouping and delta code never branch on the type code.
 */
public abstract class RecordTypeTable {

    /** Name of the synthetic field that always holds the primary's untouched 1..123 payload. */
    public static final String RAW_PAYLOAD_FIELD = "primary_1_123";
    public static final int DEFAULT_CONTINUATION_COLUMN = 22;
    public static final int NO_APPLICATION_TYPE_COLUMN = 0;

    private final String typeCode;
    private final TypeTuple typeTuple;
    private final String title;
    private final int continuationColumn;
    private final int applicationTypeColumn;
    private final List<FieldDescriptor> fields;
    private final List<String> summaryFields;

    protected RecordTypeTable(
            String typeCode,
            TypeTuple typeTuple,
            String title,
            int continuationColumn,
            int applicationTypeColumn,
            List<FieldDescriptor> fields,
            List<String> summaryFields) {
        this.typeCode = Objects.requireNonNull(typeCode, "typeCode");
        this.typeTuple = Objects.requireNonNull(typeTuple, "typeTuple");
        this.title = Objects.requireNonNull(title, "title");
        this.continuationColumn = continuationColumn;
        this.applicationTypeColumn = applicationTypeColumn;
        this.fields = List.copyOf(fields);
        this.summaryFields = List.copyOf(summaryFields);
    }

    public String getTypeCode() {
        return typeCode;
    }

    public TypeTuple getTypeTuple() {
        return typeTuple;
    }

    public String getTitle() {
        return title;
    }

    public int getContinuationColumn() {
        return continuationColumn;
    }

    public int getApplicationTypeColumn() {
        return applicationTypeColumn;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (FieldDescriptor field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    public List<String> getSummaryFields() {
        return summaryFields;
    }

    /** Type-specific cleanup applied to every projected row before empty defaults are filled in. */
    public void postProcess(Row row) {}

    public Optional<ExtraViewHandler> getExtraViewHandler() {
        return Optional.empty();
    }

    /** Short label such as {@code LTAC - 03R}, falling back to the trimmed primary payload. */
    public String describe(Row row) {
        List<String> parts = new ArrayList<>();
        for (String field : summaryFields) {
            String value = row.get(field).strip();
            if (!value.isEmpty()) {
                parts.add(value);
            }
        }
        if (!parts.isEmpty()) {
            return String.join(" - ", parts);
        }
        String payload = row.get(RAW_PAYLOAD_FIELD).strip();
        return payload.isEmpty() ? "Record" : payload;
    }

    protected static void keepLeading(Row row, String field, int length) {
        String value = row.get(field);
        if (!value.isEmpty()) {
            row.put(field, value.substring(0, Math.min(length, value.length())).strip());
        }
    }

    protected static void strip(Row row, String... fieldNames) {
        for (String field : fieldNames) {
            String value = row.get(field);
            if (!value.isEmpty()) {
                row.put(field, value.strip());
            }
        }
    }

    protected static FieldDescriptor field(String name, int startColumn, int endColumn) {
        return FieldDescriptor.range(name, startColumn, endColumn);
    }

    protected static FieldDescriptor rawPayload() {
        return FieldDescriptor.rawPayload(RAW_PAYLOAD_FIELD);
    }
}
