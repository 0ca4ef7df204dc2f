package com.arincdelta.jdbc.output;

import com.arincdelta.jdbc.group.Continuation;
import com.arincdelta.jdbc.group.RecordGroup;
import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.record.ContinuationNumbers;
import com.arincdelta.jdbc.schema.FieldDescriptor;
import com.arincdelta.jdbc.schema.RecordTypeTable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Builds output headers and rows for one record type. */
public final class RowProjector {

    private final RecordTypeTable table;

    public RowProjector(RecordTypeTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Schema fields in declared order, then a code/label/payload triplet for every continuation
     * number seen in either snapshot.
     */
    public List<String> buildHeader(Collection<String> continuationNumbers) {
        return buildHeader(table.getFieldNames(), continuationNumbers);
    }

    public static List<String> buildHeader(List<String> fieldNames, Collection<String> continuationNumbers) {
        List<String> header = new ArrayList<>(fieldNames);
        for (String number : ContinuationNumbers.sorted(continuationNumbers)) {
            header.add(applicationCodeField(number));
            header.add(applicationLabelField(number));
            header.add(payloadField(number));
        }
        return List.copyOf(header);
    }

    public static List<String> modifiedHeader(List<String> header) {
        List<String> modified = new ArrayList<>(header.size() + 2);
        modified.addAll(header);
        modified.add(Row.CHANGED_FIELD_COUNT);
        modified.add(Row.CHANGED_FIELDS);
        return List.copyOf(modified);
    }

    public Row buildRow(RecordGroup group, List<String> header) {
        Row row = new Row();
        List<String> numbers = group.getSortedContinuationNumbers();
        ArincLine reference = group.getPrimary();
        if (reference == null && !numbers.isEmpty()) {
            reference = group.getContinuations().get(numbers.get(0)).line();
        }
        if (reference != null) {
            for (FieldDescriptor field : table.getFields()) {
                row.put(field.getName(), field.extract(reference));
            }
            if (group.hasPrimary()) {
                row.put(RecordTypeTable.RAW_PAYLOAD_FIELD, group.getPrimary().payload());
            }
        } else {
            for (String field : header) {
                row.put(field, "");
            }
        }
        for (String number : numbers) {
            Continuation continuation = group.getContinuations().get(number);
            putIfDeclared(row, header, applicationCodeField(number), continuation.applicationType());
            putIfDeclared(row, header, applicationLabelField(number), continuation.applicationLabel());
            putIfDeclared(row, header, payloadField(number), continuation.line().payload());
        }
        table.postProcess(row);
        for (String field : header) {
            row.putIfAbsent(field, "");
        }
        return row;
    }

    public static String applicationCodeField(String number) {
        return "cont#" + number + "_appl_code";
    }

    public static String applicationLabelField(String number) {
        return "cont#" + number + "_appl_label";
    }

    public static String payloadField(String number) {
        return "cont#" + number + "_1_123";
    }

    private static void putIfDeclared(Row row, List<String> header, String field, String value) {
        if (header.contains(field)) {
            row.put(field, value);
        }
    }
}
