package com.arincdelta.jdbc.output;

import com.arincdelta.jdbc.schema.RecordTypeTable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Splits VHF navaid output into an ILS/DME view and a VOR view. The VOR view is only meaningful for
 * a regional run; for any other run its tables are reported obsolete. The default tables of the type
 * are always replaced.
 */
public final class VhfNavaidViews implements ExtraViewHandler {

    static final String ILS_IDENT = "ils_ident";
    static final String VOR_IDENT = "vor_ident";
    static final String NAVAID_CLASS = "navaid_class";
    /** 0-based index into the 1..123 payload, i.e. column 29. */
    private static final int ILS_FLAG_INDEX = 28;

    @Override
    public ExtraViews apply(TypeDelta delta, ViewContext context) {
        String base = delta.getTypeCode().toLowerCase(Locale.ROOT);
        String ilsSuffix = base + "_ils_dme";
        String vorSuffix = base + "_vor";

        List<OutputTable> tables = new ArrayList<>();
        for (TypeDelta.State state : TypeDelta.State.values()) {
            tables.add(
                    new OutputTable(
                            state.tableName(ilsSuffix),
                            delta.getHeader(state),
                            select(delta.getRows(state), VhfNavaidViews::isIlsDme)));
        }

        Set<String> obsolete = new LinkedHashSet<>();
        for (TypeDelta.State state : TypeDelta.State.values()) {
            if (context.regionRequested()) {
                List<Row> renamed = new ArrayList<>();
                for (Row row : select(delta.getRows(state), VhfNavaidViews::isVor)) {
                    renamed.add(row.renamed(ILS_IDENT, VOR_IDENT));
                }
                tables.add(
                        new OutputTable(
                                state.tableName(vorSuffix),
                                renameHeader(delta.getHeader(state), ILS_IDENT, VOR_IDENT),
                                renamed));
            } else {
                obsolete.add(state.tableName(vorSuffix));
            }
        }
        return new ExtraViews(tables, true, obsolete);
    }

    static boolean isIlsDme(Row row) {
        String raw = row.get(RecordTypeTable.RAW_PAYLOAD_FIELD);
        return raw.length() > ILS_FLAG_INDEX && Character.toUpperCase(raw.charAt(ILS_FLAG_INDEX)) == 'I';
    }

    static boolean isVor(Row row) {
        return row.get(NAVAID_CLASS).toUpperCase(Locale.ROOT).startsWith("V");
    }

    private static List<Row> select(List<Row> rows, Predicate<Row> predicate) {
        List<Row> selected = new ArrayList<>();
        for (Row row : rows) {
            if (predicate.test(row)) {
                selected.add(row);
            }
        }
        return selected;
    }

    private static List<String> renameHeader(List<String> header, String from, String to) {
        List<String> renamed = new ArrayList<>(header.size());
        for (String field : header) {
            renamed.add(field.equals(from) ? to : field);
        }
        return renamed;
    }
}
