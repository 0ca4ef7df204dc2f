package com.arincdelta.jdbc.delta;

import com.arincdelta.jdbc.output.Row;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Field-level comparison of two projected rows. This works on rows, not payloads, so a modified
 * group can legitimately report no changed field when only unprojected columns differ.
 */
public final class ChangedFields {

    private ChangedFields() {}

    /** Header fields whose values differ, in header order, skipping {@code ignored}. */
    public static List<String> between(Row oldRow, Row newRow, List<String> header, Set<String> ignored) {
        List<String> changed = new ArrayList<>();
        for (String field : header) {
            if (ignored.contains(field)) {
                continue;
            }
            if (!oldRow.get(field).equals(newRow.get(field))) {
                changed.add(field);
            }
        }
        return changed;
    }
}
