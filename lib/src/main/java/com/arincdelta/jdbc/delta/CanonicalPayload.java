package com.arincdelta.jdbc.delta;

import com.arincdelta.jdbc.group.Continuation;
import com.arincdelta.jdbc.group.RecordGroup;
import java.util.StringJoiner;

/**
 * Comparison form of a record group: the primary payload followed by every continuation payload
 * tagged {@code [C<number>:<application type>]}, in continuation order, joined by {@code |}.
 * Columns 124..132 never take part.
 */
public final class CanonicalPayload {

    private static final String SEPARATOR = "|";
    private static final String NO_APPLICATION_TYPE = "_";

    private CanonicalPayload() {}

    public static String of(RecordGroup group) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        if (group.hasPrimary()) {
            joiner.add(group.getPrimary().payload());
        }
        for (String number : group.getSortedContinuationNumbers()) {
            Continuation continuation = group.getContinuations().get(number);
            String applicationType =
                    continuation.applicationType().isEmpty() ? NO_APPLICATION_TYPE : continuation.applicationType();
            joiner.add("[C" + number + ":" + applicationType + "]" + continuation.line().payload());
        }
        return joiner.toString();
    }

    public static boolean structurallyEqual(RecordGroup left, RecordGroup right) {
        return of(left).equals(of(right));
    }
}
