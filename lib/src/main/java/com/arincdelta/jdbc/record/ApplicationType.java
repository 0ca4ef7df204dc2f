package com.arincdelta.jdbc.record;

import java.util.Locale;

/** Continuation record application types (ARINC-424 5.91). */
public enum ApplicationType {
    A("Notes or formatted data continuation"),
    C("Call sign or controlling agency continuation"),
    E("Primary record extension"),
    L("VHF navaid limitation continuation"),
    N("Sector narrative continuation"),
    T("Time of operations continuation (formatted data)"),
    U("Time of operations continuation (narrative data)"),
    V("Time of operations continuation (alternate narrative)"),
    P("Flight planning application continuation"),
    Q("Flight planning primary data continuation"),
    S("Simulation application continuation");

    public static final String UNKNOWN_LABEL = "Unknown";

    private final String label;

    ApplicationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Empty code gives an empty label; a code outside the table gives {@value #UNKNOWN_LABEL}. */
    public static String labelFor(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        String normalized = code.toUpperCase(Locale.ROOT);
        for (ApplicationType type : values()) {
            if (type.name().equals(normalized)) {
                return type.label;
            }
        }
        return UNKNOWN_LABEL;
    }
}
