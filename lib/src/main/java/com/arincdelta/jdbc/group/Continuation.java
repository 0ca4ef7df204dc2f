package com.arincdelta.jdbc.group;

import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.record.ApplicationType;
import java.util.Objects;

public record Continuation(ArincLine line, String applicationType) {

    public Continuation {
        Objects.requireNonNull(line, "line");
        applicationType = applicationType == null ? "" : applicationType;
    }

    public String applicationLabel() {
        return ApplicationType.labelFor(applicationType);
    }
}
