package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.record.ArincLine;
import java.util.Objects;

/**
 * A named fixed-width field. A descriptor without a column range carries the whole 1..123 payload
 * verbatim instead of a trimmed slice.
 */
public final class FieldDescriptor {
    private final String name;
    private final int startColumn;
    private final int endColumn;

    private FieldDescriptor(String name, int startColumn, int endColumn) {
        this.name = Objects.requireNonNull(name, "name");
        this.startColumn = startColumn;
        this.endColumn = endColumn;
    }

    public static FieldDescriptor range(String name, int startColumn, int endColumn) {
        if (startColumn < 1 || endColumn < startColumn || endColumn > ArincLine.WIDTH) {
            throw new IllegalArgumentException(
                    "Invalid column range " + startColumn + ".." + endColumn + " for field " + name);
        }
        return new FieldDescriptor(name, startColumn, endColumn);
    }

    public static FieldDescriptor rawPayload(String name) {
        return new FieldDescriptor(name, 0, 0);
    }

    public String extract(ArincLine line) {
        if (isRawPayload()) {
            return line.payload();
        }
        return line.slice(startColumn, endColumn).strip();
    }

    public boolean isRawPayload() {
        return startColumn == 0;
    }

    public String getName() {
        return name;
    }
}
