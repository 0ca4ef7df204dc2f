package com.arincdelta.jdbc.group;

import com.arincdelta.jdbc.record.ArincLine;
import java.util.Comparator;
import java.util.Objects;

/** Identity of a logical record: type code plus the raw columns 1..21 shared by a primary and its continuations. */
public record EntityKey(String typeCode, String identifier) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> ORDER =
            Comparator.comparing(EntityKey::typeCode).thenComparing(EntityKey::identifier);

    public EntityKey {
        Objects.requireNonNull(typeCode, "typeCode");
        Objects.requireNonNull(identifier, "identifier");
    }

    public static EntityKey of(ArincLine line) {
        return new EntityKey(line.typeCode(), line.identifier());
    }

    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }
}
