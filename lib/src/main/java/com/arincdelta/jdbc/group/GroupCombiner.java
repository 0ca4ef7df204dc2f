package com.arincdelta.jdbc.group;

import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.record.ContinuationNumbers;
import com.arincdelta.jdbc.schema.RecordTypeRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines flat record lines into {@link RecordGroup}s in a single pass. The first primary for a key
 * wins and later ones are dropped; a repeated continuation number overwrites the earlier entry.
 */
public final class GroupCombiner {

    private final RecordTypeRegistry registry;

    public GroupCombiner(RecordTypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Map<EntityKey, RecordGroup> combine(List<ArincLine> lines) {
        Map<EntityKey, Builder> builders = new LinkedHashMap<>();
        for (ArincLine line : lines) {
            EntityKey key = EntityKey.of(line);
            Builder builder = builders.computeIfAbsent(key, k -> new Builder(k, line));
            String typeCode = key.typeCode();
            String number = ContinuationNumbers.of(line, registry.continuationColumnFor(typeCode));
            if (number.equals(ContinuationNumbers.PRIMARY)) {
                if (builder.primary == null) {
                    builder.primary = line;
                }
                continue;
            }
            String applicationType =
                    ContinuationNumbers.applicationType(line, registry.applicationTypeColumnFor(typeCode));
            builder.continuations.put(number, new Continuation(line, applicationType));
        }
        Map<EntityKey, RecordGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<EntityKey, Builder> entry : builders.entrySet()) {
            groups.put(entry.getKey(), entry.getValue().build());
        }
        return Collections.unmodifiableMap(groups);
    }

    private static final class Builder {
        private final EntityKey key;
        private final ArincLine sample;
        private final Map<String, Continuation> continuations = new LinkedHashMap<>();
        private ArincLine primary;

        Builder(EntityKey key, ArincLine sample) {
            this.key = key;
            this.sample = sample;
        }

        RecordGroup build() {
            return new RecordGroup(key, sample, primary, continuations);
        }
    }
}
