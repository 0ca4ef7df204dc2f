package com.arincdelta.jdbc.group;

import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.record.ContinuationNumbers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A primary record together with its continuations, as built for one snapshot. Instances are
 * immutable once {@link GroupCombiner} hands them out.
 */
public final class RecordGroup {
    private final EntityKey key;
    private final ArincLine sample;
    private final ArincLine primary;
    private final Map<String, Continuation> continuations;

    RecordGroup(EntityKey key, ArincLine sample, ArincLine primary, Map<String, Continuation> continuations) {
        this.key = Objects.requireNonNull(key, "key");
        this.sample = Objects.requireNonNull(sample, "sample");
        this.primary = primary;
        this.continuations = Collections.unmodifiableMap(new LinkedHashMap<>(continuations));
    }

    public EntityKey getKey() {
        return key;
    }

    /** First line seen for this key, primary or not. */
    public ArincLine getSample() {
        return sample;
    }

    /** May be {@code null} when only continuations were seen. */
    public ArincLine getPrimary() {
        return primary;
    }

    public boolean hasPrimary() {
        return primary != null;
    }

    public boolean hasContinuations() {
        return !continuations.isEmpty();
    }

    /** Continuations keyed by number, in insertion order. */
    public Map<String, Continuation> getContinuations() {
        return continuations;
    }

    public List<String> getSortedContinuationNumbers() {
        return ContinuationNumbers.sorted(continuations.keySet());
    }

    /** Primary if present, otherwise the sample line. */
    public ArincLine getReferenceLine() {
        return primary != null ? primary : sample;
    }

    public String getIcao() {
        return getReferenceLine().icao();
    }
}
