package com.arincdelta.jdbc.report;

import com.arincdelta.jdbc.delta.ChangedFields;
import com.arincdelta.jdbc.delta.DeltaEngine;
import com.arincdelta.jdbc.delta.DeltaResult;
import com.arincdelta.jdbc.group.EntityKey;
import com.arincdelta.jdbc.group.GroupCombiner;
import com.arincdelta.jdbc.group.OrphanAirports;
import com.arincdelta.jdbc.group.RecordGroup;
import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.loader.Snapshot;
import com.arincdelta.jdbc.loader.SnapshotLoader;
import com.arincdelta.jdbc.output.ExtraViewHandler;
import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.output.RowProjector;
import com.arincdelta.jdbc.output.TypeDelta;
import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.schema.FieldDescriptor;
import com.arincdelta.jdbc.schema.RecordTypeTable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the whole comparison: load both snapshots, drop orphan airports from both, then group,
 * compare and project each requested record type independently.
 */
public final class DeltaRunner {

    private static final Logger LOGGER = Logger.getLogger(DeltaRunner.class.getName());

    private final DeltaRequest request;
    private final GroupCombiner combiner;

    public DeltaRunner(DeltaRequest request) {
        this.request = Objects.requireNonNull(request, "request");
        this.combiner = new GroupCombiner(request.getRegistry());
    }

    /** Either path may be {@code null} and is then compared as an empty snapshot, but not both. */
    public DeltaReport run(Path oldPath, Path newPath) throws LoaderException, DeltaRequestException {
        if (oldPath == null && newPath == null) {
            throw new DeltaRequestException("At least one snapshot file is required.");
        }
        if (request.isAirportRequested()) {
            LOGGER.log(Level.FINE, "Restricting to airports {0}", request.getIcaoFilter());
        }
        SnapshotLoader loader = new SnapshotLoader(request.toRecordFilter());
        Snapshot oldSnapshot = loader.load(oldPath);
        Snapshot newSnapshot = loader.load(newPath);
        if (oldPath == null) {
            LOGGER.info("No old snapshot given; comparing against empty data.");
        }
        if (newPath == null) {
            LOGGER.info("No new snapshot given; comparing against empty data.");
        }
        return compare(oldSnapshot.getLines(), newSnapshot.getLines());
    }

    /** Compares already loaded and filtered lines. */
    public DeltaReport compare(List<ArincLine> oldLines, List<ArincLine> newLines) {
        SortedSet<String> discarded = new OrphanAirports(combiner).find(oldLines, newLines);
        if (discarded.isEmpty()) {
            LOGGER.info("No airports discarded (primary present for all with continuations).");
        } else {
            LOGGER.log(Level.INFO, "Discarded ICAOs: {0}", String.join(", ", discarded));
        }
        Map<String, List<ArincLine>> oldBuckets = bucketByTypeCode(OrphanAirports.exclude(oldLines, discarded));
        Map<String, List<ArincLine>> newBuckets = bucketByTypeCode(OrphanAirports.exclude(newLines, discarded));

        List<TypeDelta> deltas = new ArrayList<>();
        List<TypeSummary> summaries = new ArrayList<>();
        for (RecordTypeTable table : request.getTables()) {
            String typeCode = table.getTypeCode();
            TypeDelta delta =
                    compareType(
                            table,
                            combiner.combine(oldBuckets.getOrDefault(typeCode, List.of())),
                            combiner.combine(newBuckets.getOrDefault(typeCode, List.of())));
            TypeSummary summary =
                    new TypeSummary(
                            typeCode,
                            delta.getCurrent().size(),
                            delta.getAdded().size(),
                            delta.getRemoved().size(),
                            delta.getModified().size());
            LOGGER.log(
                    Level.INFO,
                    "{0}: current={1} added={2} removed={3} modified={4}",
                    new Object[] {typeCode, summary.current(), summary.added(), summary.removed(), summary.modified()});
            deltas.add(delta);
            summaries.add(summary);
        }
        return new DeltaReport(List.copyOf(discarded), deltas, summaries);
    }

    TypeDelta compareType(
            RecordTypeTable table, Map<EntityKey, RecordGroup> oldGroups, Map<EntityKey, RecordGroup> newGroups) {
        Set<String> continuationNumbers = new HashSet<>();
        for (RecordGroup group : oldGroups.values()) {
            continuationNumbers.addAll(group.getContinuations().keySet());
        }
        for (RecordGroup group : newGroups.values()) {
            continuationNumbers.addAll(group.getContinuations().keySet());
        }
        RowProjector projector = new RowProjector(table);
        List<String> header = projector.buildHeader(continuationNumbers);

        List<Row> current = new ArrayList<>(newGroups.size());
        for (RecordGroup group : newGroups.values()) {
            current.add(projector.buildRow(group, header));
        }

        DeltaResult result = DeltaEngine.compute(oldGroups, newGroups);
        List<Row> added = new ArrayList<>(result.getAdded().size());
        for (EntityKey key : result.getAdded()) {
            added.add(projector.buildRow(newGroups.get(key), header));
        }
        List<Row> removed = new ArrayList<>(result.getRemoved().size());
        for (EntityKey key : result.getRemoved()) {
            removed.add(projector.buildRow(oldGroups.get(key), header));
        }

        Set<String> ignored = rawPayloadFields(table);
        List<Row> modified = new ArrayList<>(result.getModified().size());
        for (EntityKey key : result.getModified()) {
            Row newRow = projector.buildRow(newGroups.get(key), header);
            Row oldRow = projector.buildRow(oldGroups.get(key), header);
            List<String> changed = ChangedFields.between(oldRow, newRow, header, ignored);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(
                        Level.FINE,
                        "{0} modified: {1} {2}",
                        new Object[] {table.getTypeCode(), table.describe(newRow), changed});
            }
            modified.add(newRow.withChangedFields(changed));
        }

        TypeDelta delta = new TypeDelta(table, header, current, added, removed, modified);
        Optional<ExtraViewHandler> handler = table.getExtraViewHandler();
        if (handler.isPresent()) {
            delta = delta.withExtraViews(handler.get().apply(delta, request.toViewContext()));
        }
        return delta;
    }

    private static Set<String> rawPayloadFields(RecordTypeTable table) {
        Set<String> fields = new HashSet<>();
        for (FieldDescriptor field : table.getFields()) {
            if (field.isRawPayload()) {
                fields.add(field.getName());
            }
        }
        return fields;
    }

    private static Map<String, List<ArincLine>> bucketByTypeCode(List<ArincLine> lines) {
        Map<String, List<ArincLine>> buckets = new HashMap<>();
        for (ArincLine line : lines) {
            buckets.computeIfAbsent(line.typeCode(), k -> new ArrayList<>()).add(line);
        }
        return buckets;
    }
}
