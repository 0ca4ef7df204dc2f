package com.arincdelta.jdbc.loader;

import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.record.RecordFilter;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a snapshot file line by line. Lines that are too short to be records, header/trailer lines
 * and lines rejected by the filter are skipped silently.
 */
public final class SnapshotLoader {

    /** One byte per character, so every byte value survives as a column. */
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private static final Logger LOGGER = Logger.getLogger(SnapshotLoader.class.getName());

    private final RecordFilter filter;

    public SnapshotLoader(RecordFilter filter) {
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /** A {@code null} path loads as an empty snapshot. */
    public Snapshot load(Path path) throws LoaderException {
        if (path == null) {
            return Snapshot.empty();
        }
        List<ArincLine> lines = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, CHARSET)) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                if (ArincLine.isHeaderOrFooter(raw) || !ArincLine.isRecord(raw)) {
                    skipped++;
                    continue;
                }
                ArincLine line = ArincLine.of(raw);
                if (!filter.accepts(line)) {
                    skipped++;
                    continue;
                }
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new LoaderException("Failed to read snapshot: " + path, ex);
        }
        LOGGER.log(
                Level.FINE,
                "Loaded {0} record lines from {1} ({2} skipped)",
                new Object[] {lines.size(), path.getFileName(), skipped});
        return new Snapshot(path, lines, skipped);
    }
}
