package com.arincdelta.jdbc.loader;

import com.arincdelta.jdbc.record.ArincLine;
import java.nio.file.Path;
import java.util.List;

/** Filtered, normalized record lines of one snapshot file. {@code source} is {@code null} for an empty snapshot. */
public final class Snapshot {
    private final Path source;
    private final List<ArincLine> lines;
    private final int skippedLines;

    public Snapshot(Path source, List<ArincLine> lines, int skippedLines) {
        this.source = source;
        this.lines = List.copyOf(lines);
        this.skippedLines = skippedLines;
    }

    public static Snapshot empty() {
        return new Snapshot(null, List.of(), 0);
    }

    public Path getSource() {
        return source;
    }

    public List<ArincLine> getLines() {
        return lines;
    }

    public int getSkippedLines() {
        return skippedLines;
    }
}
