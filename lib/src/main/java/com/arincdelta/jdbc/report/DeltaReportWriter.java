package com.arincdelta.jdbc.report;

import com.arincdelta.jdbc.output.OutputTable;
import com.arincdelta.jdbc.output.TypeDelta;
import com.arincdelta.jdbc.schema.DiscardedAirportsTable;
import com.arincdelta.jdbc.schema.SummaryTable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Writes a {@link DeltaReport} as CSV files into one output directory. */
public final class DeltaReportWriter {
    public static final String CSV_EXTENSION = ".csv";
    public static final String SUMMARY_FILE = SummaryTable.NAME + CSV_EXTENSION;
    public static final String DISCARDED_FILE = DiscardedAirportsTable.NAME + ".txt";

    private static final Logger LOGGER = Logger.getLogger(DeltaReportWriter.class.getName());

    private final Path outputDirectory;

    public DeltaReportWriter(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /** Returns the files written, in write order. */
    public List<Path> write(DeltaReport report) throws IOException {
        Files.createDirectories(outputDirectory);
        List<Path> written = new ArrayList<>();

        Path discardedFile = outputDirectory.resolve(DISCARDED_FILE);
        if (report.getDiscardedAirports().isEmpty()) {
            Files.deleteIfExists(discardedFile);
        } else {
            Files.writeString(
                    discardedFile, String.join("\n", report.getDiscardedAirports()), StandardCharsets.UTF_8);
            written.add(discardedFile);
        }

        for (TypeDelta delta : report.getTypeDeltas()) {
            for (String obsolete : delta.getObsoleteTableNames()) {
                if (Files.deleteIfExists(outputDirectory.resolve(obsolete + CSV_EXTENSION))) {
                    LOGGER.log(Level.FINE, "Removed stale output {0}", obsolete + CSV_EXTENSION);
                }
            }
            for (OutputTable table : delta.getOutputTables()) {
                Path file = outputDirectory.resolve(table.getName() + CSV_EXTENSION);
                CsvWriter.write(file, table.getHeader(), table.materializeRows());
                written.add(file);
            }
        }

        Path summaryFile = outputDirectory.resolve(SUMMARY_FILE);
        CsvWriter.write(
                summaryFile,
                SummaryTable.getDefinition().getColumnNames(),
                SummaryTable.materializeRows(report.getSummaries()));
        written.add(summaryFile);

        LOGGER.log(Level.INFO, "Wrote {0} files to {1}", new Object[] {written.size(), outputDirectory});
        return written;
    }
}
