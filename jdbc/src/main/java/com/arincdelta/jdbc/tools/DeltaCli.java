package com.arincdelta.jdbc.tools;

import com.arincdelta.jdbc.loader.DebugFlags;
import com.arincdelta.jdbc.loader.DeltaRequest;
import com.arincdelta.jdbc.loader.DeltaRequestException;
import com.arincdelta.jdbc.loader.LoaderException;
import com.arincdelta.jdbc.report.DeltaReport;
import com.arincdelta.jdbc.report.DeltaReportWriter;
import com.arincdelta.jdbc.report.DeltaRunner;
import com.arincdelta.jdbc.report.TypeSummary;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Command-line entry point: compares two snapshots and writes the delta files.
 *
 * <pre>DeltaCli &lt;old&gt; &lt;new&gt; [--out dir] [--airport LIST] [--area LIST] [--region LIST] [--types LIST]</pre>
 */
public final class DeltaCli {

    static final String DEFAULT_OUT = "delta_pg_pi_pv_out";
    static final String DEFAULT_REGION = "EUR,EEU,MES";
    static final String USAGE =
            "Usage: DeltaCli <old> <new> [--out dir] [--airport ICAO,...] [--area CODE,...]"
                    + " [--region LIST (default " + DEFAULT_REGION + ", empty for all)] [--types PG,PI,PV,DV]";

    private DeltaCli() {}

    public static void main(String[] args) {
        DebugFlags.applyLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return 2;
        }
        try {
            DeltaRequest request = DeltaRequest.fromProperties(arguments.requestProperties());
            DeltaReport report = new DeltaRunner(request).run(arguments.oldPath(), arguments.newPath());
            new DeltaReportWriter(arguments.outputDirectory()).write(report);
            print(report, arguments.outputDirectory(), out);
            return 0;
        } catch (DeltaRequestException ex) {
            err.println("Invalid request: " + ex.getMessage());
            return 2;
        } catch (LoaderException ex) {
            err.println("Failed to load snapshots: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            err.println("Failed to write output: " + ex.getMessage());
            return 1;
        }
    }

    private static void print(DeltaReport report, Path outputDirectory, PrintStream out) {
        if (report.getDiscardedAirports().isEmpty()) {
            out.println("No airports discarded (primary present for all with continuations).");
        } else {
            out.println("Discarded ICAOs: " + String.join(", ", report.getDiscardedAirports()));
        }
        for (TypeSummary summary : report.getSummaries()) {
            out.printf(
                    "%s: current=%d added=%d removed=%d modified=%d%n",
                    summary.typeCode(), summary.current(), summary.added(), summary.removed(), summary.modified());
        }
        out.println("Output: " + outputDirectory.toAbsolutePath());
    }

    record Arguments(Path oldPath, Path newPath, Path outputDirectory, Properties requestProperties) {

        static Arguments parse(String[] args) {
            List<String> positional = new ArrayList<>();
            Properties properties = new Properties();
            properties.setProperty(DeltaRequest.REGION, DEFAULT_REGION);
            Path out = Path.of(DEFAULT_OUT);
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    positional.add(arg);
                    continue;
                }
                String name = arg.substring(2);
                String value;
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("Missing value for --" + name);
                }
                switch (name) {
                    case "out" -> out = Path.of(value);
                    case DeltaRequest.AIRPORT, DeltaRequest.AREA, DeltaRequest.REGION, DeltaRequest.TYPES ->
                            properties.setProperty(name, value);
                    default -> throw new IllegalArgumentException("Unknown option: --" + name);
                }
            }
            if (positional.size() != 2) {
                throw new IllegalArgumentException("Expected <old> and <new> snapshot paths.");
            }
            return new Arguments(
                    Path.of(positional.get(0)).toAbsolutePath().normalize(),
                    Path.of(positional.get(1)).toAbsolutePath().normalize(),
                    out,
                    properties);
        }
    }
}
