package com.arincdelta.jdbc.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Minimal RFC 4180 writer: UTF-8, CRLF line endings, quoting only where a value needs it. */
public final class CsvWriter {
    private static final String LINE_END = "\r\n";

    private CsvWriter() {}

    public static void write(Path file, List<String> header, List<Object[]> rows) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRecord(writer, header.toArray());
            for (Object[] row : rows) {
                writeRecord(writer, row);
            }
        }
    }

    static void writeRecord(Writer writer, Object[] values) throws IOException {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(values[i]));
        }
        writer.write(LINE_END);
    }

    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value.toString();
        boolean needsQuotes = false;
        for (int i = 0; i < text.length() && !needsQuotes; i++) {
            char c = text.charAt(i);
            needsQuotes = c == ',' || c == '"' || c == '\r' || c == '\n';
        }
        if (!needsQuotes) {
            return text;
        }
        return '"' + text.replace("\"", "\"\"") + '"';
    }
}
