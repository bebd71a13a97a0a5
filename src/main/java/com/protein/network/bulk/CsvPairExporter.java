package com.protein.network.bulk;

import com.protein.network.core.model.JoinedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a classified pair table as CSV.
 *
 * <p>Output format:</p>
 * <pre>
 * entity_A,entity_B,compartment_A,compartment_B,group_A,group_B
 * P1,P3,X,Y,0,1
 * P2,P5,X,,0,
 * </pre>
 *
 * <p>Missing compartments and groups are written as empty fields.</p>
 */
public class CsvPairExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvPairExporter.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    public static final String HEADER = "entity_A,entity_B,compartment_A,compartment_B,group_A,group_B";

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    public ExportResult export(List<JoinedPair> pairs, Path file, ProgressCallback callback) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            return export(pairs, writer, callback);
        } catch (IOException e) {
            log.error("export.failed file={} error={}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    /**
     * Writes the table to the writer and flushes it; the writer is not closed.
     *
     * @throws UncheckedIOException if the writer fails
     */
    public ExportResult export(List<JoinedPair> pairs, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(writer instanceof BufferedWriter ? writer : new BufferedWriter(writer));

        long rows = 0;
        pw.println(HEADER);
        for (JoinedPair pair : pairs) {
            pw.print(csvEscape(pair.entityA()));
            pw.print(',');
            pw.print(csvEscape(pair.entityB()));
            pw.print(',');
            pw.print(csvEscape(pair.compartmentA()));
            pw.print(',');
            pw.print(csvEscape(pair.compartmentB()));
            pw.print(',');
            pw.print(pair.groupA() != null ? pair.groupA().toString() : "");
            pw.print(',');
            pw.println(pair.groupB() != null ? pair.groupB().toString() : "");
            rows++;
            if (rows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(rows, pairs.size(), "Exported " + rows + " pairs");
            }
        }
        pw.flush();
        if (pw.checkError()) {
            throw new UncheckedIOException(new IOException("Error writing pair table"));
        }

        ExportResult result = new ExportResult(rows);
        cb.onProgress(rows, pairs.size(), "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
