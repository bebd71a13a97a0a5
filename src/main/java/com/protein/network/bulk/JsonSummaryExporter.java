package com.protein.network.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.protein.network.api.AnalysisSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the summary of an analysis run as pretty-printed JSON.
 */
public class JsonSummaryExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonSummaryExporter.class);

    private final ObjectMapper objectMapper;

    public JsonSummaryExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonSummaryExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(AnalysisSummary summary) {
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis summary", e);
        }
    }

    public AnalysisSummary fromJson(String json) {
        try {
            return objectMapper.readValue(json, AnalysisSummary.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid analysis summary JSON", e);
        }
    }

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    public void export(AnalysisSummary summary, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(toJson(summary));
            writer.write(System.lineSeparator());
        } catch (IOException e) {
            log.error("export.failed file={} error={}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.info("export.summary.completed file={}", file);
    }
}
