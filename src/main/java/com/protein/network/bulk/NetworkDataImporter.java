package com.protein.network.bulk;

import com.protein.network.api.AnalysisInput;
import com.protein.network.core.model.RawInteraction;
import com.protein.network.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the three analysis inputs.
 *
 * <p>Expected formats:</p>
 * <pre>
 * proteins.txt                 protein_compartments.csv     protein_interactions.txt
 * P1                           protein_id,compartment_id    P2 P1
 * P2                           P1,C3                        P3 P4
 * P3                           P2,C1
 * </pre>
 *
 * <p>The protein list and the interaction list have no header; the compartment table
 * has one, which is skipped. Malformed rows are skipped and reported in the
 * {@link ImportResult}; they never abort the import. Identifiers are not validated
 * here, that is the pipeline's job.</p>
 */
public class NetworkDataImporter {
    private static final Logger log = LoggerFactory.getLogger(NetworkDataImporter.class);
    private static final int PROGRESS_INTERVAL = 1000;

    static final String PROTEINS = "proteins";
    static final String COMPARTMENTS = "compartments";
    static final String INTERACTIONS = "interactions";

    /**
     * Imports the three inputs from files, read as UTF-8.
     *
     * @throws UncheckedIOException if a file cannot be read
     */
    public ImportResult importFiles(Path proteinsFile, Path compartmentsFile, Path interactionsFile,
                                    ProgressCallback callback) {
        try (Reader proteins = Files.newBufferedReader(proteinsFile, StandardCharsets.UTF_8);
             Reader compartments = Files.newBufferedReader(compartmentsFile, StandardCharsets.UTF_8);
             Reader interactions = Files.newBufferedReader(interactionsFile, StandardCharsets.UTF_8)) {
            return importData(proteins, compartments, interactions, callback);
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            throw new UncheckedIOException("Failed to read analysis input", e);
        }
    }

    /**
     * Imports the three inputs from readers. The readers are consumed but not closed.
     *
     * @throws UncheckedIOException if a reader fails
     */
    public ImportResult importData(Reader proteins, Reader compartments, Reader interactions,
                                   ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        List<String> proteinList = readProteins(proteins, errors, cb);
        Map<String, String> compartmentMap = readCompartments(compartments, errors, cb);
        List<RawInteraction> interactionList = readInteractions(interactions, errors, cb);

        ImportResult result = new ImportResult(
                new AnalysisInput(proteinList, compartmentMap, interactionList),
                proteinList.size(), compartmentMap.size(), interactionList.size(), errors);
        log.info("import.completed result={}", result);
        return result;
    }

    List<String> readProteins(Reader reader, List<ImportResult.ImportError> errors, ProgressCallback cb) {
        Set<String> proteins = new LinkedHashSet<>();
        try (LogContext ctx = LogContext.forImport(PROTEINS)) {
            BufferedReader br = buffered(reader);
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                String id = line.trim();
                if (id.isEmpty()) {
                    continue;
                }
                if (id.indexOf(',') >= 0 || id.split("\\s+").length > 1) {
                    reject(errors, PROTEINS, lineNumber, line, "Expected a single identifier");
                    continue;
                }
                if (!proteins.add(id)) {
                    reject(errors, PROTEINS, lineNumber, line, "Duplicate protein: " + id);
                    continue;
                }
                progress(cb, proteins.size(), PROTEINS);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read protein list", e);
        }
        return new ArrayList<>(proteins);
    }

    Map<String, String> readCompartments(Reader reader, List<ImportResult.ImportError> errors,
                                         ProgressCallback cb) {
        Map<String, String> compartments = new LinkedHashMap<>();
        try (LogContext ctx = LogContext.forImport(COMPARTMENTS)) {
            BufferedReader br = buffered(reader);
            String header = br.readLine();
            if (header == null) {
                return compartments;
            }
            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> fields = splitCsvLine(line.trim());
                if (fields.size() != 2 || fields.get(0).isEmpty() || fields.get(1).isEmpty()) {
                    reject(errors, COMPARTMENTS, lineNumber, line, "Expected protein_id,compartment_id");
                    continue;
                }
                String previous = compartments.put(fields.get(0), fields.get(1));
                if (previous != null && !previous.equals(fields.get(1))) {
                    log.warn("import.compartment.reassigned protein={} from={} to={}",
                            fields.get(0), previous, fields.get(1));
                }
                progress(cb, compartments.size(), COMPARTMENTS);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read compartment table", e);
        }
        return compartments;
    }

    List<RawInteraction> readInteractions(Reader reader, List<ImportResult.ImportError> errors,
                                          ProgressCallback cb) {
        List<RawInteraction> interactions = new ArrayList<>();
        try (LogContext ctx = LogContext.forImport(INTERACTIONS)) {
            BufferedReader br = buffered(reader);
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String[] fields = trimmed.split("\\s+");
                if (fields.length != 2) {
                    reject(errors, INTERACTIONS, lineNumber, line, "Expected two whitespace-separated identifiers");
                    continue;
                }
                interactions.add(new RawInteraction(fields[0], fields[1]));
                progress(cb, interactions.size(), INTERACTIONS);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read interaction list", e);
        }
        return interactions;
    }

    /**
     * Splits one CSV line, honouring double-quoted fields with {@code ""} escapes.
     */
    static List<String> splitCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    private static BufferedReader buffered(Reader reader) {
        return reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    }

    private static void reject(List<ImportResult.ImportError> errors, String source,
                               long lineNumber, String line, String message) {
        errors.add(new ImportResult.ImportError(source, lineNumber, line, message));
        log.warn("import.skipped source={} line={} error={}", source, lineNumber, message);
    }

    private static void progress(ProgressCallback cb, long count, String source) {
        if (count % PROGRESS_INTERVAL == 0) {
            cb.onProgress(count, -1, "Read " + count + " " + source);
        }
    }
}
