package com.protein.network.cli;

import com.protein.network.api.AnalysisOptions;
import com.protein.network.api.AnalysisResult;
import com.protein.network.api.ProteinNetworkAnalyzer;
import com.protein.network.bulk.CsvPairExporter;
import com.protein.network.bulk.ImportResult;
import com.protein.network.bulk.JsonSummaryExporter;
import com.protein.network.bulk.NetworkDataImporter;
import com.protein.network.core.DuplicateProteinException;
import com.protein.network.core.InvalidInteractionException;
import com.protein.network.core.MalformedIdentifierException;
import com.protein.network.core.PairUniverseTooLargeException;
import com.protein.network.graph.EdgeValidationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Command-line runner.
 *
 * <p>Usage:</p>
 * <pre>
 * NetworkAnalysisMain PROTEINS COMPARTMENTS INTERACTIONS OUTPUT_DIR
 *                     [--max-pairs N] [--reject-invalid-edges] [--parallel]
 * </pre>
 *
 * <p>Writes {@value #UNOBSERVED_FILE}, {@value #CROSS_GROUP_FILE} and
 * {@value #SUMMARY_FILE} into the output directory. Defaults come from
 * {@code protein-network.properties} on the classpath; JVM system properties with the
 * same keys override them and command-line flags override both.</p>
 */
public final class NetworkAnalysisMain {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisMain.class);

    static final String CONFIG_RESOURCE = "/protein-network.properties";
    static final String UNOBSERVED_FILE = "unobserved_cross_compartment.csv";
    static final String CROSS_GROUP_FILE = "cross_group_cross_compartment.csv";
    static final String SUMMARY_FILE = "summary.json";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INVALID_INPUT = 3;
    static final int EXIT_IO = 4;

    private NetworkAnalysisMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        return run(args, NetworkAnalysisMain::loadProperties);
    }

    static int run(String[] args, Supplier<Properties> configuration) {
        CliOptions cli;
        AnalysisOptions options;
        try {
            cli = CliOptions.parse(args);
            options = resolveOptions(cli, configuration.get());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        } catch (UncheckedIOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }

        try {
            ImportResult imported = new NetworkDataImporter().importFiles(
                    cli.proteinsFile(), cli.compartmentsFile(), cli.interactionsFile(), null);
            if (imported.hasErrors()) {
                log.warn("cli.import.skipped rows={}", imported.errorCount());
            }

            AnalysisResult result = ProteinNetworkAnalyzer.builder()
                    .options(options)
                    .build()
                    .analyze(imported.input());

            Files.createDirectories(cli.outputDir());
            CsvPairExporter csv = new CsvPairExporter();
            csv.export(result.getUnobservedCrossCompartment(), cli.outputDir().resolve(UNOBSERVED_FILE), null);
            csv.export(result.getCrossGroupCrossCompartment(), cli.outputDir().resolve(CROSS_GROUP_FILE), null);
            new JsonSummaryExporter().export(result.summary(), cli.outputDir().resolve(SUMMARY_FILE));

            System.out.printf("Proteins:                       %d%n", result.getProteinCount());
            System.out.printf("Connectivity groups:            %d%n", result.getGroups().size());
            System.out.printf("Unobserved pairs:               %d%n", result.getUnobserved().size());
            System.out.printf("Cross-compartment pairs:        %d%n", result.getCrossCompartment().size());
            System.out.printf("Unobserved cross-compartment:   %d%n", result.getUnobservedCrossCompartment().size());
            System.out.printf("Cross-group cross-compartment:  %d%n", result.getCrossGroupCrossCompartment().size());
            return EXIT_OK;
        } catch (MalformedIdentifierException | InvalidInteractionException
                 | DuplicateProteinException | PairUniverseTooLargeException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream in = NetworkAnalysisMain.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
        }
        for (String key : new String[]{AnalysisOptions.MAX_PAIRS_KEY,
                AnalysisOptions.EDGE_VALIDATION_KEY, AnalysisOptions.PARALLEL_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return properties;
    }

    static AnalysisOptions resolveOptions(CliOptions cli, Properties properties) {
        AnalysisOptions.Builder builder = AnalysisOptions.fromProperties(properties).toBuilder();
        if (cli.maxPairs() != null) {
            builder.maxPairs(cli.maxPairs());
        }
        if (cli.rejectInvalidEdges()) {
            builder.edgeValidationPolicy(EdgeValidationPolicy.REJECT);
        }
        if (cli.parallel()) {
            builder.parallelClassification(true);
        }
        return builder.build();
    }

    private static void printUsage() {
        System.err.println("Usage: " + NetworkAnalysisMain.class.getSimpleName()
                + " PROTEINS COMPARTMENTS INTERACTIONS OUTPUT_DIR"
                + " [--max-pairs N] [--reject-invalid-edges] [--parallel]");
    }
}
