package com.contract.checker;

import com.contract.checker.evaluation.AnalysisReport;
import com.contract.checker.exception.ContractCheckException;
import com.contract.checker.processor.ContractProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Main application entry point for the bounded contract checker.
 * Loads a JSON spec, checks the contract over its bounded domain and reports
 * which preconditions are redundant.
 */
public class ContractCheckerApp {

    private static final Logger logger = LoggerFactory.getLogger(ContractCheckerApp.class);

    static final String USAGE =
            "Usage: java -jar contract-checker.jar <spec.json> | --spec <spec.json>"
            + " [--step-limit <n>] [--group] [--out <dir>]";

    private static final Set<String> OPTIONS_WITH_VALUE = Set.of("--spec", "--step-limit", "--out");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the checker and returns the process exit code.
     */
    static int run(String[] args) {
        Map<String, String> options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 2;
        }

        String spec = options.get("spec");
        if (spec == null) {
            System.err.println("Missing spec path. Provide --spec or a positional argument.");
            System.err.println(USAGE);
            return 2;
        }

        Integer stepLimit = options.containsKey("step-limit") ? Integer.valueOf(options.get("step-limit")) : null;
        boolean group = options.containsKey("group");
        Path outputDir = Paths.get(options.getOrDefault("out", "outputs"));

        logger.info("Starting bounded contract checker");
        logger.info("Spec: {}", spec);

        try {
            ContractProcessor processor = new ContractProcessor();
            AnalysisReport report = processor.analyze(Paths.get(spec), stepLimit, group);
            Path written = processor.writeReport(report, System.out, outputDir);
            if (written != null) {
                System.out.println("Wrote " + written);
            }
            return 0;
        } catch (IOException | ContractCheckException e) {
            logger.error("Error analyzing spec {}", spec, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (OPTIONS_WITH_VALUE.contains(arg) && i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            if ("--spec".equals(arg)) {
                options.put("spec", args[++i]);
            } else if ("--step-limit".equals(arg)) {
                String value = args[++i];
                try {
                    if (Integer.parseInt(value) <= 0) {
                        throw new IllegalArgumentException("--step-limit must be positive: " + value);
                    }
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("--step-limit must be an integer: " + value);
                }
                options.put("step-limit", value);
            } else if ("--out".equals(arg)) {
                options.put("out", args[++i]);
            } else if ("--group".equals(arg)) {
                options.put("group", "true");
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (!options.containsKey("spec")) {
                options.put("spec", arg);
            }
        }
        return options;
    }
}
