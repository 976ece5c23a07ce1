package com.contract.checker.evaluation;

import com.contract.checker.model.RedundancyReport;
import com.contract.checker.model.RunResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link AnalysisReport} as text and exports group redundancy results as JSON.
 */
public class ReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(new ObjectMapper());
    }

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Print a human-readable report.
     */
    public void printReport(AnalysisReport report, PrintStream out) {
        RunResult base = report.baseRun;

        out.println("Spec: " + report.specName);
        out.println("Inputs considered: " + base.getConsideredInputs());
        out.printf("Inputs satisfying pre: %d (%s)%n", base.getSatisfyingPre(),
                formatPercentage(base.getSatisfyingPre(), base.getConsideredInputs()));
        out.println("Violations (bounded): " + base.getViolations());
        out.printf("Nontermination (step_limit=%d): %d%n", report.stepLimit, base.getNontermination());
        out.println();

        if (report.hasBaseViolations()) {
            out.println("NOTE: Base contract has violations under this bounded domain.");
            out.println();
        }

        if (!report.preconditions.isEmpty()) {
            out.println("Single precondition redundancy (bounded verifier-based check):");
            printVerdicts(out, report.preconditions, report.singleRedundant, "REDUNDANT", "NEEDED");
            if (!report.singleRedundant.contains(Boolean.TRUE)) {
                out.println("- none");
            }
            out.println();

            out.println("Implication checking (bounded, IC-like):");
            printVerdicts(out, report.preconditions, report.impliedByOthers, "IMPLIED", "NOT implied");
            out.println();

            out.println("Dependency checking (syntactic, DC-like):");
            printVerdicts(out, report.preconditions, report.syntacticallyIrrelevant, "IRRELEVANT", "RELEVANT");
            out.println();
        }

        if (!report.postconditions.isEmpty()) {
            out.println("Variable usage (syntactic):");
            out.println("- vars(pre): " + report.preconditionVariables);
            out.println("- vars(post): " + report.postconditionVariables);
            out.println();
        }

        if (report.groupReport != null) {
            RedundancyReport group = report.groupReport;
            out.println("Group redundancy (bounded):");
            out.println("- single-redundant indices: " + group.getSingleRedundantIndices());
            out.println("- greedy group indices: " + group.getGreedyGroupIndices());
            out.println("- all single-redundant removable together: "
                    + (group.isAllSingleGroupRedundant() ? "yes" : "no"));
            group.getCounterexample().ifPresent(input -> out.println("- counterexample: " + input));
            out.println();
        }
    }

    /**
     * Serializes a group redundancy report to JSON.
     */
    public String toJson(RedundancyReport report) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode single = root.putArray("single_redundant_indices");
        report.getSingleRedundantIndices().forEach(single::add);
        ArrayNode greedy = root.putArray("greedy_group_indices");
        report.getGreedyGroupIndices().forEach(greedy::add);
        root.put("all_single_is_group_redundant", report.isAllSingleGroupRedundant());
        if (report.getCounterexample().isPresent()) {
            ObjectNode counterexample = root.putObject("counterexample_if_not_group");
            for (Map.Entry<String, Long> entry : report.getCounterexample().get().entrySet()) {
                counterexample.put(entry.getKey(), entry.getValue());
            }
        } else {
            root.putNull("counterexample_if_not_group");
        }
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    /**
     * Export a group redundancy report to a JSON file, creating parent directories.
     */
    public void exportGroupReport(RedundancyReport report, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(report) + System.lineSeparator());
        logger.info("Group redundancy report exported to: {}", outputPath);
    }

    private void printVerdicts(PrintStream out, List<String> preconditions, List<Boolean> verdicts,
                               String positive, String negative) {
        for (int i = 0; i < preconditions.size(); i++) {
            Boolean verdict = verdicts.get(i);
            String status = verdict == null ? "ERROR" : verdict ? positive : negative;
            out.printf("- pre%d: %s | %s%n", i + 1, status, preconditions.get(i));
        }
    }

    static String formatPercentage(long part, long total) {
        if (total <= 0) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f%%", 100.0 * part / total);
    }
}
