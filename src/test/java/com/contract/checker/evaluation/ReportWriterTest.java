package com.contract.checker.evaluation;

import com.contract.checker.model.RedundancyReport;
import com.contract.checker.model.RunResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    private final ReportWriter writer = new ReportWriter();

    private static AnalysisReport report(RunResult base, RedundancyReport group) {
        AnalysisReport report = new AnalysisReport();
        report.specName = "specs/example.json";
        report.stepLimit = 10000;
        report.preconditions = List.of("N >= 0", "N >= -5");
        report.postconditions = List.of("y == 0");
        report.baseRun = base;
        report.singleRedundant = List.of(false, true);
        report.impliedByOthers = List.of(false, true);
        report.syntacticallyIrrelevant = List.of(false, false);
        report.preconditionVariables = new TreeSet<>(List.of("N"));
        report.postconditionVariables = new TreeSet<>(List.of("y"));
        report.groupReport = group;
        return report;
    }

    private String print(AnalysisReport report) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        writer.printReport(report, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void formatsPercentages() {
        assertEquals("68.75%", ReportWriter.formatPercentage(11, 16));
        assertEquals("100.00%", ReportWriter.formatPercentage(3, 3));
        assertEquals("n/a", ReportWriter.formatPercentage(0, 0));
    }

    @Test
    void printsBaseCountsAndVerdicts() {
        String text = print(report(new RunResult(16, 11, 0, 0), null));
        assertTrue(text.contains("Inputs considered: 16"));
        assertTrue(text.contains("Inputs satisfying pre: 11 (68.75%)"));
        assertTrue(text.contains("Violations (bounded): 0"));
        assertTrue(text.contains("Nontermination (step_limit=10000): 0"));
        assertTrue(text.contains("- pre1: NEEDED | N >= 0"));
        assertTrue(text.contains("- pre2: REDUNDANT | N >= -5"));
        assertTrue(text.contains("- pre2: IMPLIED | N >= -5"));
        assertTrue(text.contains("- pre1: RELEVANT | N >= 0"));
        assertTrue(text.contains("- vars(post): [y]"));
        assertFalse(text.contains("NOTE:"));
        assertFalse(text.contains("Group redundancy"));
    }

    @Test
    void notesBaseViolations() {
        String text = print(report(new RunResult(16, 11, 2, 0), null));
        assertTrue(text.contains("NOTE: Base contract has violations"));
    }

    @Test
    void printsGroupSectionWithCounterexample() {
        RedundancyReport group = new RedundancyReport(List.of(0, 1), List.of(0), false, Map.of("N", -5L));
        String text = print(report(new RunResult(11, 6, 0, 0), group));
        assertTrue(text.contains("- greedy group indices: [0]"));
        assertTrue(text.contains("- all single-redundant removable together: no"));
        assertTrue(text.contains("- counterexample: {N=-5}"));
    }

    @Test
    void jsonUsesSnakeCaseKeysAndNullCounterexample() throws IOException {
        RedundancyReport group = new RedundancyReport(List.of(1, 2), List.of(1, 2), true, null);
        JsonNode json = new ObjectMapper().readTree(writer.toJson(group));
        assertEquals("[1,2]", json.get("single_redundant_indices").toString());
        assertEquals("[1,2]", json.get("greedy_group_indices").toString());
        assertTrue(json.get("all_single_is_group_redundant").asBoolean());
        assertTrue(json.has("counterexample_if_not_group"));
        assertTrue(json.get("counterexample_if_not_group").isNull());
    }
}
