package com.contract.checker.processor;

import com.contract.checker.TestSpecs;
import com.contract.checker.evaluation.AnalysisReport;
import com.contract.checker.evaluation.ReportWriter;
import com.contract.checker.model.Contract;
import com.contract.checker.model.RunResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ContractProcessorTest {

    private final ContractProcessor processor = new ContractProcessor();

    @Test
    void collectsEveryPerPreconditionVerdict() throws IOException {
        AnalysisReport report = processor.analyze(TestSpecs.path("sub_with_m.json"), null, false);
        assertEquals(new RunResult(70, 16, 0, 0), report.baseRun);
        assertEquals(List.of(false, true, true, true), report.singleRedundant);
        assertEquals(List.of(false, true, false, false), report.impliedByOthers);
        assertEquals(List.of(false, false, false, true), report.syntacticallyIrrelevant);
        assertEquals(Set.of("M", "N"), report.preconditionVariables);
        assertEquals(Set.of("y"), report.postconditionVariables);
        assertNull(report.groupReport);
        assertFalse(report.hasBaseViolations());
    }

    @Test
    void implicationErrorIsReportedPerPrecondition() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": -1, "max": 1}, "b": {"min": -1, "max": 1}},
                 "pre": ["b != 0", "a % b == 0"],
                 "program": []}
                """);
        AnalysisReport report = processor.analyze("guarded_mod", contract, false);
        assertEquals(0, report.baseRun.getViolations());
        // "a % b == 0" alone divides by zero when b == 0
        assertEquals(Arrays.asList(null, true), report.impliedByOthers);
        assertEquals(List.of(false, true), report.singleRedundant);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ReportWriter().printReport(report, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("- pre1: ERROR | b != 0"));
        assertTrue(text.contains("- pre2: IMPLIED | a % b == 0"));
    }

    @Test
    void stepLimitOverrideIsReported() throws IOException {
        AnalysisReport report = processor.analyze(TestSpecs.path("sub.json"), 5, false);
        assertEquals(5, report.stepLimit);
        // the countdown from N=1 already needs more than five steps
        assertTrue(report.baseRun.getNontermination() > 0);
    }

    @Test
    void withoutGroupNothingIsWritten(@TempDir Path dir) throws IOException {
        AnalysisReport report = processor.analyze(TestSpecs.path("sub.json"), null, false);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Path written = processor.writeReport(report, new PrintStream(buffer, true, StandardCharsets.UTF_8), dir);
        assertNull(written);
        assertFalse(Files.exists(dir.resolve(ContractProcessor.GROUP_REPORT_FILE)));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("- pre2: REDUNDANT | N >= -5"));
    }

    @Test
    void groupAnalysisIsExportedAsJson(@TempDir Path dir) throws IOException {
        AnalysisReport report = processor.analyze(TestSpecs.path("duplicate_guard.json"), null, true);
        Path out = dir.resolve("nested").resolve("outputs");
        Path written = processor.writeReport(report, new PrintStream(new ByteArrayOutputStream(), true,
                StandardCharsets.UTF_8), out);

        assertEquals(out.resolve(ContractProcessor.GROUP_REPORT_FILE), written);
        JsonNode json = new ObjectMapper().readTree(written.toFile());
        assertEquals("[0,1]", json.get("single_redundant_indices").toString());
        assertEquals("[0]", json.get("greedy_group_indices").toString());
        assertFalse(json.get("all_single_is_group_redundant").asBoolean());
        assertEquals(-5, json.get("counterexample_if_not_group").get("N").asLong());
    }
}
