package com.contract.checker.processor;

import com.contract.checker.analysis.ContractRunner;
import com.contract.checker.analysis.DependencyAnalyzer;
import com.contract.checker.analysis.ImplicationChecker;
import com.contract.checker.analysis.RedundancyAnalyzer;
import com.contract.checker.evaluation.AnalysisReport;
import com.contract.checker.evaluation.ReportWriter;
import com.contract.checker.exception.EvaluationException;
import com.contract.checker.expression.Expression;
import com.contract.checker.model.Contract;
import com.contract.checker.model.RedundancyReport;
import com.contract.checker.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Analyzes one contract spec end to end.
 *
 * Steps:
 * - Load and validate the spec
 * - Base run over the bounded domain
 * - Single redundancy, implication (IC-like) and dependency (DC-like) checks per precondition
 * - Optionally, group redundancy with a counterexample when single results do not combine
 */
public class ContractProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ContractProcessor.class);

    public static final String GROUP_REPORT_FILE = "group_redundancy_report.json";

    private final SpecificationLoader loader;
    private final ContractRunner runner;
    private final RedundancyAnalyzer redundancyAnalyzer;
    private final ImplicationChecker implicationChecker;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final ReportWriter reportWriter;

    public ContractProcessor() {
        this.loader = new SpecificationLoader();
        this.runner = new ContractRunner();
        this.redundancyAnalyzer = new RedundancyAnalyzer(runner);
        this.implicationChecker = new ImplicationChecker();
        this.dependencyAnalyzer = new DependencyAnalyzer();
        this.reportWriter = new ReportWriter();
    }

    /**
     * Loads and analyzes a spec file.
     *
     * @param specPath Path to the JSON spec
     * @param stepLimitOverride Replaces the spec's step limit when non-null
     * @param includeGroup Whether to also run the group redundancy analysis
     * @return The collected report
     * @throws IOException If the spec cannot be read
     */
    public AnalysisReport analyze(Path specPath, Integer stepLimitOverride, boolean includeGroup) throws IOException {
        Contract contract = loader.load(specPath, stepLimitOverride);
        return analyze(specPath.toString(), contract, includeGroup);
    }

    /**
     * Analyzes an already loaded contract.
     *
     * @param specName Name shown in the report
     * @param contract The contract
     * @param includeGroup Whether to also run the group redundancy analysis
     * @return The collected report
     */
    public AnalysisReport analyze(String specName, Contract contract, boolean includeGroup) {
        AnalysisReport report = new AnalysisReport();
        report.specName = specName;
        report.stepLimit = contract.getStepLimit();
        report.preconditions = sources(contract.getPreconditions());
        report.postconditions = sources(contract.getPostconditions());

        logger.info("Base run over {} (step limit {})", contract.getDomain(), contract.getStepLimit());
        RunResult base = runner.run(contract);
        report.baseRun = base;
        if (base.getViolations() > 0) {
            logger.warn("Base contract has {} violations under this bounded domain", base.getViolations());
        }

        int count = contract.getPreconditions().size();
        List<Integer> singleIndices;
        if (includeGroup) {
            logger.info("Running group redundancy analysis over {} preconditions", count);
            RedundancyReport groupReport = redundancyAnalyzer.analyze(contract);
            report.groupReport = groupReport;
            singleIndices = groupReport.getSingleRedundantIndices();
        } else {
            singleIndices = redundancyAnalyzer.findSingleRedundant(contract);
        }
        report.singleRedundant = flags(singleIndices, count);
        report.impliedByOthers = impliedByOthers(contract);
        report.syntacticallyIrrelevant = flags(dependencyAnalyzer.findIrrelevantPreconditions(contract), count);

        report.preconditionVariables = variables(contract.getPreconditions());
        report.postconditionVariables = variables(contract.getPostconditions());

        logger.info("Analysis complete: {} of {} preconditions single-redundant", singleIndices.size(), count);
        return report;
    }

    /**
     * Prints the report and, when it carries a group analysis, writes it as JSON into {@code outputDir}.
     *
     * @return The JSON file written, or null if there was no group analysis
     */
    public Path writeReport(AnalysisReport report, PrintStream out, Path outputDir) throws IOException {
        reportWriter.printReport(report, out);
        if (report.groupReport == null) {
            return null;
        }
        Path jsonPath = outputDir.resolve(GROUP_REPORT_FILE);
        reportWriter.exportGroupReport(report.groupReport, jsonPath);
        return jsonPath;
    }

    private List<Boolean> impliedByOthers(Contract contract) {
        int count = contract.getPreconditions().size();
        List<Boolean> implied = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            try {
                implied.add(implicationChecker.isImpliedByOthers(contract, i));
            } catch (EvaluationException e) {
                logger.warn("Implication check for pre{} failed: {}", i + 1, e.getMessage());
                implied.add(null);
            }
        }
        return implied;
    }

    private static List<String> sources(List<Expression> expressions) {
        List<String> sources = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            sources.add(expression.getSource());
        }
        return sources;
    }

    private static List<Boolean> flags(List<Integer> indices, int count) {
        List<Boolean> flags = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            flags.add(indices.contains(i));
        }
        return flags;
    }

    private static SortedSet<String> variables(List<Expression> expressions) {
        SortedSet<String> names = new TreeSet<>();
        for (Expression expression : expressions) {
            names.addAll(expression.getVariables());
        }
        return names;
    }
}
