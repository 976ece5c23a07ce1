package com.contract.checker.evaluation;

import com.contract.checker.model.RedundancyReport;
import com.contract.checker.model.RunResult;

import java.util.List;
import java.util.SortedSet;

/**
 * Data class holding everything one spec analysis produced, for printing and export.
 */
public class AnalysisReport {

    // Source
    public String specName;
    public int stepLimit;
    public List<String> preconditions;
    public List<String> postconditions;

    // Base run
    public RunResult baseRun;

    // Per-precondition verdicts, same order as preconditions
    public List<Boolean> singleRedundant;
    // null where the implication check raised an evaluation error
    public List<Boolean> impliedByOthers;
    public List<Boolean> syntacticallyIrrelevant;

    // Syntactic variable usage
    public SortedSet<String> preconditionVariables;
    public SortedSet<String> postconditionVariables;

    // Only present when group analysis was requested
    public RedundancyReport groupReport;

    public boolean hasBaseViolations() {
        return baseRun != null && baseRun.getViolations() > 0;
    }
}
