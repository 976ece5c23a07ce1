package com.contract.checker.analysis;

import com.contract.checker.TestSpecs;
import com.contract.checker.model.Contract;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyAnalyzerTest {

    private final DependencyAnalyzer analyzer = new DependencyAnalyzer();

    @Test
    void loopGuardInfluencesEverythingItGoverns() {
        Contract contract = TestSpecs.load("sub_with_m.json");
        assertEquals(Set.of("N", "x", "y"),
                analyzer.findInfluencingVariables(contract.getProgram(), contract.getPostconditions()));
    }

    @Test
    void preconditionOverUntouchedVariableIsIrrelevant() {
        assertEquals(List.of(3), analyzer.findIrrelevantPreconditions(TestSpecs.load("sub_with_m.json")));
    }

    @Test
    void ifConditionInfluencesBothArms() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 0, "max": 1}, "b": {"min": 0, "max": 1}, "c": {"min": 0, "max": 1}},
                 "pre": ["a >= 0", "b >= 0", "c >= 0"],
                 "post": ["r >= 0"],
                 "program": [{"if": {"cond": "a > 0", "then": [{"assign": {"r": 1}}], "else": [{"assign": {"s": "b"}}]}}]}
                """);
        assertEquals(Set.of("a", "r"),
                analyzer.findInfluencingVariables(contract.getProgram(), contract.getPostconditions()));
        assertEquals(List.of(1, 2), analyzer.findIrrelevantPreconditions(contract));
    }

    @Test
    void influenceFollowsAssignmentChains() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 0, "max": 1}},
                 "post": ["d == 0"],
                 "program": [{"assign": {"b": "a"}}, {"assign": {"c": "b + 1"}}, {"assign": {"d": "c * 2"}}]}
                """);
        assertEquals(Set.of("a", "b", "c", "d"),
                analyzer.findInfluencingVariables(contract.getProgram(), contract.getPostconditions()));
    }

    @Test
    void constantPreconditionIsIrrelevant() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 0, "max": 1}},
                 "pre": ["True", "a == a"],
                 "post": ["a >= 0"],
                 "program": []}
                """);
        assertEquals(List.of(0), analyzer.findIrrelevantPreconditions(contract));
    }

    @Test
    void collectsAssignedVariablesFromNestedBlocks() {
        Contract contract = TestSpecs.load("sub_with_m.json");
        assertEquals(Set.of("x", "y", "z"), analyzer.findAssignedVariables(contract.getProgram()));
    }
}
