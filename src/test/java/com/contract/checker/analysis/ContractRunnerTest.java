package com.contract.checker.analysis;

import com.contract.checker.TestSpecs;
import com.contract.checker.expression.ExpressionEvaluator;
import com.contract.checker.model.Contract;
import com.contract.checker.model.Environment;
import com.contract.checker.model.RunResult;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

public class ContractRunnerTest {

    private static final List<String> FIXTURES = List.of("sub.json", "sub_with_m.json", "duplicate_guard.json");

    private final ContractRunner runner = new ContractRunner();

    @TestFactory
    Collection<DynamicTest> removingAPreconditionNeverShrinksTheAdmittedSet() {
        List<DynamicTest> tests = new ArrayList<>();
        for (String fixture : FIXTURES) {
            Contract contract = TestSpecs.load(fixture);
            for (int i = 0; i < contract.getPreconditions().size(); i++) {
                int index = i;
                tests.add(dynamicTest(fixture + " without pre" + (index + 1), () -> {
                    RunResult base = runner.run(contract);
                    RunResult reduced = runner.run(contract.withoutPrecondition(index));
                    assertEquals(base.getConsideredInputs(), reduced.getConsideredInputs());
                    assertTrue(reduced.getSatisfyingPre() >= base.getSatisfyingPre(),
                            () -> "admitted " + reduced.getSatisfyingPre() + " < " + base.getSatisfyingPre());
                }));
            }
        }
        return tests;
    }

    @TestFactory
    Collection<DynamicTest> admittedPlusSkippedCoversTheDomain() {
        ExpressionEvaluator evaluator = new ExpressionEvaluator();
        List<DynamicTest> tests = new ArrayList<>();
        for (String fixture : FIXTURES) {
            tests.add(dynamicTest(fixture, () -> {
                Contract contract = TestSpecs.load(fixture);
                long skipped = 0;
                for (Map<String, Long> input : new DomainEnumerator(contract.getDomain())) {
                    if (!evaluator.testAll(contract.getPreconditions(), Environment.fromInput(input))) {
                        skipped++;
                    }
                }
                RunResult result = runner.run(contract);
                assertEquals(contract.getDomain().size(), result.getConsideredInputs());
                assertEquals(result.getConsideredInputs(), result.getSatisfyingPre() + skipped);
            }));
        }
        return tests;
    }

    @Test
    void baseRunOfCountdownHolds() {
        RunResult result = runner.run(TestSpecs.load("sub.json"));
        assertEquals(new RunResult(16, 11, 0, 0), result);
        assertTrue(result.holds());
    }

    @Test
    void droppingTheNeededBoundAdmitsViolations() {
        Contract contract = TestSpecs.load("sub.json").withoutPrecondition(0);
        RunResult result = runner.run(contract);
        assertEquals(16, result.getSatisfyingPre());
        assertEquals(5, result.getViolations());
        assertEquals(0, result.getNontermination());
        assertEquals(Optional.of(Map.of("N", -5L)), runner.findCounterexample(contract));
    }

    @Test
    void runsAreIdempotent() {
        Contract contract = TestSpecs.load("sub_with_m.json");
        assertEquals(runner.run(contract), runner.run(contract));
    }

    @Test
    void consideredEqualsDomainSize() {
        Contract contract = TestSpecs.load("sub_with_m.json");
        RunResult result = runner.run(contract);
        assertEquals(contract.getDomain().size(), result.getConsideredInputs());
        assertEquals(70, result.getConsideredInputs());
        assertEquals(16, result.getSatisfyingPre());
    }

    @Test
    void emptyPreAndPostAreVacuous() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 1, "max": 4}},
                 "program": [{"assign": {"b": "a * 2"}}]}
                """);
        assertEquals(new RunResult(4, 4, 0, 0), runner.run(contract));
        assertTrue(runner.findCounterexample(contract).isEmpty());
    }

    @Test
    void nonterminationIsCountedWithoutCheckingPost() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"n": {"min": 0, "max": 3}},
                 "post": ["False"],
                 "step_limit": 50,
                 "program": [{"while": {"cond": "n != 2", "body": []}}]}
                """);
        // n == 2 terminates and fails the post; the rest spin forever
        RunResult result = runner.run(contract);
        assertEquals(new RunResult(4, 4, 1, 3), result);
        assertEquals(Optional.of(Map.of("n", 0L)), runner.findCounterexample(contract));
    }

    @Test
    void evaluationErrorsCountAsViolationsAndTheSweepContinues() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"d": {"min": -1, "max": 2}},
                 "post": ["r >= 0"],
                 "program": [{"assign": {"r": "10 % d"}}]}
                """);
        // d == 0 raises modulo by zero; d == -1 gives a negative remainder of 0
        RunResult result = runner.run(contract);
        assertEquals(4, result.getConsideredInputs());
        assertEquals(4, result.getSatisfyingPre());
        assertEquals(1, result.getViolations());
        assertEquals(Optional.of(Map.of("d", 0L)), runner.findCounterexample(contract));
    }

    @Test
    void errorInsidePreconditionIsAViolationButNotAdmitted() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 0, "max": 2}},
                 "pre": ["ghost > 0"],
                 "program": []}
                """);
        assertEquals(new RunResult(3, 0, 3, 0), runner.run(contract));
        assertEquals(Optional.of(Map.of("a", 0L)), runner.findCounterexample(contract));
    }

    @Test
    void unknownVariableInProgramIsAViolation() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"a": {"min": 0, "max": 1}},
                 "pre": ["a == 1"],
                 "program": [{"assign": {"b": "c"}}]}
                """);
        assertEquals(new RunResult(2, 1, 1, 0), runner.run(contract));
        assertEquals(Optional.of(Map.of("a", 1L)), runner.findCounterexample(contract));
    }

    @Test
    void counterexampleSkipsInputsFailingThePrecondition() {
        Contract contract = TestSpecs.parse("""
                {"inputs": {"x": {"min": -3, "max": 3}},
                 "pre": ["x > 0"],
                 "post": ["y < 3"],
                 "program": [{"assign": {"y": "x"}}]}
                """);
        assertEquals(Optional.of(Map.of("x", 3L)), runner.findCounterexample(contract));
    }
}
