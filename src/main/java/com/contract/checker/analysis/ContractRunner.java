package com.contract.checker.analysis;

import com.contract.checker.exception.EvaluationException;
import com.contract.checker.execution.BoundedExecutor;
import com.contract.checker.execution.ExecutionOutcome;
import com.contract.checker.expression.ExpressionEvaluator;
import com.contract.checker.model.Contract;
import com.contract.checker.model.Environment;
import com.contract.checker.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Runs a contract over every input of its bounded domain.
 *
 * For each input: check the preconditions, execute the program under the
 * step limit, then check the postconditions. An evaluation error for one
 * input counts as a violation for that input and the sweep carries on.
 */
public class ContractRunner {

    private static final Logger logger = LoggerFactory.getLogger(ContractRunner.class);

    private enum Verdict {
        SKIPPED,
        PASSED,
        VIOLATED,
        NONTERMINATING,
        ERROR
    }

    private final ExpressionEvaluator evaluator;
    private final BoundedExecutor executor;

    public ContractRunner() {
        this(new ExpressionEvaluator());
    }

    public ContractRunner(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
        this.executor = new BoundedExecutor(evaluator);
    }

    /**
     * Executes the contract for all inputs and counts outcomes.
     *
     * @param contract The contract to check
     * @return Aggregate counts over the whole domain
     */
    public RunResult run(Contract contract) {
        long considered = 0;
        long satisfyingPre = 0;
        long violations = 0;
        long nontermination = 0;

        for (Map<String, Long> input : new DomainEnumerator(contract.getDomain())) {
            considered++;
            switch (check(contract, input)) {
                case SKIPPED -> {
                }
                case PASSED -> satisfyingPre++;
                case VIOLATED -> {
                    satisfyingPre++;
                    violations++;
                }
                case NONTERMINATING -> {
                    satisfyingPre++;
                    nontermination++;
                }
                // an error inside the precondition never admitted the input
                case ERROR -> violations++;
            }
        }

        RunResult result = new RunResult(considered, satisfyingPre, violations, nontermination);
        logger.debug("Bounded run: {}", result);
        return result;
    }

    /**
     * Finds the first input, in enumeration order, that satisfies the
     * preconditions but times out, fails a postcondition, or raises an
     * evaluation error.
     *
     * @param contract The contract to check
     * @return The failing input, or empty if the contract holds on the whole domain
     */
    public Optional<Map<String, Long>> findCounterexample(Contract contract) {
        for (Map<String, Long> input : new DomainEnumerator(contract.getDomain())) {
            Verdict verdict = check(contract, input);
            if (verdict != Verdict.SKIPPED && verdict != Verdict.PASSED) {
                logger.debug("Counterexample {} ({})", input, verdict);
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    private Verdict check(Contract contract, Map<String, Long> input) {
        Environment env = Environment.fromInput(input);
        boolean admitted = false;
        try {
            if (!evaluator.testAll(contract.getPreconditions(), env)) {
                return Verdict.SKIPPED;
            }
            admitted = true;
            ExecutionOutcome outcome = executor.execute(contract.getProgram(), env, contract.getStepLimit());
            if (outcome.isExceeded()) {
                return Verdict.NONTERMINATING;
            }
            return evaluator.testAll(contract.getPostconditions(), env) ? Verdict.PASSED : Verdict.VIOLATED;
        } catch (EvaluationException e) {
            logger.debug("Input {} raised {}", input, e.getMessage());
            return admitted ? Verdict.VIOLATED : Verdict.ERROR;
        }
    }
}
