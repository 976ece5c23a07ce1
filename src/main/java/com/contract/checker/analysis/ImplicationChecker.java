package com.contract.checker.analysis;

import com.contract.checker.expression.Expression;
import com.contract.checker.expression.ExpressionEvaluator;
import com.contract.checker.model.Contract;
import com.contract.checker.model.Environment;
import com.contract.checker.model.InputDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded semantic entailment: does a conjunction of expressions imply
 * another expression on every input of a finite domain?
 *
 * Evaluation errors are not tolerated here; they propagate to the caller.
 */
public class ImplicationChecker {

    private static final Logger logger = LoggerFactory.getLogger(ImplicationChecker.class);

    private final ExpressionEvaluator evaluator;

    public ImplicationChecker() {
        this(new ExpressionEvaluator());
    }

    public ImplicationChecker(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Checks whether the antecedent implies the consequent on the whole domain.
     * An empty antecedent requires the consequent to hold everywhere.
     *
     * @param antecedent Expressions read as a conjunction
     * @param consequent The implied expression
     * @param domain The bounded domain
     * @return true if no input satisfies the antecedent but not the consequent
     */
    public boolean impliesBounded(List<Expression> antecedent, Expression consequent, InputDomain domain) {
        return findCounterexample(antecedent, consequent, domain).isEmpty();
    }

    /**
     * First input, in enumeration order, where the antecedent holds and the
     * consequent does not.
     */
    public Optional<Map<String, Long>> findCounterexample(List<Expression> antecedent,
                                                         Expression consequent,
                                                         InputDomain domain) {
        for (Map<String, Long> input : new DomainEnumerator(domain)) {
            Environment env = Environment.fromInput(input);
            if (!evaluator.testAll(antecedent, env)) {
                continue;
            }
            if (!evaluator.test(consequent, env)) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    /**
     * For every precondition, whether it is implied by the remaining ones.
     *
     * @param contract The contract whose preconditions are checked
     * @return One flag per precondition, in order
     */
    public List<Boolean> findImpliedPreconditions(Contract contract) {
        int count = contract.getPreconditions().size();
        List<Boolean> implied = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            implied.add(isImpliedByOthers(contract, i));
        }
        return implied;
    }

    /**
     * Whether the precondition at {@code index} is implied by all the others.
     *
     * @param contract The contract whose preconditions are checked
     * @param index Index of the precondition to check
     * @return true if the remaining preconditions imply it on the whole domain
     */
    public boolean isImpliedByOthers(Contract contract, int index) {
        List<Expression> others = new ArrayList<>(contract.getPreconditions());
        Expression candidate = others.remove(index);
        boolean isImplied = impliesBounded(others, candidate, contract.getDomain());
        logger.debug("pre{} ({}) implied by the others: {}", index + 1, candidate, isImplied);
        return isImplied;
    }
}
