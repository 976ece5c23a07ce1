package com.contract.checker.analysis;

import com.contract.checker.expression.Expression;
import com.contract.checker.model.Contract;
import com.contract.checker.model.RedundancyReport;
import com.contract.checker.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decides which preconditions are unnecessary within the bounded domain by
 * re-running the contract with preconditions removed.
 *
 * Two notions of "still correct" are used:
 * <ul>
 *   <li>single redundancy only requires zero violations; inputs that now run
 *       out of steps are tolerated</li>
 *   <li>group removal and the joint check require zero violations and zero
 *       nontermination</li>
 * </ul>
 */
public class RedundancyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RedundancyAnalyzer.class);

    private final ContractRunner runner;

    public RedundancyAnalyzer() {
        this(new ContractRunner());
    }

    public RedundancyAnalyzer(ContractRunner runner) {
        this.runner = runner;
    }

    /**
     * Indices of preconditions whose individual removal leaves zero violations.
     * One contract run per precondition.
     *
     * @param contract The contract under analysis
     * @return Ascending indices of single-redundant preconditions
     */
    public List<Integer> findSingleRedundant(Contract contract) {
        List<Integer> redundant = new ArrayList<>();
        for (int i = 0; i < contract.getPreconditions().size(); i++) {
            RunResult reduced = runner.run(contract.withoutPrecondition(i));
            boolean isRedundant = reduced.getViolations() == 0;
            logger.debug("pre{} ({}): {}", i + 1, contract.getPreconditions().get(i),
                    isRedundant ? "redundant" : "needed");
            if (isRedundant) {
                redundant.add(i);
            }
        }
        return redundant;
    }

    /**
     * Greedily removes preconditions one at a time while the contract still
     * holds, repeating full passes until a pass removes nothing.
     *
     * A later pass may remove an index an earlier pass could not, since the
     * removals made in between change which inputs are admitted. The result
     * is maximal for this order, not necessarily the largest possible group.
     *
     * @param contract The contract under analysis
     * @return Ascending indices of the removed group
     */
    public List<Integer> findGreedyGroup(Contract contract) {
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < contract.getPreconditions().size(); i++) {
            remaining.add(i);
        }
        List<Integer> removed = new ArrayList<>();

        boolean changed = true;
        int pass = 0;
        while (changed) {
            changed = false;
            pass++;
            for (Integer index : new ArrayList<>(remaining)) {
                List<Integer> trial = new ArrayList<>(remaining);
                trial.remove(index);
                if (holds(contract, trial)) {
                    remaining.remove(index);
                    removed.add(index);
                    changed = true;
                }
            }
            logger.debug("Greedy pass {}: removed so far {}", pass, removed);
        }

        Collections.sort(removed);
        return removed;
    }

    /**
     * Full analysis: single redundancy, the greedy group, and whether all
     * single-redundant preconditions can be dropped together. When they
     * cannot, a witnessing input is searched against the jointly reduced contract.
     *
     * @param contract The contract under analysis
     * @return The redundancy report
     */
    public RedundancyReport analyze(Contract contract) {
        List<Integer> single = findSingleRedundant(contract);
        List<Integer> greedy = findGreedyGroup(contract);

        Contract jointlyReduced = contract.withoutPreconditions(single);
        boolean allSingleGroupRedundant = runner.run(jointlyReduced).holds();

        Map<String, Long> counterexample = null;
        if (!single.isEmpty() && !allSingleGroupRedundant) {
            counterexample = runner.findCounterexample(jointlyReduced).orElse(null);
            logger.info("Single-redundant preconditions {} are not redundant together; witness {}",
                    single, counterexample);
        }

        return new RedundancyReport(single, greedy, allSingleGroupRedundant, counterexample);
    }

    private boolean holds(Contract contract, List<Integer> keptIndices) {
        List<Expression> kept = new ArrayList<>();
        for (Integer index : keptIndices) {
            kept.add(contract.getPreconditions().get(index));
        }
        return runner.run(contract.withPreconditions(kept)).holds();
    }
}
