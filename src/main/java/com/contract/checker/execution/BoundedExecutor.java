package com.contract.checker.execution;

import com.contract.checker.expression.Expression;
import com.contract.checker.expression.ExpressionEvaluator;
import com.contract.checker.model.AssignStatement;
import com.contract.checker.model.Environment;
import com.contract.checker.model.IfStatement;
import com.contract.checker.model.Statement;
import com.contract.checker.model.WhileStatement;

import java.util.List;
import java.util.Map;

/**
 * Interprets a program against a mutable environment under a step budget.
 *
 * Step accounting:
 * <ul>
 *   <li>one step per assignment target stored</li>
 *   <li>one step per {@code if} condition test</li>
 *   <li>one step per {@code while} guard test, including the final false one,
 *       plus the steps of each body execution</li>
 * </ul>
 * The running total is checked after every charge. As soon as it exceeds the
 * budget, execution stops where it is and the outcome is marked exceeded.
 */
public class BoundedExecutor {

    private final ExpressionEvaluator evaluator;

    public BoundedExecutor() {
        this(new ExpressionEvaluator());
    }

    public BoundedExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Executes a block of statements in order.
     *
     * @param block The statements to run
     * @param env The environment, mutated in place
     * @param stepBudget Maximum number of steps before the run counts as nonterminating
     * @return Steps used, and whether the budget was exceeded
     * @throws com.contract.checker.exception.EvaluationException If an expression fails to evaluate
     */
    public ExecutionOutcome execute(List<Statement> block, Environment env, int stepBudget) {
        StepBudget budget = new StepBudget(stepBudget);
        executeBlock(block, env, budget);
        return new ExecutionOutcome(budget.getUsed(), budget.isExceeded());
    }

    /**
     * @return false if the budget ran out inside the block
     */
    private boolean executeBlock(List<Statement> block, Environment env, StepBudget budget) {
        for (Statement statement : block) {
            if (!executeStatement(statement, env, budget)) {
                return false;
            }
        }
        return true;
    }

    private boolean executeStatement(Statement statement, Environment env, StepBudget budget) {
        return switch (statement.getKind()) {
            case ASSIGN -> executeAssign((AssignStatement) statement, env, budget);
            case IF -> executeIf((IfStatement) statement, env, budget);
            case WHILE -> executeWhile((WhileStatement) statement, env, budget);
        };
    }

    private boolean executeAssign(AssignStatement statement, Environment env, StepBudget budget) {
        for (Map.Entry<String, Expression> assignment : statement.getAssignments().entrySet()) {
            env.assign(assignment.getKey(), evaluator.evaluate(assignment.getValue(), env));
            if (!budget.charge()) {
                return false;
            }
        }
        return true;
    }

    private boolean executeIf(IfStatement statement, Environment env, StepBudget budget) {
        boolean condition = evaluator.test(statement.getCondition(), env);
        if (!budget.charge()) {
            return false;
        }
        return executeBlock(condition ? statement.getThenBlock() : statement.getElseBlock(), env, budget);
    }

    private boolean executeWhile(WhileStatement statement, Environment env, StepBudget budget) {
        while (true) {
            boolean guard = evaluator.test(statement.getCondition(), env);
            if (!budget.charge()) {
                return false;
            }
            if (!guard) {
                return true;
            }
            if (!executeBlock(statement.getBody(), env, budget)) {
                return false;
            }
        }
    }
}
