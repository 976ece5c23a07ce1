package com.contract.checker.expression;

import com.contract.checker.exception.ArithmeticEvaluationException;
import com.contract.checker.model.Environment;
import com.contract.checker.visitor.ExpressionVisitor;

import java.util.List;

/**
 * Evaluates validated expressions against an environment.
 *
 * Arithmetic is 64-bit and overflow-checked. {@code %} uses floored modulo,
 * so the result takes the sign of the divisor. {@code and}/{@code or}
 * short-circuit and always produce a boolean.
 */
public class ExpressionEvaluator {

    /**
     * Evaluates an expression.
     *
     * @param expression The expression
     * @param env The variable bindings
     * @return The resulting value
     * @throws com.contract.checker.exception.UnknownVariableException If a name is unbound
     * @throws ArithmeticEvaluationException On modulo by zero or overflow
     */
    public Value evaluate(Expression expression, Environment env) {
        return expression.getRoot().accept(new EvaluatingVisitor(env));
    }

    /**
     * Evaluates an expression and reduces it to its truth value.
     */
    public boolean test(Expression expression, Environment env) {
        return evaluate(expression, env).isTruthy();
    }

    /**
     * True when every expression is truthy; an empty list is vacuously true.
     */
    public boolean testAll(List<Expression> expressions, Environment env) {
        for (Expression expression : expressions) {
            if (!test(expression, env)) {
                return false;
            }
        }
        return true;
    }

    private static final class EvaluatingVisitor implements ExpressionVisitor<Value> {

        private final Environment env;

        EvaluatingVisitor(Environment env) {
            this.env = env;
        }

        @Override
        public Value visit(LiteralNode node) {
            return node.getValue();
        }

        @Override
        public Value visit(VariableNode node) {
            return env.lookup(node.getName());
        }

        @Override
        public Value visit(UnaryNode node) {
            Value operand = node.getOperand().accept(this);
            try {
                return switch (node.getOperator()) {
                    case NOT -> Value.of(!operand.isTruthy());
                    case MINUS -> Value.of(Math.negateExact(operand.asLong()));
                    case PLUS -> Value.of(operand.asLong());
                };
            } catch (ArithmeticException e) {
                throw new ArithmeticEvaluationException("integer overflow in " + node, e);
            }
        }

        @Override
        public Value visit(BinaryNode node) {
            long left = node.getLeft().accept(this).asLong();
            long right = node.getRight().accept(this).asLong();
            try {
                return switch (node.getOperator()) {
                    case ADD -> Value.of(Math.addExact(left, right));
                    case SUBTRACT -> Value.of(Math.subtractExact(left, right));
                    case MULTIPLY -> Value.of(Math.multiplyExact(left, right));
                    case REMAINDER -> {
                        if (right == 0) {
                            throw new ArithmeticEvaluationException("integer modulo by zero in " + node);
                        }
                        yield Value.of(Math.floorMod(left, right));
                    }
                };
            } catch (ArithmeticException e) {
                throw new ArithmeticEvaluationException("integer overflow in " + node, e);
            }
        }

        @Override
        public Value visit(BooleanNode node) {
            boolean isAnd = node.getOperator() == BooleanNode.Operator.AND;
            for (ExpressionNode operand : node.getOperands()) {
                boolean truth = operand.accept(this).isTruthy();
                // and: stop at the first false operand; or: stop at the first true one
                if (truth != isAnd) {
                    return Value.of(truth);
                }
            }
            return Value.of(isAnd);
        }

        @Override
        public Value visit(ComparisonNode node) {
            long current = node.getLeft().accept(this).asLong();
            List<ComparisonNode.Operator> operators = node.getOperators();
            List<ExpressionNode> comparators = node.getComparators();
            for (int i = 0; i < operators.size(); i++) {
                long rhs = comparators.get(i).accept(this).asLong();
                if (!operators.get(i).test(current, rhs)) {
                    return Value.FALSE;
                }
                current = rhs;
            }
            return Value.TRUE;
        }
    }
}
