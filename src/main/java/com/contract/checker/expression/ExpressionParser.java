package com.contract.checker.expression;

import com.contract.checker.exception.UnsafeExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses the restricted expression language into an {@link Expression}.
 *
 * Grammar, loosest binding first:
 * <pre>
 *   expression := and ( "or" and )*
 *   and        := not ( "and" not )*
 *   not        := "not" not | comparison
 *   comparison := sum ( ("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") sum )*
 *   sum        := term ( ("+" | "-") term )*
 *   term       := factor ( ("*" | "%") factor )*
 *   factor     := ("-" | "+") factor | atom
 *   atom       := INTEGER | "True" | "False" | NAME | "(" expression ")"
 * </pre>
 * Parsing and validation are the same step: the only way to obtain a tree is
 * through these productions, and any other input raises
 * {@link UnsafeExpressionException}.
 */
public class ExpressionParser {

    // Reserved words that would introduce constructs outside the grammar.
    private static final Set<String> RESERVED_WORDS = Set.of(
            "None", "lambda", "if", "else", "elif", "for", "while", "in", "is",
            "import", "from", "def", "class", "return", "yield", "await", "async",
            "with", "as", "assert", "del", "global", "nonlocal", "pass", "raise",
            "try", "except", "finally", "break", "continue");

    static final int MAX_NESTING_DEPTH = 100;

    /**
     * Parses and validates expression text.
     *
     * @param source The expression text, typically from an untrusted spec file
     * @return The validated expression
     * @throws UnsafeExpressionException If the text is empty, malformed, or uses
     *                                   any construct outside the grammar
     */
    public Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new UnsafeExpressionException("Empty expression", String.valueOf(source));
        }
        List<Token> tokens = new ExpressionLexer(source).tokenize();
        ExpressionNode root = new Parser(source, tokens).parseAll();
        return new Expression(source, root);
    }

    /**
     * Parses a list of expression texts, keeping their order.
     */
    public List<Expression> parseAll(List<String> sources) {
        List<Expression> expressions = new ArrayList<>(sources.size());
        for (String source : sources) {
            expressions.add(parse(source));
        }
        return expressions;
    }

    /**
     * Recursive-descent parser over one token list.
     */
    private static final class Parser {

        private final String source;
        private final List<Token> tokens;
        private int index = 0;
        private int depth = 0;

        Parser(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        ExpressionNode parseAll() {
            ExpressionNode node = parseOr();
            Token trailing = current();
            if (trailing.getType() != Token.Type.END) {
                throw unsafe("Unexpected " + trailing + " at position " + trailing.getPosition());
            }
            return node;
        }

        private ExpressionNode parseOr() {
            enter();
            ExpressionNode first = parseAnd();
            List<ExpressionNode> operands = null;
            while (current().isKeyword("or")) {
                advance();
                if (operands == null) {
                    operands = new ArrayList<>();
                    operands.add(first);
                }
                operands.add(parseAnd());
            }
            leave();
            return operands == null ? first : new BooleanNode(BooleanNode.Operator.OR, operands);
        }

        private ExpressionNode parseAnd() {
            ExpressionNode first = parseNot();
            List<ExpressionNode> operands = null;
            while (current().isKeyword("and")) {
                advance();
                if (operands == null) {
                    operands = new ArrayList<>();
                    operands.add(first);
                }
                operands.add(parseNot());
            }
            return operands == null ? first : new BooleanNode(BooleanNode.Operator.AND, operands);
        }

        private ExpressionNode parseNot() {
            if (current().isKeyword("not")) {
                advance();
                enter();
                ExpressionNode operand = parseNot();
                leave();
                return new UnaryNode(UnaryNode.Operator.NOT, operand);
            }
            return parseComparison();
        }

        private ExpressionNode parseComparison() {
            ExpressionNode left = parseSum();
            List<ComparisonNode.Operator> operators = new ArrayList<>();
            List<ExpressionNode> comparators = new ArrayList<>();
            ComparisonNode.Operator op;
            while ((op = comparisonOperator(current())) != null) {
                advance();
                operators.add(op);
                comparators.add(parseSum());
            }
            return operators.isEmpty() ? left : new ComparisonNode(left, operators, comparators);
        }

        // Chains build left-deep trees, so every operator counts toward the depth.
        private ExpressionNode parseSum() {
            int saved = depth;
            ExpressionNode node = parseTerm();
            while (true) {
                Token token = current();
                if (token.isOperator("+")) {
                    advance();
                    enter();
                    node = new BinaryNode(node, BinaryNode.Operator.ADD, parseTerm());
                } else if (token.isOperator("-")) {
                    advance();
                    enter();
                    node = new BinaryNode(node, BinaryNode.Operator.SUBTRACT, parseTerm());
                } else {
                    depth = saved;
                    return node;
                }
            }
        }

        private ExpressionNode parseTerm() {
            int saved = depth;
            ExpressionNode node = parseFactor();
            while (true) {
                Token token = current();
                if (token.isOperator("*")) {
                    advance();
                    enter();
                    node = new BinaryNode(node, BinaryNode.Operator.MULTIPLY, parseFactor());
                } else if (token.isOperator("%")) {
                    advance();
                    enter();
                    node = new BinaryNode(node, BinaryNode.Operator.REMAINDER, parseFactor());
                } else {
                    depth = saved;
                    return node;
                }
            }
        }

        private ExpressionNode parseFactor() {
            Token token = current();
            UnaryNode.Operator op = null;
            if (token.isOperator("-")) {
                op = UnaryNode.Operator.MINUS;
            } else if (token.isOperator("+")) {
                op = UnaryNode.Operator.PLUS;
            }
            if (op == null) {
                return parseAtom();
            }
            advance();
            enter();
            ExpressionNode operand = parseFactor();
            leave();
            return new UnaryNode(op, operand);
        }

        private ExpressionNode parseAtom() {
            Token token = current();
            switch (token.getType()) {
                case INTEGER -> {
                    advance();
                    return new LiteralNode(Value.of(parseLong(token.getText())));
                }
                case NAME -> {
                    advance();
                    return nameAtom(token);
                }
                case LEFT_PAREN -> {
                    advance();
                    if (current().getType() == Token.Type.RIGHT_PAREN) {
                        throw unsafe("Disallowed syntax: empty tuple");
                    }
                    ExpressionNode inner = parseOr();
                    if (current().getType() != Token.Type.RIGHT_PAREN) {
                        throw unsafe("Expected ')' but found " + current());
                    }
                    advance();
                    return inner;
                }
                default -> throw unsafe("Unexpected " + token + " at position " + token.getPosition());
            }
        }

        private ExpressionNode nameAtom(Token token) {
            String name = token.getText();
            if (current().getType() == Token.Type.LEFT_PAREN) {
                throw unsafe("Disallowed syntax: function call '" + name + "(...)'");
            }
            switch (name) {
                case "True":
                    return new LiteralNode(Value.TRUE);
                case "False":
                    return new LiteralNode(Value.FALSE);
                case "and":
                case "or":
                case "not":
                    throw unsafe("Unexpected keyword '" + name + "' at position " + token.getPosition());
                default:
                    if (RESERVED_WORDS.contains(name)) {
                        throw unsafe("Disallowed syntax: keyword '" + name + "'");
                    }
                    return new VariableNode(name);
            }
        }

        private long parseLong(String digits) {
            try {
                return Long.parseLong(digits);
            } catch (NumberFormatException e) {
                throw unsafe("Integer literal out of range: " + digits);
            }
        }

        private static ComparisonNode.Operator comparisonOperator(Token token) {
            if (token.getType() != Token.Type.OPERATOR) {
                return null;
            }
            for (ComparisonNode.Operator op : ComparisonNode.Operator.values()) {
                if (op.getSymbol().equals(token.getText())) {
                    return op;
                }
            }
            return null;
        }

        private void enter() {
            if (++depth > MAX_NESTING_DEPTH) {
                throw unsafe("Expression nesting too deep");
            }
        }

        private void leave() {
            depth--;
        }

        private Token current() {
            return tokens.get(index);
        }

        private void advance() {
            if (index < tokens.size() - 1) {
                index++;
            }
        }

        private UnsafeExpressionException unsafe(String message) {
            return new UnsafeExpressionException(message, source);
        }
    }
}
