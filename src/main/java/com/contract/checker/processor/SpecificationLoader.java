package com.contract.checker.processor;

import com.contract.checker.exception.MalformedProgramException;
import com.contract.checker.exception.MalformedSpecificationException;
import com.contract.checker.exception.UnknownStatementException;
import com.contract.checker.expression.Expression;
import com.contract.checker.expression.ExpressionParser;
import com.contract.checker.model.AssignStatement;
import com.contract.checker.model.Contract;
import com.contract.checker.model.IfStatement;
import com.contract.checker.model.InputDomain;
import com.contract.checker.model.Statement;
import com.contract.checker.model.VariableRange;
import com.contract.checker.model.WhileStatement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a JSON contract specification into a validated {@link Contract}.
 *
 * Expected shape:
 * <pre>
 * {
 *   "program": [ {"assign": {"x": "0"}}, {"while": {"cond": "x &lt; N", "body": [...]}} ],
 *   "pre": ["N &gt;= 0"],
 *   "post": ["x == N"],
 *   "inputs": {"N": {"min": -5, "max": 10}},
 *   "step_limit": 10000
 * }
 * </pre>
 * Every expression is parsed and every statement is built here, so unsafe
 * syntax and malformed programs fail before any input is enumerated.
 */
public class SpecificationLoader {

    private static final Logger logger = LoggerFactory.getLogger(SpecificationLoader.class);

    private final ObjectMapper objectMapper;
    private final ExpressionParser expressionParser;

    public SpecificationLoader() {
        this(new ObjectMapper(), new ExpressionParser());
    }

    public SpecificationLoader(ObjectMapper objectMapper, ExpressionParser expressionParser) {
        this.objectMapper = objectMapper;
        this.expressionParser = expressionParser;
    }

    /**
     * Loads a spec file.
     *
     * @param specPath Path to the JSON spec
     * @param stepLimitOverride Replaces the file's step limit when non-null
     * @return The validated contract
     * @throws IOException If the file cannot be read
     */
    public Contract load(Path specPath, Integer stepLimitOverride) throws IOException {
        if (!Files.exists(specPath)) {
            throw new IOException("Spec file does not exist: " + specPath);
        }
        logger.info("Loading spec: {}", specPath);
        JsonNode root;
        try {
            root = objectMapper.readTree(specPath.toFile());
        } catch (JsonProcessingException e) {
            throw new MalformedSpecificationException("Invalid JSON in " + specPath + ": " + e.getOriginalMessage(), e);
        }
        return fromTree(root, stepLimitOverride);
    }

    /**
     * Parses a spec held in a string.
     */
    public Contract parse(String json) {
        try {
            return fromTree(objectMapper.readTree(json), null);
        } catch (JsonProcessingException e) {
            throw new MalformedSpecificationException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    Contract fromTree(JsonNode root, Integer stepLimitOverride) {
        if (root == null || !root.isObject()) {
            throw new MalformedSpecificationException("Spec must be a JSON object");
        }

        JsonNode programNode = root.get("program");
        if (programNode == null) {
            throw new MalformedProgramException("Spec is missing 'program'");
        }
        List<Statement> program = parseBlock(programNode, "program");

        List<Expression> pre = parseExpressionList(root.get("pre"), "pre");
        List<Expression> post = parseExpressionList(root.get("post"), "post");
        InputDomain domain = parseInputs(root.get("inputs"));

        int stepLimit = Contract.DEFAULT_STEP_LIMIT;
        JsonNode stepLimitNode = root.get("step_limit");
        if (stepLimitNode != null && !stepLimitNode.isNull()) {
            if (!stepLimitNode.canConvertToInt() || !stepLimitNode.isIntegralNumber()) {
                throw new MalformedSpecificationException("'step_limit' must be an integer, got " + stepLimitNode);
            }
            stepLimit = stepLimitNode.intValue();
        }
        if (stepLimitOverride != null) {
            stepLimit = stepLimitOverride;
        }
        if (stepLimit <= 0) {
            throw new MalformedSpecificationException("'step_limit' must be positive, got " + stepLimit);
        }

        logger.debug("Spec has {} statements, {} pre, {} post, domain {}",
                program.size(), pre.size(), post.size(), domain);
        return new Contract(pre, post, program, domain, stepLimit);
    }

    /**
     * Builds a block of statements from a JSON array.
     *
     * @param node The JSON array
     * @param where Location used in error messages
     * @return The statements in order
     */
    public List<Statement> parseBlock(JsonNode node, String where) {
        if (!node.isArray()) {
            throw new MalformedProgramException(where + " must be a list");
        }
        List<Statement> block = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            block.add(parseStatement(node.get(i), where + "[" + i + "]"));
        }
        return block;
    }

    private Statement parseStatement(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new MalformedProgramException(where + " must be an object");
        }
        if (node.has("assign")) {
            return parseAssign(node.get("assign"), where + ".assign");
        }
        if (node.has("while")) {
            return parseWhile(node.get("while"), where + ".while");
        }
        if (node.has("if")) {
            return parseIf(node.get("if"), where + ".if");
        }
        throw new UnknownStatementException(node.toString());
    }

    private AssignStatement parseAssign(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new MalformedProgramException(where + " must be an object");
        }
        if (node.isEmpty()) {
            throw new MalformedProgramException(where + " must assign at least one variable");
        }
        Map<String, Expression> assignments = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            assignments.put(field.getKey(), parseExpression(field.getValue(), where + "." + field.getKey()));
        }
        return new AssignStatement(assignments);
    }

    private IfStatement parseIf(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new MalformedProgramException(where + " must be an object");
        }
        Expression condition = parseCondition(node, where);
        List<Statement> thenBlock = parseOptionalBlock(node.get("then"), where + ".then");
        List<Statement> elseBlock = parseOptionalBlock(node.get("else"), where + ".else");
        return new IfStatement(condition, thenBlock, elseBlock);
    }

    private WhileStatement parseWhile(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new MalformedProgramException(where + " must be an object");
        }
        Expression condition = parseCondition(node, where);
        List<Statement> body = parseOptionalBlock(node.get("body"), where + ".body");
        return new WhileStatement(condition, body);
    }

    private Expression parseCondition(JsonNode node, String where) {
        JsonNode cond = node.get("cond");
        if (cond == null) {
            throw new MalformedProgramException(where + " is missing 'cond'");
        }
        return parseExpression(cond, where + ".cond");
    }

    private List<Statement> parseOptionalBlock(JsonNode node, String where) {
        if (node == null) {
            return List.of();
        }
        return parseBlock(node, where);
    }

    private Expression parseExpression(JsonNode node, String where) {
        // Integer constants may be written as JSON numbers
        if (node.isTextual() || node.isIntegralNumber()) {
            return expressionParser.parse(node.asText());
        }
        throw new MalformedProgramException(where + " must be an expression string, got " + node);
    }

    private List<Expression> parseExpressionList(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedSpecificationException("'" + field + "' must be a list of expressions");
        }
        List<Expression> expressions = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (!item.isTextual()) {
                throw new MalformedSpecificationException(field + "[" + i + "] must be an expression string, got " + item);
            }
            expressions.add(expressionParser.parse(item.asText()));
        }
        return expressions;
    }

    private InputDomain parseInputs(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedSpecificationException("Spec is missing 'inputs' object");
        }
        List<VariableRange> ranges = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode bounds = field.getValue();
            if (!bounds.isObject()) {
                throw new MalformedSpecificationException("inputs." + name + " must be an object with 'min' and 'max'");
            }
            ranges.add(new VariableRange(name, bound(bounds, "min", name), bound(bounds, "max", name)));
        }
        return new InputDomain(ranges);
    }

    private static long bound(JsonNode bounds, String key, String name) {
        JsonNode value = bounds.get(key);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new MalformedSpecificationException("inputs." + name + "." + key + " must be an integer");
        }
        return value.longValue();
    }
}
