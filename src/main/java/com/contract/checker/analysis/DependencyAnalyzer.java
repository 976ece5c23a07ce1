package com.contract.checker.analysis;

import com.contract.checker.expression.Expression;
import com.contract.checker.model.AssignStatement;
import com.contract.checker.model.Contract;
import com.contract.checker.model.IfStatement;
import com.contract.checker.model.Statement;
import com.contract.checker.model.WhileStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Syntactic dependency analysis: which variables can influence the
 * variables read by the postconditions, and which preconditions constrain
 * none of them.
 *
 * Edges:
 * - assignment {@code x := e}: every variable of {@code e} flows to {@code x}
 * - if/while: every condition variable flows to every variable assigned
 *   anywhere inside the governed blocks
 *
 * No execution is involved, so the result over-approximates influence and
 * says nothing about the bounded domain.
 */
public class DependencyAnalyzer {

    /**
     * Variables from which a postcondition variable is reachable, including
     * the postcondition variables themselves.
     *
     * @param program The program
     * @param postconditions The postconditions
     * @return Sorted set of influencing variable names
     */
    public SortedSet<String> findInfluencingVariables(List<Statement> program, List<Expression> postconditions) {
        SortedSet<String> postVariables = new TreeSet<>();
        for (Expression post : postconditions) {
            postVariables.addAll(post.getVariables());
        }

        // Reverse edges: destination -> sources
        Map<String, Set<String>> reverse = new HashMap<>();
        collectEdges(program, reverse);

        SortedSet<String> reachable = new TreeSet<>(postVariables);
        Deque<String> queue = new ArrayDeque<>(postVariables);
        while (!queue.isEmpty()) {
            String variable = queue.pop();
            for (String source : reverse.getOrDefault(variable, Collections.emptySet())) {
                if (reachable.add(source)) {
                    queue.push(source);
                }
            }
        }
        return reachable;
    }

    /**
     * Indices of preconditions whose variables are disjoint from every
     * variable that can influence the postconditions.
     *
     * @param contract The contract
     * @return Ascending indices of syntactically irrelevant preconditions
     */
    public List<Integer> findIrrelevantPreconditions(Contract contract) {
        Set<String> influencing = findInfluencingVariables(contract.getProgram(), contract.getPostconditions());
        List<Integer> irrelevant = new ArrayList<>();
        List<Expression> preconditions = contract.getPreconditions();
        for (int i = 0; i < preconditions.size(); i++) {
            if (Collections.disjoint(preconditions.get(i).getVariables(), influencing)) {
                irrelevant.add(i);
            }
        }
        return irrelevant;
    }

    /**
     * Every variable assigned anywhere in the block, nested blocks included.
     */
    public SortedSet<String> findAssignedVariables(List<Statement> block) {
        SortedSet<String> assigned = new TreeSet<>();
        for (Statement statement : block) {
            switch (statement.getKind()) {
                case ASSIGN -> assigned.addAll(((AssignStatement) statement).getAssignments().keySet());
                case IF -> {
                    IfStatement ifStatement = (IfStatement) statement;
                    assigned.addAll(findAssignedVariables(ifStatement.getThenBlock()));
                    assigned.addAll(findAssignedVariables(ifStatement.getElseBlock()));
                }
                case WHILE -> assigned.addAll(findAssignedVariables(((WhileStatement) statement).getBody()));
            }
        }
        return assigned;
    }

    private void collectEdges(List<Statement> block, Map<String, Set<String>> reverse) {
        for (Statement statement : block) {
            switch (statement.getKind()) {
                case ASSIGN -> {
                    for (Map.Entry<String, Expression> entry : ((AssignStatement) statement).getAssignments().entrySet()) {
                        for (String source : entry.getValue().getVariables()) {
                            addEdge(reverse, source, entry.getKey());
                        }
                    }
                }
                case IF -> {
                    IfStatement ifStatement = (IfStatement) statement;
                    Set<String> governed = new TreeSet<>(findAssignedVariables(ifStatement.getThenBlock()));
                    governed.addAll(findAssignedVariables(ifStatement.getElseBlock()));
                    addControlEdges(reverse, ifStatement.getCondition(), governed);
                    collectEdges(ifStatement.getThenBlock(), reverse);
                    collectEdges(ifStatement.getElseBlock(), reverse);
                }
                case WHILE -> {
                    WhileStatement whileStatement = (WhileStatement) statement;
                    addControlEdges(reverse, whileStatement.getCondition(),
                            findAssignedVariables(whileStatement.getBody()));
                    collectEdges(whileStatement.getBody(), reverse);
                }
            }
        }
    }

    private void addControlEdges(Map<String, Set<String>> reverse, Expression condition, Set<String> governed) {
        for (String source : condition.getVariables()) {
            for (String destination : governed) {
                addEdge(reverse, source, destination);
            }
        }
    }

    private static void addEdge(Map<String, Set<String>> reverse, String source, String destination) {
        reverse.computeIfAbsent(destination, k -> new TreeSet<>()).add(source);
    }
}
