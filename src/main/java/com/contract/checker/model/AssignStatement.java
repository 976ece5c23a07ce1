package com.contract.checker.model;

import com.contract.checker.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns one or more variables. Targets are evaluated and stored one after
 * another in declaration order, so later targets see earlier updates.
 */
public final class AssignStatement extends Statement {

    private final Map<String, Expression> assignments;

    public AssignStatement(Map<String, Expression> assignments) {
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    public Map<String, Expression> getAssignments() {
        return assignments;
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGN;
    }

    @Override
    public String toString() {
        return "assign " + assignments;
    }
}
