package com.contract.checker.model;

import com.contract.checker.exception.UnknownVariableException;
import com.contract.checker.expression.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable variable store for one execution. Created from an input
 * assignment and extended as assignments run; never shared between inputs.
 */
public class Environment {

    private final Map<String, Value> variables = new LinkedHashMap<>();

    public Environment() {
    }

    /**
     * Creates an environment holding a copy of the given input assignment.
     *
     * @param input Variable name to integer value
     * @return A fresh environment
     */
    public static Environment fromInput(Map<String, Long> input) {
        Environment env = new Environment();
        input.forEach((name, value) -> env.assign(name, Value.of(value)));
        return env;
    }

    /**
     * Looks up a variable.
     *
     * @param name The variable name
     * @return The bound value
     * @throws UnknownVariableException If the name is not bound
     */
    public Value lookup(String name) {
        Value value = variables.get(name);
        if (value == null) {
            throw new UnknownVariableException(name);
        }
        return value;
    }

    public boolean isBound(String name) {
        return variables.containsKey(name);
    }

    public void assign(String name, Value value) {
        variables.put(name, value);
    }

    public Map<String, Value> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public String toString() {
        return variables.toString();
    }
}
