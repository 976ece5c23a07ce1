package com.contract.checker.model;

import com.contract.checker.expression.Expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A program with its pre/postconditions, bounded input domain and step limit.
 *
 * Preconditions and postconditions are each read as a conjunction; an empty
 * list is vacuously true. Contracts are immutable; the {@code with...}
 * methods return modified copies, which is how the redundancy analyses build
 * their reduced contracts.
 */
public final class Contract {

    public static final int DEFAULT_STEP_LIMIT = 10000;

    private final List<Expression> preconditions;
    private final List<Expression> postconditions;
    private final List<Statement> program;
    private final InputDomain domain;
    private final int stepLimit;

    public Contract(List<Expression> preconditions,
                    List<Expression> postconditions,
                    List<Statement> program,
                    InputDomain domain,
                    int stepLimit) {
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("step limit must be positive, got " + stepLimit);
        }
        this.preconditions = List.copyOf(preconditions);
        this.postconditions = List.copyOf(postconditions);
        this.program = List.copyOf(program);
        this.domain = Objects.requireNonNull(domain, "domain");
        this.stepLimit = stepLimit;
    }

    public List<Expression> getPreconditions() {
        return preconditions;
    }

    public List<Expression> getPostconditions() {
        return postconditions;
    }

    public List<Statement> getProgram() {
        return program;
    }

    public InputDomain getDomain() {
        return domain;
    }

    public int getStepLimit() {
        return stepLimit;
    }

    public Contract withPreconditions(List<Expression> newPreconditions) {
        return new Contract(newPreconditions, postconditions, program, domain, stepLimit);
    }

    public Contract withStepLimit(int newStepLimit) {
        return new Contract(preconditions, postconditions, program, domain, newStepLimit);
    }

    /**
     * Copy without the precondition at {@code index}; the others keep their order.
     */
    public Contract withoutPrecondition(int index) {
        Objects.checkIndex(index, preconditions.size());
        List<Expression> reduced = new ArrayList<>(preconditions);
        reduced.remove(index);
        return withPreconditions(reduced);
    }

    /**
     * Copy without every precondition whose index is in {@code indices},
     * removed as one edit.
     */
    public Contract withoutPreconditions(Collection<Integer> indices) {
        List<Expression> reduced = new ArrayList<>();
        for (int i = 0; i < preconditions.size(); i++) {
            if (!indices.contains(i)) {
                reduced.add(preconditions.get(i));
            }
        }
        return withPreconditions(reduced);
    }

    @Override
    public String toString() {
        return "Contract{pre=" + preconditions + ", post=" + postconditions
                + ", domain=" + domain + ", stepLimit=" + stepLimit + "}";
    }
}
