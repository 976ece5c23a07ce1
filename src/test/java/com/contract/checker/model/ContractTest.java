package com.contract.checker.model;

import com.contract.checker.expression.Expression;
import com.contract.checker.expression.ExpressionParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ContractTest {

    private final ExpressionParser parser = new ExpressionParser();

    private Contract contract(String... pre) {
        return new Contract(parser.parseAll(List.of(pre)), List.of(), List.of(),
                InputDomain.of(new VariableRange("N", 0, 1)), Contract.DEFAULT_STEP_LIMIT);
    }

    private static List<String> sources(Contract contract) {
        return contract.getPreconditions().stream().map(Expression::getSource).toList();
    }

    @Test
    void withoutPreconditionKeepsOrder() {
        Contract reduced = contract("a", "b", "c").withoutPrecondition(1);
        assertEquals(List.of("a", "c"), sources(reduced));
    }

    @Test
    void withoutPreconditionsRemovesAllAtOnce() {
        Contract reduced = contract("a", "b", "c", "d").withoutPreconditions(Set.of(0, 2));
        assertEquals(List.of("b", "d"), sources(reduced));
    }

    @Test
    void originalIsUnchanged() {
        Contract original = contract("a", "b");
        original.withoutPrecondition(0);
        assertEquals(List.of("a", "b"), sources(original));
    }

    @Test
    void rejectsNonPositiveStepLimit() {
        assertThrows(IllegalArgumentException.class, () -> contract("a").withStepLimit(0));
        assertEquals(5, contract("a").withStepLimit(5).getStepLimit());
    }

    @Test
    void withoutPreconditionChecksIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> contract("a").withoutPrecondition(1));
    }
}
