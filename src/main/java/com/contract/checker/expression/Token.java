package com.contract.checker.expression;

/**
 * Lexical token of the expression language.
 */
final class Token {

    enum Type {
        INTEGER,
        NAME,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        END
    }

    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    int getPosition() {
        return position;
    }

    boolean is(Type expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    boolean isKeyword(String keyword) {
        return is(Type.NAME, keyword);
    }

    boolean isOperator(String symbol) {
        return is(Type.OPERATOR, symbol);
    }

    @Override
    public String toString() {
        return type == Type.END ? "end of expression" : "'" + text + "'";
    }
}
