package com.contract.checker.expression;

import com.contract.checker.exception.UnsafeExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Every character outside the small
 * alphabet of the language is rejected here, naming the construct it would
 * have started where that is recognizable.
 */
final class ExpressionLexer {

    private final String source;
    private int pos = 0;

    ExpressionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token nextToken() {
        int start = pos;
        char c = source.charAt(pos);

        if (isAsciiDigit(c)) {
            return readInteger(start);
        }
        if (isNameStart(c)) {
            while (pos < source.length() && isNamePart(source.charAt(pos))) {
                pos++;
            }
            return new Token(Token.Type.NAME, source.substring(start, pos), start);
        }

        switch (c) {
            case '(':
                pos++;
                return new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')':
                pos++;
                return new Token(Token.Type.RIGHT_PAREN, ")", start);
            case '+':
            case '-':
            case '%':
                pos++;
                return operator(String.valueOf(c), start);
            case '*':
                if (peek(1) == '*') {
                    throw unsafe("Disallowed syntax: power operator");
                }
                pos++;
                return operator("*", start);
            case '<':
            case '>':
                if (peek(1) == c) {
                    throw unsafe("Disallowed syntax: shift operator");
                }
                if (peek(1) == '=') {
                    pos += 2;
                    return operator(c + "=", start);
                }
                pos++;
                return operator(String.valueOf(c), start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return operator("==", start);
                }
                throw unsafe("Disallowed syntax: assignment");
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return operator("!=", start);
                }
                throw unsafe("Disallowed syntax: '!'");
            case '/':
                throw unsafe("Disallowed syntax: division");
            case '.':
                throw unsafe("Disallowed syntax: attribute access or float literal");
            case '[':
            case ']':
                throw unsafe("Disallowed syntax: subscript or list literal");
            case '{':
            case '}':
                throw unsafe("Disallowed syntax: dict or set literal");
            case ',':
                throw unsafe("Disallowed syntax: tuple");
            case ':':
                throw unsafe("Disallowed syntax: name binding or slice");
            case ';':
                throw unsafe("Disallowed syntax: chained statements");
            case '\'':
            case '"':
                throw unsafe("Disallowed syntax: string literal");
            case '&':
            case '|':
            case '^':
            case '~':
                throw unsafe("Disallowed syntax: bitwise operator");
            default:
                throw unsafe(String.format("Disallowed character '%s' at position %d", c, start));
        }
    }

    private Token readInteger(int start) {
        while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length()) {
            char next = source.charAt(pos);
            if (next == '.' || isNamePart(next)) {
                throw unsafe("Disallowed syntax: non-integer numeric literal");
            }
        }
        String digits = source.substring(start, pos);
        if (digits.length() > 1 && digits.charAt(0) == '0' && !digits.chars().allMatch(ch -> ch == '0')) {
            throw unsafe("Disallowed syntax: leading zeros in integer literal");
        }
        return new Token(Token.Type.INTEGER, digits, start);
    }

    private Token operator(String symbol, int start) {
        return new Token(Token.Type.OPERATOR, symbol, start);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private UnsafeExpressionException unsafe(String message) {
        return new UnsafeExpressionException(message, source);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || isAsciiDigit(c);
    }
}
