package com.deepansh.react.tool.impl;

import com.deepansh.react.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Arithmetic evaluator for the calculator action.
 *
 * Supports + - * / ^ (right-associative), parentheses, unary signs and sqrt(...).
 * Other characters are stripped before parsing, but whitespace still separates
 * numbers. Nesting is capped at MAX_DEPTH levels. A malformed expression
 * yields an explanatory observation rather than an exception, so the model can
 * rephrase it on the next step.
 */
@Component
@Slf4j
public class CalculatorTool implements AgentTool {

    private static final char SQRT = '#';
    static final int MAX_DEPTH = 100;

    @Override
    public String getName() {
        return "calculator";
    }

    @Override
    public String getDescription() {
        return "Evaluate a mathematical expression";
    }

    @Override
    public String getUsage() {
        return "calculator[expression]";
    }

    @Override
    public List<String> getExamples() {
        return List.of("calculator[29^0.23]", "calculator[sqrt(16) + 5]");
    }

    @Override
    public String invoke(String input) {
        String expression = input == null ? "" : input.trim();
        try {
            double value = evaluate(expression);
            return "Result: " + format(value);
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.debug("Calculator rejected '{}': {}", expression, e.getMessage());
            return "Could not evaluate \"" + expression + "\" (" + e.getMessage() + "). Check the expression format.";
        }
    }

    static double evaluate(String expression) {
        String sanitized = expression.toLowerCase()
                .replace("sqrt", String.valueOf(SQRT))
                .replace("**", "^")
                .replaceAll("[^0-9+\\-*/^().#\\s]", "");
        if (sanitized.isBlank()) {
            throw new IllegalArgumentException("empty expression");
        }
        Parser parser = new Parser(sanitized);
        double result = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("unexpected '" + parser.peek() + "' at position " + parser.pos);
        }
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return result;
    }

    private static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    /** Recursive-descent parser over the sanitized expression. */
    private static final class Parser {

        private final String src;
        private int pos;
        private int depth;

        Parser(String src) {
            this.src = src;
        }

        boolean atEnd() {
            return pos >= src.length();
        }

        char peek() {
            return src.charAt(pos);
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private void descend() {
            if (++depth > MAX_DEPTH) {
                throw new IllegalArgumentException("expression nested too deeply");
            }
        }

        private boolean accept(char c) {
            skipWhitespace();
            if (!atEnd() && peek() == c) {
                pos++;
                return true;
            }
            return false;
        }

        // expression := term (('+' | '-') term)*
        double parseExpression() {
            double value = parseTerm();
            while (true) {
                if (accept('+')) value += parseTerm();
                else if (accept('-')) value -= parseTerm();
                else return value;
            }
        }

        // term := factor (('*' | '/') factor)*
        double parseTerm() {
            double value = parseFactor();
            while (true) {
                if (accept('*')) {
                    value *= parseFactor();
                } else if (accept('/')) {
                    double divisor = parseFactor();
                    if (divisor == 0) throw new ArithmeticException("division by zero");
                    value /= divisor;
                } else {
                    return value;
                }
            }
        }

        // factor := ('+' | '-') factor | power
        double parseFactor() {
            descend();
            try {
                if (accept('+')) return parseFactor();
                if (accept('-')) return -parseFactor();
                return parsePower();
            } finally {
                depth--;
            }
        }

        // power := primary ('^' factor)?
        double parsePower() {
            double base = parsePrimary();
            if (accept('^')) {
                return Math.pow(base, parseFactor());
            }
            return base;
        }

        double parsePrimary() {
            if (accept('(')) {
                double value = parseExpression();
                if (!accept(')')) throw new IllegalArgumentException("missing closing parenthesis");
                return value;
            }
            if (accept(SQRT)) {
                descend();
                double operand;
                try {
                    operand = parsePrimary();
                } finally {
                    depth--;
                }
                if (operand < 0) throw new ArithmeticException("square root of a negative number");
                return Math.sqrt(operand);
            }
            skipWhitespace();
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException(atEnd()
                        ? "unexpected end of expression"
                        : "unexpected '" + peek() + "' at position " + pos);
            }
            try {
                return Double.parseDouble(src.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("malformed number '" + src.substring(start, pos) + "'");
            }
        }
    }
}
