/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * A named arithmetic expression over the {@link Measure measures} of a pivot, evaluated for every cell and total from
 * that cell's (or total's) reduced measure values. For example, with the measures {@code sum(ltv)} and
 * {@code count(count)} configured, the formula {@code sum(ltv) / count(count)} yields the average lifetime value.
 *
 * <p>The expression language is deliberately small:
 * <ul>
 *     <li>decimal numbers, such as {@code 100} or {@code 0.5}
 *     <li>measure references, written as the measure name, such as {@code sum(ltv)}; matched case-insensitively
 *     <li>the binary operators {@code +}, {@code -}, {@code *}, {@code /}, with the usual precedence
 *     <li>unary minus, and parentheses
 * </ul>
 *
 * <p>Division by zero yields {@code 0}, as does any other computation that is not a finite number.
 */
public final class Formula implements PivotValue {
    private final String name;
    private final String expression;
    private final boolean percent;
    private final Node root;
    private final Set<String> references;

    private Formula(String name, String expression, boolean percent, Node root, Set<String> references) {
        this.name = name;
        this.expression = expression;
        this.percent = percent;
        this.root = root;
        this.references = references;
    }

    /**
     * Parses the given expression into a formula with the given name.
     *
     * @param name the formula name
     * @param expression the expression
     * @return a new formula
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static Formula parse(String name, String expression) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(expression);
        Parser parser = new Parser(expression);
        Node root = parser.parse();
        return new Formula(name, expression, false, root, Collections.unmodifiableSet(parser.references));
    }

    /**
     * Returns a copy of this formula that is displayed as a percentage.
     *
     * @return a copy of this formula that is displayed as a percentage
     */
    public Formula asPercent() {
        return new Formula(name, expression, true, root, references);
    }

    /**
     * Evaluates this formula. The given function supplies the value of each measure reference, by its lower-cased
     * measure name.
     *
     * @param values a function from lower-cased measure name to measure value
     * @return the value of this formula, or {@code 0} if it is not a finite number
     */
    public double evaluate(ToDoubleFunction<String> values) {
        double result = root.eval(values);
        return Double.isFinite(result) ? result : 0d;
    }

    /**
     * Returns the lower-cased names of the measures this formula references.
     *
     * @return the lower-cased names of the measures this formula references
     */
    public Set<String> references() {
        return references;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isPercent() {
        return percent;
    }

    @Override
    public boolean isCurrency() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Formula))
            return false;
        Formula other = (Formula) o;
        return percent == other.percent && name.equals(other.name) && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression, percent);
    }

    @Override
    public String toString() {
        return name + " = " + expression;
    }

    private interface Node {
        double eval(ToDoubleFunction<String> values);
    }

    /**
     * Recursive-descent parser. Grammar:
     *
     * <pre>{@code
     * expr    := term (('+' | '-') term)*
     * term    := unary (('*' | '/') unary)*
     * unary   := '-' unary | primary
     * primary := number | '(' expr ')' | ident '(' ident ')'
     * }</pre>
     */
    private static class Parser {
        final String text;
        final Set<String> references = new LinkedHashSet<>();
        int pos = 0;

        Parser(String text) {
            this.text = text;
        }

        Node parse() {
            Node node = expr();
            skipWhitespace();
            if (pos < text.length())
                throw error("Unexpected '" + text.charAt(pos) + "'");
            return node;
        }

        Node expr() {
            Node node = term();
            for (;;) {
                if (accept('+')) {
                    Node left = node, right = term();
                    node = values -> left.eval(values) + right.eval(values);
                }
                else if (accept('-')) {
                    Node left = node, right = term();
                    node = values -> left.eval(values) - right.eval(values);
                }
                else
                    return node;
            }
        }

        Node term() {
            Node node = unary();
            for (;;) {
                if (accept('*')) {
                    Node left = node, right = unary();
                    node = values -> left.eval(values) * right.eval(values);
                }
                else if (accept('/')) {
                    Node left = node, right = unary();
                    node = values -> {
                        double divisor = right.eval(values);
                        return divisor == 0d ? 0d : left.eval(values) / divisor;
                    };
                }
                else
                    return node;
            }
        }

        Node unary() {
            if (accept('-')) {
                Node operand = unary();
                return values -> -operand.eval(values);
            }
            return primary();
        }

        Node primary() {
            skipWhitespace();
            if (pos >= text.length())
                throw error("Unexpected end of expression");
            char c = text.charAt(pos);
            if (accept('(')) {
                Node node = expr();
                expect(')');
                return node;
            }
            if (Character.isDigit(c) || c == '.')
                return number();
            if (Character.isLetter(c)) {
                String reducer = identifier();
                expect('(');
                String field = identifier();
                expect(')');
                String reference = (reducer + "(" + field + ")").toLowerCase(Locale.ROOT);
                references.add(reference);
                return values -> values.applyAsDouble(reference);
            }
            throw error("Unexpected '" + c + "'");
        }

        Node number() {
            int start = pos;
            while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.'))
                pos++;
            double value = parseNumber(text.substring(start, pos));
            return values -> value;
        }

        double parseNumber(String digits) {
            try {
                return Double.parseDouble(digits);
            } catch (NumberFormatException e) {
                throw error("Malformed number '" + digits + "'");
            }
        }

        String identifier() {
            skipWhitespace();
            int start = pos;
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
                pos++;
            if (start == pos)
                throw error("Expected a name");
            return text.substring(start, pos);
        }

        boolean accept(char c) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        void expect(char c) {
            if (!accept(c))
                throw error("Expected '" + c + "'");
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
                pos++;
        }

        IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at position " + pos + " in formula: " + text);
        }
    }
}
