/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.unitrun.runner;

import java.util.Arrays;
import java.util.Objects;

/**
 * Description of a binary comparison assertion, rendered as
 * {@code "<left> <op> <right> (<leftValue> <op> <rightValue>)"}, for example
 * {@code count == expected (3 == 4)}.
 */
public final class Comparison {

    public enum Operator {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * @param cmp the result of {@code left.compareTo(right)}
         */
        public boolean test(int cmp) {
            switch (this) {
                case EQ: return cmp == 0;
                case NE: return cmp != 0;
                case LT: return cmp < 0;
                case LE: return cmp <= 0;
                case GT: return cmp > 0;
                case GE: return cmp >= 0;
                default: throw new AssertionError(this);
            }
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
    }

    private final String leftExpression;
    private final Object leftValue;
    private final Operator operator;
    private final String rightExpression;
    private final Object rightValue;

    private Comparison(String leftExpression, Object leftValue, Operator operator, String rightExpression, Object rightValue) {
        this.leftExpression = Objects.requireNonNull(leftExpression, "leftExpression");
        this.leftValue = leftValue;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.rightExpression = Objects.requireNonNull(rightExpression, "rightExpression");
        this.rightValue = rightValue;
    }

    public static Comparison of(String leftExpression, Object leftValue, Operator operator, String rightExpression, Object rightValue) {
        return new Comparison(leftExpression, leftValue, operator, rightExpression, rightValue);
    }

    /**
     * Evaluates {@code left <op> right} with natural ordering. Nulls are only equal to each other
     * and never ordered.
     */
    public static <T extends Comparable<? super T>> boolean evaluate(T left, Operator operator, T right) {
        if (left == null || right == null) {
            boolean same = left == right;
            return operator == Operator.EQ ? same : operator == Operator.NE && !same;
        }
        return operator.test(left.compareTo(right));
    }

    public Operator operator() {
        return operator;
    }

    public String description() {
        String op = operator.symbol();
        return leftExpression + " " + op + " " + rightExpression
                + " (" + repr(leftValue) + " " + op + " " + repr(rightValue) + ")";
    }

    /**
     * Renders a value for a description: strings quoted, characters single-quoted, arrays
     * element by element.
     */
    static String repr(Object value) {
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        if (value instanceof Character) {
            return "'" + value + "'";
        }
        if (value != null && value.getClass().isArray()) {
            return Arrays.deepToString(new Object[] {value}).replaceAll("^\\[|\\]$", "");
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return description();
    }
}
