package org.postfixer.compiler.frontend.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable table from operator symbol to binding powers, one entry per role.
 * <p>
 * A prefix operator has a single right power, a postfix operator a single left power,
 * and an infix operator a (left, right) pair. Higher numbers bind tighter. For an infix
 * operator {@code left < right} makes it left-associative and {@code left > right}
 * right-associative. A ternary operator is an infix operator that additionally names the
 * separator between its middle and right operands.
 * <p>
 * Adding an operator to the language is a table edit; the parser has no per-operator code.
 */
public final class BindingPowers {

    /**
     * The binding powers of an infix operator.
     * @param left The power with which the operator binds the operand on its left.
     * @param right The power with which the operator binds the operand on its right.
     */
    public record InfixPower(int left, int right) {}

    private static final BindingPowers STANDARD = builder()
            .infix("=", 2, 1)
            .ternary("?", ":", 4, 3)
            .infix("+", 5, 6)
            .infix("-", 5, 6)
            .infix("*", 7, 8)
            .infix("/", 7, 8)
            .prefix("+", 9)
            .prefix("-", 9)
            .postfix("!", 11)
            .postfix("[", 11)
            .postfix(")", 12)
            .infix(".", 14, 13)
            .prefix("(", 15)
            .build();

    private final Map<String, Integer> prefix;
    private final Map<String, InfixPower> infix;
    private final Map<String, Integer> postfix;
    private final Map<String, String> ternarySeparators;

    private BindingPowers(Builder builder) {
        this.prefix = Map.copyOf(builder.prefix);
        this.infix = Map.copyOf(builder.infix);
        this.postfix = Map.copyOf(builder.postfix);
        this.ternarySeparators = Map.copyOf(builder.ternarySeparators);
    }

    /**
     * Returns the operator table of the expression language:
     * <pre>
     *   =        infix   2 1   (right-associative)
     *   ?  :     ternary 4 3
     *   + -      infix   5 6
     *   * /      infix   7 8
     *   + -      prefix  9
     *   ! [      postfix 11
     *   )        postfix 12
     *   .        infix   14 13 (right-associative)
     *   (        prefix  15
     * </pre>
     * @return The shared standard table.
     */
    public static BindingPowers standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalInt prefix(String symbol) {
        Integer power = prefix.get(symbol);
        return power == null ? OptionalInt.empty() : OptionalInt.of(power);
    }

    public Optional<InfixPower> infix(String symbol) {
        return Optional.ofNullable(infix.get(symbol));
    }

    public OptionalInt postfix(String symbol) {
        Integer power = postfix.get(symbol);
        return power == null ? OptionalInt.empty() : OptionalInt.of(power);
    }

    /**
     * @return The separator that follows the middle operand if {@code symbol} is a ternary head.
     */
    public Optional<String> ternarySeparator(String symbol) {
        return Optional.ofNullable(ternarySeparators.get(symbol));
    }

    /**
     * @return {@code true} if {@code symbol} separates the operands of some ternary operator.
     */
    public boolean isTernarySeparator(String symbol) {
        return ternarySeparators.containsValue(symbol);
    }

    /**
     * @return {@code true} if {@code symbol} has an entry for any role or is a ternary separator.
     */
    public boolean knows(String symbol) {
        return prefix.containsKey(symbol) || infix.containsKey(symbol)
                || postfix.containsKey(symbol) || isTernarySeparator(symbol);
    }

    /**
     * Collects the entries of a {@link BindingPowers} table.
     */
    public static final class Builder {
        private final Map<String, Integer> prefix = new HashMap<>();
        private final Map<String, InfixPower> infix = new HashMap<>();
        private final Map<String, Integer> postfix = new HashMap<>();
        private final Map<String, String> ternarySeparators = new HashMap<>();

        private Builder() {}

        public Builder prefix(String symbol, int right) {
            prefix.put(symbol, right);
            return this;
        }

        public Builder infix(String symbol, int left, int right) {
            infix.put(symbol, new InfixPower(left, right));
            return this;
        }

        public Builder postfix(String symbol, int left) {
            postfix.put(symbol, left);
            return this;
        }

        /**
         * Registers {@code head} as an infix operator whose right side is
         * {@code middle separator right}.
         */
        public Builder ternary(String head, String separator, int left, int right) {
            infix(head, left, right);
            ternarySeparators.put(head, separator);
            return this;
        }

        public BindingPowers build() {
            return new BindingPowers(this);
        }
    }
}
