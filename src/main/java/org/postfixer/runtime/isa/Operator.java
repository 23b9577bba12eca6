package org.postfixer.runtime.isa;

import java.util.Arrays;
import java.util.Optional;

/**
 * The binary arithmetic operators the stack machine executes. Arithmetic is 32-bit
 * two's-complement and wraps on overflow.
 */
public enum Operator {
    ADD("+") {
        @Override
        public int apply(int left, int right) {
            return left + right;
        }
    },
    SUB("-") {
        @Override
        public int apply(int left, int right) {
            return left - right;
        }
    },
    MUL("*") {
        @Override
        public int apply(int left, int right) {
            return left * right;
        }
    },
    DIV("/") {
        @Override
        public int apply(int left, int right) {
            return left / right;
        }
    };

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Applies the operator.
     * @param left The second value popped.
     * @param right The first value popped.
     * @return The result.
     * @throws ArithmeticException on division by zero.
     */
    public abstract int apply(int left, int right);

    /**
     * Looks up the operator for an {@link Instruction.Apply}. Only binary instructions map to an operator.
     * @param instruction The instruction to decode.
     * @return The operator, or empty if the machine cannot execute the instruction.
     */
    public static Optional<Operator> decode(Instruction.Apply instruction) {
        if (instruction.arity() != 2) {
            return Optional.empty();
        }
        return fromSymbol(instruction.symbol());
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
