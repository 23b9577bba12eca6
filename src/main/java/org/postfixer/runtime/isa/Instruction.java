package org.postfixer.runtime.isa;

/**
 * One step of a stack-machine program. A program is a postfix sequence: every
 * instruction's operands were produced by the instructions before it.
 */
public sealed interface Instruction permits Instruction.Push, Instruction.Apply {

    /**
     * Pushes an integer constant.
     * @param value The constant.
     */
    record Push(int value) implements Instruction {
        @Override
        public String toString() {
            return "PUSH " + value;
        }
    }

    /**
     * Pops {@code arity} values, applies the operator and pushes the result. The first value
     * popped is the rightmost operand.
     * @param symbol The operator symbol as written in the source, e.g. {@code "+"}.
     * @param arity The number of operands the operator consumes.
     */
    record Apply(String symbol, int arity) implements Instruction {
        @Override
        public String toString() {
            return "APPLY " + symbol + "/" + arity;
        }
    }
}
