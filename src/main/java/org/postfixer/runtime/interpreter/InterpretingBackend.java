package org.postfixer.runtime.interpreter;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.AbstractBackendSession;
import org.postfixer.runtime.CompiledExpression;
import org.postfixer.runtime.IBackendSession;
import org.postfixer.runtime.IExecutionBackend;
import org.postfixer.runtime.isa.Instruction;
import org.postfixer.runtime.isa.Operator;

import java.util.List;

/**
 * In-process stack machine. The returned callable walks the instruction list on every
 * evaluation, using a fresh integer stack sized to the program's verified depth.
 */
public class InterpretingBackend implements IExecutionBackend {

    private final int maxStackDepth;

    /**
     * @param maxStackDepth The stack capacity programs are verified against.
     */
    public InterpretingBackend(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    @Override
    public String getName() {
        return "interpreter";
    }

    @Override
    public IBackendSession openSession() {
        return new AbstractBackendSession(getName(), maxStackDepth) {
            @Override
            protected CompiledExpression doCompile(List<Instruction> program, int stackDepth) {
                return () -> run(program, stackDepth);
            }
        };
    }

    static int run(List<Instruction> program, int stackDepth) throws BackendException {
        int[] stack = new int[stackDepth];
        int sp = 0;
        for (Instruction instruction : program) {
            if (instruction instanceof Instruction.Push push) {
                stack[sp++] = push.value();
            } else if (instruction instanceof Instruction.Apply apply) {
                // Verified programs only contain binary operators.
                Operator op = Operator.decode(apply).orElseThrow();
                int right = stack[--sp];
                int left = stack[--sp];
                try {
                    stack[sp++] = op.apply(left, right);
                } catch (ArithmeticException e) {
                    throw new BackendException("Arithmetic fault in " + left + " " + op.symbol() + " " + right
                            + ": " + e.getMessage(), e);
                }
            }
        }
        return stack[0];
    }
}
