package org.postfixer.runtime;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.isa.Instruction;
import org.postfixer.runtime.isa.Operator;

import java.util.List;

/**
 * Checks the stack effect of a program before a backend accepts it: every instruction must be
 * executable, the stack must never underflow or grow past the limit, and exactly one value must
 * remain at the end.
 */
public final class ProgramVerifier {

    private final int maxStackDepth;

    /**
     * @param maxStackDepth The stack capacity of the target machine.
     */
    public ProgramVerifier(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    /**
     * @param program The program to check.
     * @return The deepest stack the program reaches.
     * @throws BackendException if the program is not executable.
     */
    public int verify(List<Instruction> program) throws BackendException {
        if (program.isEmpty()) {
            throw new BackendException("Empty program");
        }
        int depth = 0;
        int maxDepth = 0;
        for (int pc = 0; pc < program.size(); pc++) {
            Instruction instruction = program.get(pc);
            if (instruction instanceof Instruction.Push) {
                depth++;
                if (depth > maxStackDepth) {
                    throw new BackendException("Stack overflow at instruction " + pc
                            + " (capacity " + maxStackDepth + ")");
                }
            } else if (instruction instanceof Instruction.Apply apply) {
                if (Operator.decode(apply).isEmpty()) {
                    throw new BackendException("Unrecognized instruction at " + pc + ": " + apply);
                }
                if (depth < 2) {
                    throw new BackendException("Stack underflow at instruction " + pc + ": " + apply);
                }
                depth--;
            }
            maxDepth = Math.max(maxDepth, depth);
        }
        if (depth != 1) {
            throw new BackendException("Program leaves " + depth + " values on the stack, expected 1");
        }
        return maxDepth;
    }
}
