package org.postfixer.compiler.api;

import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.runtime.isa.Instruction;

import java.util.List;

/**
 * The result of compiling one line of input: the expression tree together with both of its
 * linear forms. The postfix text and the instruction list are produced by the same
 * children-first traversal and therefore list the same items in the same order.
 *
 * @param source The line that was compiled.
 * @param ast The root of the expression tree.
 * @param postfix The printable postfix rendering, e.g. {@code "3 4 5 * +"}.
 * @param instructions The stack-machine program.
 */
public record CompiledProgram(
        String source,
        AstNode ast,
        String postfix,
        List<Instruction> instructions
) {
    public CompiledProgram {
        instructions = List.copyOf(instructions);
    }
}
