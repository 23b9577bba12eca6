package org.postfixer.compiler.backend.emit;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.isa.Instruction;
import org.postfixer.runtime.isa.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads postfix text, as produced by {@link PostfixPrinter}, back into a stack-machine program.
 * <ul>
 *     <li>a run of digits pushes its value,</li>
 *     <li>{@code + - * /} apply the binary operator,</li>
 *     <li>parentheses and spaces are skipped,</li>
 *     <li>anything else is rejected.</li>
 * </ul>
 */
public final class PostfixAssembler {

    private PostfixAssembler() {}

    /**
     * @param postfix The postfix text, e.g. {@code "3 4 +"}.
     * @return The instructions in execution order.
     * @throws BackendException if the text contains something the stack machine cannot execute.
     */
    public static List<Instruction> assemble(String postfix) throws BackendException {
        List<Instruction> program = new ArrayList<>();
        int i = 0;
        while (i < postfix.length()) {
            char c = postfix.charAt(i);
            if (c >= '0' && c <= '9') {
                int start = i;
                while (i < postfix.length() && postfix.charAt(i) >= '0' && postfix.charAt(i) <= '9') i++;
                String digits = postfix.substring(start, i);
                try {
                    program.add(new Instruction.Push(Integer.parseInt(digits)));
                } catch (NumberFormatException e) {
                    throw new BackendException("Integer literal out of range: " + digits, e);
                }
                continue;
            }
            if (c != ' ' && c != '(' && c != ')') {
                String symbol = String.valueOf(c);
                if (Operator.fromSymbol(symbol).isEmpty()) {
                    throw new BackendException("cannot compile: " + postfix.substring(i));
                }
                program.add(new Instruction.Apply(symbol, 2));
            }
            i++;
        }
        return Collections.unmodifiableList(program);
    }
}
