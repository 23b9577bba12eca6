package org.postfixer.compiler.backend.emit;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.compiler.diagnostics.DiagnosticsEngine;
import org.postfixer.compiler.frontend.TreeWalker;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.compiler.frontend.parser.ast.AtomNode;
import org.postfixer.compiler.frontend.parser.ast.OperatorNode;
import org.postfixer.runtime.isa.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Linearizes an expression tree into a stack-machine program. It walks the tree in the same
 * children-first order as {@link PostfixPrinter}, so the n-th instruction always corresponds to
 * the n-th item of the postfix text.
 * <p>
 * Numeric atoms become {@link Instruction.Push}, operator nodes become {@link Instruction.Apply}
 * with the node's operand count. Whether the backend can execute a given operator is not decided
 * here. Atoms without an integer value are collected as errors and reported together.
 */
public class InstructionEmitter {

    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private List<Instruction> program = new ArrayList<>();

    /**
     * Emits the program for one tree. Each call starts with no instructions and no diagnostics,
     * so an emitter can be reused after a failure.
     * @param root The root of the tree.
     * @return The instructions in execution order.
     * @throws BackendException if an atom cannot be pushed as an integer constant.
     */
    public List<Instruction> emit(AstNode root) throws BackendException {
        diagnostics = new DiagnosticsEngine();
        program = new ArrayList<>();
        new TreeWalker(Map.of(
                AtomNode.class, node -> emitAtom((AtomNode) node),
                OperatorNode.class, node -> emitOperator((OperatorNode) node)
        )).walk(root);

        if (diagnostics.hasErrors()) {
            throw new BackendException("Cannot emit instructions (" + diagnostics.errorCount() + " error(s)):\n"
                    + diagnostics.summary());
        }
        return Collections.unmodifiableList(program);
    }

    /**
     * @return The findings of the most recent {@link #emit(AstNode)} call.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void emitAtom(AtomNode atom) {
        if (!atom.isNumeric()) {
            diagnostics.reportError("Operand '" + atom.symbol() + "' has no integer value", atom.column());
            return;
        }
        try {
            program.add(new Instruction.Push(Integer.parseInt(atom.symbol())));
        } catch (NumberFormatException e) {
            diagnostics.reportError("Integer literal out of range: " + atom.symbol(), atom.column());
        }
    }

    private void emitOperator(OperatorNode node) {
        program.add(new Instruction.Apply(node.symbol(), node.fixity().arity()));
    }
}
