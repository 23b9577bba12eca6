package org.postfixer.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Collects the errors of a phase that inspects the whole expression tree before deciding
 * whether it succeeded, so that one failure report can name every bad operand at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> entries = new ArrayList<>();

    /**
     * @param message What is wrong.
     * @param column Where in the line, 1-based.
     */
    public void reportError(String message, int column) {
        entries.add(new Diagnostic(message, column));
    }

    public boolean hasErrors() {
        return !entries.isEmpty();
    }

    public int errorCount() {
        return entries.size();
    }

    /**
     * @return A read-only snapshot, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(entries);
    }

    /**
     * @return One line per error, in report order.
     */
    public String summary() {
        StringJoiner lines = new StringJoiner("\n");
        entries.forEach(d -> lines.add(d.toString()));
        return lines.toString();
    }
}
