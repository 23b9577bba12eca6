package org.postfixer.compiler.diagnostics;

/**
 * One error found by the emission phase, tied to a column of the input line.
 *
 * @param message What is wrong.
 * @param column The 1-based column of the offending atom or operator, or 0 if unknown.
 */
public record Diagnostic(String message, int column) {

    @Override
    public String toString() {
        return "column " + column + ": " + message;
    }
}
