package org.postfixer.compiler.api;

/**
 * A pure data class representing a position in the line being compiled.
 *
 * @param column The 1-based column of the first character of the construct.
 */
public record SourceInfo(int column) {

    @Override
    public String toString() {
        return "column " + column;
    }
}
