package org.postfixer.compiler;

import com.typesafe.config.Config;
import org.postfixer.compiler.frontend.parser.GroupingMode;
import org.postfixer.compiler.frontend.parser.Parser;

/**
 * Settings of the lexer and parser.
 *
 * @param strictLexing Reject operator characters the operator table does not know.
 * @param groupingMode How parenthesized groups are closed.
 * @param maxDepth The deepest allowed nesting of sub-expressions.
 */
public record CompilerOptions(boolean strictLexing, GroupingMode groupingMode, int maxDepth) {

    public CompilerOptions {
        if (groupingMode == null) {
            throw new IllegalArgumentException("groupingMode must not be null");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(false, GroupingMode.EXPLICIT, Parser.DEFAULT_MAX_DEPTH);
    }

    /**
     * Reads {@code postfixer.lexer} and {@code postfixer.parser}. Missing keys fall back to the defaults.
     * @param config The application configuration.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        CompilerOptions defaults = defaults();
        boolean strict = config.hasPath("postfixer.lexer.strict")
                ? config.getBoolean("postfixer.lexer.strict")
                : defaults.strictLexing();
        GroupingMode grouping = config.hasPath("postfixer.parser.grouping")
                ? config.getEnum(GroupingMode.class, "postfixer.parser.grouping")
                : defaults.groupingMode();
        int maxDepth = config.hasPath("postfixer.parser.max-depth")
                ? config.getInt("postfixer.parser.max-depth")
                : defaults.maxDepth();
        return new CompilerOptions(strict, grouping, maxDepth);
    }
}
