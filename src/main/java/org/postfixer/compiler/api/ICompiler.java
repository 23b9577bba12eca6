package org.postfixer.compiler.api;

/**
 * Defines the public interface for the expression compiler.
 */
public interface ICompiler {

    /**
     * Tokenizes and parses one line of input and linearizes the resulting tree.
     *
     * @param line The expression text.
     * @return A {@link CompiledProgram} holding the tree, its postfix text and its instructions.
     * @throws CompilationException if the line cannot be tokenized or parsed, or the tree
     *                              cannot be expressed as stack-machine instructions.
     */
    CompiledProgram compile(String line) throws CompilationException;

    /**
     * Compiles one line of input, hands the instructions to the configured execution backend
     * and invokes the resulting callable.
     *
     * @param line The expression text.
     * @return The integer result.
     * @throws CompilationException if compilation fails; {@link BackendException} if the backend
     *                              rejects the program or fails while evaluating it.
     */
    int evaluate(String line) throws CompilationException;
}
