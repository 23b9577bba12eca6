package org.postfixer.cli.commands;

import org.postfixer.cli.CommandLineInterface;
import org.postfixer.compiler.Compiler;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompiledProgram;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "eval", description = "Evaluates an infix expression and prints its postfix form and result.")
public class EvalCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "1..*", paramLabel = "EXPRESSION", description = "The expression, e.g. '3 + 4 * 5'.")
    private List<String> words;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Compiler compiler = parent.createCompiler();
        String line = String.join(" ", words);
        try {
            CompiledProgram program = compiler.compile(line);
            int result = compiler.execute(program.instructions());
            spec.commandLine().getOut().println(program.postfix() + " -> " + result);
            return 0;
        } catch (CompilationException e) {
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return 1;
        }
    }
}
