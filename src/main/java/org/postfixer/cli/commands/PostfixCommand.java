package org.postfixer.cli.commands;

import org.postfixer.cli.CommandLineInterface;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.backend.emit.PostfixPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "postfix", description = "Prints the postfix (reverse-Polish) form of an infix expression.")
public class PostfixCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "1..*", paramLabel = "EXPRESSION", description = "The expression, e.g. 'a = b = c'.")
    private List<String> words;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // Only the frontend runs here, so operators the backend cannot execute still print.
        try {
            String postfix = PostfixPrinter.print(parent.createCompiler().parse(String.join(" ", words)));
            spec.commandLine().getOut().println(postfix);
            return 0;
        } catch (CompilationException e) {
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return 1;
        }
    }
}
