package org.postfixer.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.postfixer.cli.CommandLineInterface;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompiledProgram;
import org.postfixer.runtime.isa.Instruction;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles an infix expression and prints the program as JSON.")
public class CompileCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "1..*", paramLabel = "EXPRESSION", description = "The expression to compile.")
    private List<String> words;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /**
     * The JSON shape of a compiled program. The tree is left out; the postfix text already encodes it.
     */
    record ProgramView(String source, String postfix, List<String> instructions) {
        static ProgramView of(CompiledProgram program) {
            List<String> rendered = program.instructions().stream().map(Instruction::toString).toList();
            return new ProgramView(program.source(), program.postfix(), rendered);
        }
    }

    @Override
    public Integer call() {
        String line = String.join(" ", words);
        CompiledProgram program;
        try {
            program = parent.createCompiler().compile(line);
        } catch (CompilationException e) {
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return 1;
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(ProgramView.of(program)));
        return 0;
    }
}
