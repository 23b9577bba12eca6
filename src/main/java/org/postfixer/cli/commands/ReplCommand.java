package org.postfixer.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.postfixer.cli.CommandLineInterface;
import org.postfixer.compiler.Compiler;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompiledProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Reads expressions line by line and prints their postfix form and value.
 * A failing line is reported and the loop continues.
 */
@Command(name = "repl", description = "Starts an interactive read-eval-print loop.")
public class ReplCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ReplCommand.class);

    static final String DEFAULT_PROMPT = "<rpn> ";
    static final int DEFAULT_HISTORY_SIZE = 500;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Compiler compiler;

    @Override
    public Integer call() throws IOException {
        Config config = parent.getConfig();
        String prompt = config.hasPath("postfixer.repl.prompt")
                ? config.getString("postfixer.repl.prompt")
                : DEFAULT_PROMPT;
        int historySize = config.hasPath("postfixer.repl.history-size")
                ? config.getInt("postfixer.repl.history-size")
                : DEFAULT_HISTORY_SIZE;
        compiler = parent.createCompiler();

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .variable(LineReader.HISTORY_SIZE, historySize)
                    .build();
            PrintWriter out = terminal.writer();

            while (true) {
                try {
                    String line = lineReader.readLine(prompt);
                    if (!processLine(line, out)) {
                        break;
                    }
                    out.flush();
                } catch (UserInterruptException e) {
                    // Ignore Ctrl-C
                } catch (EndOfFileException e) {
                    // Ctrl-D, exit
                    break;
                }
            }
        }
        return 0;
    }

    /**
     * Handles one line of input.
     * @param line The line as read, may be null at end of input.
     * @param out Where results and errors are printed.
     * @return false if the loop should stop.
     */
    boolean processLine(String line, PrintWriter out) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if ("exit".equalsIgnoreCase(trimmed) || "quit".equalsIgnoreCase(trimmed)) {
            return false;
        }
        if (trimmed.isEmpty()) {
            return true;
        }
        try {
            CompiledProgram program = compiler.compile(trimmed);
            int result = compiler.execute(program.instructions());
            out.println(program.postfix() + " -> " + result);
        } catch (CompilationException e) {
            LOG.debug("Failed to evaluate '{}' ({})", trimmed, e.getErrorCode(), e);
            out.println("error: " + e.getMessage());
        }
        return true;
    }

    void setCompiler(Compiler compiler) {
        this.compiler = compiler;
    }
}
