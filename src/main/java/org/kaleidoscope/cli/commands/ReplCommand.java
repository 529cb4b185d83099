package org.kaleidoscope.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.kaleidoscope.cli.CommandLineInterface;
import org.kaleidoscope.cli.LineReaderCharSource;
import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.driver.TopLevelDriver;
import org.kaleidoscope.compiler.driver.TopLevelListener;
import org.kaleidoscope.compiler.frontend.parser.Parser;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.kaleidoscope.compiler.frontend.parser.ast.AstNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * The interactive prompt. Input is parsed while it is typed: a construct may span
 * several lines and several constructs may share one line, separated by ';'.
 */
@Command(name = "repl",
        mixinStandardHelpOptions = true,
        description = "Starts an interactive prompt that parses Kaleidoscope as it is typed.")
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    private static final String PROMPT_PATH = "kaleidoscope.repl.prompt";
    private static final String CONTINUATION_PROMPT_PATH = "kaleidoscope.repl.continuation-prompt";
    private static final String ECHO_AST_PATH = "kaleidoscope.repl.echo-ast";

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws IOException {
        Config config = parent.getConfig();
        PrecedenceTable precedence = parent.getPrecedenceTable();
        String prompt = config.hasPath(PROMPT_PATH) ? config.getString(PROMPT_PATH) : "ready> ";
        String continuation = config.hasPath(CONTINUATION_PROMPT_PATH) ? config.getString(CONTINUATION_PROMPT_PATH) : "  ...> ";
        boolean echoAst = config.hasPath(ECHO_AST_PATH) && config.getBoolean(ECHO_AST_PATH);

        try (Terminal terminal = openTerminal()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            LineReaderCharSource source = new LineReaderCharSource(lineReader, prompt, continuation);
            Parser parser = Parser.forSource(source, "<stdin>", precedence);

            log.debug("Starting REPL with operators {}", precedence.asMap());
            new TopLevelDriver(parser, new ReplListener(source, terminal.writer(), echoAst)).run();
            terminal.writer().println();
            terminal.writer().flush();
        }
        return 0;
    }

    private Terminal openTerminal() throws IOException {
        try {
            return TerminalBuilder.builder()
                    .system(true)
                    .build();
        } catch (IOException | IllegalStateException e) {
            // Fallback to dumb terminal if system terminal is not available (e.g., in an IDE)
            log.debug("System terminal unavailable, using a dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder()
                    .dumb(true)
                    .build();
        }
    }

    /**
     * Prints one line per parsed construct, in the style of the classic tutorial REPL.
     */
    static final class ReplListener implements TopLevelListener {

        private final LineReaderCharSource source;
        private final PrintWriter out;
        private final boolean echoAst;

        ReplListener(LineReaderCharSource source, PrintWriter out, boolean echoAst) {
            this.source = source;
            this.out = out;
            this.echoAst = echoAst;
        }

        @Override
        public void onReady() {
            source.expectNewStatement();
        }

        @Override
        public void onDefinition(FunctionNode function) {
            report("Parsed a function definition.", function);
        }

        @Override
        public void onExtern(PrototypeNode prototype) {
            report("Parsed an extern.", prototype);
        }

        @Override
        public void onTopLevelExpression(FunctionNode function) {
            report("Parsed a top-level expression.", function.body());
        }

        @Override
        public void onError(ParseException error) {
            out.println("Error: " + error.getMessage());
            out.flush();
        }

        private void report(String message, AstNode node) {
            out.println(echoAst ? message + " " + AstPrinter.print(node) : message);
            out.flush();
        }
    }
}
