package org.kaleidoscope.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.kaleidoscope.cli.CommandLineInterface;
import org.kaleidoscope.compiler.diagnostics.Diagnostic;
import org.kaleidoscope.compiler.diagnostics.DiagnosticsEngine;
import org.kaleidoscope.compiler.driver.CollectingListener;
import org.kaleidoscope.compiler.driver.TopLevelDriver;
import org.kaleidoscope.compiler.frontend.lexer.ReaderCharSource;
import org.kaleidoscope.compiler.frontend.parser.Parser;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;
import org.kaleidoscope.compiler.util.AstJsonWriter;
import org.kaleidoscope.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "parse",
        mixinStandardHelpOptions = true,
        description = "Parses a Kaleidoscope source and prints its top-level units.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    /** Output formats of the parse command. */
    public enum OutputFormat { SEXPR, JSON }

    @Parameters(index = "0", arity = "0..1", description = "The source file; '-' or none reads standard input.")
    private File file;

    @Option(names = {"-f", "--format"}, defaultValue = "SEXPR",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrecedenceTable precedence = parent.getPrecedenceTable();
        boolean fromStdin = file == null || "-".equals(file.getPath());
        String sourceName = fromStdin ? "<stdin>" : file.getPath().replace('\\', '/');

        if (!fromStdin && !file.isFile()) {
            log.error("File not found: {}", file.getAbsolutePath());
            return 2;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        CollectingListener listener = new CollectingListener(diagnostics);
        try {
            if (fromStdin) {
                // Standard input belongs to the JVM and is left open.
                parse(new InputStreamReader(System.in, StandardCharsets.UTF_8), sourceName, precedence, listener);
            } else {
                try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
                    parse(reader, sourceName, precedence, listener);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read '{}': {}", sourceName, e.getMessage());
            return 2;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (format == OutputFormat.JSON) {
            try {
                out.println(new AstJsonWriter().toJson(listener.getUnits()));
            } catch (JsonProcessingException e) {
                log.error("Failed to render the AST as JSON: {}", e.getMessage(), e);
                return 2;
            }
        } else {
            for (TopLevelNode unit : listener.getUnits()) {
                out.println(AstPrinter.printTopLevel(unit));
            }
        }
        out.flush();

        PrintWriter err = spec.commandLine().getErr();
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
        err.flush();

        log.debug("Parsed {} unit(s) from '{}' with {} error(s)",
                listener.getUnits().size(), sourceName, diagnostics.errorCount());
        return diagnostics.hasErrors() ? 1 : 0;
    }

    private static void parse(Reader reader, String sourceName, PrecedenceTable precedence, CollectingListener listener) {
        Parser parser = Parser.forSource(new ReaderCharSource(reader, sourceName), sourceName, precedence);
        new TopLevelDriver(parser, listener).run();
    }
}
