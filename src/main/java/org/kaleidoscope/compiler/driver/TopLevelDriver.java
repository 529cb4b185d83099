package org.kaleidoscope.compiler.driver;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.diagnostics.CompilerLogger;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.parser.Parser;

/**
 * Drives a {@link Parser} over a whole input:
 * <pre>
 * top ::= definition | external | expression | ';'
 * </pre>
 * Each construct is dispatched on its first token and its outcome handed to a
 * {@link TopLevelListener}. After a failure exactly one token is skipped and
 * dispatching resumes. The driver never prints; presentation is the listener's job.
 */
public class TopLevelDriver {

    private final Parser parser;
    private final TopLevelListener listener;

    /**
     * @param parser The parse session to drive.
     * @param listener The receiver of parsed units and errors.
     */
    public TopLevelDriver(Parser parser, TopLevelListener listener) {
        this.parser = parser;
        this.listener = listener;
    }

    /**
     * Runs until the end of the input. Primes the parser if nobody did yet.
     */
    public void run() {
        if (parser.current() == null) {
            try {
                parser.advance();
            } catch (ParseException e) {
                fail(e);
            }
        }

        while (true) {
            listener.onReady();
            Token token = parser.current();
            switch (token.type()) {
                case END_OF_FILE:
                    CompilerLogger.debug("Reached end of input '{}'", token.fileName());
                    return;
                case DEF:
                    handleDefinition();
                    break;
                case EXTERN:
                    handleExtern();
                    break;
                default:
                    if (token.isChar(';')) {
                        skipSemicolon();
                    } else {
                        handleTopLevelExpression();
                    }
                    break;
            }
        }
    }

    private void handleDefinition() {
        try {
            listener.onDefinition(parser.parseDefinition());
        } catch (ParseException e) {
            fail(e);
        }
    }

    private void handleExtern() {
        try {
            listener.onExtern(parser.parseExtern());
        } catch (ParseException e) {
            fail(e);
        }
    }

    private void handleTopLevelExpression() {
        try {
            listener.onTopLevelExpression(parser.parseTopLevelExpr());
        } catch (ParseException e) {
            fail(e);
        }
    }

    private void skipSemicolon() {
        try {
            parser.advance();
        } catch (ParseException e) {
            fail(e);
        }
    }

    private void fail(ParseException e) {
        CompilerLogger.debug("{} error at {}: {}", e.getKind(), e.getSourceInfo(), e.getMessage());
        listener.onError(e);
        parser.synchronize();
    }
}
