package org.kaleidoscope.compiler.frontend.parser;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.frontend.lexer.Lexer;
import org.kaleidoscope.compiler.frontend.lexer.Token;

/**
 * A single-token buffer over a {@link Lexer}. The current token is the one the
 * parser is looking at; {@link #advance()} reads another token from the lexer
 * and makes it current.
 */
public class TokenCursor implements ParsingContext {

    private final Lexer lexer;
    private Token current;

    /**
     * @param lexer The lexer to pull tokens from.
     */
    public TokenCursor(Lexer lexer) {
        this.lexer = lexer;
    }

    @Override
    public Token current() {
        return current;
    }

    /**
     * {@inheritDoc}
     * <p>
     * When the lexer rejects a literal, the rejected literal becomes the current
     * token before the exception propagates, so that skipping one token skips it.
     */
    @Override
    public Token advance() throws ParseException {
        try {
            current = lexer.nextToken();
        } catch (ParseException e) {
            current = e.getToken();
            throw e;
        }
        return current;
    }
}
