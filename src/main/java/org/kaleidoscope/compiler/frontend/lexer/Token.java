package org.kaleidoscope.compiler.frontend.lexer;

import org.kaleidoscope.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the character stream by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The payload: the {@link Character} of a {@link TokenType#CHAR}, the
 *              name of an {@link TokenType#IDENTIFIER}, the {@link Double} of a
 *              {@link TokenType#NUMBER}; {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the source the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Checks whether this is the single-character token {@code c}.
     * @param c The character to test for.
     * @return true if this token is a {@link TokenType#CHAR} holding {@code c}.
     */
    public boolean isChar(char c) {
        return type == TokenType.CHAR && value instanceof Character ch && ch == c;
    }

    /**
     * Gets the numeric value of a {@link TokenType#NUMBER} token.
     * @return The parsed value.
     * @throws IllegalStateException if this is not a number token.
     */
    public double numberValue() {
        if (!(value instanceof Double d)) {
            throw new IllegalStateException("Not a number token: " + this);
        }
        return d;
    }

    /**
     * Gets the character of a {@link TokenType#CHAR} token.
     * @return The character.
     * @throws IllegalStateException if this is not a single-character token.
     */
    public char charValue() {
        if (!(value instanceof Character c)) {
            throw new IllegalStateException("Not a character token: " + this);
        }
        return c;
    }

    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return A short rendering for messages, e.g. {@code ')'} or {@code end of input}.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of input" : "'" + text + "'";
    }
}
