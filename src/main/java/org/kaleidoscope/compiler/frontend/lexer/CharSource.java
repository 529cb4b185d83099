package org.kaleidoscope.compiler.frontend.lexer;

/**
 * A pull-based source of characters for the {@link Lexer}.
 * <p>
 * Implementations hand out one character per call and signal exhaustion with
 * {@link #EOF}. Once {@link #EOF} has been returned, every further call returns it too.
 * Reading never throws: a failing underlying stream counts as exhausted.
 */
@FunctionalInterface
public interface CharSource {

    /** The end-of-input marker. */
    int EOF = -1;

    /**
     * Reads the next character.
     * @return The next character, or {@link #EOF} once the source is exhausted.
     */
    int read();
}
