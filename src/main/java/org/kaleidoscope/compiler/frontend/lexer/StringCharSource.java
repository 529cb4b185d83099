package org.kaleidoscope.compiler.frontend.lexer;

import java.util.Objects;

/**
 * A {@link CharSource} over an in-memory string.
 */
public final class StringCharSource implements CharSource {

    private final String source;
    private int current = 0;

    /**
     * @param source The characters to hand out.
     */
    public StringCharSource(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public int read() {
        if (current >= source.length()) {
            return EOF;
        }
        return source.charAt(current++);
    }
}
