package org.kaleidoscope.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * A {@link CharSource} over a {@link Reader}, e.g. a file or standard input.
 * <p>
 * An {@link IOException} from the reader is logged and ends the input; the
 * lexer then sees end of input and the parse finishes normally.
 */
public final class ReaderCharSource implements CharSource {

    private static final Logger log = LoggerFactory.getLogger(ReaderCharSource.class);

    private final Reader reader;
    private final String name;
    private boolean exhausted = false;

    /**
     * @param reader The reader to pull from. It is buffered if it is not already.
     * @param name The logical name of the input, used in log messages.
     */
    public ReaderCharSource(Reader reader, String name) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        this.name = name;
    }

    @Override
    public int read() {
        if (exhausted) {
            return EOF;
        }
        try {
            int c = reader.read();
            if (c < 0) {
                exhausted = true;
                return EOF;
            }
            return c;
        } catch (IOException e) {
            log.warn("Failed to read from '{}', treating it as end of input: {}", name, e.getMessage());
            exhausted = true;
            return EOF;
        }
    }
}
