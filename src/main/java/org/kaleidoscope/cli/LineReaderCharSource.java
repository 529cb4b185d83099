package org.kaleidoscope.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.kaleidoscope.compiler.frontend.lexer.CharSource;

/**
 * A {@link CharSource} that pulls lines from a JLine {@link LineReader} only when the
 * lexer needs more characters, so the parser consumes interactive input as it is typed.
 * <p>
 * The primary prompt is shown when a new top-level construct starts
 * (see {@link #expectNewStatement()}), the continuation prompt while one is incomplete.
 * Ctrl-D and Ctrl-C end the input.
 */
public class LineReaderCharSource implements CharSource {

    private final LineReader lineReader;
    private final String primaryPrompt;
    private final String continuationPrompt;

    private String buffer = "";
    private int position = 0;
    private boolean newStatement = true;
    private boolean exhausted = false;

    /**
     * @param lineReader The reader to pull lines from.
     * @param primaryPrompt The prompt for a new construct, e.g. {@code "ready> "}.
     * @param continuationPrompt The prompt while a construct is incomplete.
     */
    public LineReaderCharSource(LineReader lineReader, String primaryPrompt, String continuationPrompt) {
        this.lineReader = lineReader;
        this.primaryPrompt = primaryPrompt;
        this.continuationPrompt = continuationPrompt;
    }

    /**
     * Makes the next line read use the primary prompt.
     */
    public void expectNewStatement() {
        newStatement = true;
    }

    @Override
    public int read() {
        while (position >= buffer.length()) {
            if (exhausted || !readLine()) {
                exhausted = true;
                return EOF;
            }
        }
        return buffer.charAt(position++);
    }

    private boolean readLine() {
        try {
            String line = lineReader.readLine(newStatement ? primaryPrompt : continuationPrompt);
            newStatement = false;
            if (line == null) {
                return false;
            }
            buffer = line + "\n";
            position = 0;
            return true;
        } catch (EndOfFileException | UserInterruptException e) {
            return false;
        }
    }
}
