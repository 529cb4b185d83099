package org.kaleidoscope.compiler.frontend.lexer;

import org.kaleidoscope.compiler.api.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a stream of characters into tokens, one token per {@link #nextToken()} call.
 * <p>
 * It pulls from its {@link CharSource} one character at a time and keeps exactly one
 * character of lookahead between calls: the character that ended the previous token
 * and has not been classified yet. All state lives in the instance, so two lexers over
 * equal inputs always produce equal token sequences.
 */
public class Lexer {

    private static final String KEYWORD_DEF = "def";
    private static final String KEYWORD_EXTERN = "extern";

    private final CharSource source;
    private final String logicalFileName;

    private int lastChar = ' ';
    private int charLine = 1;
    private int charColumn = 0;

    /**
     * Creates a new Lexer over an in-memory source.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(new StringCharSource(source), "<memory>");
    }

    /**
     * Creates a new Lexer.
     * @param source The character source to tokenize.
     */
    public Lexer(CharSource source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The character source to tokenize.
     * @param logicalFileName The name of the input, for error reporting.
     */
    public Lexer(CharSource source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Reads the next token. Once the input is exhausted every call returns
     * a {@link TokenType#END_OF_FILE} token.
     * @return The next token.
     * @throws ParseException if a numeric literal is malformed. The literal has been
     *         consumed, so the next call continues behind it.
     */
    public Token nextToken() throws ParseException {
        while (true) {
            while (isSpace(lastChar)) {
                nextChar();
            }

            int line = charLine;
            int column = charColumn;

            if (isAlpha(lastChar)) {
                return identifier(line, column);
            }
            if (isDigit(lastChar) || lastChar == '.') {
                return number(line, column);
            }
            if (lastChar == '#') {
                // A comment goes until the end of the line, then tokenizing starts over.
                do {
                    nextChar();
                } while (lastChar != CharSource.EOF && lastChar != '\n' && lastChar != '\r');
                continue;
            }
            if (lastChar == CharSource.EOF) {
                return new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName);
            }

            char c = (char) lastChar;
            nextChar();
            return new Token(TokenType.CHAR, String.valueOf(c), c, line, column, logicalFileName);
        }
    }

    /**
     * Tokenizes the rest of the input.
     * @return The tokens, the last one being {@link TokenType#END_OF_FILE}.
     * @throws ParseException if a numeric literal is malformed.
     */
    public List<Token> scanTokens() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    private Token identifier(int line, int column) {
        StringBuilder text = new StringBuilder();
        do {
            text.append((char) lastChar);
            nextChar();
        } while (isAlphaNumeric(lastChar));

        String word = text.toString();
        if (KEYWORD_DEF.equals(word)) {
            return new Token(TokenType.DEF, word, null, line, column, logicalFileName);
        }
        if (KEYWORD_EXTERN.equals(word)) {
            return new Token(TokenType.EXTERN, word, null, line, column, logicalFileName);
        }
        return new Token(TokenType.IDENTIFIER, word, word, line, column, logicalFileName);
    }

    private Token number(int line, int column) throws ParseException {
        StringBuilder text = new StringBuilder();
        int dots = 0;
        int digits = 0;
        do {
            if (lastChar == '.') dots++; else digits++;
            text.append((char) lastChar);
            nextChar();
        } while (isDigit(lastChar) || lastChar == '.');

        String numberString = text.toString();
        if (dots > 1 || digits == 0) {
            Token bad = new Token(TokenType.UNEXPECTED, numberString, null, line, column, logicalFileName);
            throw ParseException.malformedNumber(bad);
        }
        double value = Double.parseDouble(numberString);
        return new Token(TokenType.NUMBER, numberString, value, line, column, logicalFileName);
    }

    private void nextChar() {
        if (lastChar == CharSource.EOF) {
            return;
        }
        if (lastChar == '\n') {
            charLine++;
            charColumn = 1;
        } else {
            charColumn++;
        }
        lastChar = source.read();
    }

    // Same classes as C's isspace/isalpha/isdigit in the "C" locale.
    private static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
