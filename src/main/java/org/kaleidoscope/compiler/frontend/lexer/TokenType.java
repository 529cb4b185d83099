package org.kaleidoscope.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** Any single character that is not part of a word, number or comment, e.g. '(' or '+'. */
    CHAR,

    // Keywords.
    /** The 'def' keyword, starting a function definition. */
    DEF,
    /** The 'extern' keyword, starting an external declaration. */
    EXTERN,

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,

    // Miscellaneous.
    /** Represents the end of the input. */
    END_OF_FILE,
    /** Marks a malformed literal; only ever attached to a lexical error. */
    UNEXPECTED
}
