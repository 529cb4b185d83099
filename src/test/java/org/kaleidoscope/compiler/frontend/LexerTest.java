package org.kaleidoscope.compiler.frontend;

import org.kaleidoscope.compiler.api.ParseErrorCode;
import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.frontend.lexer.Lexer;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer turns source text into the token classes of the
 * language and handles comments, positions and malformed literals.
 */
public class LexerTest {

    /**
     * Verifies that a definition is split into keyword, identifiers, characters and numbers.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() throws ParseException {
        // Arrange
        Lexer lexer = new Lexer("def foo(x y) x*y+4.5");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DEF, TokenType.IDENTIFIER, TokenType.CHAR, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.CHAR, TokenType.IDENTIFIER, TokenType.CHAR,
                TokenType.IDENTIFIER, TokenType.CHAR, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(1)).extracting(Token::text, Token::value).containsExactly("foo", "foo");
        assertThat(tokens.get(2).isChar('(')).isTrue();
        assertThat(tokens.get(7).isChar('*')).isTrue();
        assertThat(tokens.get(9).charValue()).isEqualTo('+');
        assertThat(tokens.get(10).numberValue()).isEqualTo(4.5);
    }

    @Test
    @Tag("unit")
    void testPayloadAccessorsCheckTokenType() throws ParseException {
        List<Token> tokens = new Lexer("x 1").scanTokens();

        assertThatThrownBy(() -> tokens.get(0).charValue()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tokens.get(0).numberValue()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tokens.get(1).charValue()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Tag("unit")
    void testKeywordsAreCaseSensitive() throws ParseException {
        List<Token> tokens = new Lexer("extern Extern def DEF define").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.EXTERN, TokenType.IDENTIFIER, TokenType.DEF, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    /**
     * Identifiers start with a letter and continue with letters and digits;
     * a digit run right after is a separate number.
     */
    @Test
    @Tag("unit")
    void testIdentifierWithDigits() throws ParseException {
        List<Token> tokens = new Lexer("x1y2 3z").scanTokens();

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "x1y2"),
                tuple(TokenType.NUMBER, "3"),
                tuple(TokenType.IDENTIFIER, "z"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    @Test
    @Tag("unit")
    void testNumberForms() throws ParseException {
        List<Token> tokens = new Lexer("42 1. .5 0.25").scanTokens();

        assertThat(tokens.subList(0, 4)).extracting(Token::numberValue).containsExactly(42.0, 1.0, 0.5, 0.25);
    }

    /**
     * Verifies that a comment runs to the end of the line and tokenizing continues after it.
     */
    @Test
    @Tag("unit")
    void testCommentIsSkipped() throws ParseException {
        List<Token> tokens = new Lexer("# a comment ( with ) junk\n42").scanTokens();

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).numberValue()).isEqualTo(42.0);
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testCommentAtEndOfInput() throws ParseException {
        List<Token> tokens = new Lexer("x # trailing").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testEndOfInputRepeats() throws ParseException {
        Lexer lexer = new Lexer("  \t\n");

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that tokens carry the line and column of their first character.
     */
    @Test
    @Tag("unit")
    void testPositions() throws ParseException {
        List<Token> tokens = new Lexer("foo +\n  bar").scanTokens();

        assertThat(tokens.get(0)).extracting(Token::line, Token::column).containsExactly(1, 1);
        assertThat(tokens.get(1)).extracting(Token::line, Token::column).containsExactly(1, 5);
        assertThat(tokens.get(2)).extracting(Token::line, Token::column).containsExactly(2, 3);
        assertThat(tokens.get(0).fileName()).isEqualTo("<memory>");
    }

    /**
     * A literal with more than one decimal point is rejected; the literal is consumed
     * so the next call continues behind it.
     */
    @Test
    @Tag("unit")
    void testMalformedNumberIsRejected() throws ParseException {
        Lexer lexer = new Lexer("1.2.3 x");

        assertThatThrownBy(lexer::nextToken)
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("1.2.3")
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.getCode()).isEqualTo(ParseErrorCode.MALFORMED_NUMBER);
                    assertThat(pe.getKind()).isEqualTo(ParseErrorCode.Kind.LEXICAL);
                    assertThat(pe.getToken().type()).isEqualTo(TokenType.UNEXPECTED);
                });

        Token next = lexer.nextToken();
        assertThat(next).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "x");
    }

    @Test
    @Tag("unit")
    void testLoneDotIsRejected() {
        assertThatThrownBy(() -> new Lexer(".").nextToken())
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getCode())
                .isEqualTo(ParseErrorCode.MALFORMED_NUMBER);
    }

    /**
     * Two lexers over the same text produce the same tokens, since all state lives in the instance.
     */
    @Test
    @Tag("unit")
    void testIndependentLexersAgree() throws ParseException {
        String source = "extern sin(x); sin(1) < 2 # done";
        Lexer first = new Lexer(source);
        Lexer second = new Lexer(source);

        Token interleaved = first.nextToken();
        List<Token> fromSecond = second.scanTokens();
        List<Token> restOfFirst = first.scanTokens();

        assertThat(fromSecond.get(0)).isEqualTo(interleaved);
        assertThat(fromSecond.subList(1, fromSecond.size())).isEqualTo(restOfFirst);
    }
}
