package org.kaleidoscope.compiler.frontend.parser;

import org.kaleidoscope.compiler.api.ParseErrorCode;
import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.api.SourceInfo;
import org.kaleidoscope.compiler.diagnostics.CompilerLogger;
import org.kaleidoscope.compiler.frontend.lexer.CharSource;
import org.kaleidoscope.compiler.frontend.lexer.Lexer;
import org.kaleidoscope.compiler.frontend.lexer.StringCharSource;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;
import org.kaleidoscope.compiler.frontend.parser.ast.BinaryExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.CallNode;
import org.kaleidoscope.compiler.frontend.parser.ast.ExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.frontend.parser.ast.VariableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive-descent parser of the language. One instance is one parse session:
 * it owns its lexer, its token cursor and a private copy of the operator table, so
 * independent sessions never share mutable state.
 * <p>
 * Grammar:
 * <pre>
 * top          ::= definition | external | expression | ';'
 * definition   ::= 'def' prototype expression
 * external     ::= 'extern' prototype
 * prototype    ::= identifier '(' identifier* ')'
 * expression   ::= primary binoprhs
 * binoprhs     ::= (binop primary)*
 * primary      ::= identifierexpr | numberexpr | parenexpr
 * identifierexpr ::= identifier | identifier '(' (expression (',' expression)*)? ')'
 * numberexpr   ::= number
 * parenexpr    ::= '(' expression ')'
 * </pre>
 * Every parse method either returns a complete node or throws {@link ParseException};
 * recovery is left to the caller (see {@link #synchronize()}).
 * <p>
 * The cursor is not primed on construction: call {@link #advance()} once before the
 * first parse method, or create the session with {@link #primed(String, PrecedenceTable)}.
 */
public class Parser {

    private final ParsingContext cursor;
    private final PrecedenceTable precedence;
    private int openGroups = 0;

    /**
     * Constructs a new parse session.
     * @param lexer The lexer to read tokens from.
     * @param precedence The operator table. The parser keeps its own copy.
     */
    public Parser(Lexer lexer, PrecedenceTable precedence) {
        this(new TokenCursor(lexer), precedence);
    }

    /**
     * Constructs a new parse session over an existing token stream.
     * @param cursor The token stream.
     * @param precedence The operator table. The parser keeps its own copy.
     */
    public Parser(ParsingContext cursor, PrecedenceTable precedence) {
        this.cursor = cursor;
        this.precedence = precedence.copy();
    }

    /**
     * Creates an unprimed session over an in-memory source.
     * @param source The source text.
     * @param precedence The operator table.
     * @return The new session.
     */
    public static Parser forSource(String source, PrecedenceTable precedence) {
        return forSource(new StringCharSource(source), "<memory>", precedence);
    }

    /**
     * Creates an unprimed session over a character source.
     * @param source The character source.
     * @param fileName The logical name of the input.
     * @param precedence The operator table.
     * @return The new session.
     */
    public static Parser forSource(CharSource source, String fileName, PrecedenceTable precedence) {
        return new Parser(new Lexer(source, fileName), precedence);
    }

    /**
     * Creates a session over an in-memory source whose cursor already holds the first token.
     * @param source The source text.
     * @param precedence The operator table.
     * @return The new session.
     * @throws ParseException if the first token is malformed.
     */
    public static Parser primed(String source, PrecedenceTable precedence) throws ParseException {
        Parser parser = forSource(source, precedence);
        parser.advance();
        return parser;
    }

    /**
     * @return The token the parser is looking at, {@code null} before the first advance.
     */
    public Token current() {
        return cursor.current();
    }

    /**
     * Consumes the current token.
     * @return The new current token.
     * @throws ParseException if the next token is malformed.
     */
    public Token advance() throws ParseException {
        return cursor.advance();
    }

    /**
     * Discards the current token and refreshes the cursor; used to resume after an error.
     * A malformed literal met on the way stays current: the next construct starting at it
     * reports it as {@link ParseErrorCode#MALFORMED_NUMBER}, and the following call skips it,
     * so resynchronization always makes progress.
     */
    public void synchronize() {
        Token skipped = cursor.current();
        try {
            cursor.advance();
        } catch (ParseException e) {
            CompilerLogger.debug("Lexical error while resynchronizing at {}, reported by the next construct: {}",
                    e.getSourceInfo(), e.getMessage());
        }
        CompilerLogger.trace("Skipped {} for error recovery", skipped == null ? "nothing" : skipped.describe());
    }

    /**
     * @return A copy of the operator table this session reads.
     */
    public PrecedenceTable getPrecedenceTable() {
        return precedence.copy();
    }

    // region Expressions

    /**
     * Parses a primary expression: an identifier, a call, a number or a parenthesized expression.
     * @return The parsed expression.
     * @throws ParseException if the current token cannot start an expression.
     */
    public ExprNode parsePrimary() throws ParseException {
        Token token = cursor.current();
        if (token == null) {
            throw new IllegalStateException("Parser has not been primed, call advance() first");
        }
        switch (token.type()) {
            case IDENTIFIER:
                return parseIdentifierExpr();
            case NUMBER:
                return parseNumberExpr();
            case UNEXPECTED:
                // A malformed literal left behind by error recovery.
                throw ParseException.malformedNumber(token);
            case END_OF_FILE:
                String message = ParseErrorCode.UNEXPECTED_END_OF_INPUT.defaultMessage();
                if (openGroups > 0) {
                    message += ", expected ')'";
                }
                throw new ParseException(ParseErrorCode.UNEXPECTED_END_OF_INPUT, message, token);
            default:
                if (token.isChar('(')) {
                    return parseParenExpr();
                }
                throw new ParseException(ParseErrorCode.UNKNOWN_TOKEN, token);
        }
    }

    /**
     * Parses {@code numberexpr ::= number}.
     * @return The literal node.
     * @throws ParseException if the following token is malformed.
     */
    public ExprNode parseNumberExpr() throws ParseException {
        Token number = cursor.current();
        NumberLiteralNode result = new NumberLiteralNode(number.numberValue(), number.sourceInfo());
        cursor.advance();
        return result;
    }

    /**
     * Parses {@code parenexpr ::= '(' expression ')'}. The parentheses do not appear in the AST.
     * @return The inner expression.
     * @throws ParseException if the inner expression fails or the closing parenthesis is missing.
     */
    public ExprNode parseParenExpr() throws ParseException {
        cursor.advance(); // eat (
        ExprNode inner;
        openGroups++;
        try {
            inner = parseExpression();
        } finally {
            openGroups--;
        }
        if (!cursor.checkChar(')')) {
            throw new ParseException(ParseErrorCode.EXPECTED_CLOSING_PAREN, cursor.current());
        }
        cursor.advance(); // eat )
        return inner;
    }

    /**
     * Parses a variable reference or a call:
     * {@code identifier | identifier '(' (expression (',' expression)*)? ')'}.
     * @return A {@link VariableNode} or a {@link CallNode}.
     * @throws ParseException if an argument fails or the argument list is malformed.
     */
    public ExprNode parseIdentifierExpr() throws ParseException {
        Token identifier = cursor.current();
        String name = identifier.text();
        cursor.advance(); // eat identifier

        if (!cursor.checkChar('(')) {
            return new VariableNode(name, identifier.sourceInfo());
        }

        cursor.advance(); // eat (
        List<ExprNode> arguments = new ArrayList<>();
        openGroups++;
        try {
            if (!cursor.checkChar(')')) {
                while (true) {
                    arguments.add(parseExpression());
                    if (cursor.checkChar(')')) {
                        break;
                    }
                    if (!cursor.checkChar(',')) {
                        throw new ParseException(ParseErrorCode.EXPECTED_ARGUMENT_SEPARATOR, cursor.current());
                    }
                    cursor.advance(); // eat ,
                }
            }
        } finally {
            openGroups--;
        }
        cursor.advance(); // eat )
        return new CallNode(name, arguments, identifier.sourceInfo());
    }

    /**
     * Parses {@code expression ::= primary binoprhs}.
     * @return The expression tree.
     * @throws ParseException if any part of the expression fails.
     */
    public ExprNode parseExpression() throws ParseException {
        ExprNode lhs = parsePrimary();
        return parseBinaryRhs(0, lhs);
    }

    /**
     * Parses the operator/operand pairs following {@code lhs} by precedence climbing.
     * Only operators binding at least as tightly as {@code minPrecedence} are consumed;
     * operators of equal precedence associate to the left.
     * @param minPrecedence The weakest operator this call may consume.
     * @param lhs The already parsed left operand.
     * @return {@code lhs} itself if no operator qualifies, otherwise the combined tree.
     * @throws ParseException if an operand fails.
     */
    public ExprNode parseBinaryRhs(int minPrecedence, ExprNode lhs) throws ParseException {
        while (true) {
            int tokenPrecedence = precedence.lookup(cursor.current());

            // Not an operator (-1) or one that binds less tightly than the caller's: done.
            if (tokenPrecedence < minPrecedence) {
                return lhs;
            }

            char operator = cursor.current().charValue();
            cursor.advance(); // eat operator

            ExprNode rhs = parsePrimary();

            // If the operator after rhs binds tighter, it takes rhs as its left operand.
            int nextPrecedence = precedence.lookup(cursor.current());
            if (tokenPrecedence < nextPrecedence) {
                rhs = parseBinaryRhs(tokenPrecedence + 1, rhs);
            }

            lhs = new BinaryExprNode(operator, lhs, rhs, lhs.sourceInfo());
        }
    }

    // endregion

    // region Top level

    /**
     * Parses {@code prototype ::= identifier '(' identifier* ')'}. Parameter names are
     * separated by whitespace only.
     * @return The prototype.
     * @throws ParseException if the name, either parenthesis or a parameter is missing.
     */
    public PrototypeNode parsePrototype() throws ParseException {
        Token nameToken = cursor.current();
        if (nameToken.type() != TokenType.IDENTIFIER) {
            throw new ParseException(ParseErrorCode.EXPECTED_FUNCTION_NAME, nameToken);
        }
        cursor.advance();

        if (!cursor.checkChar('(')) {
            throw new ParseException(ParseErrorCode.EXPECTED_PROTOTYPE_OPEN_PAREN, cursor.current());
        }

        List<String> parameters = new ArrayList<>();
        while (cursor.advance().type() == TokenType.IDENTIFIER) {
            parameters.add(cursor.current().text());
        }
        if (!cursor.checkChar(')')) {
            throw new ParseException(ParseErrorCode.EXPECTED_PROTOTYPE_CLOSE_PAREN, cursor.current());
        }
        cursor.advance(); // eat )

        return new PrototypeNode(nameToken.text(), parameters, nameToken.sourceInfo());
    }

    /**
     * Parses {@code definition ::= 'def' prototype expression}.
     * @return The function definition.
     * @throws ParseException if the prototype or the body fails.
     */
    public FunctionNode parseDefinition() throws ParseException {
        cursor.advance(); // eat def
        PrototypeNode prototype = parsePrototype();
        if (cursor.isAtEnd() || cursor.checkChar(';')) {
            throw new ParseException(ParseErrorCode.EXPECTED_FUNCTION_BODY, cursor.current());
        }
        ExprNode body = parseExpression();
        CompilerLogger.trace("Parsed definition of '{}'", prototype.name());
        return new FunctionNode(prototype, body);
    }

    /**
     * Parses {@code external ::= 'extern' prototype}.
     * @return The declared prototype.
     * @throws ParseException if the prototype fails.
     */
    public PrototypeNode parseExtern() throws ParseException {
        cursor.advance(); // eat extern
        return parsePrototype();
    }

    /**
     * Parses a bare expression and wraps it into a function with an anonymous prototype,
     * so that consumers can treat it like any other callable unit.
     * @return The wrapping function.
     * @throws ParseException if the expression fails.
     */
    public FunctionNode parseTopLevelExpr() throws ParseException {
        SourceInfo start = cursor.current().sourceInfo();
        ExprNode body = parseExpression();
        return new FunctionNode(PrototypeNode.anonymous(start), body);
    }

    // endregion
}
