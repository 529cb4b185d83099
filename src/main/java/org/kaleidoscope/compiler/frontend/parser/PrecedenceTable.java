package org.kaleidoscope.compiler.frontend.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Holds the precedence of every binary operator the parser accepts. Higher
 * values bind tighter. A character without an entry is not an infix operator.
 * <p>
 * The table is configuration: it is filled before parsing starts. Each
 * {@link Parser} works on its own {@link #copy()}, so changing a table never
 * affects a parse that is already running.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * kaleidoscope.parser.binop-precedence {
 *   "&lt;" = 10
 *   "+" = 20
 *   "-" = 20
 *   "*" = 40
 * }
 * </pre>
 */
public final class PrecedenceTable {

    /** The configuration path of the operator table. */
    public static final String CONFIG_PATH = "kaleidoscope.parser.binop-precedence";

    /** Returned by {@link #lookup(Token)} for anything that is not an operator. */
    public static final int NO_PRECEDENCE = -1;

    private static final String RESERVED = "(),;#.";

    private final Map<Character, Integer> precedences = new TreeMap<>();

    /**
     * Creates an empty table: no character is an operator.
     */
    public PrecedenceTable() {
    }

    private PrecedenceTable(Map<Character, Integer> precedences) {
        this.precedences.putAll(precedences);
    }

    /**
     * Creates the table of the standard language: {@code <} = 10, {@code +} = 20,
     * {@code -} = 20, {@code *} = 40.
     * @return A new table with the standard operators.
     */
    public static PrecedenceTable defaults() {
        return new PrecedenceTable()
                .set('<', 10)
                .set('+', 20)
                .set('-', 20)
                .set('*', 40);
    }

    /**
     * Reads the table from {@value #CONFIG_PATH}. Falls back to {@link #defaults()} when
     * the path is absent.
     * @param config The configuration to read.
     * @return A new table.
     * @throws ConfigException.BadValue if a key is not a single operator character or
     *         a value is not a positive whole number.
     * @throws ConfigException.WrongType if a value is not a number.
     */
    public static PrecedenceTable fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        ConfigObject object = config.getObject(CONFIG_PATH);
        PrecedenceTable table = new PrecedenceTable();
        for (Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            String key = entry.getKey();
            ConfigValue value = entry.getValue();
            String path = CONFIG_PATH + "." + ConfigUtil.quoteString(key);
            if (key.length() != 1) {
                throw new ConfigException.BadValue(value.origin(), path,
                        "operator must be a single character, got '" + key + "'");
            }
            if (!(value.unwrapped() instanceof Number number)) {
                throw new ConfigException.WrongType(value.origin(), path, "NUMBER", value.valueType().name());
            }
            double precedence = number.doubleValue();
            if (precedence != Math.rint(precedence) || precedence > Integer.MAX_VALUE || precedence < Integer.MIN_VALUE) {
                throw new ConfigException.BadValue(value.origin(), path,
                        "precedence must be a whole number, got " + value.render());
            }
            try {
                table.set(key.charAt(0), (int) precedence);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(value.origin(), path, e.getMessage(), e);
            }
        }
        return table;
    }

    /**
     * Declares or redefines a binary operator.
     * @param operator The operator character.
     * @param precedence The binding strength, must be positive.
     * @return This table, for chaining.
     * @throws IllegalArgumentException if the precedence is not positive or the character
     *         can never be lexed as a single-character token.
     */
    public PrecedenceTable set(char operator, int precedence) {
        if (precedence <= 0) {
            throw new IllegalArgumentException("Precedence of '" + operator + "' must be positive, got " + precedence);
        }
        if (!canBeOperator(operator)) {
            throw new IllegalArgumentException("'" + operator + "' cannot be used as a binary operator");
        }
        precedences.put(operator, precedence);
        return this;
    }

    /**
     * Removes an operator. Removing an unknown operator has no effect.
     * @param operator The operator character.
     * @return This table, for chaining.
     */
    public PrecedenceTable remove(char operator) {
        precedences.remove(operator);
        return this;
    }

    /**
     * @param operator The character to test.
     * @return true if the character is a declared operator.
     */
    public boolean contains(char operator) {
        return precedences.containsKey(operator);
    }

    /**
     * Gets the precedence of a token if it is a declared binary operator.
     * @param token The token to look up, may be {@code null}.
     * @return The precedence, or {@link #NO_PRECEDENCE} if the token is not an operator.
     */
    public int lookup(Token token) {
        if (token == null || token.type() != TokenType.CHAR) {
            return NO_PRECEDENCE;
        }
        Integer precedence = precedences.get(token.charValue());
        return precedence == null || precedence <= 0 ? NO_PRECEDENCE : precedence;
    }

    /**
     * @return An unmodifiable snapshot of the table, ordered by operator character.
     */
    public Map<Character, Integer> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(precedences));
    }

    /**
     * @return An independent copy of this table.
     */
    public PrecedenceTable copy() {
        return new PrecedenceTable(precedences);
    }

    private static boolean canBeOperator(char c) {
        if (Character.isWhitespace(c) || c == 0x0B) return false;
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) return false;
        return RESERVED.indexOf(c) < 0;
    }

    @Override
    public String toString() {
        return "PrecedenceTable" + precedences;
    }
}
