package org.kaleidoscope.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frontend-internal logger with an integer verbosity gate in front of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 * Messages above the gate are dropped before they reach SLF4J. The CLI sets the
 * gate from {@value #CONFIG_PATH}.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    /** The configuration path of the verbosity level. */
    public static final String CONFIG_PATH = "kaleidoscope.parser.verbosity";
    private static volatile int level = TRACE;

    private static final Logger logger = LoggerFactory.getLogger("org.kaleidoscope.compiler");

    private CompilerLogger() {}

    /**
     * Sets the verbosity level. Values outside the known range are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a debug message.
     * @param format The SLF4J message pattern.
     * @param args The pattern arguments.
     */
    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    /**
     * Logs a trace message.
     * @param format The SLF4J message pattern.
     * @param args The pattern arguments.
     */
    public static void trace(String format, Object... args) {
        if (level >= TRACE && logger.isTraceEnabled()) logger.trace(format, args);
    }
}
