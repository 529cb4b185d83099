package org.kaleidoscope.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is declared with
 * {@link ExpectLog}, and fails it when an expected event does not occur often enough.
 * Class-level and method-level annotations are merged.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final Level WATCHED_LEVEL = Level.WARN;

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = new CapturingTurboFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        ExpectLog[] expects = merge(context, ExpectLog.class);
        List<CapturedEvent> events = filter.events;

        List<String> problems = new ArrayList<>();
        for (CapturedEvent e : events) {
            if (!e.level.isGreaterOrEqual(WATCHED_LEVEL)) continue;
            if (isExpected(e, expects)) continue;
            problems.add("Unexpected log: " + e);
        }
        for (ExpectLog expect : expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static <A extends java.lang.annotation.Annotation> A[] merge(ExtensionContext context, Class<A> type) {
        List<A> merged = new ArrayList<>();
        context.getTestClass().ifPresent(c -> merged.addAll(List.of(c.getAnnotationsByType(type))));
        context.getTestMethod().ifPresent(m -> merged.addAll(List.of(m.getAnnotationsByType(type))));
        @SuppressWarnings("unchecked")
        A[] array = (A[]) java.lang.reflect.Array.newInstance(type, merged.size());
        return merged.toArray(array);
    }

    private static boolean isExpected(CapturedEvent e, ExpectLog[] expects) {
        for (ExpectLog x : expects) {
            if (matches(e, x.level(), x.loggerPattern(), x.messagePattern())) return true;
        }
        return false;
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback consults turbo filters for isXxxEnabled() checks too; those have no format.
            if (format != null && level.isGreaterOrEqual(Level.INFO)) {
                events.add(new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage()));
            }
            return FilterReply.NEUTRAL;
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
