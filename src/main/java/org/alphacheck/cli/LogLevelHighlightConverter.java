package org.alphacheck.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colours console output by log level.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Default</li>
 *   <li>DEBUG/TRACE - Dim</li>
 * </ul>
 * Colouring is skipped entirely when the {@code NO_COLOR} environment variable is set
 * (see no-color.org), so CI logs stay free of escape codes.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_DIM = "\u001B[2m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        Level level = event.getLevel();
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_DIM + in + ANSI_RESET;
            default -> in;
        };
    }
}
