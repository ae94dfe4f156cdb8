package org.propensa.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the console output of compiler diagnostics by level: errors red, warnings (such as a
 * refused overwrite) yellow, everything else unchanged.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            default -> in;
        };
    }
}
