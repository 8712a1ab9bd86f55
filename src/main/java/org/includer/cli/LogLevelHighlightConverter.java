package org.includer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter for log level coloring in console output.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Cyan</li>
 *   <li>DEBUG/TRACE - Default</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color.isEmpty() ? in : color + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_CYAN;
            default -> "";
        };
    }
}
