package org.tapline.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level of console build output: failures red, warnings
 * yellow, build summaries blue.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) {
            return RED + in + RESET;
        }
        if (level == Level.WARN_INT) {
            return YELLOW + in + RESET;
        }
        if (level == Level.INFO_INT) {
            return BLUE + in + RESET;
        }
        return in;
    }
}
