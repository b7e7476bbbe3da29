package com.libragraph.datasink.formats.riot;

import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.system.ErrorHandler;

/**
 * RIOT error handler that turns every error into an exception and drops warnings
 * without logging them. Sniffing runs most parsers against text in the wrong
 * format, so parser log output would only be noise.
 */
public final class StrictErrorHandler implements ErrorHandler {

    public static final StrictErrorHandler INSTANCE = new StrictErrorHandler();

    private StrictErrorHandler() {
    }

    @Override
    public void warning(String message, long line, long col) {
    }

    @Override
    public void error(String message, long line, long col) {
        throw new RiotException(position(message, line, col));
    }

    @Override
    public void fatal(String message, long line, long col) {
        throw new RiotException(position(message, line, col));
    }

    private static String position(String message, long line, long col) {
        if (line < 0) {
            return message;
        }
        return "[line " + line + ", col " + col + "] " + message;
    }
}
