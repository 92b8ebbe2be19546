package com.cern;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

public class Logging {
    private static final String CERN_LOGGER_NAME = "com.cern";

    private Logging() {
    }

    public static Logger getCernLogger() {
        return Logger.getLogger(CERN_LOGGER_NAME);
    }

    /**
     * Raise or lower the threshold of the project logger; appenders come from log4j.properties.
     */
    public static Logger setupLogging(boolean verbose) {
        Logger logger = getCernLogger();
        if (verbose) {
            logger.setLevel(Level.DEBUG);
        }
        return logger;
    }
}
