package com.plotbinding.core.model;

import java.util.Locale;

/**
 * BokehJS client-side log levels, most verbose first.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    /**
     * Returns the name BokehJS expects in {@code Bokeh.set_log_level}.
     *
     * @return lower-case level name
     */
    public String clientName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether this level logs more than another one.
     *
     * @param other level to compare with
     * @return true if this level is strictly more verbose
     */
    public boolean isMoreVerboseThan(LogLevel other) {
        return ordinal() < other.ordinal();
    }
}
