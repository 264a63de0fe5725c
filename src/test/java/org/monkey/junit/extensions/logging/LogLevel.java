package org.monkey.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} watches.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
