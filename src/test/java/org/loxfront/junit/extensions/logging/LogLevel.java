package org.loxfront.junit.extensions.logging;

/**
 * Levels a test can declare log expectations for.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
