package io.dapprunner.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import io.dapprunner.api.LogLevel;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the logback configuration from {@code logback.xml} to the command line: console threshold
 * and an optional debug-level log file.
 */
final class LoggingSetup {
    static final String CONSOLE_APPENDER = "STDERR";
    static final String FILE_APPENDER = "FILE";
    static final String PATTERN = "[%d{yyyy-MM-dd'T'HH:mm:ss.SSSXXX} %-5level %logger{36}] %msg%n";

    private LoggingSetup() {}

    static void configure(LogLevel consoleLevel, Path logFile) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        var root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        var console = root.getAppender(CONSOLE_APPENDER);
        if (console != null) {
            var threshold = new ThresholdFilter();
            threshold.setContext(context);
            threshold.setLevel(consoleLevel.name());
            threshold.start();
            console.clearAllFilters();
            console.addFilter(threshold);
        }
        if (logFile == null) {
            root.setLevel(Level.toLevel(consoleLevel.name()));
            return;
        }
        root.setLevel(Level.DEBUG);

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        var file = new FileAppender<ILoggingEvent>();
        file.setContext(context);
        file.setName(FILE_APPENDER);
        file.setFile(logFile.toAbsolutePath().toString());
        file.setAppend(false);
        file.setEncoder(encoder);
        file.start();
        root.detachAppender(FILE_APPENDER);
        root.addAppender(file);
        LoggerFactory.getLogger(LoggingSetup.class).info("Using log file `{}`", logFile.toAbsolutePath());
    }
}
