package org.janelia.epochreg.util;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for manipulating logback logging levels and appenders from code.
 *
 * @author Eric Trautman
 */
public class LogbackTools {

    public static void setRootLogLevel(final Level rootLogLevel) {
        setLogLevel(ROOT_LOGGER_NAME, rootLogLevel);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        if (logger == null) {
            throw new IllegalArgumentException("logger with name '" + loggerName + "' not found");
        }
        logger.setLevel(logLevel);
    }

    /**
     * Applies the level for the specified verbosity to the root logger and to the project loggers,
     * so that levels configured for the project package cannot mask the requested verbosity.
     */
    public static void setVerbosity(final int verbosity) {
        final Level level = getLevelForVerbosity(verbosity);
        setRootLogLevel(level);
        setLogLevel(PROJECT_LOGGER_NAME, level);
    }

    /**
     * Maps a verbosity level to a log level.
     * Level 0 only shows warnings, level 1 is the default informational level,
     * anything higher turns on debug logging.
     */
    public static Level getLevelForVerbosity(final int verbosity) {
        final Level level;
        if (verbosity < 1) {
            level = Level.WARN;
        } else if (verbosity == 1) {
            level = Level.INFO;
        } else {
            level = Level.DEBUG;
        }
        return level;
    }

    /**
     * Adds a file appender named [prefix].[yyyyMMdd_HHmmss].log in the specified directory to the root logger.
     *
     * @return the log file.
     */
    public static File setRootFileAppenderWithTimestamp(final File logDirectory,
                                                        final String logFileNamePrefix) {
        FileUtil.ensureWritableDirectory(logDirectory);
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMdd_HHmmss");
        final String logFileName = logFileNamePrefix + "." + sdf.format(new Date()) + ".log";
        final File logFile = new File(logDirectory, logFileName);
        setRootFileAppender(logFile);
        return logFile;
    }

    public static void setRootFileAppender(final File logFile) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);

        // detach previous run file appender if it already exists
        if (rootLogger.getAppender(RUN_FILE_APPENDER_NAME) != null) {
            rootLogger.detachAppender(RUN_FILE_APPENDER_NAME);
        }

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(RUN_FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setEncoder(encoder);
        fileAppender.setContext(loggerContext);
        fileAppender.start();
        rootLogger.addAppender(fileAppender);
    }

    public static final String PROJECT_LOGGER_NAME = "org.janelia.epochreg";
    public static final String RUN_FILE_APPENDER_NAME = "runFileAppender";

    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
}
