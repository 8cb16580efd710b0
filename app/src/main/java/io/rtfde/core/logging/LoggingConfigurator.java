package io.rtfde.core.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import io.rtfde.core.config.ChannelLevel;
import io.rtfde.core.config.DiagnosticsConfig;
import io.rtfde.core.config.LogFormat;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link DiagnosticsConfig} to logback: switches the console encoder format and aligns each channel
 * logger's level with the configured threshold, so events the gate lets through are not dropped by logback.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(DiagnosticsConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        applyFormat(context, config.logFormat());
        applyChannelLevels(config);
    }

    /**
     * Sets each channel logger to the level configured for its channel, overriding logback.xml.
     */
    public static void applyChannelLevels(DiagnosticsConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        for (DiagnosticChannel channel : DiagnosticChannel.values()) {
            context.getLogger(channel.loggerName()).setLevel(toLogbackLevel(config.levelOf(channel)));
        }
    }

    static Level toLogbackLevel(ChannelLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
            case OFF -> Level.OFF;
        };
    }

    private static void applyFormat(LoggerContext context, LogFormat format) {
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> outputStreamAppender) {
                Encoder<ILoggingEvent> encoder = switch (format) {
                    case JSON -> jsonEncoder(context);
                    case TEXT -> textEncoder(context);
                };
                restartAppender(outputStreamAppender, encoder);
            }
        }
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        DiagnosticJsonLayout layout = new DiagnosticJsonLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
