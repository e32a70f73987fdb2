package ai.legaldoc.reviser.logging;

import ai.legaldoc.reviser.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Iterator;
import org.slf4j.LoggerFactory;

/**
 * Switches every stream appender attached to the root logger (console and daily file) between the
 * plain-text pattern and {@link SimpleJsonLayout}.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} %X{article} - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * @return the number of appenders that received a new encoder
     */
    public static int configure(LogFormat format) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return 0;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        int updated = 0;
        for (Iterator<Appender<ILoggingEvent>> iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
                Encoder<ILoggingEvent> encoder = switch (format) {
                    case JSON -> jsonEncoder(context);
                    case TEXT -> textEncoder(context);
                };
                restartAppender(streamAppender, encoder);
                updated++;
            }
        }
        return updated;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
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
