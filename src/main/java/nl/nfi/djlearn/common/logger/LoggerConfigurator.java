package nl.nfi.djlearn.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import static nl.nfi.djlearn.common.HostUtils.hostname;

/**
 * Logs to a rolling file in the directory given by the {@code LOG_DIRECTORY_PATH} system
 * property, or to stderr when it is absent. The root level is taken from {@code LOG_LEVEL}.
 */
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{2000} -%kvp- %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        final String logDirectoryPath = System.getProperty("LOG_DIRECTORY_PATH");
        final String level = System.getProperty("LOG_LEVEL", "INFO");

        setContext(loggerContext);

        final Appender<ILoggingEvent> appender = logDirectoryPath == null
                ? createConsoleAppender()
                : createFileAppender(logDirectoryPath);
        final Logger root = setupLogger("ROOT", level, null);
        root.addAppender(appender);

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        // stdout carries the learned constraints
        appender.setTarget("System.err");
        return start(appender);
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + hostname() + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + hostname() + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("256MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        return start(appender);
    }

    private Appender<ILoggingEvent> start(final OutputStreamAppender<ILoggingEvent> appender) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);
        appender.start();
        return appender;
    }
}
