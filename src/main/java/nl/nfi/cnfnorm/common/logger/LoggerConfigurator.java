package nl.nfi.cnfnorm.common.logger;

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

import static nl.nfi.cnfnorm.common.HostUtils.hostname;

// file logging when LOG_DIRECTORY_PATH is set, standard error at LOG_LEVEL otherwise
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final String DEFAULT_CONSOLE_LEVEL = "WARN";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        // read on configuration, the CLI sets it just before the first logger is created
        final String logDirectoryPath = System.getProperty("LOG_DIRECTORY_PATH");
        if (logDirectoryPath != null) {
            final Logger root = setupLogger("ROOT", "DEBUG", null);
            root.addAppender(createFileAppender(logDirectoryPath));
        } else {
            final Logger root = setupLogger("ROOT", System.getProperty("LOG_LEVEL", DEFAULT_CONSOLE_LEVEL), null);
            root.addAppender(createConsoleAppender());
        }
        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + hostname() + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + hostname() + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        return withEncoder(appender);
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
        appender.setTarget("System.err");
        return withEncoder(appender);
    }

    private Appender<ILoggingEvent> withEncoder(final OutputStreamAppender<ILoggingEvent> appender) {
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
