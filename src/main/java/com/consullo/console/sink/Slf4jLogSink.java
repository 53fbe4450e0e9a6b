package com.consullo.console.sink;

import com.consullo.console.capture.LogSink;
import com.consullo.console.capture.OutputChannel;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards records to SLF4J: primary output at INFO, secondary output at WARN, each on its own logger.
 *
 * <p>
 * A console appender may write back into an intercepted {@code System.out}. Records produced on a thread that is
 * already inside {@link #emit(String, OutputChannel)} are dropped so that such a setup cannot loop.
 * </p>
 *
 * @since 1.0
 */
public final class Slf4jLogSink implements LogSink {

  private static final ThreadLocal<Boolean> EMITTING = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private final Logger primaryLogger;
  private final Logger secondaryLogger;

  /**
   * Creates a sink logging to the named loggers.
   *
   * @param primaryLoggerName logger for {@link OutputChannel#PRIMARY}
   * @param secondaryLoggerName logger for {@link OutputChannel#SECONDARY}
   */
  public Slf4jLogSink(final String primaryLoggerName, final String secondaryLoggerName) {
    this(LoggerFactory.getLogger(Validate.notBlank(primaryLoggerName, "primaryLoggerName must not be blank")),
        LoggerFactory.getLogger(Validate.notBlank(secondaryLoggerName, "secondaryLoggerName must not be blank")));
  }

  /**
   * Creates a sink over explicit loggers.
   *
   * @param primaryLogger logger for {@link OutputChannel#PRIMARY}
   * @param secondaryLogger logger for {@link OutputChannel#SECONDARY}
   */
  public Slf4jLogSink(final Logger primaryLogger, final Logger secondaryLogger) {
    Validate.notNull(primaryLogger, "primaryLogger must not be null");
    Validate.notNull(secondaryLogger, "secondaryLogger must not be null");
    this.primaryLogger = primaryLogger;
    this.secondaryLogger = secondaryLogger;
  }

  @Override
  public void emit(final String line, final OutputChannel destination) {
    Validate.notNull(destination, "destination must not be null");
    if (EMITTING.get()) {
      return;
    }
    EMITTING.set(Boolean.TRUE);
    try {
      if (destination == OutputChannel.SECONDARY) {
        secondaryLogger.warn("{}", line);
      } else {
        primaryLogger.info("{}", line);
      }
    } finally {
      EMITTING.set(Boolean.FALSE);
    }
  }
}
