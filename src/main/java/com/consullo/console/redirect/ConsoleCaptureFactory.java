package com.consullo.console.redirect;

import com.consullo.console.capture.ConsoleStream;
import com.consullo.console.capture.LogSink;
import com.consullo.console.capture.OutputChannel;
import com.consullo.console.capture.StreamInterceptor;
import com.consullo.console.config.ConsoleCaptureConfig;
import com.consullo.console.io.InterceptingPrintStream;
import com.consullo.console.io.PrintStreamConsole;
import com.consullo.console.sched.ConsumerLoop;
import com.consullo.console.sched.Scheduler;
import com.consullo.console.sink.CompositeLogSink;
import com.consullo.console.sink.LogHistorySink;
import com.consullo.console.sink.Slf4jLogSink;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup routine that builds console captures with sensible defaults.
 *
 * <p>
 * This class centralizes the wiring decisions:
 * <ul>
 * <li>each interceptor echoes through its own passthrough console's {@code write}</li>
 * <li>PRIMARY wraps stdout, SECONDARY wraps stderr unless explicit consoles are given</li>
 * <li>raw byte writes are decoded as UTF-8</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class ConsoleCaptureFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleCaptureFactory.class);

  private ConsoleCaptureFactory() {
  }

  /**
   * Create a capture over the process's current stdout and stderr.
   *
   * @param scheduler deferred-call primitive for partial lines
   * @param sink record destination
   * @return capture
   */
  public static ConsoleCapture create(Scheduler scheduler, LogSink sink) {
    return create(scheduler, sink, PrintStreamConsole.stdout(), PrintStreamConsole.stderr());
  }

  /**
   * Create a capture over explicit passthrough consoles.
   *
   * @param scheduler deferred-call primitive for partial lines
   * @param sink record destination
   * @param primaryConsole console wrapped by the PRIMARY interceptor
   * @param secondaryConsole console wrapped by the SECONDARY interceptor
   * @return capture
   */
  public static ConsoleCapture create(
      Scheduler scheduler,
      LogSink sink,
      ConsoleStream primaryConsole,
      ConsoleStream secondaryConsole) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.notNull(primaryConsole, "primaryConsole must not be null");
    Validate.notNull(secondaryConsole, "secondaryConsole must not be null");

    StreamInterceptor primary = new StreamInterceptor(
        primaryConsole, primaryConsole::write, OutputChannel.PRIMARY, scheduler, sink);
    StreamInterceptor secondary = new StreamInterceptor(
        secondaryConsole, secondaryConsole::write, OutputChannel.SECONDARY, scheduler, sink);

    Charset charset = StandardCharsets.UTF_8;
    LOGGER.debug("create: primary terminal={}, secondary terminal={}",
        primaryConsole.isTerminal(), secondaryConsole.isTerminal());
    return new ConsoleCapture(
        primary,
        secondary,
        new InterceptingPrintStream(primary, charset),
        new InterceptingPrintStream(secondary, charset));
  }

  /**
   * Standard sink stack: SLF4J loggers named by the config, plus a bounded in-memory history.
   *
   * @param config configuration
   * @param history history sink to include
   * @return composite sink
   */
  public static LogSink standardSink(ConsoleCaptureConfig config, LogHistorySink history) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(history, "history must not be null");
    return CompositeLogSink.of(new Slf4jLogSink(config.primaryLoggerName(), config.secondaryLoggerName()), history);
  }

  /**
   * Create an in-memory history sized by the config.
   *
   * @param config configuration
   * @return empty history
   */
  public static LogHistorySink history(ConsoleCaptureConfig config) {
    Validate.notNull(config, "config must not be null");
    return new LogHistorySink(config.historyCapacity());
  }

  /**
   * Create an unstarted consumer loop named and paced by the config.
   *
   * @param config configuration
   * @return unstarted loop
   */
  public static ConsumerLoop consumerLoop(ConsoleCaptureConfig config) {
    Validate.notNull(config, "config must not be null");
    return new ConsumerLoop(config.consumerThreadName(), config.cycleIntervalMillis());
  }
}
