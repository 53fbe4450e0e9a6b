package com.consullo.console.demo;

import com.consullo.console.capture.LogRecord;
import com.consullo.console.config.ConsoleCaptureConfig;
import com.consullo.console.redirect.ConsoleCapture;
import com.consullo.console.redirect.ConsoleCaptureFactory;
import com.consullo.console.redirect.SystemStreamRedirection;
import com.consullo.console.sched.ConsumerLoop;
import com.consullo.console.sink.LogHistorySink;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that redirects stdout/stderr, runs a few concurrent producers, and prints the coalesced records.
 *
 * @since 1.0
 */
public final class ConsoleCaptureDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleCaptureDemo.class);

  private ConsoleCaptureDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional producer count
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final int producers = args.length > 0 ? Integer.parseInt(args[0]) : 3;
    final PrintStream console = System.out;

    final ConsoleCaptureConfig config = ConsoleCaptureConfig.load();
    final LogHistorySink history = ConsoleCaptureFactory.history(config);

    try (ConsumerLoop loop = ConsoleCaptureFactory.consumerLoop(config)) {
      loop.start();
      final ConsoleCapture capture = ConsoleCaptureFactory.create(loop, ConsoleCaptureFactory.standardSink(config, history));

      try (SystemStreamRedirection ignored = SystemStreamRedirection.install(capture)) {
        LOGGER.info("Started demo with {} producer(s)", producers);

        final List<Thread> threads = new ArrayList<>(producers);
        for (int i = 0; i < producers; i++) {
          final Thread t = new Thread(new ConsoleFixtureProducer("producer-" + i, System.out, System.err),
              "DemoProducer-" + i);
          threads.add(t);
          t.start();
        }
        for (Thread t : threads) {
          t.join();
        }
      }
    }

    console.println("=== Captured Records ===");
    final List<LogRecord> records = history.records();
    for (LogRecord r : records) {
      console.println(r);
    }
    console.println("=== End Records (" + records.size() + " records) ===");
    LOGGER.info("Demo completed");
  }
}
