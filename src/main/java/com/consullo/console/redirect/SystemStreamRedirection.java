package com.consullo.console.redirect;

import java.io.PrintStream;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in process-wide redirection of {@code System.out} and {@code System.err} to a {@link ConsoleCapture}.
 *
 * <p>Closing restores the streams that were installed before, returning the process to direct passthrough.
 *
 * @since 1.0
 */
public final class SystemStreamRedirection implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemStreamRedirection.class);

  private final ConsoleCapture capture;
  private final PrintStream previousOut;
  private final PrintStream previousErr;
  private boolean restored;

  private SystemStreamRedirection(ConsoleCapture capture, PrintStream previousOut, PrintStream previousErr) {
    this.capture = capture;
    this.previousOut = previousOut;
    this.previousErr = previousErr;
  }

  /**
   * Installs the capture's print streams as {@code System.out} and {@code System.err}.
   *
   * @param capture capture to install
   * @return handle that restores the previous streams on close
   */
  public static synchronized SystemStreamRedirection install(ConsoleCapture capture) {
    Validate.notNull(capture, "capture must not be null");
    SystemStreamRedirection r = new SystemStreamRedirection(capture, System.out, System.err);
    System.setOut(capture.out());
    System.setErr(capture.err());
    LOGGER.debug("install: System.out/System.err redirected");
    return r;
  }

  public ConsoleCapture capture() {
    return capture;
  }

  public synchronized boolean isRestored() {
    return restored;
  }

  /**
   * Ships pending text and restores the previous streams. Calling it again has no effect.
   */
  @Override
  public void close() {
    synchronized (SystemStreamRedirection.class) {
      synchronized (this) {
        if (restored) {
          return;
        }
        restored = true;
      }
      capture.shipAll();
      System.setOut(previousOut);
      System.setErr(previousErr);
    }
    LOGGER.debug("close: System.out/System.err restored");
  }
}
