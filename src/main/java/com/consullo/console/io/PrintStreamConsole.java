package com.consullo.console.io;

import com.consullo.console.capture.ConsoleStream;
import java.io.PrintStream;
import org.apache.commons.lang3.Validate;

/**
 * Passthrough console backed by a {@link PrintStream}, typically the process's original stdout or stderr.
 *
 * @since 1.0
 */
public final class PrintStreamConsole implements ConsoleStream {

  private final PrintStream stream;
  private final boolean terminal;

  /**
   * Wraps a print stream.
   *
   * @param stream underlying stream (not owned, never closed here)
   * @param terminal whether the stream is attached to an interactive terminal
   */
  public PrintStreamConsole(final PrintStream stream, final boolean terminal) {
    Validate.notNull(stream, "stream must not be null");
    this.stream = stream;
    this.terminal = terminal;
  }

  /**
   * Wraps the current {@link System#out}.
   *
   * @return console over stdout
   */
  public static PrintStreamConsole stdout() {
    return new PrintStreamConsole(System.out, System.console() != null);
  }

  /**
   * Wraps the current {@link System#err}.
   *
   * @return console over stderr
   */
  public static PrintStreamConsole stderr() {
    return new PrintStreamConsole(System.err, System.console() != null);
  }

  @Override
  public void write(final String text) {
    stream.print(text);
    stream.flush();
  }

  @Override
  public void flush() {
    stream.flush();
  }

  @Override
  public boolean isTerminal() {
    return terminal;
  }

  public PrintStream stream() {
    return stream;
  }
}
