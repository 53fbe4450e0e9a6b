package com.consullo.console.capture;

/**
 * Minimal text console shape shared by the passthrough console and the interceptor that replaces it.
 *
 * <p>Anything that previously wrote straight to a console can be handed a {@link StreamInterceptor}
 * instead, since both satisfy this interface.
 *
 * @since 1.0
 */
public interface ConsoleStream {

  /**
   * Writes a text fragment.
   *
   * @param text fragment, possibly empty, multi-line or without a trailing newline
   */
  void write(final String text);

  /**
   * Flushes the underlying console.
   */
  void flush();

  /**
   * Returns true if the underlying console is attached to a terminal.
   *
   * @return true if interactive terminal
   */
  boolean isTerminal();
}
