package com.consullo.console.capture;

/**
 * Destination for finished, newline-free log records.
 *
 * <p>Implementations must be safe to call from more than one thread over time. A single interceptor
 * never has two of its own emissions in flight concurrently for the same drained buffer.
 *
 * @since 1.0
 */
public interface LogSink {

  /**
   * Stores or forwards one record.
   *
   * @param line record text without trailing newline
   * @param destination channel that produced the record
   */
  void emit(final String line, final OutputChannel destination);
}
