package com.consullo.console.capture;

import java.time.Instant;

/**
 * One shipped log line together with the channel that produced it.
 *
 * @since 1.0
 */
public final class LogRecord {

  private final String text;
  private final OutputChannel channel;
  private final Instant timestamp;

  private LogRecord(String text, OutputChannel channel, Instant timestamp) {
    this.text = text;
    this.channel = channel;
    this.timestamp = timestamp;
  }

  public static LogRecord of(String text, OutputChannel channel, Instant ts) {
    if (text == null || channel == null || ts == null) {
      throw new IllegalArgumentException("text/channel/ts must not be null.");
    }
    return new LogRecord(text, channel, ts);
  }

  public String text() {
    return text;
  }

  public OutputChannel channel() {
    return channel;
  }

  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return channel + ": " + text;
  }
}
