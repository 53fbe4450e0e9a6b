package com.consullo.console.capture;

import com.consullo.console.sched.Scheduler;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console stream that echoes every write immediately and coalesces fragments into newline-free log records.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Echo each fragment verbatim to the passthrough console, outside any lock.</li>
 * <li>Append the fragment to a per-channel buffer under {@code lock}.</li>
 * <li>Ship synchronously when the fragment ends with a newline; otherwise ask the {@link Scheduler} to ship on
 * the next consumer cycle, so that {@code print(a); print(b); println()} lands as one record.</li>
 * </ul>
 * </p>
 *
 * <p>
 * The buffer is per channel, not per thread. Unterminated fragments from two producer threads that meet in the
 * same cycle end up in one record, in lock-acquisition order.
 * </p>
 *
 * @since 1.0
 */
public final class StreamInterceptor implements ConsoleStream {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamInterceptor.class);

  private final ConsoleStream original;
  private final EchoCallback echoCallback;
  private final OutputChannel destinationTag;
  private final Scheduler scheduler;
  private final LogSink logSink;

  private final Object lock = new Object();

  // Guarded by lock. Replaced, never cleared in place.
  private List<String> buffer = new ArrayList<>();

  // Guarded by lock. True while a deferred ship is queued and has not yet drained.
  private boolean shipPending;

  /**
   * Creates an interceptor for one output channel.
   *
   * @param original wrapped passthrough console (shared, not owned)
   * @param echoCallback receives every raw write synchronously
   * @param destinationTag channel tag attached to every record
   * @param scheduler deferred-call primitive for partial lines
   * @param logSink record destination
   */
  public StreamInterceptor(
      final ConsoleStream original,
      final EchoCallback echoCallback,
      final OutputChannel destinationTag,
      final Scheduler scheduler,
      final LogSink logSink) {
    Validate.notNull(original, "original must not be null");
    Validate.notNull(echoCallback, "echoCallback must not be null");
    Validate.notNull(destinationTag, "destinationTag must not be null");
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(logSink, "logSink must not be null");
    this.original = original;
    this.echoCallback = echoCallback;
    this.destinationTag = destinationTag;
    this.scheduler = scheduler;
    this.logSink = logSink;
  }

  @Override
  public void write(final String text) {
    final String fragment = String.valueOf(text);

    echoCallback.echo(fragment);

    if (fragment.endsWith("\n")) {
      // Append and drain in one step so two complete lines from different threads never share a record.
      final List<String> taken;
      synchronized (lock) {
        buffer.add(fragment);
        taken = takeBuffer();
      }
      emit(taken);
      return;
    }

    final boolean scheduleShip;
    synchronized (lock) {
      buffer.add(fragment);
      scheduleShip = !shipPending;
      shipPending = true;
    }
    if (scheduleShip) {
      requestDeferredShip();
    }
  }

  private void requestDeferredShip() {
    try {
      // Writers may be the consumer thread itself, hence the suppressed warning.
      scheduler.enqueue(this::ship, true, true);
    } catch (IllegalStateException e) {
      // Scheduler no longer accepts work (closed). Nothing will drain later, so ship now.
      LOGGER.debug("write: deferred ship rejected on {}, shipping synchronously: {}", destinationTag, e.getMessage());
      ship();
    }
  }

  /**
   * Drains the buffer and forwards its contents to the log sink as a single record.
   *
   * <p>Safe to call at any time from any thread. An empty buffer produces no record.
   */
  public void ship() {
    final List<String> taken;
    synchronized (lock) {
      taken = takeBuffer();
    }
    emit(taken);
  }

  @Override
  public void flush() {
    original.flush();
  }

  @Override
  public boolean isTerminal() {
    return original.isTerminal();
  }

  public OutputChannel channel() {
    return destinationTag;
  }

  /**
   * Returns buffered text that has not been shipped yet. Does not drain.
   *
   * @return concatenated pending fragments, empty if idle
   */
  public String pendingText() {
    synchronized (lock) {
      return String.join("", buffer);
    }
  }

  // Caller holds lock.
  private List<String> takeBuffer() {
    final List<String> taken = buffer;
    buffer = new ArrayList<>();
    shipPending = false;
    return taken;
  }

  private void emit(final List<String> taken) {
    if (taken.isEmpty()) {
      return;
    }
    final String line = stripTrailingNewline(String.join("", taken));
    if (line == null) {
      return;
    }
    LOGGER.trace("ship: {} fragment(s) -> {} chars on {}", taken.size(), line.length(), destinationTag);
    logSink.emit(line, destinationTag);
  }

  /**
   * Strips exactly one trailing line terminator. {@code "\r\n"} counts as one terminator.
   *
   * @return stripped line, or null if nothing was written at all
   */
  static String stripTrailingNewline(final String joined) {
    if (joined.isEmpty()) {
      return null;
    }
    if (joined.endsWith("\r\n")) {
      return joined.substring(0, joined.length() - 2);
    }
    if (joined.endsWith("\n")) {
      return joined.substring(0, joined.length() - 1);
    }
    return joined;
  }
}
