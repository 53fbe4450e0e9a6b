package com.consullo.console.sink;

import com.consullo.console.capture.LogRecord;
import com.consullo.console.capture.LogSink;
import com.consullo.console.capture.OutputChannel;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Bounded in-memory history of shipped records, oldest evicted first.
 *
 * @since 1.0
 */
public final class LogHistorySink implements LogSink {

  private final Object lock = new Object();
  private final Deque<LogRecord> records = new ArrayDeque<>();
  private final int capacity;

  /**
   * Creates a history holding at most {@code capacity} records.
   *
   * @param capacity maximum retained records
   */
  public LogHistorySink(final int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
  }

  @Override
  public void emit(final String line, final OutputChannel destination) {
    final LogRecord record = LogRecord.of(line, destination, Instant.now());
    synchronized (lock) {
      while (records.size() >= capacity) {
        records.removeFirst();
      }
      records.addLast(record);
    }
  }

  /**
   * Returns a snapshot of retained records in arrival order.
   *
   * @return unmodifiable snapshot
   */
  public List<LogRecord> records() {
    synchronized (lock) {
      return Collections.unmodifiableList(new ArrayList<>(records));
    }
  }

  /**
   * Removes and returns all retained records.
   *
   * @return drained records in arrival order
   */
  public List<LogRecord> drain() {
    synchronized (lock) {
      final List<LogRecord> out = new ArrayList<>(records);
      records.clear();
      return out;
    }
  }

  public int size() {
    synchronized (lock) {
      return records.size();
    }
  }

  public int capacity() {
    return capacity;
  }
}
