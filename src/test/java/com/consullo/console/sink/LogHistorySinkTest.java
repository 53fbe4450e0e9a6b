package com.consullo.console.sink;

import com.consullo.console.capture.LogRecord;
import com.consullo.console.capture.OutputChannel;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the bounded in-memory history sink.
 *
 * @since 1.0
 */
public class LogHistorySinkTest {

  @Test
  @DisplayName("Should keep records in arrival order with their channel")
  void emit_Records_RetainedInOrder() {
    final LogHistorySink sink = new LogHistorySink(10);

    sink.emit("one", OutputChannel.PRIMARY);
    sink.emit("two", OutputChannel.SECONDARY);

    final List<LogRecord> records = sink.records();
    assertThat(records).extracting(LogRecord::text).containsExactly("one", "two");
    assertThat(records).extracting(LogRecord::channel)
        .containsExactly(OutputChannel.PRIMARY, OutputChannel.SECONDARY);
    assertThat(records.get(0).timestamp()).isNotNull();
  }

  @Test
  @DisplayName("Should evict the oldest record when full")
  void emit_OverCapacity_EvictsOldest() {
    final LogHistorySink sink = new LogHistorySink(2);

    sink.emit("a", OutputChannel.PRIMARY);
    sink.emit("b", OutputChannel.PRIMARY);
    sink.emit("c", OutputChannel.PRIMARY);

    assertThat(sink.size()).isEqualTo(2);
    assertThat(sink.records()).extracting(LogRecord::text).containsExactly("b", "c");
  }

  @Test
  @DisplayName("Should empty the history on drain")
  void drain_ReturnsAndClears() {
    final LogHistorySink sink = new LogHistorySink(5);
    sink.emit("x", OutputChannel.PRIMARY);

    assertThat(sink.drain()).extracting(LogRecord::text).containsExactly("x");
    assertThat(sink.size()).isZero();
    assertThat(sink.drain()).isEmpty();
  }

  @Test
  @DisplayName("Should return an unmodifiable snapshot")
  void records_Snapshot_IsUnmodifiable() {
    final LogHistorySink sink = new LogHistorySink(5);
    sink.emit("x", OutputChannel.PRIMARY);

    final List<LogRecord> snapshot = sink.records();
    sink.emit("y", OutputChannel.PRIMARY);

    assertThat(snapshot).hasSize(1);
    assertThatThrownBy(() -> snapshot.add(snapshot.get(0))).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Should reject a non-positive capacity")
  void constructor_ZeroCapacity_Throws() {
    assertThatThrownBy(() -> new LogHistorySink(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
