package com.consullo.console.capture;

import com.consullo.console.sched.ConsumerLoop;
import com.consullo.console.sink.LogHistorySink;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Multi-producer tests for the stream interceptor.
 *
 * @since 1.0
 */
public class StreamInterceptorConcurrencyTest {

  private static final int PRODUCERS = 16;
  private static final int LINES_PER_PRODUCER = 200;

  @Test
  @DisplayName("Should emit exactly one record per complete write under concurrent producers")
  void write_ConcurrentCompleteLines_OneRecordEach() throws Exception {
    final LogHistorySink sink = new LogHistorySink(PRODUCERS * LINES_PER_PRODUCER);
    final List<String> echoed = Collections.synchronizedList(new ArrayList<>());

    try (ConsumerLoop loop = new ConsumerLoop("concurrency-loop", 5L)) {
      loop.start();
      final StreamInterceptor interceptor = new StreamInterceptor(
          mock(ConsoleStream.class), echoed::add, OutputChannel.PRIMARY, loop, sink);

      runProducers(id -> {
        for (int i = 0; i < LINES_PER_PRODUCER; i++) {
          interceptor.write("p" + id + "-" + i + "\n");
        }
      });
    }

    final List<String> expected = new ArrayList<>();
    for (int id = 0; id < PRODUCERS; id++) {
      for (int i = 0; i < LINES_PER_PRODUCER; i++) {
        expected.add("p" + id + "-" + i);
      }
    }

    assertThat(sink.records()).extracting(LogRecord::text).containsExactlyInAnyOrderElementsOf(expected);
    assertThat(echoed).hasSize(PRODUCERS * LINES_PER_PRODUCER);
  }

  @Test
  @DisplayName("Should lose no text when partial writes from several threads are shipped by the loop")
  void write_ConcurrentPartials_AllTextDelivered() throws Exception {
    final LogHistorySink sink = new LogHistorySink(PRODUCERS * LINES_PER_PRODUCER);

    try (ConsumerLoop loop = new ConsumerLoop("partials-loop", 5L)) {
      loop.start();
      final StreamInterceptor interceptor = new StreamInterceptor(
          mock(ConsoleStream.class), text -> { }, OutputChannel.SECONDARY, loop, sink);

      runProducers(id -> {
        for (int i = 0; i < LINES_PER_PRODUCER; i++) {
          interceptor.write("x");
        }
      });
    }

    int total = 0;
    for (LogRecord r : sink.records()) {
      assertThat(r.channel()).isEqualTo(OutputChannel.SECONDARY);
      assertThat(r.text()).matches("x+");
      total += r.text().length();
    }
    assertThat(total).isEqualTo(PRODUCERS * LINES_PER_PRODUCER);
  }

  private static void runProducers(final Producer producer) throws Exception {
    final ExecutorService pool = Executors.newFixedThreadPool(PRODUCERS);
    final CountDownLatch go = new CountDownLatch(1);
    try {
      final List<Future<?>> futures = new ArrayList<>(PRODUCERS);
      for (int id = 0; id < PRODUCERS; id++) {
        final int producerId = id;
        futures.add(pool.submit(() -> {
          go.await();
          producer.produce(producerId);
          return null;
        }));
      }
      go.countDown();
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @FunctionalInterface
  private interface Producer {
    void produce(int id);
  }
}
