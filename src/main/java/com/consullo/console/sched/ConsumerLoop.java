package com.consullo.console.sched;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-consumer execution context backed by an unbounded task queue.
 *
 * <p>
 * Each cycle drains the callbacks queued before the cycle began and runs them in enqueue order, then runs the
 * registered per-cycle tasks. Callbacks enqueued while a cycle is running are picked up by the next cycle.
 * </p>
 *
 * <p>
 * The loop can either own a daemon thread ({@link #start()}) or be driven by a host thread that calls
 * {@link #runCycle()} itself after {@link #bindToCurrentThread()}.
 * </p>
 *
 * @since 1.0
 */
public final class ConsumerLoop implements Scheduler, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerLoop.class);

  private static final Runnable WAKE = () -> {
  };

  private final String threadName;
  private final long cycleIntervalMillis;

  private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
  private final List<Runnable> cycleTasks = new CopyOnWriteArrayList<>();

  private final Object lifecycleLock = new Object();
  private Thread loopThread;

  private volatile Thread consumerThread;
  private volatile boolean closed;

  /**
   * Creates a loop that is not yet bound to any thread.
   *
   * @param threadName name of the owned thread when started
   * @param cycleIntervalMillis maximum idle wait between cycles
   */
  public ConsumerLoop(final String threadName, final long cycleIntervalMillis) {
    Validate.notBlank(threadName, "threadName must not be blank");
    Validate.isTrue(cycleIntervalMillis > 0, "cycleIntervalMillis must be positive");
    this.threadName = threadName;
    this.cycleIntervalMillis = cycleIntervalMillis;
  }

  @Override
  public void enqueue(final Runnable callback, final boolean crossThread, final boolean suppressWarning) {
    Validate.notNull(callback, "callback must not be null");

    final Thread bound = consumerThread;
    if (bound != null) {
      final boolean onContext = Thread.currentThread() == bound;
      if (!crossThread && !onContext) {
        throw new IllegalStateException("enqueue from foreign thread '" + Thread.currentThread().getName()
            + "' requires crossThread=true.");
      }
      if (crossThread && onContext && !suppressWarning) {
        LOGGER.warn("enqueue: cross-thread call issued from consumer thread '{}'", bound.getName());
      }
    }

    // Checked and added under lifecycleLock so close() cannot slip between them and miss the callback.
    synchronized (lifecycleLock) {
      if (closed) {
        throw new IllegalStateException("ConsumerLoop '" + threadName + "' is closed.");
      }
      queue.add(callback);
    }
  }

  /**
   * Registers work that runs once per cycle, after the queued callbacks.
   *
   * @param task per-cycle task
   */
  public void addCycleTask(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    cycleTasks.add(task);
  }

  /**
   * Binds the consumer context to the calling thread. The caller then drives cycles with {@link #runCycle()}.
   */
  public void bindToCurrentThread() {
    synchronized (lifecycleLock) {
      Validate.validState(loopThread == null, "ConsumerLoop '%s' already owns a thread", threadName);
      consumerThread = Thread.currentThread();
    }
  }

  /**
   * Starts the owned daemon thread, which becomes the consumer context.
   */
  public void start() {
    synchronized (lifecycleLock) {
      Validate.validState(!closed, "ConsumerLoop '%s' is closed", threadName);
      Validate.validState(loopThread == null, "ConsumerLoop '%s' already started", threadName);
      Validate.validState(consumerThread == null, "ConsumerLoop '%s' is bound to another thread", threadName);

      final Thread t = new Thread(this::runLoop, threadName);
      t.setDaemon(true);
      loopThread = t;
      consumerThread = t;
      t.start();
    }
    LOGGER.debug("start: consumer thread '{}' started", threadName);
  }

  /**
   * Runs one cycle on the calling thread.
   *
   * @return number of queued callbacks executed
   * @throws IllegalStateException if called off the bound consumer thread
   */
  public int runCycle() {
    final Thread bound = consumerThread;
    if (bound != null && bound != Thread.currentThread()) {
      throw new IllegalStateException("runCycle must be called on consumer thread '" + bound.getName() + "'.");
    }
    return runCycle(null);
  }

  public boolean isConsumerThread() {
    return consumerThread == Thread.currentThread();
  }

  public int pendingCount() {
    return queue.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops accepting work and delivers what is already queued.
   *
   * <p>With an owned thread, that thread runs the final cycle and is joined. Otherwise the final cycle runs on the
   * caller if it is (or no thread is) the consumer context.
   */
  @Override
  public void close() throws InterruptedException {
    final Thread owned;
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
      owned = loopThread;
    }

    if (owned != null) {
      queue.add(WAKE);
      owned.join(TimeUnit.SECONDS.toMillis(5));
      if (owned.isAlive()) {
        LOGGER.warn("close: consumer thread '{}' did not stop within 5s", threadName);
      }
      return;
    }

    final Thread bound = consumerThread;
    if (bound == null || bound == Thread.currentThread()) {
      runCycle(null);
    } else if (!queue.isEmpty()) {
      LOGGER.warn("close: {} callback(s) left undelivered; consumer thread '{}' is not the caller",
          queue.size(), bound.getName());
    }
  }

  private void runLoop() {
    try {
      while (!closed) {
        final Runnable head = queue.poll(cycleIntervalMillis, TimeUnit.MILLISECONDS);
        runCycle(head);
      }
      // Final cycle for callbacks queued before close.
      runCycle(null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("runLoop: consumer thread '{}' interrupted", threadName);
    }
    LOGGER.debug("runLoop: consumer thread '{}' exiting", threadName);
  }

  private int runCycle(final Runnable head) {
    final List<Runnable> batch = new ArrayList<>();
    if (head != null) {
      batch.add(head);
    }
    queue.drainTo(batch);

    int executed = 0;
    for (Runnable callback : batch) {
      if (callback == WAKE) {
        continue;
      }
      execute(callback, "callback");
      executed++;
    }

    for (Runnable task : cycleTasks) {
      execute(task, "cycle task");
    }
    return executed;
  }

  private static void execute(final Runnable r, final String what) {
    try {
      r.run();
    } catch (RuntimeException e) {
      LOGGER.error("runCycle: {} failed: {}", what, e.getMessage(), e);
    }
  }
}
