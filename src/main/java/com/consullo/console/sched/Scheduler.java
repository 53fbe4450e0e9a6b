package com.consullo.console.sched;

/**
 * Deferred-call primitive: any thread may enqueue a callback that later runs on a single designated consumer
 * context.
 *
 * @since 1.0
 */
public interface Scheduler {

  /**
   * Enqueues a callback to run at the next processing cycle of the consumer context. Each enqueue runs the
   * callback at most once.
   *
   * @param callback zero-argument callback
   * @param crossThread true if the caller may be running off the consumer context
   * @param suppressWarning true to silence the diagnostic raised when a cross-thread enqueue is issued from the
   *     consumer context itself
   * @throws IllegalStateException if the scheduler no longer accepts work, or a same-thread enqueue arrives
   *     from a foreign thread
   */
  void enqueue(final Runnable callback, final boolean crossThread, final boolean suppressWarning);
}
