package com.consullo.console.capture;

/**
 * Logical output channel an interceptor feeds into the log sink.
 *
 * @since 1.0
 */
public enum OutputChannel {
  PRIMARY,
  SECONDARY
}
