package com.consullo.console.capture;

/**
 * Receives every raw write verbatim and immediately, bypassing any buffering.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface EchoCallback {

  /**
   * Echoes a raw fragment to the visible console. Must not throw.
   *
   * @param text raw fragment, unmodified
   */
  void echo(String text);
}
