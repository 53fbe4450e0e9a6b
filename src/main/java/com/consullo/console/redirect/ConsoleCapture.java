package com.consullo.console.redirect;

import com.consullo.console.capture.OutputChannel;
import com.consullo.console.capture.StreamInterceptor;
import com.consullo.console.io.InterceptingPrintStream;
import java.io.PrintStream;
import org.apache.commons.lang3.Validate;

/**
 * The pair of interceptors (primary and secondary output) created at redirection time, plus their
 * {@link PrintStream} front ends.
 *
 * <p>
 * Output-producing code receives {@link #out()} / {@link #err()} (or the interceptors themselves) explicitly.
 * Replacing {@code System.out} is left to {@link SystemStreamRedirection}.
 * </p>
 *
 * @since 1.0
 */
public final class ConsoleCapture {

  private final StreamInterceptor primary;
  private final StreamInterceptor secondary;
  private final InterceptingPrintStream out;
  private final InterceptingPrintStream err;

  ConsoleCapture(
      StreamInterceptor primary,
      StreamInterceptor secondary,
      InterceptingPrintStream out,
      InterceptingPrintStream err) {
    Validate.notNull(primary, "primary must not be null");
    Validate.notNull(secondary, "secondary must not be null");
    Validate.notNull(out, "out must not be null");
    Validate.notNull(err, "err must not be null");
    this.primary = primary;
    this.secondary = secondary;
    this.out = out;
    this.err = err;
  }

  public StreamInterceptor primary() {
    return primary;
  }

  public StreamInterceptor secondary() {
    return secondary;
  }

  public PrintStream out() {
    return out;
  }

  public PrintStream err() {
    return err;
  }

  public StreamInterceptor interceptor(OutputChannel channel) {
    Validate.notNull(channel, "channel must not be null");
    return channel == OutputChannel.PRIMARY ? primary : secondary;
  }

  /**
   * Ships whatever both channels still hold, on the calling thread.
   */
  public void shipAll() {
    primary.ship();
    secondary.ship();
  }
}
