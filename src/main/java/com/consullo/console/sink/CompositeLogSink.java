package com.consullo.console.sink;

import com.consullo.console.capture.LogSink;
import com.consullo.console.capture.OutputChannel;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans each record out to several sinks in order. A failing sink does not stop delivery to the rest.
 *
 * @since 1.0
 */
public final class CompositeLogSink implements LogSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(CompositeLogSink.class);

  private final List<LogSink> delegates;

  public CompositeLogSink(final List<LogSink> delegates) {
    Validate.notNull(delegates, "delegates must not be null");
    Validate.noNullElements(delegates, "delegates must not contain null");
    this.delegates = List.copyOf(delegates);
  }

  public static CompositeLogSink of(final LogSink... delegates) {
    return new CompositeLogSink(List.of(delegates));
  }

  @Override
  public void emit(final String line, final OutputChannel destination) {
    for (LogSink sink : delegates) {
      try {
        sink.emit(line, destination);
      } catch (RuntimeException e) {
        LOGGER.warn("emit: sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
      }
    }
  }

  public List<LogSink> delegates() {
    return delegates;
  }
}
