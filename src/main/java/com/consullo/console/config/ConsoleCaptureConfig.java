package com.consullo.console.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console capture configuration values.
 *
 * @param historyCapacity maximum records retained by the in-memory history
 * @param cycleIntervalMillis maximum idle wait of the consumer loop between cycles
 * @param primaryLoggerName SLF4J logger receiving primary-output records
 * @param secondaryLoggerName SLF4J logger receiving secondary-output records
 * @param consumerThreadName name of the consumer loop thread
 * @since 1.0
 */
public record ConsoleCaptureConfig(
    int historyCapacity,
    long cycleIntervalMillis,
    String primaryLoggerName,
    String secondaryLoggerName,
    String consumerThreadName) {

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "console-capture.properties";

  private static final String PREFIX = "console.capture.";

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleCaptureConfig.class);

  public ConsoleCaptureConfig {
    Validate.isTrue(historyCapacity > 0, "historyCapacity must be positive");
    Validate.isTrue(cycleIntervalMillis > 0, "cycleIntervalMillis must be positive");
    Validate.notBlank(primaryLoggerName, "primaryLoggerName must not be blank");
    Validate.notBlank(secondaryLoggerName, "secondaryLoggerName must not be blank");
    Validate.notBlank(consumerThreadName, "consumerThreadName must not be blank");
  }

  public static ConsoleCaptureConfig defaults() {
    return new ConsoleCaptureConfig(1_000, 16L, "console.stdout", "console.stderr", "ConsoleCaptureLoop");
  }

  /**
   * Loads {@link #RESOURCE} from the classpath, falling back to {@link #defaults()} when it is absent.
   *
   * @return configuration
   * @throws IllegalStateException if the resource exists but cannot be read
   */
  public static ConsoleCaptureConfig load() {
    try (InputStream is = ConsoleCaptureConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (is == null) {
        LOGGER.debug("load: {} not found, using defaults", RESOURCE);
        return defaults();
      }
      final Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    } catch (IOException e) {
      throw new IllegalStateException("Failed reading " + RESOURCE, e);
    }
  }

  /**
   * Builds a configuration from {@code console.capture.*} properties. Missing keys take their default value.
   *
   * @param props properties
   * @return configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static ConsoleCaptureConfig fromProperties(final Properties props) {
    Validate.notNull(props, "props must not be null");
    final ConsoleCaptureConfig d = defaults();
    return new ConsoleCaptureConfig(
        intValue(props, "historyCapacity", d.historyCapacity()),
        longValue(props, "cycleIntervalMillis", d.cycleIntervalMillis()),
        stringValue(props, "primaryLoggerName", d.primaryLoggerName()),
        stringValue(props, "secondaryLoggerName", d.secondaryLoggerName()),
        stringValue(props, "consumerThreadName", d.consumerThreadName()));
  }

  private static long longValue(Properties props, String key, long fallback) {
    final String raw = StringUtils.trimToNull(props.getProperty(PREFIX + key));
    if (raw == null) {
      return fallback;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
    }
  }

  private static int intValue(Properties props, String key, int fallback) {
    final long v = longValue(props, key, fallback);
    if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Value out of range for " + PREFIX + key + ": " + v);
    }
    return (int) v;
  }

  private static String stringValue(Properties props, String key, String fallback) {
    final String raw = StringUtils.trimToNull(props.getProperty(PREFIX + key));
    return raw != null ? raw : fallback;
  }
}
