package com.consullo.console.demo;

import java.io.PrintStream;
import org.apache.commons.lang3.Validate;

/**
 * Deterministic console output fixture used by the demo.
 *
 * <p>This producer emits:
 * 1) Committed lines (newline terminated, one write each)
 * 2) A line printed as several fragments followed by println
 * 3) A progress line built from partial writes only, terminated at the end
 *
 * @since 1.0
 */
public final class ConsoleFixtureProducer implements Runnable {

  private final String name;
  private final PrintStream out;
  private final PrintStream err;

  public ConsoleFixtureProducer(final String name, final PrintStream out, final PrintStream err) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(out, "out must not be null");
    Validate.notNull(err, "err must not be null");
    this.name = name;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run() {
    out.println(name + ": start");

    out.print(name);
    out.print(": answer=");
    out.print(42);
    out.println();

    for (int p = 0; p <= 100; p += 25) {
      out.print(p + "% ");
    }
    out.println();

    err.println(name + ": warning line");
    out.println(name + ": done");
  }
}
