package com.consullo.console.io;

import com.consullo.console.capture.ConsoleStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import org.apache.commons.lang3.Validate;

/**
 * {@link PrintStream} front end for a {@link ConsoleStream}, so that an interceptor can stand in wherever code
 * expects {@code System.out}-style output.
 *
 * <p>
 * Every {@code print} overload forwards one text fragment. {@code println(x)} forwards {@code x} joined with the line
 * separator as a single fragment while holding this stream's monitor, so concurrent {@code println} calls never
 * interleave and each one yields its own record. Raw byte writes are decoded
 * with the stream's charset; incomplete multi-byte sequences are carried over to the next write.
 * </p>
 *
 * @since 1.0
 */
public final class InterceptingPrintStream extends PrintStream {

  private final ConsoleStream target;
  private final String lineSeparator;

  private final Object decoderLock = new Object();
  private final CharsetDecoder decoder;
  private byte[] carry = new byte[0];

  /**
   * Creates a print stream that forwards to {@code target}.
   *
   * @param target console receiving text fragments
   * @param charset charset used to decode raw byte writes
   */
  public InterceptingPrintStream(final ConsoleStream target, final Charset charset) {
    super(OutputStream.nullOutputStream(), false, charset);
    Validate.notNull(target, "target must not be null");
    this.target = target;
    this.lineSeparator = System.lineSeparator();
    this.decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
  }

  public ConsoleStream target() {
    return target;
  }

  @Override
  public void write(int b) {
    write(new byte[] {(byte) b}, 0, 1);
  }

  @Override
  public void write(byte[] buf, int off, int len) {
    Validate.notNull(buf, "buf must not be null");
    if (off < 0 || len < 0 || off + len > buf.length) {
      throw new IndexOutOfBoundsException("Invalid off/len.");
    }
    if (len == 0) {
      return;
    }
    final String text = decode(buf, off, len);
    if (!text.isEmpty()) {
      target.write(text);
    }
  }

  @Override
  public void print(boolean b) {
    target.write(String.valueOf(b));
  }

  @Override
  public void print(char c) {
    target.write(String.valueOf(c));
  }

  @Override
  public void print(int i) {
    target.write(String.valueOf(i));
  }

  @Override
  public void print(long l) {
    target.write(String.valueOf(l));
  }

  @Override
  public void print(float f) {
    target.write(String.valueOf(f));
  }

  @Override
  public void print(double d) {
    target.write(String.valueOf(d));
  }

  @Override
  public void print(char[] s) {
    target.write(new String(s));
  }

  @Override
  public void print(String s) {
    target.write(String.valueOf(s));
  }

  @Override
  public void print(Object obj) {
    target.write(String.valueOf(obj));
  }

  @Override
  public void println() {
    writeLine("");
  }

  @Override
  public void println(boolean x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(char x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(int x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(long x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(float x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(double x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(char[] x) {
    writeLine(new String(x));
  }

  @Override
  public void println(String x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void println(Object x) {
    writeLine(String.valueOf(x));
  }

  @Override
  public void flush() {
    target.flush();
  }

  /**
   * Flushes the target. The wrapped console outlives this stream and is never closed here.
   */
  @Override
  public void close() {
    flush();
  }

  @Override
  public boolean checkError() {
    flush();
    return false;
  }

  // Same monitor as java.io.PrintStream#println; the text and its separator travel as one fragment.
  private void writeLine(final String text) {
    synchronized (this) {
      target.write(text + lineSeparator);
    }
  }

  private String decode(byte[] buf, int off, int len) {
    synchronized (decoderLock) {
      final byte[] input = new byte[carry.length + len];
      System.arraycopy(carry, 0, input, 0, carry.length);
      System.arraycopy(buf, off, input, carry.length, len);

      final ByteBuffer in = ByteBuffer.wrap(input);
      final CharBuffer out = CharBuffer.allocate((int) Math.ceil(input.length * (double) decoder.maxCharsPerByte()) + 1);
      final CoderResult result = decoder.decode(in, out, false);
      if (result.isOverflow()) {
        // Output is sized from maxCharsPerByte.
        throw new IllegalStateException("Decoder overflow for charset " + decoder.charset());
      }

      carry = new byte[in.remaining()];
      in.get(carry);
      out.flip();
      return out.toString();
    }
  }
}
