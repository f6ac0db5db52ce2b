package ca.gc.cra.relay.infrastructure.buffer;

import java.util.Objects;

/**
 * Expandable byte buffer backed by a single array with manual read/write indices.
 * <p>Holds the bytes of a message head that has not been terminated yet. Once the head is complete the
 * owner drains the remaining bytes with {@link #drain()} and drops the buffer.
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 2048;
  private static final int MAX_CAPACITY = 32 * 1024 * 1024; // 32 MiB safety guard

  private byte[] data;
  private int readIndex;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
  }

  /**
   * Appends a region of the provided array, growing the buffer if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param length number of bytes to append
   */
  public void write(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (offset < 0 || length < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    if (length == 0) {
      return;
    }
    ensureWritable(length);
    System.arraycopy(src, offset, data, writeIndex, length);
    writeIndex += length;
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex - readIndex;
  }

  /**
   * Finds the first occurrence of {@code needle} at or after {@code fromOffset}, relative to the reader index.
   *
   * @param needle byte sequence to look for
   * @param fromOffset relative offset to start scanning from; negative values scan from the start
   * @return relative index or {@code -1} when not found
   */
  public int indexOf(byte[] needle, int fromOffset) {
    Objects.requireNonNull(needle, "needle");
    int needleLen = needle.length;
    if (needleLen == 0) {
      return 0;
    }
    int start = readIndex + Math.max(0, fromOffset);
    int limit = writeIndex - needleLen;
    outer:
    for (int i = start; i <= limit; i++) {
      for (int j = 0; j < needleLen; j++) {
        if (data[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i - readIndex;
    }
    return -1;
  }

  /**
   * Copies {@code length} readable bytes into a fresh array and consumes them.
   */
  public byte[] copy(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    byte[] out = new byte[length];
    System.arraycopy(data, readIndex, out, 0, length);
    skip(length);
    return out;
  }

  /**
   * Advances the reader index by {@code length} bytes.
   */
  public void skip(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      readIndex = 0;
      writeIndex = 0;
    }
  }

  /**
   * Hands off every readable byte as a new array and leaves the buffer empty.
   */
  public byte[] drain() {
    return copy(readableBytes());
  }

  private void ensureWritable(int minWritableBytes) {
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    compact();
    writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    int required = readableBytes() + minWritableBytes;
    int newCapacity = data.length;
    while (newCapacity < required && newCapacity < MAX_CAPACITY) {
      newCapacity <<= 1;
    }
    if (newCapacity < required) {
      newCapacity = required;
    }
    if (newCapacity > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + newCapacity);
    }
    byte[] next = new byte[newCapacity];
    int readable = readableBytes();
    System.arraycopy(data, readIndex, next, 0, readable);
    data = next;
    readIndex = 0;
    writeIndex = readable;
  }

  private void compact() {
    if (readIndex == 0) {
      return;
    }
    int readable = readableBytes();
    if (readable > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
    }
    readIndex = 0;
    writeIndex = readable;
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
