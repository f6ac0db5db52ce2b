package ca.gc.cra.relay.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep relayed payloads out of operator logs at full size.
 * <p><strong>Why:</strong> Request and response previews are logged at DEBUG; bodies may be large or binary.
 * <p><strong>Role:</strong> Cross-cutting utility used by the relay engine and connection handling.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate text to a byte budget while preserving readability.</li>
 *   <li>Render raw byte chunks as printable previews.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders a byte chunk as a single-line preview; CR, LF, and other non-printables are escaped.
   *
   * @param data source bytes; {@code null} results in {@code "<null>"}
   * @param offset first byte to render
   * @param length number of bytes available
   * @param maxBytes maximum number of bytes to render; must be positive
   * @return printable preview
   */
  public static String preview(byte[] data, int offset, int length, int maxBytes) {
    if (data == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(length, maxBytes);
    StringBuilder sb = new StringBuilder(shown + 16);
    for (int i = offset; i < offset + shown; i++) {
      int b = data[i] & 0xFF;
      if (b == '\r') {
        sb.append("\\r");
      } else if (b == '\n') {
        sb.append("\\n");
      } else if (b < 0x20 || b > 0x7E) {
        sb.append(String.format("\\x%02x", b));
      } else {
        sb.append((char) b);
      }
    }
    if (shown < length) {
      sb.append("... (truncated, ").append(shown).append(" of ").append(length).append(')');
    }
    return sb.toString();
  }
}
