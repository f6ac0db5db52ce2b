package ca.gc.cra.relay.domain.http;

import java.util.Objects;

/**
 * Single HTTP header field. The name is fixed at creation; the value may be rewritten in place.
 *
 * @since 0.1.0
 */
public final class HeaderField {
  private final String name;
  private String value;

  /**
   * Creates a header field.
   *
   * @param name header name, matched exactly (no case folding)
   * @param value header value; {@code null} is stored as the empty string
   * @throws NullPointerException if {@code name} is {@code null}
   */
  public HeaderField(String name, String value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = value == null ? "" : value;
  }

  public String name() {
    return name;
  }

  public String value() {
    return value;
  }

  public void setValue(String value) {
    this.value = value == null ? "" : value;
  }

  /**
   * Renders the field as a CRLF-terminated header line.
   *
   * @return {@code name: value\r\n}
   */
  public String wireForm() {
    return name + ": " + value + HttpMessage.CRLF;
  }

  @Override
  public String toString() {
    return "HeaderField{" + name + '=' + value + '}';
  }
}
