package ca.gc.cra.relay.domain.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Ordered, duplicate-permitting store of HTTP header fields.
 * <p><strong>Why:</strong> Rewrite strategies need exact control over the header block that is re-serialized onto the wire,
 * including repeated fields such as {@code Set-Cookie}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve insertion order; it is the serialization order.</li>
 *   <li>Match names exactly. No case normalization is applied.</li>
 *   <li>Serialize each field as {@code name: value\r\n}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single connection.</p>
 *
 * @since 0.1.0
 */
public final class HeaderCollection implements Iterable<HeaderField> {
  private final List<HeaderField> fields = new ArrayList<>();

  /**
   * Appends a field without checking for existing fields of the same name.
   *
   * @param name header name
   * @param value header value
   */
  public void add(String name, String value) {
    fields.add(new HeaderField(name, value));
  }

  /**
   * Returns the value of the first field named {@code name}. Duplicates are not aggregated.
   *
   * @param name header name, matched exactly
   * @return value of the first match, or empty when absent
   */
  public Optional<String> value(String name) {
    for (HeaderField field : fields) {
      if (field.name().equals(name)) {
        return Optional.of(field.value());
      }
    }
    return Optional.empty();
  }

  /**
   * Removes every field named {@code name}.
   *
   * @param name header name, matched exactly
   * @return number of fields removed
   */
  public int remove(String name) {
    int before = fields.size();
    fields.removeIf(field -> field.name().equals(name));
    return before - fields.size();
  }

  /**
   * Replaces all fields named {@code name} with a single field appended at the end.
   *
   * @param name header name
   * @param value new value
   */
  public void replace(String name, String value) {
    remove(name);
    add(name, value);
  }

  public boolean contains(String name) {
    return value(name).isPresent();
  }

  /**
   * Counts the fields named {@code name}.
   */
  public int count(String name) {
    int count = 0;
    for (HeaderField field : fields) {
      if (field.name().equals(name)) {
        count++;
      }
    }
    return count;
  }

  public int size() {
    return fields.size();
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /**
   * Serializes the fields in insertion order.
   *
   * @return concatenated {@code name: value\r\n} lines; empty when there are no fields
   */
  public String serialize() {
    StringBuilder sb = new StringBuilder();
    for (HeaderField field : fields) {
      sb.append(field.wireForm());
    }
    return sb.toString();
  }

  /**
   * Iterates fields in insertion order. Each call starts a fresh pass; values may be mutated through
   * {@link HeaderField#setValue(String)} while iterating, structural changes may not.
   */
  @Override
  public Iterator<HeaderField> iterator() {
    return Collections.unmodifiableList(fields).iterator();
  }

  /**
   * Lazily streams fields in insertion order.
   */
  public Stream<HeaderField> stream() {
    return fields.stream();
  }

  /**
   * Streams the fields named {@code name}, for example every {@code Set-Cookie}.
   */
  public Stream<HeaderField> named(String name) {
    Objects.requireNonNull(name, "name");
    return fields.stream().filter(field -> field.name().equals(name));
  }

  @Override
  public String toString() {
    return "HeaderCollection" + fields;
  }
}
