package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsAndNumbersTest {

  @Test
  void nonBlankTrimsAndRejectsControlCharacters() {
    assertEquals("value", Strings.requireNonBlank("x", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("x", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("x", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("x", null));
  }

  @Test
  void printableAsciiEnforcesLengthAndCharset() {
    assertEquals("/static/", Strings.requirePrintableAscii("prefix", "/static/", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("prefix", "/a-long-prefix/", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("prefix", "/café/", 16));
  }

  @Test
  void headerNamesAreTokens() {
    assertEquals("Set-Cookie", Strings.requireHeaderName("h", "Set-Cookie"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHeaderName("h", "Set Cookie"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHeaderName("h", "X:Y"));
  }

  @Test
  void splitListDropsEmptyEntries() {
    assertEquals(List.of("a", "b"), Strings.splitList(" a, ,b,"));
    assertTrue(Strings.splitList(null).isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> Strings.splitList("a").add("b"));
  }

  @Test
  void numbersAreParsedWithinRange() {
    assertEquals(42, Numbers.parseIntInRange("n", " 42 ", 0, 100));
    assertEquals(7L, Numbers.requireRange("n", 7, 7, 7));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("readChunkBytes", "1", 512, 1024));
    assertEquals("readChunkBytes must be between 512 and 1024 (was 1)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("n", "4k", 0, 10_000));
  }
}
