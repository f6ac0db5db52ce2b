package ca.gc.cra.relay.domain.http;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class HttpMessageTest {

  @Test
  void requestSettersRegenerateRequestLine() {
    HttpRequest request = new HttpRequest(
        "GET /a HTTP/1.1", "GET", "/a", "HTTP", "1.1", new HeaderCollection(), null);

    request.setUri("/b?x=1");
    request.setMethod("POST");
    request.setVersion("1.0");

    assertEquals("POST /b?x=1 HTTP/1.0", request.startLine());
  }

  @Test
  void untouchedRequestKeepsReceivedLine() {
    HttpRequest request = new HttpRequest(
        "GET   /a HTTP/1.1", "GET", "/a", "HTTP", "1.1", new HeaderCollection(), null);

    assertEquals("GET   /a HTTP/1.1", request.startLine());
  }

  @Test
  void responseSettersRegenerateStatusLine() {
    HttpResponse response = new HttpResponse(
        "HTTP/1.1 200 OK", "HTTP", "1.1", 200, "OK", new HeaderCollection(), null);

    response.setStatusCode(302);
    response.setReasonPhrase("Found");

    assertEquals("HTTP/1.1 302 Found", response.startLine());
    assertThrows(IllegalArgumentException.class, () -> response.setStatusCode(42));
  }

  @Test
  void wireFormIsHeadThenBufferedBody() {
    HeaderCollection headers = new HeaderCollection();
    headers.add("Content-Length", "7");
    HttpRequest request = new HttpRequest(
        "POST /x HTTP/1.1", "POST", "/x", "HTTP", "1.1", headers, "abc".getBytes(StandardCharsets.US_ASCII));
    request.appendBody("defg".getBytes(StandardCharsets.US_ASCII), 0, 4);

    byte[] expected = "POST /x HTTP/1.1\r\nContent-Length: 7\r\n\r\nabcdefg".getBytes(StandardCharsets.US_ASCII);
    assertArrayEquals(expected, request.toWireBytes());
    assertEquals(7, request.bodyLength());
  }

  @Test
  void createBuildsClosingResponseWithLength() {
    HttpResponse response = HttpResponse.create(404, "Not Found", "No handler for /x.\n");

    String wire = new String(response.toWireBytes(), StandardCharsets.ISO_8859_1);
    assertEquals(
        "HTTP/1.1 404 Not Found\r\nContent-Length: 19\r\nConnection: close\r\n\r\nNo handler for /x.\n", wire);
  }

  @Test
  void headCharactersOutsideLatin1AreReplaced() {
    HeaderCollection headers = new HeaderCollection();
    headers.add("X-Note", "caf\u00e9 \u2713");
    HttpRequest request = new HttpRequest("GET / HTTP/1.1", "GET", "/", "HTTP", "1.1", headers, null);

    assertEquals(
        "GET / HTTP/1.1\r\nX-Note: caf\u00e9 ?\r\n\r\n",
        new String(request.toWireBytes(), StandardCharsets.ISO_8859_1));
  }
}
