package ca.gc.cra.relay.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation utilities for RELAY listen addresses and proxy targets.
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;   // total length
  private static final int MAX_LABEL_LENGTH    = 63;    // per label

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a host name, IPv4 literal, or IPv6 literal (with or without brackets).
   *
   * @param name logical name for diagnostics
   * @param value candidate host
   * @return trimmed host with IPv6 brackets removed
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String name, String value) {
    String host = Strings.requireNonBlank(name, value);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
      validateIpv6(host);
      return host;
    }
    if (host.indexOf(':') >= 0) {
      validateIpv6(host);
      return host;
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return host;
    }
    validateHostname(host);
    return host;
  }

  /**
   * Parses and validates a TCP port.
   *
   * @param name logical name for diagnostics
   * @param raw port text
   * @return port in {@code 1..65535}
   */
  public static int validatePort(String name, String raw) {
    return Numbers.parseIntInRange(name, raw, 1, 65_535);
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  /**
   * Validates a single label [start,end): length 1..63, alphanumeric at both ends, hyphens inside.
   */
  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  /** Validates a raw IPv6 literal (without brackets) using JDK parsing. */
  private static void validateIpv6(String host) {
    try {
      final InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
