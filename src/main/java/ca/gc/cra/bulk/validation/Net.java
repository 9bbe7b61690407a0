package ca.gc.cra.bulk.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validation of Kafka bootstrap endpoints ({@code HOST:PORT[,HOST:PORT...]}).
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern LABEL_PATTERN = Pattern.compile("\\A[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated list of {@code host:port} endpoints.
   *
   * @param value raw bootstrap list
   * @return normalized list joined by commas, without surrounding whitespace
   * @throws IllegalArgumentException if any endpoint is malformed
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> endpoints = new ArrayList<>();
    for (String part : sanitized.split(",")) {
      if (part.isBlank()) {
        throw new IllegalArgumentException("kafkaBootstrap must not contain empty entries");
      }
      endpoints.add(validateHostPort(part));
    }
    return String.join(",", endpoints);
  }

  /**
   * Validates a single {@code host:port} endpoint. IPv6 literals are not accepted.
   *
   * @param value candidate endpoint
   * @return normalized endpoint
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    int colon = sanitized.lastIndexOf(':');
    if (colon <= 0 || colon == sanitized.length() - 1) {
      throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
    }
    String host = sanitized.substring(0, colon);
    String portPart = sanitized.substring(colon + 1);
    if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 hosts are not supported: " + host);
    }
    validateHost(host);
    int port = Numbers.parseIntInRange("port", portPart, 1, 65535);
    return host + ':' + port;
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH || !LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
  }
}
