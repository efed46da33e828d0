package ca.gc.cra.warper.validation;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Validates Kafka bootstrap server lists ({@code host:port[,host:port]}).
 *
 * @since WARPER 0.1
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern HOST_LABEL = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated list of {@code host:port} entries.
   *
   * @param value bootstrap list
   * @return normalized list without surrounding whitespace
   * @throws IllegalArgumentException if any entry is malformed
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("bootstrap", value);
    StringJoiner joiner = new StringJoiner(",");
    for (String entry : sanitized.split(",")) {
      joiner.add(validateHostPort(entry));
    }
    return joiner.toString();
  }

  /**
   * Validates a single {@code host:port} string supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param value candidate entry
   * @return normalized entry
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, idx + 1);
      portPart = sanitized.substring(idx + 2);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHostname(host);
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return host + ':' + port;
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (!HOST_LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
  }
}
