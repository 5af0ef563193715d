package de.caluga.topology.sdam;

import de.caluga.topology.driver.ConfigurationException;

import java.util.Locale;

/**
 * host and port of a server. Host names are compared case insensitive and therefore kept in lower case.
 */
public record ServerAddress(String host, int port) {
    public static final int DEFAULT_PORT = 27017;

    public ServerAddress {
        if (host == null || host.isEmpty()) {
            throw new ConfigurationException("host must not be empty");
        }

        if (port <= 0 || port > 65535) {
            throw new ConfigurationException("Port must be an integer between 0 and 65535: " + port);
        }

        host = host.toLowerCase(Locale.ROOT);
    }

    /**
     * parses <code>host</code>, <code>host:port</code> or <code>[ipv6]:port</code>
     */
    public static ServerAddress parse(String hostAndPort) {
        if (hostAndPort == null || hostAndPort.isBlank()) {
            throw new ConfigurationException("empty host string");
        }

        String s = hostAndPort.trim();

        if (s.startsWith("[")) {
            int end = s.indexOf(']');

            if (end < 0) {
                throw new ConfigurationException("an IPv6 address must be enclosed in '[' and ']': " + s);
            }

            String host = s.substring(1, end);

            if (end == s.length() - 1) {
                return new ServerAddress(host, DEFAULT_PORT);
            }

            if (s.charAt(end + 1) != ':') {
                throw new ConfigurationException("invalid host string " + s);
            }

            return new ServerAddress(host, parsePort(s.substring(end + 2), s));
        }

        int idx = s.lastIndexOf(':');

        if (idx < 0) {
            return new ServerAddress(s, DEFAULT_PORT);
        }

        if (s.indexOf(':') != idx) {
            //unbracketed ipv6
            return new ServerAddress(s, DEFAULT_PORT);
        }

        return new ServerAddress(s.substring(0, idx), parsePort(s.substring(idx + 1), s));
    }

    private static int parsePort(String p, String full) {
        try {
            return Integer.parseInt(p);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Port must be an integer between 0 and 65535: " + full, e);
        }
    }

    @Override
    public String toString() {
        if (host.indexOf(':') >= 0) {
            return "[" + host + "]:" + port;
        }

        return host + ":" + port;
    }
}
