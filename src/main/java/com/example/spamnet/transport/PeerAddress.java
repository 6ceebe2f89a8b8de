package com.example.spamnet.transport;

import java.util.Objects;

public final class PeerAddress {

    private final String host;
    private final int port;

    public PeerAddress(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Missing host");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.host = host.trim();
        this.port = port;
    }

    /**
     * Parses {@code host:port}. The last colon separates the port so bracket-less
     * IPv6 literals are not supported.
     */
    public static PeerAddress parse(String hostPort) {
        if (hostPort == null) {
            throw new IllegalArgumentException("Missing address");
        }
        String s = hostPort.trim();
        int idx = s.lastIndexOf(':');
        if (idx <= 0 || idx == s.length() - 1) {
            throw new IllegalArgumentException("Expected host:port but got '" + hostPort + "'");
        }
        int port;
        try {
            port = Integer.parseInt(s.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + hostPort + "'", e);
        }
        return new PeerAddress(s.substring(0, idx), port);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerAddress)) return false;
        PeerAddress that = (PeerAddress) o;
        return port == that.port && host.equalsIgnoreCase(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host.toLowerCase(), port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
