package com.stockscan.data;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One entry of the upstream access pool: an optional HTTP proxy and/or an optional auth token.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class Credential {
    public static final String DIRECT_ID = "direct";

    public final String id;
    public final String proxyHost;
    public final int proxyPort;
    public final String token;

    public static Credential direct() {
        return new Credential(DIRECT_ID, null, 0, null);
    }

    /**
     * Parses {@code host:port}, {@code host:port|token} or {@code |token}.
     */
    public static Credential parse(String line, int index) {
        String text = line == null ? "" : line.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("empty credential line #" + index);
        }
        String proxyPart = text;
        String token = null;
        int bar = text.indexOf('|');
        if (bar >= 0) {
            proxyPart = text.substring(0, bar).trim();
            token = text.substring(bar + 1).trim();
            if (token.isEmpty()) {
                token = null;
            }
        }
        String host = null;
        int port = 0;
        if (!proxyPart.isEmpty()) {
            int colon = proxyPart.lastIndexOf(':');
            if (colon <= 0 || colon == proxyPart.length() - 1) {
                throw new IllegalArgumentException("credential line #" + index + " must be host:port, got " + proxyPart);
            }
            host = proxyPart.substring(0, colon).trim();
            try {
                port = Integer.parseInt(proxyPart.substring(colon + 1).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("credential line #" + index + " has a bad port: " + proxyPart, e);
            }
        }
        if (host == null && token == null) {
            throw new IllegalArgumentException("credential line #" + index + " has neither proxy nor token");
        }
        String id = host == null ? "token#" + index : host + ":" + port;
        return new Credential(id, host, port, token);
    }

    public boolean hasProxy() {
        return proxyHost != null;
    }

    public boolean hasToken() {
        return token != null;
    }

    @Override
    public String toString() {
        return "Credential{" + id + (token == null ? "" : ", token=***") + "}";
    }
}
