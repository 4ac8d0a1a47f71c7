package com.chatmesh.ice;

import java.util.List;
import java.util.Objects;

/**
 * A STUN or TURN endpoint used for NAT traversal.
 *
 * @param urls       one or more {@code stun:}/{@code turn:}/{@code turns:} URLs
 * @param username   TURN username, or null
 * @param credential TURN credential, or null
 */
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        Objects.requireNonNull(urls, "urls");
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("ICE server needs at least one URL");
        }
        urls = List.copyOf(urls);
    }

    public static IceServer stun(String... urls) {
        return new IceServer(List.of(urls), null, null);
    }

    public static IceServer turn(String username, String credential, String... urls) {
        return new IceServer(List.of(urls), username, credential);
    }

    public boolean hasCredentials() {
        return username != null && credential != null;
    }

    @Override
    public String toString() {
        // credential deliberately left out
        return "IceServer[" + String.join(",", urls) + (username != null ? ", user=" + username : "") + "]";
    }
}
