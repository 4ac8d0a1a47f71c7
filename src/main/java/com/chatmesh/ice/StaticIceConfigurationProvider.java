package com.chatmesh.ice;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Fixed ICE server list. Entries are redundant on purpose: any single endpoint may be unreachable.
 *
 * <p>Property layout read by {@link #fromProperties(Properties)}:
 * <pre>
 * ice.servers.0.urls=stun:stun.l.google.com:19302,stun:stun1.l.google.com:19302
 * ice.servers.1.urls=turn:turn.example.com:3478
 * ice.servers.1.username=user
 * ice.servers.1.credential=secret
 * </pre>
 * Indices are read from 0 until the first missing {@code urls} key.
 */
public final class StaticIceConfigurationProvider implements IceConfigurationProvider {

    static final String PREFIX = "ice.servers.";

    private static final List<IceServer> DEFAULT_SERVERS = List.of(
        IceServer.stun("stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302"),
        IceServer.stun("stun:stun2.l.google.com:19302", "stun:stun3.l.google.com:19302",
            "stun:stun4.l.google.com:19302")
    );

    private final List<IceServer> iceServers;

    public StaticIceConfigurationProvider(List<IceServer> iceServers) {
        Objects.requireNonNull(iceServers, "iceServers");
        if (iceServers.isEmpty()) {
            throw new IllegalArgumentException("At least one ICE server is required");
        }
        this.iceServers = List.copyOf(iceServers);
    }

    /**
     * Public Google STUN servers.
     */
    public static StaticIceConfigurationProvider defaults() {
        return new StaticIceConfigurationProvider(DEFAULT_SERVERS);
    }

    /**
     * Reads {@code ice.servers.N.*} entries, falling back to {@link #defaults()} when none exist.
     */
    public static StaticIceConfigurationProvider fromProperties(Properties properties) {
        List<IceServer> servers = new ArrayList<>();
        for (int index = 0; ; index++) {
            String urls = properties.getProperty(PREFIX + index + ".urls");
            if (urls == null || urls.isBlank()) {
                break;
            }
            List<String> urlList = Arrays.stream(urls.split(","))
                .map(String::trim)
                .filter(url -> !url.isEmpty())
                .collect(Collectors.toList());
            servers.add(new IceServer(urlList,
                properties.getProperty(PREFIX + index + ".username"),
                properties.getProperty(PREFIX + index + ".credential")));
        }
        return servers.isEmpty() ? defaults() : new StaticIceConfigurationProvider(servers);
    }

    @Override
    public List<IceServer> getIceServers() {
        return iceServers;
    }

    @Override
    public String toString() {
        return "StaticIceConfigurationProvider" + iceServers;
    }
}
