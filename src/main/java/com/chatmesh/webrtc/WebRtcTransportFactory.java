package com.chatmesh.webrtc;

import com.chatmesh.ice.IceServer;
import com.chatmesh.p2p.MediaTransport;
import com.chatmesh.p2p.TransportEvents;
import com.chatmesh.p2p.TransportFactory;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.RTCBundlePolicy;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import dev.onvoid.webrtc.RTCRtcpMuxPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates native transports from a {@link PeerConnectionFactory}, usually the one owned by
 * {@link WebRtcRuntime}.
 */
public final class WebRtcTransportFactory implements TransportFactory {

    private static final Logger LOGGER = Logger.getLogger(WebRtcTransportFactory.class.getName());

    private final PeerConnectionFactory factory;

    public WebRtcTransportFactory(PeerConnectionFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public WebRtcTransportFactory(WebRtcRuntime runtime) {
        this(runtime.getFactory());
    }

    @Override
    public MediaTransport create(String remoteId, List<IceServer> iceServers, TransportEvents events) {
        RTCConfiguration configuration = toConfiguration(iceServers);
        LOGGER.fine("[WebRTC] Creating peer connection to " + remoteId + " with "
            + configuration.iceServers.size() + " ICE server(s)");
        return new WebRtcTransport(remoteId, factory, configuration, events);
    }

    static RTCConfiguration toConfiguration(List<IceServer> iceServers) {
        List<RTCIceServer> nativeServers = new ArrayList<>(iceServers.size());
        for (IceServer server : iceServers) {
            RTCIceServer nativeServer = new RTCIceServer();
            nativeServer.urls.addAll(server.urls());
            if (server.hasCredentials()) {
                nativeServer.username = server.username();
                nativeServer.password = server.credential();
            }
            nativeServers.add(nativeServer);
        }

        RTCConfiguration configuration = new RTCConfiguration();
        configuration.iceServers = nativeServers;
        configuration.iceTransportPolicy = RTCIceTransportPolicy.ALL;
        // audio and video share one transport
        configuration.bundlePolicy = RTCBundlePolicy.MAX_BUNDLE;
        configuration.rtcpMuxPolicy = RTCRtcpMuxPolicy.REQUIRE;
        return configuration;
    }
}
