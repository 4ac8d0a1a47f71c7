package com.chatmesh.p2p;

import com.chatmesh.ice.IceServer;

import java.util.List;

/**
 * Creates the transport for a newly registered connection.
 */
@FunctionalInterface
public interface TransportFactory {

    MediaTransport create(String remoteId, List<IceServer> iceServers, TransportEvents events);
}
