package com.chatmesh.p2p;

/**
 * Callbacks a {@link MediaTransport} pushes as things happen on the wire. Implementations may be
 * invoked from any thread.
 */
public interface TransportEvents {

    void onIceCandidate(IceCandidate candidate);

    void onIceStateChange(IceState state);

    void onTransportStateChange(TransportState state);

    void onRemoteTrack(MediaTrack track);
}
