package com.chatmesh.p2p;

/**
 * What the host application observes about remote participants: a stream arriving and a stream
 * ending. Internal restarts and retries never surface here.
 */
public interface PeerEvents {

    /**
     * The first inbound stream of a connection became available, or renegotiation replaced it.
     */
    void onRemoteStream(String remoteId, RemoteStream stream);

    /**
     * Fired exactly once per connection when it is torn down; remove the participant's tile.
     */
    void onRemoteStreamEnded(String remoteId);
}
