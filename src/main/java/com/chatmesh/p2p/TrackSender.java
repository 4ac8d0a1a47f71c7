package com.chatmesh.p2p;

/**
 * Handle returned by {@link MediaTransport#addTrack} for a local track attached to a transport.
 */
public interface TrackSender {

    MediaTrack getTrack();
}
