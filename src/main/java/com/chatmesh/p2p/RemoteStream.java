package com.chatmesh.p2p;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inbound media from one remote participant. Tracks are appended as they arrive, so the object
 * handed to {@link PeerEvents#onRemoteStream} stays live.
 */
public final class RemoteStream {

    private final String remoteId;
    private final int generation;
    private final List<MediaTrack> tracks = new ArrayList<>();

    RemoteStream(String remoteId, int generation) {
        this.remoteId = remoteId;
        this.generation = generation;
    }

    public String getRemoteId() {
        return remoteId;
    }

    /**
     * Starts at 1 and increases each time renegotiation produces a new stream for the same peer.
     */
    public int getGeneration() {
        return generation;
    }

    public synchronized List<MediaTrack> getTracks() {
        return Collections.unmodifiableList(new ArrayList<>(tracks));
    }

    synchronized boolean containsTrack(String trackId) {
        return tracks.stream().anyMatch(t -> t.getId().equals(trackId));
    }

    synchronized boolean hasKind(String kind) {
        return tracks.stream().anyMatch(t -> t.getKind().equals(kind));
    }

    synchronized void addTrack(MediaTrack track) {
        tracks.add(track);
    }

    @Override
    public synchronized String toString() {
        return "RemoteStream[" + remoteId + "#" + generation + ", tracks=" + tracks.size() + "]";
    }
}
