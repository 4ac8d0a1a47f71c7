package com.chatmesh.p2p;

import java.util.List;
import java.util.Objects;

/**
 * The outgoing media stream. Owned by the application; the mesh borrows its tracks.
 */
public final class LocalStream {

    private final String id;
    private final List<MediaTrack> tracks;

    public LocalStream(String id, List<? extends MediaTrack> tracks) {
        this.id = Objects.requireNonNull(id, "id");
        this.tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
    }

    public String getId() {
        return id;
    }

    public List<MediaTrack> getTracks() {
        return tracks;
    }

    /**
     * Stops every track of this stream.
     */
    public void stop() {
        for (MediaTrack track : tracks) {
            track.stop();
        }
    }

    @Override
    public String toString() {
        return "LocalStream[" + id + ", tracks=" + tracks.size() + "]";
    }
}
