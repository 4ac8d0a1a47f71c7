package com.chatmesh.p2p;

/**
 * A single audio or video track, local or remote.
 */
public interface MediaTrack {

    String KIND_AUDIO = "audio";
    String KIND_VIDEO = "video";

    String getId();

    /**
     * @return {@code "audio"} or {@code "video"}
     */
    String getKind();

    /**
     * Stops capture/playback of this track. Calling it twice has no effect.
     */
    void stop();
}
