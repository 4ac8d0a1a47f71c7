package com.chatmesh.webrtc;

import com.chatmesh.p2p.MediaTrack;
import dev.onvoid.webrtc.media.MediaStreamTrack;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MediaTrack} backed by a native track.
 */
public final class WebRtcMediaTrack implements MediaTrack {

    private static final Logger LOGGER = Logger.getLogger(WebRtcMediaTrack.class.getName());

    private final MediaStreamTrack track;
    private final String id;
    private final String kind;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public WebRtcMediaTrack(MediaStreamTrack track) {
        this.track = Objects.requireNonNull(track, "track");
        this.id = track.getId();
        this.kind = track.getKind();
    }

    public MediaStreamTrack getNativeTrack() {
        return track;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            track.setEnabled(false);
            track.dispose();
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "[WebRTC] Error disposing track " + id, e);
        }
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
