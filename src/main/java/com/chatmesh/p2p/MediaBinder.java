package com.chatmesh.p2p;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Keeps the local stream's tracks attached to every connection. All three entry points share one
 * lock, so a connection created while streaming starts or stops never sees a half-attached stream.
 */
public final class MediaBinder {

    private static final Logger LOGGER = Logger.getLogger(MediaBinder.class.getName());

    private final Supplier<Collection<PeerConnection>> connections;
    private LocalStream localStream;

    MediaBinder(Supplier<Collection<PeerConnection>> connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Stores {@code stream} and attaches its tracks to every registered connection. A previously
     * started stream is detached first; its tracks are not stopped since the application owns them.
     */
    public synchronized void startLocal(LocalStream stream) {
        Objects.requireNonNull(stream, "stream");
        if (localStream != null && localStream != stream) {
            LOGGER.info("[MediaBinder] Swapping local stream " + localStream.getId() + " -> " + stream.getId());
            detachFromAll();
        }
        localStream = stream;
        Collection<PeerConnection> current = connections.get();
        for (PeerConnection connection : current) {
            connection.attachLocalTracks(stream);
        }
        LOGGER.info(String.format("[MediaBinder] Local stream %s attached to %d connection(s)",
            stream.getId(), current.size()));
    }

    /**
     * Stops every local track, detaches them from all connections and forgets the stream.
     */
    public synchronized void stopLocal() {
        if (localStream == null) {
            return;
        }
        localStream.stop();
        detachFromAll();
        LOGGER.info("[MediaBinder] Local stream " + localStream.getId() + " stopped");
        localStream = null;
    }

    /**
     * Attaches the current local stream, if any, to a freshly created connection.
     */
    public synchronized void onConnectionCreated(PeerConnection connection) {
        if (localStream != null) {
            connection.attachLocalTracks(localStream);
        }
    }

    public synchronized Optional<LocalStream> getLocalStream() {
        return Optional.ofNullable(localStream);
    }

    private void detachFromAll() {
        for (PeerConnection connection : connections.get()) {
            connection.detachLocalTracks();
        }
    }
}
