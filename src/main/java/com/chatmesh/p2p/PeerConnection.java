package com.chatmesh.p2p;

import com.chatmesh.ice.IceServer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One bidirectional media link to exactly one remote participant.
 *
 * Instances are created by {@link ConnectionRegistry} only; {@link #getRemoteId()} never changes.
 */
public final class PeerConnection {

    private static final Logger LOGGER = Logger.getLogger(PeerConnection.class.getName());

    /**
     * Receives the transport callbacks of a connection, tagged with the connection they came from.
     */
    interface Listener {

        void onIceCandidate(PeerConnection connection, IceCandidate candidate);

        void onIceStateChange(PeerConnection connection, IceState state);

        void onTransportStateChange(PeerConnection connection, TransportState state);

        void onRemoteTrack(PeerConnection connection, MediaTrack track);
    }

    private final String remoteId;
    private final MediaTransport transport;
    private final ConnectionHealthMonitor healthMonitor;
    private final AtomicBoolean tornDown = new AtomicBoolean();
    private final Object stateLock = new Object();

    // local track id -> sender
    private final Map<String, TrackSender> senders = new LinkedHashMap<>();
    private RemoteStream remoteStream;
    private int streamGeneration;
    private Future<?> graceTimer;
    private volatile boolean makingOffer;

    PeerConnection(String remoteId,
                   TransportFactory transportFactory,
                   List<IceServer> iceServers,
                   ConnectionHealthMonitor healthMonitor,
                   Listener listener) {
        this.remoteId = Objects.requireNonNull(remoteId, "remoteId");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        Objects.requireNonNull(listener, "listener");
        this.transport = Objects.requireNonNull(
            transportFactory.create(remoteId, iceServers, new TransportEvents() {
                @Override
                public void onIceCandidate(IceCandidate candidate) {
                    listener.onIceCandidate(PeerConnection.this, candidate);
                }

                @Override
                public void onIceStateChange(IceState state) {
                    listener.onIceStateChange(PeerConnection.this, state);
                }

                @Override
                public void onTransportStateChange(TransportState state) {
                    listener.onTransportStateChange(PeerConnection.this, state);
                }

                @Override
                public void onRemoteTrack(MediaTrack track) {
                    listener.onRemoteTrack(PeerConnection.this, track);
                }
            }), "transport");
    }

    public String getRemoteId() {
        return remoteId;
    }

    public MediaTransport getTransport() {
        return transport;
    }

    public ConnectionHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public NegotiationState getNegotiationState() {
        return isClosed() ? NegotiationState.CLOSED : transport.getNegotiationState();
    }

    public Optional<RemoteStream> getRemoteStream() {
        synchronized (stateLock) {
            return Optional.ofNullable(remoteStream);
        }
    }

    /**
     * Local tracks currently sent on this connection.
     */
    public List<MediaTrack> getSentTracks() {
        synchronized (stateLock) {
            List<MediaTrack> tracks = new ArrayList<>(senders.size());
            for (TrackSender sender : senders.values()) {
                tracks.add(sender.getTrack());
            }
            return tracks;
        }
    }

    /**
     * True between starting to generate a local offer and sending it.
     */
    public boolean isMakingOffer() {
        return makingOffer;
    }

    void setMakingOffer(boolean makingOffer) {
        this.makingOffer = makingOffer;
    }

    public boolean isClosed() {
        return tornDown.get() || transport.isClosed();
    }

    void attachLocalTracks(LocalStream stream) {
        synchronized (stateLock) {
            if (isClosed()) {
                return;
            }
            for (MediaTrack track : stream.getTracks()) {
                if (!senders.containsKey(track.getId())) {
                    senders.put(track.getId(), transport.addTrack(track, stream.getId()));
                }
            }
        }
    }

    void detachLocalTracks() {
        synchronized (stateLock) {
            for (TrackSender sender : senders.values()) {
                try {
                    transport.removeTrack(sender);
                } catch (RuntimeException ex) {
                    LOGGER.log(Level.FINE, "[PeerConnection] Could not remove track from " + remoteId, ex);
                }
            }
            senders.clear();
        }
    }

    /**
     * Adds an inbound track to the current remote stream.
     *
     * @return the stream to announce, if this track started a new one
     */
    Optional<RemoteStream> acceptRemoteTrack(MediaTrack track) {
        synchronized (stateLock) {
            if (remoteStream != null && remoteStream.containsTrack(track.getId())) {
                return Optional.empty();
            }
            if (remoteStream == null || remoteStream.hasKind(track.getKind())) {
                remoteStream = new RemoteStream(remoteId, ++streamGeneration);
                remoteStream.addTrack(track);
                return Optional.of(remoteStream);
            }
            remoteStream.addTrack(track);
            return Optional.empty();
        }
    }

    void setGraceTimer(Future<?> timer) {
        synchronized (stateLock) {
            if (graceTimer != null) {
                graceTimer.cancel(false);
            }
            graceTimer = timer;
        }
    }

    void cancelGraceTimer() {
        setGraceTimer(null);
    }

    /**
     * Claims the single teardown of this connection.
     *
     * @return false if teardown already happened
     */
    boolean beginTeardown() {
        return tornDown.compareAndSet(false, true);
    }

    /**
     * Releases the transport. Safe to call more than once.
     */
    void close() {
        healthMonitor.markClosed();
        cancelGraceTimer();
        if (transport.isClosed()) {
            return;
        }
        try {
            transport.close();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[PeerConnection] Error closing transport for " + remoteId, ex);
        }
    }

    @Override
    public String toString() {
        return "PeerConnection[" + remoteId + ", " + healthMonitor.getState() + "]";
    }
}
