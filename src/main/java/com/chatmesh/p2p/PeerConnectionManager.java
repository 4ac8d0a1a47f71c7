package com.chatmesh.p2p;

import com.chatmesh.config.MeshConfig;
import com.chatmesh.signaling.SignalingChannel;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mesh connection manager for one participant in one room.
 *
 * Architecture:
 * 1. {@link ConnectionRegistry} holds one {@link PeerConnection} per remote participant
 * 2. {@link MediaBinder} keeps the local stream attached to all of them
 * 3. {@link Negotiator} runs offer/answer and glare resolution
 * 4. {@link ConnectionHealthMonitor} (one per connection) decides restart, grace period or teardown
 *
 * <p>Transport callbacks and asynchronous negotiation steps are re-dispatched onto a single
 * session executor. The only timeout is the disconnection grace period from {@link MeshConfig}.
 * The host only ever sees {@link PeerEvents#onRemoteStream} and
 * {@link PeerEvents#onRemoteStreamEnded}.
 */
public final class PeerConnectionManager implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(PeerConnectionManager.class.getName());

    private final String localId;
    private final TransportFactory transportFactory;
    private final PeerEvents events;
    private final MeshConfig config;
    private final Executor sessionExecutor;
    private final ScheduledExecutorService timerScheduler;
    private final boolean ownsExecutors;

    private final MediaBinder mediaBinder;
    private final ConnectionRegistry registry;
    private final Negotiator negotiator;
    private final PeerConnection.Listener connectionListener = new ConnectionListener();

    public PeerConnectionManager(String localId,
                                 TransportFactory transportFactory,
                                 SignalingChannel signaling,
                                 PeerEvents events,
                                 MeshConfig config) {
        this(localId, transportFactory, signaling, events, config,
            newSessionExecutor(localId), newTimerScheduler(localId), true);
    }

    /**
     * Uses caller-supplied executors, which the caller keeps ownership of.
     */
    public PeerConnectionManager(String localId,
                                 TransportFactory transportFactory,
                                 SignalingChannel signaling,
                                 PeerEvents events,
                                 MeshConfig config,
                                 Executor sessionExecutor,
                                 ScheduledExecutorService timerScheduler) {
        this(localId, transportFactory, signaling, events, config, sessionExecutor, timerScheduler, false);
    }

    private PeerConnectionManager(String localId,
                                  TransportFactory transportFactory,
                                  SignalingChannel signaling,
                                  PeerEvents events,
                                  MeshConfig config,
                                  Executor sessionExecutor,
                                  ScheduledExecutorService timerScheduler,
                                  boolean ownsExecutors) {
        this.localId = Objects.requireNonNull(localId, "localId");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.events = Objects.requireNonNull(events, "events");
        this.config = Objects.requireNonNull(config, "config");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler");
        this.ownsExecutors = ownsExecutors;

        this.mediaBinder = new MediaBinder(this::registeredConnections);
        this.registry = new ConnectionRegistry(this::openConnection, mediaBinder::onConnectionCreated);
        this.negotiator = new Negotiator(localId, registry, Objects.requireNonNull(signaling, "signaling"),
            sessionExecutor);

        LOGGER.info("[Mesh] Manager ready for " + localId + " with " + config);
    }

    private static ExecutorService newSessionExecutor(String localId) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mesh-session-" + localId);
            t.setDaemon(true);
            return t;
        });
    }

    private static ScheduledExecutorService newTimerScheduler(String localId) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mesh-grace-timer-" + localId);
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------ streaming

    /**
     * Attaches {@code stream} to every current and future connection. Returns once every
     * registered connection carries the stream's tracks.
     */
    public void startStreaming(LocalStream stream) {
        mediaBinder.startLocal(stream);
    }

    /**
     * Stops the local tracks and detaches them from every connection.
     */
    public void stopStreaming() {
        mediaBinder.stopLocal();
    }

    public boolean isStreaming() {
        return mediaBinder.getLocalStream().isPresent();
    }

    // ------------------------------------------------------------------ negotiation

    /**
     * Opens (or reuses) the connection to {@code remoteId} and sends it an offer.
     *
     * @return completes exceptionally with {@link NegotiationException} on a transient failure;
     *         call again to retry
     */
    public CompletableFuture<Void> createOffer(String remoteId) {
        Objects.requireNonNull(remoteId, "remoteId");
        return negotiator.createOffer(remoteId);
    }

    public CompletableFuture<Void> handleOffer(String fromId, String sdp) {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(sdp, "sdp");
        return negotiator.handleOffer(fromId, sdp);
    }

    public CompletableFuture<Void> handleAnswer(String fromId, String sdp) {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(sdp, "sdp");
        return negotiator.handleAnswer(fromId, sdp);
    }

    public void handleIceCandidate(String fromId, IceCandidate candidate) {
        Objects.requireNonNull(fromId, "fromId");
        negotiator.handleIceCandidate(fromId, candidate);
    }

    // ------------------------------------------------------------------ lifecycle

    /**
     * Tears down the connection to {@code remoteId}. Unknown ids are ignored.
     */
    public void removePeer(String remoteId) {
        registry.get(remoteId).ifPresent(connection -> teardown(connection, "removed by host"));
    }

    /**
     * Stops streaming and tears down every connection. Intended for leaving the room.
     */
    public void cleanup() {
        mediaBinder.stopLocal();
        Collection<PeerConnection> connections = registry.connections();
        for (PeerConnection connection : connections) {
            teardown(connection, "cleanup");
        }
        LOGGER.info(String.format("[Mesh] Cleaned up %d connection(s)", connections.size()));
    }

    @Override
    public void close() {
        cleanup();
        if (!ownsExecutors) {
            return;
        }
        timerScheduler.shutdownNow();
        ExecutorService session = (ExecutorService) sessionExecutor;
        session.shutdown();
        try {
            if (!session.awaitTermination(3, TimeUnit.SECONDS)) {
                LOGGER.warning("[Mesh] Session executor did not terminate gracefully, forcing shutdown");
                session.shutdownNow();
            }
        } catch (InterruptedException e) {
            session.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------ queries

    public String getLocalId() {
        return localId;
    }

    public Optional<PeerConnection> getConnection(String remoteId) {
        return registry.get(remoteId);
    }

    public Set<String> getRemoteIds() {
        return registry.remoteIds();
    }

    public Optional<NegotiationState> getNegotiationState(String remoteId) {
        return registry.get(remoteId).map(PeerConnection::getNegotiationState);
    }

    ConnectionRegistry getRegistry() {
        return registry;
    }

    Negotiator getNegotiator() {
        return negotiator;
    }

    // ------------------------------------------------------------------ internals

    private Collection<PeerConnection> registeredConnections() {
        return registry.connections();
    }

    private PeerConnection openConnection(String remoteId) {
        return new PeerConnection(remoteId, transportFactory,
            config.getIceConfiguration().getIceServers(),
            new ConnectionHealthMonitor(config.getMaxIceRestarts()),
            connectionListener);
    }

    private void apply(PeerConnection connection, HealthAction action) {
        switch (action) {
            case RESTART_ICE:
                negotiator.restartIce(connection);
                break;
            case START_GRACE_TIMER:
                startGraceTimer(connection);
                break;
            case CANCEL_GRACE_TIMER:
                LOGGER.info("[Health] " + connection.getRemoteId() + " recovered within grace period");
                connection.cancelGraceTimer();
                break;
            case TEARDOWN:
                teardown(connection, "connection " + connection.getHealthMonitor().getState());
                break;
            default:
                break;
        }
    }

    private void startGraceTimer(PeerConnection connection) {
        long generation = connection.getHealthMonitor().getGraceGeneration();
        long graceMs = config.getDisconnectGracePeriod().toMillis();
        LOGGER.info(String.format("[Health] %s disconnected, waiting %dms for recovery",
            connection.getRemoteId(), graceMs));
        try {
            ScheduledFuture<?> timer = timerScheduler.schedule(
                () -> runOnSession(() -> apply(connection,
                    connection.getHealthMonitor().onGracePeriodExpired(generation))),
                graceMs, TimeUnit.MILLISECONDS);
            connection.setGraceTimer(timer);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "[Health] Timer scheduler stopped, tearing down " + connection.getRemoteId(), e);
            teardown(connection, "scheduler stopped");
        }
    }

    private void teardown(PeerConnection connection, String reason) {
        if (!connection.beginTeardown()) {
            return;
        }
        String remoteId = connection.getRemoteId();
        registry.remove(connection);
        LOGGER.info("[Mesh] Tore down connection to " + remoteId + " (" + reason + ")");
        try {
            events.onRemoteStreamEnded(remoteId);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[Mesh] onRemoteStreamEnded listener failed for " + remoteId, ex);
        }
    }

    private void runOnSession(Runnable task) {
        try {
            sessionExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "[Mesh] Session executor stopped, dropping event", e);
        }
    }

    /**
     * Re-dispatches transport callbacks onto the session executor.
     */
    private final class ConnectionListener implements PeerConnection.Listener {

        @Override
        public void onIceCandidate(PeerConnection connection, IceCandidate candidate) {
            runOnSession(() -> negotiator.forwardLocalCandidate(connection, candidate));
        }

        @Override
        public void onIceStateChange(PeerConnection connection, IceState state) {
            runOnSession(() -> {
                LOGGER.fine("[Health] ICE " + state + " for " + connection.getRemoteId());
                apply(connection, connection.getHealthMonitor().onIceStateChange(state));
            });
        }

        @Override
        public void onTransportStateChange(PeerConnection connection, TransportState state) {
            runOnSession(() -> {
                LOGGER.fine("[Health] Transport " + state + " for " + connection.getRemoteId());
                apply(connection, connection.getHealthMonitor().onTransportStateChange(state));
            });
        }

        @Override
        public void onRemoteTrack(PeerConnection connection, MediaTrack track) {
            runOnSession(() -> {
                if (connection.isClosed()) {
                    return;
                }
                connection.acceptRemoteTrack(track).ifPresent(stream -> {
                    LOGGER.info("[Mesh] Remote stream from " + connection.getRemoteId() + ": " + stream);
                    try {
                        events.onRemoteStream(connection.getRemoteId(), stream);
                    } catch (RuntimeException ex) {
                        LOGGER.log(Level.WARNING,
                            "[Mesh] onRemoteStream listener failed for " + connection.getRemoteId(), ex);
                    }
                });
            });
        }
    }
}
