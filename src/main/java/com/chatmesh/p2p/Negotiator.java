package com.chatmesh.p2p;

import com.chatmesh.signaling.SignalingChannel;
import com.chatmesh.signaling.SignalingMessage;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the offer/answer exchange for every connection and resolves glare.
 *
 * <p>When both sides offer at once, the participant whose id sorts lower is polite: it rolls back
 * its own offer and answers the remote one. The other side is impolite and drops the incoming
 * offer, keeping its own in flight. Exactly one offer per pair survives without an arbiter.
 *
 * <p>Every asynchronous step resumes on the session executor. No lock is held across a step, so
 * messages for other participants interleave freely.
 */
public final class Negotiator {

    private static final Logger LOGGER = Logger.getLogger(Negotiator.class.getName());

    private final String localId;
    private final ConnectionRegistry registry;
    private final SignalingChannel signaling;
    private final Executor sessionExecutor;

    Negotiator(String localId, ConnectionRegistry registry, SignalingChannel signaling, Executor sessionExecutor) {
        this.localId = Objects.requireNonNull(localId, "localId");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.signaling = Objects.requireNonNull(signaling, "signaling");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
    }

    /**
     * True if this side concedes when its offer collides with one from {@code remoteId}.
     */
    public boolean isPolite(String remoteId) {
        return localId.compareTo(remoteId) < 0;
    }

    /**
     * Creates a send/receive offer for {@code remoteId}, applies it locally and sends it.
     *
     * @return completes exceptionally with {@link NegotiationException} if generating or applying
     *         the offer failed; the connection is kept for a retry
     */
    public CompletableFuture<Void> createOffer(String remoteId) {
        PeerConnection connection = registry.getOrCreate(remoteId);
        LOGGER.info("[Negotiator] Creating offer for " + remoteId);
        return sendOffer(connection, OfferOptions.sendReceive());
    }

    /**
     * Renegotiates connectivity on the existing session. Skipped while another negotiation is in
     * flight, since that one gathers fresh candidates anyway.
     */
    CompletableFuture<Void> restartIce(PeerConnection connection) {
        if (connection.isClosed()) {
            return CompletableFuture.completedFuture(null);
        }
        NegotiationState state = connection.getNegotiationState();
        if (state != NegotiationState.STABLE || connection.isMakingOffer()) {
            LOGGER.fine("[Negotiator] Skipping ICE restart for " + connection.getRemoteId() + " in state " + state);
            return CompletableFuture.completedFuture(null);
        }
        LOGGER.info("[Negotiator] Restarting ICE with " + connection.getRemoteId());
        return sendOffer(connection, OfferOptions.forIceRestart()).exceptionally(ex -> null);
    }

    /**
     * Answers an offer from {@code fromId}, resolving glare first if this side has an offer of its
     * own outstanding. Never completes exceptionally.
     */
    public CompletableFuture<Void> handleOffer(String fromId, String sdp) {
        PeerConnection connection = registry.getOrCreate(fromId);
        MediaTransport transport = connection.getTransport();

        boolean collision = connection.isMakingOffer()
            || connection.getNegotiationState() == NegotiationState.HAVE_LOCAL_OFFER;
        CompletableFuture<Void> ready;
        if (collision) {
            if (!isPolite(fromId)) {
                LOGGER.info("[Negotiator] Glare with " + fromId + ": keeping own offer, ignoring theirs");
                return CompletableFuture.completedFuture(null);
            }
            if (connection.getNegotiationState() == NegotiationState.HAVE_LOCAL_OFFER) {
                LOGGER.info("[Negotiator] Glare with " + fromId + ": rolling back own offer");
                ready = call(() -> transport.setLocalDescription(SessionDescription.rollback()));
            } else {
                ready = CompletableFuture.completedFuture(null);
            }
        } else {
            ready = CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        ready.thenComposeAsync(v -> whileOpen(connection,
                    () -> transport.setRemoteDescription(SessionDescription.offer(sdp))), sessionExecutor)
            .thenComposeAsync(v -> whileOpen(connection, transport::createAnswer), sessionExecutor)
            .thenComposeAsync(answer -> whileOpen(connection,
                    () -> transport.setLocalDescription(answer)).thenApply(v -> answer), sessionExecutor)
            .thenAcceptAsync(answer -> {
                if (!connection.isClosed()) {
                    signaling.send(new SignalingMessage.Answer(localId, fromId, answer.sdp()));
                    LOGGER.fine("[Negotiator] Answer sent to " + fromId);
                }
            }, sessionExecutor)
            .whenComplete((v, error) -> {
                if (error != null) {
                    logFailure(connection, "answer offer from", error);
                }
                result.complete(null);
            });
        return result;
    }

    /**
     * Completes the exchange started by {@link #createOffer}. An answer from a participant with no
     * connection is dropped. Never completes exceptionally.
     */
    public CompletableFuture<Void> handleAnswer(String fromId, String sdp) {
        Optional<PeerConnection> found = registry.get(fromId);
        if (found.isEmpty()) {
            LOGGER.fine("[Negotiator] Dropping answer from unknown peer " + fromId);
            return CompletableFuture.completedFuture(null);
        }
        PeerConnection connection = found.get();
        CompletableFuture<Void> result = new CompletableFuture<>();
        whileOpen(connection, () -> connection.getTransport().setRemoteDescription(SessionDescription.answer(sdp)))
            .whenCompleteAsync((v, error) -> {
                if (error != null) {
                    logFailure(connection, "apply answer from", error);
                } else {
                    LOGGER.fine("[Negotiator] Answer from " + fromId + " applied");
                }
                result.complete(null);
            }, sessionExecutor);
        return result;
    }

    /**
     * Adds a trickled candidate. Candidates for unknown peers and malformed candidates are dropped;
     * trickle ICE sends redundant candidates, so nothing is retried.
     */
    public void handleIceCandidate(String fromId, IceCandidate candidate) {
        Optional<PeerConnection> found = registry.get(fromId);
        if (found.isEmpty()) {
            LOGGER.fine("[Negotiator] Dropping candidate from unknown peer " + fromId);
            return;
        }
        if (candidate == null || !candidate.isWellFormed()) {
            LOGGER.fine("[Negotiator] Dropping malformed candidate from " + fromId);
            return;
        }
        PeerConnection connection = found.get();
        if (connection.isClosed()) {
            return;
        }
        try {
            connection.getTransport().addIceCandidate(candidate);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.FINE, "[Negotiator] Candidate from " + fromId + " rejected", ex);
        }
    }

    /**
     * Sends a locally discovered candidate to the connection's peer as soon as it is found.
     */
    void forwardLocalCandidate(PeerConnection connection, IceCandidate candidate) {
        if (connection.isClosed()) {
            return;
        }
        try {
            signaling.send(new SignalingMessage.Candidate(localId, connection.getRemoteId(), candidate));
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[Negotiator] Failed to send candidate to " + connection.getRemoteId(), ex);
        }
    }

    private CompletableFuture<Void> sendOffer(PeerConnection connection, OfferOptions options) {
        String remoteId = connection.getRemoteId();
        MediaTransport transport = connection.getTransport();
        CompletableFuture<Void> result = new CompletableFuture<>();

        connection.setMakingOffer(true);
        whileOpen(connection, () -> transport.createOffer(options))
            .thenComposeAsync(offer -> whileOpen(connection,
                    () -> transport.setLocalDescription(offer)).thenApply(v -> offer), sessionExecutor)
            .thenAcceptAsync(offer -> {
                if (!connection.isClosed()) {
                    signaling.send(new SignalingMessage.Offer(localId, remoteId, offer.sdp()));
                    LOGGER.fine("[Negotiator] Offer sent to " + remoteId);
                }
            }, sessionExecutor)
            .whenComplete((v, error) -> {
                connection.setMakingOffer(false);
                if (error == null || connection.isClosed()) {
                    result.complete(null);
                    return;
                }
                Throwable cause = unwrap(error);
                LOGGER.log(Level.WARNING, "[Negotiator] Failed to create offer for " + remoteId, cause);
                result.completeExceptionally(
                    new NegotiationException(remoteId, "Failed to create offer for " + remoteId, cause));
            });
        return result;
    }

    private void logFailure(PeerConnection connection, String what, Throwable error) {
        if (connection.isClosed()) {
            LOGGER.fine("[Negotiator] Connection to " + connection.getRemoteId()
                + " closed mid-negotiation, dropping step");
            return;
        }
        LOGGER.log(Level.WARNING, "[Negotiator] Failed to " + what + " " + connection.getRemoteId(), unwrap(error));
    }

    /**
     * Runs {@code step} unless the connection was closed while the previous step was suspended.
     */
    private static <T> CompletableFuture<T> whileOpen(PeerConnection connection,
                                                      Supplier<CompletableFuture<T>> step) {
        if (connection.isClosed()) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Connection to " + connection.getRemoteId() + " is closed"));
        }
        return call(step);
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> step) {
        try {
            return step.get();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
