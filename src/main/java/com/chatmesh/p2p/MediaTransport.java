package com.chatmesh.p2p;

import java.util.concurrent.CompletableFuture;

/**
 * The real-time transport behind one {@link PeerConnection}. Futures returned here complete on
 * whatever thread the transport uses; callers re-dispatch onto their own context. Once
 * {@link #close()} was called every returned future fails.
 */
public interface MediaTransport {

    CompletableFuture<SessionDescription> createOffer(OfferOptions options);

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    /**
     * @throws IllegalArgumentException if the candidate is rejected
     * @throws IllegalStateException    if the transport is closed
     */
    void addIceCandidate(IceCandidate candidate);

    TrackSender addTrack(MediaTrack track, String streamId);

    void removeTrack(TrackSender sender);

    NegotiationState getNegotiationState();

    boolean isClosed();

    void close();
}
