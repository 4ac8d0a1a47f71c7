package com.chatmesh.p2p;

/**
 * Offer/answer state of one connection, mirroring the transport's signaling state.
 */
public enum NegotiationState {
    STABLE,
    HAVE_LOCAL_OFFER,
    HAVE_REMOTE_OFFER,
    CLOSED
}
