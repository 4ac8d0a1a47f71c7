package com.chatmesh.p2p;

import java.util.Objects;

/**
 * An SDP blob together with its role in the offer/answer exchange.
 */
public record SessionDescription(Type type, String sdp) {

    public enum Type {
        OFFER,
        ANSWER,
        ROLLBACK
    }

    public SessionDescription {
        Objects.requireNonNull(type, "type");
        sdp = sdp == null ? "" : sdp;
    }

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(Type.OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(Type.ANSWER, sdp);
    }

    public static SessionDescription rollback() {
        return new SessionDescription(Type.ROLLBACK, "");
    }

    @Override
    public String toString() {
        return "SessionDescription[" + type + ", " + sdp.length() + " bytes]";
    }
}
