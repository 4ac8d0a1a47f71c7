package com.chatmesh.p2p;

/**
 * Offer/answer generation or description assignment failed. The connection is left intact and
 * the operation may be retried.
 */
public class NegotiationException extends Exception {

    private final String remoteId;

    public NegotiationException(String remoteId, String message, Throwable cause) {
        super(message, cause);
        this.remoteId = remoteId;
    }

    public String getRemoteId() {
        return remoteId;
    }
}
