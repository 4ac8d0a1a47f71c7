package com.chatmesh.p2p;

/**
 * A trickled ICE candidate as exchanged over signaling.
 *
 * @param sdpMid        media section identifier, may be null when the index is set
 * @param sdpMLineIndex index of the media section, or -1 when unknown
 * @param candidate     the {@code candidate:} attribute line
 */
public record IceCandidate(String sdpMid, int sdpMLineIndex, String candidate) {

    /**
     * A candidate is usable when it carries a candidate line and identifies its media section
     * either by mid or by index.
     */
    public boolean isWellFormed() {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        return (sdpMid != null && !sdpMid.isEmpty()) || sdpMLineIndex >= 0;
    }
}
