package com.chatmesh.p2p;

/**
 * Options for {@link MediaTransport#createOffer(OfferOptions)}.
 */
public record OfferOptions(boolean offerToReceiveAudio, boolean offerToReceiveVideo, boolean iceRestart) {

    /** Send and receive both audio and video. */
    public static OfferOptions sendReceive() {
        return new OfferOptions(true, true, false);
    }

    /** Same as {@link #sendReceive()} but gathering fresh ICE credentials. */
    public static OfferOptions forIceRestart() {
        return new OfferOptions(true, true, true);
    }
}
