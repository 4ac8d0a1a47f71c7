package com.chatmesh.webrtc;

import com.chatmesh.p2p.MediaTrack;
import com.chatmesh.p2p.TrackSender;
import dev.onvoid.webrtc.RTCRtpSender;

final class WebRtcTrackSender implements TrackSender {

    private final MediaTrack track;
    private final RTCRtpSender sender;

    WebRtcTrackSender(MediaTrack track, RTCRtpSender sender) {
        this.track = track;
        this.sender = sender;
    }

    RTCRtpSender getNativeSender() {
        return sender;
    }

    @Override
    public MediaTrack getTrack() {
        return track;
    }
}
