package com.chatmesh.webrtc;

import com.chatmesh.p2p.IceCandidate;
import com.chatmesh.p2p.IceState;
import com.chatmesh.p2p.MediaTrack;
import com.chatmesh.p2p.MediaTransport;
import com.chatmesh.p2p.NegotiationState;
import com.chatmesh.p2p.OfferOptions;
import com.chatmesh.p2p.SessionDescription;
import com.chatmesh.p2p.TrackSender;
import com.chatmesh.p2p.TransportEvents;
import com.chatmesh.p2p.TransportState;
import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCRtpSender;
import dev.onvoid.webrtc.RTCRtpTransceiver;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.RTCSignalingState;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import dev.onvoid.webrtc.media.MediaStreamTrack;
import dev.onvoid.webrtc.media.audio.AudioOptions;
import dev.onvoid.webrtc.media.audio.AudioTrack;
import dev.onvoid.webrtc.media.video.VideoDeviceSource;
import dev.onvoid.webrtc.media.video.VideoTrack;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MediaTransport} over a native {@link RTCPeerConnection}.
 *
 * <p>Observer callbacks are bridged to {@link CompletableFuture}s which complete on the native
 * signaling thread.
 *
 * <p>An offer asking to receive a kind that no local track carries gets a disabled placeholder
 * track of that kind, so the section is negotiated as send/receive. A local track of the same
 * kind added later takes over the placeholder's sender.
 */
final class WebRtcTransport implements MediaTransport {

    private static final Logger LOGGER = Logger.getLogger(WebRtcTransport.class.getName());
    private static final String PLACEHOLDER_STREAM_ID = "placeholder";

    private final String remoteId;
    private final TransportEvents events;
    private final PeerConnectionFactory factory;
    private final RTCPeerConnection peerConnection;
    private final Map<String, RTCRtpSender> placeholderSenders = new ConcurrentHashMap<>();
    private final List<MediaStreamTrack> placeholderTracks = Collections.synchronizedList(new ArrayList<>());

    private volatile RTCSignalingState signalingState = RTCSignalingState.STABLE;
    private volatile boolean closed;

    WebRtcTransport(String remoteId, PeerConnectionFactory factory, RTCConfiguration configuration,
                    TransportEvents events) {
        this.remoteId = remoteId;
        this.events = events;
        this.factory = factory;
        this.peerConnection = factory.createPeerConnection(configuration, new Observer());
        if (peerConnection == null) {
            throw new IllegalStateException("Native peer connection could not be created for " + remoteId);
        }
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer(OfferOptions options) {
        RTCOfferOptions offerOptions = new RTCOfferOptions();
        offerOptions.iceRestart = options.iceRestart();
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        if (failIfClosed(future)) {
            return future;
        }
        for (String kind : missingKinds(options, presentKinds())) {
            addPlaceholder(kind);
        }
        peerConnection.createOffer(offerOptions, new DescriptionObserver(future, "create offer"));
        return future;
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        if (failIfClosed(future)) {
            return future;
        }
        peerConnection.createAnswer(new RTCAnswerOptions(), new DescriptionObserver(future, "create answer"));
        return future;
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        if (failIfClosed(future)) {
            return future;
        }
        peerConnection.setLocalDescription(toNative(description), new SetObserver(future, "set local description"));
        return future;
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        if (failIfClosed(future)) {
            return future;
        }
        peerConnection.setRemoteDescription(toNative(description), new SetObserver(future, "set remote description"));
        return future;
    }

    @Override
    public void addIceCandidate(IceCandidate candidate) {
        if (closed) {
            throw new IllegalStateException("Transport to " + remoteId + " is closed");
        }
        peerConnection.addIceCandidate(
            new RTCIceCandidate(candidate.sdpMid(), candidate.sdpMLineIndex(), candidate.candidate()));
    }

    @Override
    public TrackSender addTrack(MediaTrack track, String streamId) {
        if (!(track instanceof WebRtcMediaTrack)) {
            throw new IllegalArgumentException("Not a native track: " + track);
        }
        MediaStreamTrack nativeTrack = ((WebRtcMediaTrack) track).getNativeTrack();
        RTCRtpSender placeholder = placeholderSenders.remove(nativeTrack.getKind());
        if (placeholder != null) {
            placeholder.replaceTrack(nativeTrack);
            return new WebRtcTrackSender(track, placeholder);
        }
        return new WebRtcTrackSender(track,
            peerConnection.addTrack(nativeTrack, Collections.singletonList(streamId)));
    }

    @Override
    public void removeTrack(TrackSender sender) {
        if (sender instanceof WebRtcTrackSender) {
            peerConnection.removeTrack(((WebRtcTrackSender) sender).getNativeSender());
        }
    }

    @Override
    public NegotiationState getNegotiationState() {
        return closed ? NegotiationState.CLOSED : toNegotiationState(signalingState);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        signalingState = RTCSignalingState.CLOSED;
        peerConnection.close();
        synchronized (placeholderTracks) {
            for (MediaStreamTrack track : placeholderTracks) {
                track.dispose();
            }
            placeholderTracks.clear();
        }
        placeholderSenders.clear();
        LOGGER.fine("[WebRTC] Peer connection to " + remoteId + " closed");
    }

    private Set<String> presentKinds() {
        Set<String> kinds = new HashSet<>();
        for (RTCRtpTransceiver transceiver : peerConnection.getTransceivers()) {
            MediaStreamTrack receiverTrack = transceiver.getReceiver().getTrack();
            if (receiverTrack != null) {
                kinds.add(receiverTrack.getKind());
            }
        }
        return kinds;
    }

    private void addPlaceholder(String kind) {
        MediaStreamTrack track;
        if (MediaTrack.KIND_AUDIO.equals(kind)) {
            AudioTrack audioTrack = factory.createAudioTrack("placeholder-audio",
                factory.createAudioSource(new AudioOptions()));
            track = audioTrack;
        } else {
            VideoTrack videoTrack = factory.createVideoTrack("placeholder-video", new VideoDeviceSource());
            track = videoTrack;
        }
        track.setEnabled(false);
        placeholderTracks.add(track);
        placeholderSenders.put(kind, peerConnection.addTrack(track, Collections.singletonList(PLACEHOLDER_STREAM_ID)));
        LOGGER.fine("[WebRTC] Added receive placeholder for " + kind + " to " + remoteId);
    }

    private boolean failIfClosed(CompletableFuture<?> future) {
        if (closed) {
            future.completeExceptionally(new IllegalStateException("Transport to " + remoteId + " is closed"));
            return true;
        }
        return false;
    }

    // ------------------------------------------------------------------ mapping

    /**
     * Kinds the offer asks to receive that no existing transceiver covers, audio first.
     */
    static List<String> missingKinds(OfferOptions options, Collection<String> presentKinds) {
        List<String> missing = new ArrayList<>(2);
        if (options.offerToReceiveAudio() && !presentKinds.contains(MediaTrack.KIND_AUDIO)) {
            missing.add(MediaTrack.KIND_AUDIO);
        }
        if (options.offerToReceiveVideo() && !presentKinds.contains(MediaTrack.KIND_VIDEO)) {
            missing.add(MediaTrack.KIND_VIDEO);
        }
        return missing;
    }

    static RTCSessionDescription toNative(SessionDescription description) {
        switch (description.type()) {
            case OFFER:
                return new RTCSessionDescription(RTCSdpType.OFFER, description.sdp());
            case ANSWER:
                return new RTCSessionDescription(RTCSdpType.ANSWER, description.sdp());
            case ROLLBACK:
                return new RTCSessionDescription(RTCSdpType.ROLLBACK, "");
            default:
                throw new IllegalArgumentException("Unsupported description type " + description.type());
        }
    }

    static NegotiationState toNegotiationState(RTCSignalingState state) {
        switch (state) {
            case STABLE:
                return NegotiationState.STABLE;
            case HAVE_LOCAL_OFFER:
            case HAVE_LOCAL_PR_ANSWER:
                return NegotiationState.HAVE_LOCAL_OFFER;
            case HAVE_REMOTE_OFFER:
            case HAVE_REMOTE_PR_ANSWER:
                return NegotiationState.HAVE_REMOTE_OFFER;
            default:
                return NegotiationState.CLOSED;
        }
    }

    static IceState toIceState(RTCIceConnectionState state) {
        switch (state) {
            case NEW:
                return IceState.NEW;
            case CHECKING:
                return IceState.CHECKING;
            case CONNECTED:
                return IceState.CONNECTED;
            case COMPLETED:
                return IceState.COMPLETED;
            case DISCONNECTED:
                return IceState.DISCONNECTED;
            case FAILED:
                return IceState.FAILED;
            default:
                return IceState.CLOSED;
        }
    }

    static TransportState toTransportState(RTCPeerConnectionState state) {
        switch (state) {
            case NEW:
                return TransportState.NEW;
            case CONNECTING:
                return TransportState.CONNECTING;
            case CONNECTED:
                return TransportState.CONNECTED;
            case DISCONNECTED:
                return TransportState.DISCONNECTED;
            case FAILED:
                return TransportState.FAILED;
            default:
                return TransportState.CLOSED;
        }
    }

    /**
     * Rewrites generated descriptions so audio and video are always offered as send/receive.
     */
    static SessionDescription fromNative(RTCSessionDescription description) {
        String sdp = SDPUtils.enforceSendRecv(description.sdp, MediaTrack.KIND_AUDIO);
        sdp = SDPUtils.enforceSendRecv(sdp, MediaTrack.KIND_VIDEO);
        if (description.sdpType == RTCSdpType.ANSWER) {
            return SessionDescription.answer(sdp);
        }
        return SessionDescription.offer(sdp);
    }

    // ------------------------------------------------------------------ observers

    private final class Observer implements PeerConnectionObserver {

        @Override
        public void onIceCandidate(RTCIceCandidate candidate) {
            if (closed) {
                return;
            }
            events.onIceCandidate(new IceCandidate(candidate.sdpMid, candidate.sdpMLineIndex, candidate.sdp));
        }

        @Override
        public void onSignalingChange(RTCSignalingState state) {
            signalingState = state;
        }

        @Override
        public void onIceConnectionChange(RTCIceConnectionState state) {
            LOGGER.fine("[WebRTC] ICE connection state for " + remoteId + ": " + state);
            events.onIceStateChange(toIceState(state));
        }

        @Override
        public void onConnectionChange(RTCPeerConnectionState state) {
            LOGGER.fine("[WebRTC] Peer connection state for " + remoteId + ": " + state);
            events.onTransportStateChange(toTransportState(state));
        }

        @Override
        public void onTrack(RTCRtpTransceiver transceiver) {
            MediaStreamTrack track = transceiver.getReceiver().getTrack();
            if (track == null || closed) {
                return;
            }
            LOGGER.fine("[WebRTC] Remote " + track.getKind() + " track from " + remoteId + ": " + track.getId());
            events.onRemoteTrack(new WebRtcMediaTrack(track));
        }
    }

    private final class DescriptionObserver implements CreateSessionDescriptionObserver {

        private final CompletableFuture<SessionDescription> future;
        private final String what;

        DescriptionObserver(CompletableFuture<SessionDescription> future, String what) {
            this.future = future;
            this.what = what;
        }

        @Override
        public void onSuccess(RTCSessionDescription description) {
            future.complete(fromNative(description));
        }

        @Override
        public void onFailure(String error) {
            LOGGER.log(Level.FINE, "[WebRTC] Failed to {0} for {1}: {2}", new Object[] {what, remoteId, error});
            future.completeExceptionally(new IllegalStateException("Failed to " + what + ": " + error));
        }
    }

    private final class SetObserver implements SetSessionDescriptionObserver {

        private final CompletableFuture<Void> future;
        private final String what;

        SetObserver(CompletableFuture<Void> future, String what) {
            this.future = future;
            this.what = what;
        }

        @Override
        public void onSuccess() {
            future.complete(null);
        }

        @Override
        public void onFailure(String error) {
            LOGGER.log(Level.FINE, "[WebRTC] Failed to {0} for {1}: {2}", new Object[] {what, remoteId, error});
            future.completeExceptionally(new IllegalStateException("Failed to " + what + ": " + error));
        }
    }
}
