package com.chatmesh.signaling;

import com.chatmesh.p2p.PeerConnectionManager;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds room relay messages into a {@link PeerConnectionManager}.
 *
 * <p>Besides plain offer/answer/candidate dispatch, this decides who opens a connection when
 * participants join or start streaming: a streaming participant offers to newcomers, and between
 * two streaming participants the one with the lower id offers.
 */
public final class RoomEventRouter {

    private static final Logger LOGGER = Logger.getLogger(RoomEventRouter.class.getName());

    private final String localId;
    private final PeerConnectionManager manager;
    private final SignalingMessageCodec codec;

    private volatile String roomId;
    private volatile List<RoomParticipant> participants = Collections.emptyList();

    public RoomEventRouter(PeerConnectionManager manager) {
        this(manager, new SignalingMessageCodec());
    }

    public RoomEventRouter(PeerConnectionManager manager, SignalingMessageCodec codec) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.localId = manager.getLocalId();
    }

    /**
     * Handles one text frame from the relay. Malformed or unknown messages are logged and dropped.
     */
    public void onRelayMessage(String text) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                LOGGER.fine("[Room] Ignoring non-object relay message");
                return;
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            LOGGER.log(Level.FINE, "[Room] Unparseable relay message", e);
            return;
        }

        String type = SignalingMessageCodec.string(json, SignalingMessageCodec.FIELD_TYPE);
        if (type == null) {
            LOGGER.fine("[Room] Relay message without type");
            return;
        }
        try {
            switch (type) {
                case "webrtc-offer":
                case "webrtc-answer":
                case "webrtc-ice-candidate":
                    codec.decode(json).ifPresentOrElse(this::dispatch,
                        () -> LOGGER.fine("[Room] Dropping malformed " + type));
                    break;
                case "room-joined":
                    roomId = SignalingMessageCodec.string(json, "roomId");
                    updateParticipants(json);
                    LOGGER.info("[Room] Joined room " + roomId + " with " + participants.size() + " participant(s)");
                    break;
                case "user-joined":
                    updateParticipants(json);
                    onUserJoined(SignalingMessageCodec.string(json, "userId"));
                    break;
                case "user-left":
                case "user-streaming-stopped":
                    updateParticipants(json);
                    onUserGone(type, SignalingMessageCodec.string(json, "userId"));
                    break;
                case "user-streaming-started":
                    updateParticipants(json);
                    onStreamingStarted(SignalingMessageCodec.string(json, "userId"));
                    break;
                default:
                    LOGGER.fine("[Room] Ignoring relay message of type " + type);
                    break;
            }
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[Room] Failed to handle " + type, ex);
        }
    }

    private void dispatch(SignalingMessage message) {
        if (!message.to().isEmpty() && !message.to().equals(localId)) {
            LOGGER.fine("[Room] Ignoring " + message.type() + " addressed to " + message.to());
            return;
        }
        switch (message.type()) {
            case OFFER:
                manager.handleOffer(message.from(), ((SignalingMessage.Offer) message).sdp());
                break;
            case ANSWER:
                manager.handleAnswer(message.from(), ((SignalingMessage.Answer) message).sdp());
                break;
            case ICE_CANDIDATE:
                manager.handleIceCandidate(message.from(), ((SignalingMessage.Candidate) message).candidate());
                break;
            default:
                break;
        }
    }

    private void onUserJoined(String userId) {
        if (userId == null || userId.equals(localId)) {
            return;
        }
        if (manager.isStreaming()) {
            LOGGER.info("[Room] " + userId + " joined while we stream, offering");
            offer(userId);
        }
    }

    private void onUserGone(String type, String userId) {
        if (userId == null || userId.equals(localId)) {
            return;
        }
        LOGGER.info("[Room] " + type + ": " + userId);
        manager.removePeer(userId);
    }

    private void onStreamingStarted(String userId) {
        if (userId == null) {
            return;
        }
        if (userId.equals(localId)) {
            for (RoomParticipant participant : participants) {
                String other = participant.userId();
                if (participant.streaming() && !other.equals(localId) && initiatesWith(other)) {
                    offer(other);
                }
            }
            return;
        }
        if (manager.isStreaming() && initiatesWith(userId)) {
            offer(userId);
        }
    }

    /**
     * Between two streaming participants, the lower id opens the connection.
     */
    private boolean initiatesWith(String otherId) {
        return localId.compareTo(otherId) < 0;
    }

    private void offer(String userId) {
        manager.createOffer(userId).exceptionally(ex -> {
            LOGGER.log(Level.FINE, "[Room] Offer to " + userId + " failed", ex);
            return null;
        });
    }

    private void updateParticipants(JsonObject json) {
        JsonElement element = json.get("participants");
        if (element == null || !element.isJsonArray()) {
            return;
        }
        JsonArray array = element.getAsJsonArray();
        List<RoomParticipant> parsed = new ArrayList<>(array.size());
        for (JsonElement entry : array) {
            if (!entry.isJsonObject()) {
                continue;
            }
            JsonObject p = entry.getAsJsonObject();
            String userId = SignalingMessageCodec.string(p, "userId");
            if (userId == null) {
                continue;
            }
            JsonElement streaming = p.get("isStreaming");
            parsed.add(new RoomParticipant(userId, SignalingMessageCodec.string(p, "userName"),
                streaming != null && streaming.isJsonPrimitive() && streaming.getAsBoolean()));
        }
        participants = Collections.unmodifiableList(parsed);
    }

    public Optional<String> getRoomId() {
        return Optional.ofNullable(roomId);
    }

    public List<RoomParticipant> getParticipants() {
        return participants;
    }
}
