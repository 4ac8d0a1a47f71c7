package com.chatmesh.signaling;

import com.chatmesh.p2p.IceCandidate;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * JSON form of {@link SignalingMessage} as carried by the room relay:
 * <pre>
 * {"type":"webrtc-offer","roomId":"r1","fromUserId":"a","toUserId":"b","offer":{"type":"offer","sdp":"..."}}
 * {"type":"webrtc-answer", ... ,"answer":{"type":"answer","sdp":"..."}}
 * {"type":"webrtc-ice-candidate", ... ,"candidate":{"candidate":"...","sdpMid":"0","sdpMLineIndex":0}}
 * </pre>
 */
public final class SignalingMessageCodec {

    private static final Logger LOGGER = Logger.getLogger(SignalingMessageCodec.class.getName());
    private static final BigDecimal MAX_M_LINE_INDEX = BigDecimal.valueOf(Integer.MAX_VALUE);

    static final String FIELD_TYPE = "type";
    static final String FIELD_ROOM = "roomId";
    static final String FIELD_FROM = "fromUserId";
    static final String FIELD_TO = "toUserId";

    private final Gson gson = new Gson();

    public String encode(SignalingMessage message, String roomId) {
        JsonObject json = new JsonObject();
        json.addProperty(FIELD_TYPE, message.type().getWireName());
        json.addProperty(FIELD_ROOM, roomId);
        json.addProperty(FIELD_FROM, message.from());
        json.addProperty(FIELD_TO, message.to());

        switch (message.type()) {
            case OFFER:
                json.add("offer", description("offer", ((SignalingMessage.Offer) message).sdp()));
                break;
            case ANSWER:
                json.add("answer", description("answer", ((SignalingMessage.Answer) message).sdp()));
                break;
            case ICE_CANDIDATE:
                IceCandidate candidate = ((SignalingMessage.Candidate) message).candidate();
                JsonObject c = new JsonObject();
                c.addProperty("candidate", candidate.candidate());
                c.addProperty("sdpMid", candidate.sdpMid());
                c.addProperty("sdpMLineIndex", candidate.sdpMLineIndex());
                json.add("candidate", c);
                break;
            default:
                throw new IllegalArgumentException("Unsupported message type: " + message.type());
        }
        return gson.toJson(json);
    }

    /**
     * Parses a relay message. Returns empty for anything that is not a well-formed WebRTC
     * signaling message; the relay is best effort, so malformed input is not an error.
     */
    public Optional<SignalingMessage> decode(String text) {
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                return Optional.empty();
            }
            return decode(element.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException e) {
            LOGGER.fine("[Codec] Unparseable signaling message: " + e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<SignalingMessage> decode(JsonObject json) {
        SignalingMessage.Type type = SignalingMessage.Type.fromWireName(string(json, FIELD_TYPE));
        String from = string(json, FIELD_FROM);
        String to = string(json, FIELD_TO);
        if (type == null || from == null) {
            return Optional.empty();
        }
        // empty target: addressed to whoever the relay delivered it to
        String target = to == null ? "" : to;
        try {
            switch (type) {
                case OFFER: {
                    String sdp = sdp(json, "offer");
                    return sdp == null ? Optional.empty() : Optional.of(new SignalingMessage.Offer(from, target, sdp));
                }
                case ANSWER: {
                    String sdp = sdp(json, "answer");
                    return sdp == null ? Optional.empty() : Optional.of(new SignalingMessage.Answer(from, target, sdp));
                }
                case ICE_CANDIDATE: {
                    JsonElement c = json.get("candidate");
                    if (c == null || !c.isJsonObject()) {
                        return Optional.empty();
                    }
                    JsonObject obj = c.getAsJsonObject();
                    JsonElement index = obj.get("sdpMLineIndex");
                    int mLineIndex = -1;
                    if (index != null && !index.isJsonNull()) {
                        BigDecimal value = index.getAsBigDecimal();
                        if (value.signum() < 0 || value.compareTo(MAX_M_LINE_INDEX) > 0) {
                            LOGGER.fine("[Codec] Candidate from " + from + " has sdpMLineIndex out of range: " + value);
                            return Optional.empty();
                        }
                        mLineIndex = value.intValue();
                    }
                    return Optional.of(new SignalingMessage.Candidate(from, target,
                        new IceCandidate(string(obj, "sdpMid"), mLineIndex, string(obj, "candidate"))));
                }
                default:
                    return Optional.empty();
            }
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            LOGGER.fine("[Codec] Malformed " + type.getWireName() + " from " + from + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static JsonObject description(String type, String sdp) {
        JsonObject description = new JsonObject();
        description.addProperty("type", type);
        description.addProperty("sdp", sdp);
        return description;
    }

    private static String sdp(JsonObject json, String field) {
        JsonElement description = json.get(field);
        if (description == null || !description.isJsonObject()) {
            return null;
        }
        return string(description.getAsJsonObject(), "sdp");
    }

    static String string(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }
}
