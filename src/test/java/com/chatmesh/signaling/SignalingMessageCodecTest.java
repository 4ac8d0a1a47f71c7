package com.chatmesh.signaling;

import com.chatmesh.p2p.IceCandidate;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SignalingMessageCodecTest {

    private final SignalingMessageCodec codec = new SignalingMessageCodec();

    @Test
    void encodesOfferInRelayFormat() {
        String json = codec.encode(new SignalingMessage.Offer("alice", "bob", "v=0"), "room-1");

        JsonObject parsed = JsonParser.parseString(json).getAsJsonObject();
        assertThat(parsed.get("type").getAsString()).isEqualTo("webrtc-offer");
        assertThat(parsed.get("roomId").getAsString()).isEqualTo("room-1");
        assertThat(parsed.get("fromUserId").getAsString()).isEqualTo("alice");
        assertThat(parsed.get("toUserId").getAsString()).isEqualTo("bob");
        JsonObject offer = parsed.getAsJsonObject("offer");
        assertThat(offer.get("type").getAsString()).isEqualTo("offer");
        assertThat(offer.get("sdp").getAsString()).isEqualTo("v=0");
    }

    @Test
    void encodesCandidateFields() {
        IceCandidate candidate = new IceCandidate("0", 0, "candidate:1 1 udp 1 10.0.0.1 5000 typ host");

        JsonObject parsed = JsonParser.parseString(
            codec.encode(new SignalingMessage.Candidate("alice", "bob", candidate), "room-1")).getAsJsonObject();

        JsonObject c = parsed.getAsJsonObject("candidate");
        assertThat(c.get("candidate").getAsString()).isEqualTo(candidate.candidate());
        assertThat(c.get("sdpMid").getAsString()).isEqualTo("0");
        assertThat(c.get("sdpMLineIndex").getAsInt()).isZero();
    }

    @Test
    void decodesAnswer() {
        String json = "{\"type\":\"webrtc-answer\",\"roomId\":\"r\",\"fromUserId\":\"bob\",\"toUserId\":\"alice\","
            + "\"answer\":{\"type\":\"answer\",\"sdp\":\"v=0 answer\"}}";

        assertThat(codec.decode(json)).contains(new SignalingMessage.Answer("bob", "alice", "v=0 answer"));
    }

    @Test
    void decodesCandidateWithoutIndex() {
        String json = "{\"type\":\"webrtc-ice-candidate\",\"fromUserId\":\"bob\",\"toUserId\":\"alice\","
            + "\"candidate\":{\"candidate\":\"candidate:9\",\"sdpMid\":\"audio\"}}";

        assertThat(codec.decode(json)).contains(
            new SignalingMessage.Candidate("bob", "alice", new IceCandidate("audio", -1, "candidate:9")));
    }

    @Test
    void candidateIndexOutsideIntRangeIsDropped() {
        String prefix = "{\"type\":\"webrtc-ice-candidate\",\"fromUserId\":\"bob\",\"toUserId\":\"alice\","
            + "\"candidate\":{\"candidate\":\"candidate:9\",\"sdpMid\":\"0\",\"sdpMLineIndex\":";

        assertThat(codec.decode(prefix + "1e10}}")).isEmpty();
        assertThat(codec.decode(prefix + "4294967296}}")).isEmpty();
        assertThat(codec.decode(prefix + "-2}}")).isEmpty();
        assertThat(codec.decode(prefix + "2147483647}}")).contains(new SignalingMessage.Candidate("bob", "alice",
            new IceCandidate("0", Integer.MAX_VALUE, "candidate:9")));
    }

    @Test
    void missingTargetDecodesAsEmpty() {
        String json = "{\"type\":\"webrtc-offer\",\"fromUserId\":\"bob\",\"offer\":{\"sdp\":\"v=0\"}}";

        assertThat(codec.decode(json)).get().extracting(SignalingMessage::to).isEqualTo("");
    }

    @Test
    void malformedMessagesDecodeToEmpty() {
        assertThat(codec.decode("not json {")).isEmpty();
        assertThat(codec.decode("[1,2]")).isEmpty();
        assertThat(codec.decode("{\"type\":\"user-joined\",\"userId\":\"x\"}")).isEmpty();
        assertThat(codec.decode("{\"type\":\"webrtc-offer\",\"toUserId\":\"a\",\"offer\":{\"sdp\":\"v\"}}")).isEmpty();
        assertThat(codec.decode("{\"type\":\"webrtc-offer\",\"fromUserId\":\"b\",\"offer\":\"v=0\"}")).isEmpty();
        assertThat(codec.decode("{\"type\":\"webrtc-ice-candidate\",\"fromUserId\":\"b\","
            + "\"candidate\":{\"candidate\":\"c\",\"sdpMLineIndex\":{\"x\":1}}}")).isEmpty();
    }

    @Test
    void jsonChannelSendsEncodedMessages() {
        List<String> frames = new ArrayList<>();
        JsonSignalingChannel channel = new JsonSignalingChannel("room-9", frames::add);

        channel.send(new SignalingMessage.Answer("alice", "bob", "v=0"));

        assertThat(frames).singleElement().satisfies(frame ->
            assertThat(codec.decode(frame)).contains(new SignalingMessage.Answer("alice", "bob", "v=0")));
        assertThat(JsonParser.parseString(frames.get(0)).getAsJsonObject().get("roomId").getAsString())
            .isEqualTo("room-9");
    }
}
