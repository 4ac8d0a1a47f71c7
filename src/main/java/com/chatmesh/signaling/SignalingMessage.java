package com.chatmesh.signaling;

import com.chatmesh.p2p.IceCandidate;

import java.util.Objects;

/**
 * A message exchanged between two participants through the room relay.
 */
public interface SignalingMessage {

    enum Type {
        OFFER("webrtc-offer"),
        ANSWER("webrtc-answer"),
        ICE_CANDIDATE("webrtc-ice-candidate");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Type fromWireName(String wireName) {
            for (Type type : values()) {
                if (type.wireName.equals(wireName)) {
                    return type;
                }
            }
            return null;
        }
    }

    Type type();

    String from();

    String to();

    record Offer(String from, String to, String sdp) implements SignalingMessage {

        public Offer {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(sdp, "sdp");
        }

        @Override
        public Type type() {
            return Type.OFFER;
        }
    }

    record Answer(String from, String to, String sdp) implements SignalingMessage {

        public Answer {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(sdp, "sdp");
        }

        @Override
        public Type type() {
            return Type.ANSWER;
        }
    }

    record Candidate(String from, String to, IceCandidate candidate) implements SignalingMessage {

        public Candidate {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(candidate, "candidate");
        }

        @Override
        public Type type() {
            return Type.ICE_CANDIDATE;
        }
    }
}
