package com.chatmesh.signaling;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Sends signaling messages as room relay JSON through a host-supplied text sender, typically a
 * WebSocket's send method.
 */
public final class JsonSignalingChannel implements SignalingChannel {

    private final String roomId;
    private final Consumer<String> sender;
    private final SignalingMessageCodec codec;

    public JsonSignalingChannel(String roomId, Consumer<String> sender) {
        this(roomId, sender, new SignalingMessageCodec());
    }

    public JsonSignalingChannel(String roomId, Consumer<String> sender, SignalingMessageCodec codec) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void send(SignalingMessage message) {
        sender.accept(codec.encode(message, roomId));
    }

    public String getRoomId() {
        return roomId;
    }
}
