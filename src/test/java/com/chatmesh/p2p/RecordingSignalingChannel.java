package com.chatmesh.p2p;

import com.chatmesh.signaling.SignalingChannel;
import com.chatmesh.signaling.SignalingMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class RecordingSignalingChannel implements SignalingChannel {

    private final List<SignalingMessage> sent = new ArrayList<>();

    @Override
    public synchronized void send(SignalingMessage message) {
        sent.add(message);
    }

    public synchronized List<SignalingMessage> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<SignalingMessage> sent(SignalingMessage.Type type) {
        return sent.stream().filter(m -> m.type() == type).collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }
}
