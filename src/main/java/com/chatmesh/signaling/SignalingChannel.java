package com.chatmesh.signaling;

/**
 * Host-provided capability that delivers a message to {@link SignalingMessage#to()} out of band,
 * typically through a room-scoped relay. The mesh never opens or authenticates the channel.
 */
@FunctionalInterface
public interface SignalingChannel {

    void send(SignalingMessage message);
}
