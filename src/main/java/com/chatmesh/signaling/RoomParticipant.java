package com.chatmesh.signaling;

/**
 * A room member as listed by the relay.
 */
public record RoomParticipant(String userId, String userName, boolean streaming) {
}
