package com.chatmesh.p2p;

/**
 * ICE-layer connectivity state reported by a transport.
 */
public enum IceState {
    NEW,
    CHECKING,
    CONNECTED,
    COMPLETED,
    DISCONNECTED,
    FAILED,
    CLOSED
}
