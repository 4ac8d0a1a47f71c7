package com.chatmesh.p2p;

/**
 * Aggregate state of a transport (ICE and DTLS combined).
 */
public enum TransportState {
    NEW,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED
}
