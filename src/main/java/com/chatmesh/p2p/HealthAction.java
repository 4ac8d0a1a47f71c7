package com.chatmesh.p2p;

/**
 * Side effect requested by {@link ConnectionHealthMonitor} in response to a state observation.
 */
public enum HealthAction {
    NONE,
    RESTART_ICE,
    START_GRACE_TIMER,
    CANCEL_GRACE_TIMER,
    TEARDOWN
}
