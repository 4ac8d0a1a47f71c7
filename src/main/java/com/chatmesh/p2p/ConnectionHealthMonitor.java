package com.chatmesh.p2p;

import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * Health state machine for one connection.
 *
 * <p>Every observation method is a transition function: it updates the state and returns the
 * single {@link HealthAction} the owner has to carry out. The monitor never schedules or closes
 * anything itself, so restart-once and grace-period behaviour can be driven step by step.
 *
 * <pre>
 * NEW -> CHECKING -> CONNECTED -> DISCONNECTED(since) -> FAILED | CLOSED
 *                        ^______________|
 * </pre>
 *
 * FAILED and CLOSED are terminal: once reached, all further observations return
 * {@link HealthAction#NONE}.
 *
 * <p>The only ICE-layer event that asks for a restart is a FAILED observation. A CHECKING
 * observation never restarts anything; it only re-arms the trigger, as CONNECTED does.
 */
public final class ConnectionHealthMonitor {

    public enum HealthState {
        NEW,
        CHECKING,
        CONNECTED,
        DISCONNECTED,
        FAILED,
        CLOSED
    }

    /** Value of {@code maxIceRestarts} that disables the cap. */
    public static final int UNLIMITED_RESTARTS = -1;

    private final int maxIceRestarts;
    private final LongSupplier clock;

    private HealthState state = HealthState.NEW;
    private long disconnectedSince = -1;
    private boolean gracePending;
    private long graceGeneration;
    private boolean iceRestartArmed = true;
    private int consecutiveIceRestarts;

    public ConnectionHealthMonitor(int maxIceRestarts) {
        this(maxIceRestarts, System::currentTimeMillis);
    }

    ConnectionHealthMonitor(int maxIceRestarts, LongSupplier clock) {
        this.maxIceRestarts = maxIceRestarts;
        this.clock = clock;
    }

    /**
     * ICE-layer observation. A FAILED observation asks for one in-place restart; the trigger is
     * re-armed by the next CHECKING or CONNECTED observation. Consecutive restarts without ICE
     * ever connecting are capped by {@code maxIceRestarts}, past which failure escalates to
     * teardown.
     */
    public synchronized HealthAction onIceStateChange(IceState ice) {
        if (isTerminal()) {
            return HealthAction.NONE;
        }
        switch (ice) {
            case CHECKING:
                iceRestartArmed = true;
                if (state == HealthState.NEW) {
                    state = HealthState.CHECKING;
                }
                return HealthAction.NONE;
            case CONNECTED:
            case COMPLETED:
                iceRestartArmed = true;
                consecutiveIceRestarts = 0;
                return HealthAction.NONE;
            case FAILED:
                if (!iceRestartArmed) {
                    return HealthAction.NONE;
                }
                iceRestartArmed = false;
                if (maxIceRestarts >= 0 && consecutiveIceRestarts >= maxIceRestarts) {
                    return terminate(HealthState.FAILED);
                }
                consecutiveIceRestarts++;
                return HealthAction.RESTART_ICE;
            default:
                return HealthAction.NONE;
        }
    }

    /**
     * Aggregate transport observation.
     */
    public synchronized HealthAction onTransportStateChange(TransportState transport) {
        if (isTerminal()) {
            return HealthAction.NONE;
        }
        switch (transport) {
            case CONNECTING:
                if (state == HealthState.NEW) {
                    state = HealthState.CHECKING;
                }
                return HealthAction.NONE;
            case CONNECTED:
                state = HealthState.CONNECTED;
                if (gracePending) {
                    gracePending = false;
                    disconnectedSince = -1;
                    return HealthAction.CANCEL_GRACE_TIMER;
                }
                return HealthAction.NONE;
            case DISCONNECTED:
                if (gracePending) {
                    return HealthAction.NONE;
                }
                state = HealthState.DISCONNECTED;
                disconnectedSince = clock.getAsLong();
                gracePending = true;
                graceGeneration++;
                return HealthAction.START_GRACE_TIMER;
            case FAILED:
                return terminate(HealthState.FAILED);
            case CLOSED:
                return terminate(HealthState.CLOSED);
            default:
                return HealthAction.NONE;
        }
    }

    /**
     * The grace timer started for {@code generation} fired. Stale timers (the connection
     * recovered, or a later disconnect started a fresh timer) are ignored.
     */
    public synchronized HealthAction onGracePeriodExpired(long generation) {
        if (isTerminal() || !gracePending || generation != graceGeneration) {
            return HealthAction.NONE;
        }
        return terminate(HealthState.FAILED);
    }

    /**
     * The owner closed the connection on its own; later observations become no-ops.
     */
    public synchronized void markClosed() {
        if (!isTerminal()) {
            terminate(HealthState.CLOSED);
        }
    }

    private HealthAction terminate(HealthState terminalState) {
        state = terminalState;
        gracePending = false;
        return HealthAction.TEARDOWN;
    }

    public synchronized HealthState getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state == HealthState.FAILED || state == HealthState.CLOSED;
    }

    /**
     * Generation of the most recently requested grace timer.
     */
    public synchronized long getGraceGeneration() {
        return graceGeneration;
    }

    public synchronized OptionalLong getDisconnectedSince() {
        return disconnectedSince < 0 ? OptionalLong.empty() : OptionalLong.of(disconnectedSince);
    }
}
