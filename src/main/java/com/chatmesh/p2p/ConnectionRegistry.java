package com.chatmesh.p2p;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Owns the mapping from remote participant id to its {@link PeerConnection}. At most one
 * connection exists per id: creation runs inside {@link ConcurrentHashMap#computeIfAbsent}, so a
 * concurrent lookup for the same id either waits for the fully built entry or creates it itself.
 */
public final class ConnectionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRegistry.class.getName());

    private final Map<String, PeerConnection> connections = new ConcurrentHashMap<>();
    private final Function<String, PeerConnection> connectionFactory;
    private final Consumer<PeerConnection> onConnectionCreated;

    /**
     * @param connectionFactory   builds a connection (and its transport) for an unknown id
     * @param onConnectionCreated invoked before the new entry becomes visible, used to bind local media
     */
    ConnectionRegistry(Function<String, PeerConnection> connectionFactory,
                       Consumer<PeerConnection> onConnectionCreated) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.onConnectionCreated = Objects.requireNonNull(onConnectionCreated, "onConnectionCreated");
    }

    /**
     * Returns the connection for {@code remoteId}, creating and binding it on first use.
     */
    public PeerConnection getOrCreate(String remoteId) {
        Objects.requireNonNull(remoteId, "remoteId");
        return connections.computeIfAbsent(remoteId, id -> {
            PeerConnection connection = connectionFactory.apply(id);
            onConnectionCreated.accept(connection);
            LOGGER.info("[Registry] Created connection for " + id);
            return connection;
        });
    }

    public Optional<PeerConnection> get(String remoteId) {
        if (remoteId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(remoteId));
    }

    /**
     * Closes and evicts the connection for {@code remoteId}. Unknown ids are ignored.
     *
     * @return the evicted connection
     */
    public Optional<PeerConnection> remove(String remoteId) {
        if (remoteId == null) {
            return Optional.empty();
        }
        PeerConnection removed = connections.remove(remoteId);
        if (removed != null) {
            removed.close();
            LOGGER.info("[Registry] Removed connection for " + remoteId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Closes {@code connection} and evicts it if it is still the registered entry for its id. A
     * newer connection registered under the same id is left alone.
     */
    boolean remove(PeerConnection connection) {
        boolean evicted = connections.remove(connection.getRemoteId(), connection);
        connection.close();
        if (evicted) {
            LOGGER.info("[Registry] Removed connection for " + connection.getRemoteId());
        }
        return evicted;
    }

    /**
     * Snapshot of the registered connections.
     */
    public Collection<PeerConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public Set<String> remoteIds() {
        return Set.copyOf(connections.keySet());
    }

    public int size() {
        return connections.size();
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }
}
