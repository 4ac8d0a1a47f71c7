package com.chatmesh.p2p;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

public class ConnectionRegistryTest {

    private FakeTransportFactory transports;
    private List<PeerConnection> created;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        transports = new FakeTransportFactory();
        created = new ArrayList<>();
        registry = new ConnectionRegistry(
            id -> new PeerConnection(id, transports, List.of(), new ConnectionHealthMonitor(-1), new NoopListener()),
            created::add);
    }

    @Test
    void getOrCreateReturnsSameConnectionForSameId() {
        PeerConnection first = registry.getOrCreate("bob");
        PeerConnection second = registry.getOrCreate("bob");

        assertThat(second).isSameAs(first);
        assertThat(transports.getCreateCount()).isEqualTo(1);
        assertThat(created).containsExactly(first);
        assertThat(registry.remoteIds()).containsExactly("bob");
    }

    @Test
    void concurrentGetOrCreateBuildsOneConnection() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<PeerConnection> seen = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    seen.add(registry.getOrCreate("carol"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(1);
        assertThat(transports.getCreateCount()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void removeUnknownIdIsNoOp() {
        registry.getOrCreate("bob");

        assertThat(registry.remove("nobody")).isEmpty();
        assertThat(registry.remove((String) null)).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void removeClosesAndEvicts() {
        PeerConnection connection = registry.getOrCreate("bob");

        assertThat(registry.remove("bob")).contains(connection);

        assertThat(connection.isClosed()).isTrue();
        assertThat(transports.last("bob").getCloseCount()).isEqualTo(1);
        assertThat(registry.get("bob")).isEmpty();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void removingStaleInstanceLeavesNewerConnection() {
        PeerConnection old = registry.getOrCreate("bob");
        registry.remove("bob");
        PeerConnection fresh = registry.getOrCreate("bob");

        assertThat(registry.remove(old)).isFalse();

        assertThat(registry.get("bob")).contains(fresh);
        assertThat(fresh.isClosed()).isFalse();
    }

    @Test
    void connectionsIsSnapshot() {
        registry.getOrCreate("bob");
        registry.getOrCreate("carol");

        Collection<PeerConnection> snapshot = registry.connections();
        registry.remove("bob");

        assertThat(snapshot).hasSize(2);
        assertThat(registry.connections()).hasSize(1);
    }

    static final class NoopListener implements PeerConnection.Listener {

        @Override
        public void onIceCandidate(PeerConnection connection, IceCandidate candidate) {
        }

        @Override
        public void onIceStateChange(PeerConnection connection, IceState state) {
        }

        @Override
        public void onTransportStateChange(PeerConnection connection, TransportState state) {
        }

        @Override
        public void onRemoteTrack(PeerConnection connection, MediaTrack track) {
        }
    }
}
