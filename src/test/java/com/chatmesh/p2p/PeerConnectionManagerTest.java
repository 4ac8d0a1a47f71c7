package com.chatmesh.p2p;

import com.chatmesh.config.MeshConfig;
import com.chatmesh.signaling.SignalingMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

public class PeerConnectionManagerTest {

    private FakeTransportFactory transports;
    private RecordingSignalingChannel signaling;
    private RecordingPeerEvents events;
    private ScheduledExecutorService scheduler;
    private PeerConnectionManager manager;

    @BeforeEach
    void setUp() {
        transports = new FakeTransportFactory();
        signaling = new RecordingSignalingChannel();
        events = new RecordingPeerEvents();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        manager = newManager(MeshConfig.defaults().withDisconnectGracePeriod(Duration.ofMillis(50)));
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.shutdownNow();
    }

    private PeerConnectionManager newManager(MeshConfig config) {
        return new PeerConnectionManager("bob", transports, signaling, events, config, Runnable::run, scheduler);
    }

    private FakeTransport connect(String remoteId) {
        manager.createOffer(remoteId).join();
        manager.handleAnswer(remoteId, "answer").join();
        FakeTransport transport = transports.last(remoteId);
        transport.fireTransportState(TransportState.CONNECTING);
        transport.fireIceState(IceState.CHECKING);
        transport.fireIceState(IceState.CONNECTED);
        transport.fireTransportState(TransportState.CONNECTED);
        return transport;
    }

    @Test
    void newConnectionsUseConfiguredIceServers() {
        manager.createOffer("carol").join();

        assertThat(transports.getLastIceServers())
            .isEqualTo(MeshConfig.defaults().getIceConfiguration().getIceServers());
    }

    @Test
    void streamingAttachesToConnectionsOpenedLater() {
        FakeTrack mic = FakeTrack.audio("mic");
        manager.startStreaming(new LocalStream("local", List.of(mic)));

        manager.handleOffer("alice", "offer").join();

        assertThat(manager.isStreaming()).isTrue();
        assertThat(transports.last("alice").getTracks()).containsExactly(mic);
    }

    @Test
    void stopStreamingStopsTracks() {
        FakeTrack cam = FakeTrack.video("cam");
        manager.startStreaming(new LocalStream("local", List.of(cam)));
        connect("carol");

        manager.stopStreaming();

        assertThat(cam.isStopped()).isTrue();
        assertThat(manager.isStreaming()).isFalse();
        assertThat(transports.last("carol").getTracks()).isEmpty();
        assertThat(manager.getRemoteIds()).containsExactly("carol");
    }

    @Test
    void remoteTracksAreGroupedIntoStreams() {
        FakeTransport transport = connect("carol");
        FakeTrack audio = FakeTrack.audio("a1");
        FakeTrack video = FakeTrack.video("v1");

        transport.fireRemoteTrack(audio);
        transport.fireRemoteTrack(video);
        transport.fireRemoteTrack(video);

        assertThat(events.streams()).singleElement().satisfies(stream -> {
            assertThat(stream.getRemoteId()).isEqualTo("carol");
            assertThat(stream.getGeneration()).isEqualTo(1);
            assertThat(stream.getTracks()).containsExactly(audio, video);
        });

        transport.fireRemoteTrack(FakeTrack.audio("a2"));

        assertThat(events.streams()).hasSize(2);
        assertThat(events.streams().get(1).getGeneration()).isEqualTo(2);
    }

    @Test
    void iceFailureTriggersSingleRestartOffer() {
        FakeTransport transport = connect("carol");
        signaling.clear();

        transport.fireIceState(IceState.FAILED);
        transport.fireIceState(IceState.FAILED);

        assertThat(signaling.sent(SignalingMessage.Type.OFFER)).hasSize(1);
        assertThat(transport.getOfferOptions()).last().isEqualTo(OfferOptions.forIceRestart());
        assertThat(events.ended()).isEmpty();
        assertThat(manager.getRemoteIds()).containsExactly("carol");
    }

    @Test
    void restartIsSkippedWhileNegotiating() {
        manager.createOffer("carol").join();
        FakeTransport transport = transports.last("carol");
        signaling.clear();

        transport.fireIceState(IceState.FAILED);

        assertThat(signaling.sent()).isEmpty();
        assertThat(transport.getOfferOptions()).hasSize(1);
    }

    @Test
    void exhaustedRestartsTearDown() {
        manager.close();
        manager = newManager(MeshConfig.defaults().withMaxIceRestarts(1));
        FakeTransport transport = connect("carol");

        transport.fireIceState(IceState.FAILED);
        manager.handleAnswer("carol", "restart-answer").join();
        transport.fireIceState(IceState.CHECKING);
        transport.fireIceState(IceState.FAILED);

        assertThat(events.ended()).containsExactly("carol");
        assertThat(manager.getRemoteIds()).isEmpty();
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void recoveryWithinGracePeriodKeepsConnection() throws Exception {
        manager.close();
        manager = newManager(MeshConfig.defaults().withDisconnectGracePeriod(Duration.ofMillis(300)));
        FakeTransport transport = connect("carol");

        transport.fireTransportState(TransportState.DISCONNECTED);
        transport.fireTransportState(TransportState.CONNECTED);

        assertThat(events.awaitEnded(600)).isFalse();
        assertThat(manager.getRemoteIds()).containsExactly("carol");
        assertThat(transport.isClosed()).isFalse();
    }

    @Test
    void gracePeriodExpiryTearsDownOnce() throws Exception {
        FakeTransport transport = connect("carol");

        transport.fireTransportState(TransportState.DISCONNECTED);

        assertThat(events.awaitEnded(2_000)).isTrue();
        Thread.sleep(100);
        assertThat(events.ended()).containsExactly("carol");
        assertThat(manager.getRemoteIds()).isEmpty();
        assertThat(transport.getCloseCount()).isEqualTo(1);
    }

    @Test
    void transportFailureTearsDownImmediately() {
        FakeTransport transport = connect("carol");

        transport.fireTransportState(TransportState.FAILED);
        transport.fireTransportState(TransportState.CLOSED);

        assertThat(events.ended()).containsExactly("carol");
        assertThat(manager.getRemoteIds()).isEmpty();
    }

    @Test
    void reconnectAfterTeardownCreatesFreshConnection() {
        FakeTransport first = connect("carol");
        first.fireTransportState(TransportState.FAILED);

        manager.createOffer("carol").join();

        assertThat(transports.getCreateCount()).isEqualTo(2);
        assertThat(transports.last("carol")).isNotSameAs(first);
        assertThat(manager.getNegotiationState("carol")).contains(NegotiationState.HAVE_LOCAL_OFFER);
    }

    @Test
    void removePeerTearsDownOnce() {
        FakeTransport transport = connect("carol");

        manager.removePeer("carol");
        manager.removePeer("carol");
        transport.fireTransportState(TransportState.CLOSED);

        assertThat(events.ended()).containsExactly("carol");
        assertThat(transport.getCloseCount()).isEqualTo(1);
    }

    @Test
    void removeUnknownPeerIsNoOp() {
        connect("carol");

        manager.removePeer("nobody");

        assertThat(events.ended()).isEmpty();
        assertThat(manager.getRemoteIds()).containsExactly("carol");
    }

    @Test
    void cleanupStopsStreamingAndEndsEveryConnection() {
        FakeTrack mic = FakeTrack.audio("mic");
        manager.startStreaming(new LocalStream("local", List.of(mic)));
        connect("carol");
        connect("dave");

        manager.cleanup();
        manager.cleanup();

        assertThat(mic.isStopped()).isTrue();
        assertThat(manager.isStreaming()).isFalse();
        assertThat(events.ended()).containsExactlyInAnyOrder("carol", "dave");
        assertThat(manager.getRemoteIds()).isEmpty();
    }

    @Test
    void listenerFailureDoesNotBreakTeardown() {
        manager.close();
        manager = new PeerConnectionManager("bob", transports, signaling, new PeerEvents() {
            @Override
            public void onRemoteStream(String remoteId, RemoteStream stream) {
                throw new IllegalStateException("ui gone");
            }

            @Override
            public void onRemoteStreamEnded(String remoteId) {
                throw new IllegalStateException("ui gone");
            }
        }, MeshConfig.defaults(), Runnable::run, scheduler);
        FakeTransport transport = connect("carol");

        transport.fireRemoteTrack(FakeTrack.audio("a1"));
        manager.removePeer("carol");

        assertThat(manager.getRemoteIds()).isEmpty();
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void ownedExecutorsAreShutDownOnClose() {
        PeerConnectionManager owning = new PeerConnectionManager("erin", transports, signaling, events,
            MeshConfig.defaults());
        owning.createOffer("frank").join();

        owning.close();

        assertThat(owning.getRemoteIds()).isEmpty();
        assertThat(events.ended()).containsExactly("frank");
    }
}
