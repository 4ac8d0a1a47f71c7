package com.chatmesh.p2p;

import com.chatmesh.config.MeshConfig;
import com.chatmesh.signaling.SignalingMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NegotiatorTest {

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
        manager = new PeerConnectionManager("bob", transports, signaling, events, MeshConfig.defaults(),
            Runnable::run, scheduler);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.shutdownNow();
    }

    @Test
    void lowerIdIsPolite() {
        assertThat(manager.getNegotiator().isPolite("carol")).isTrue();
        assertThat(manager.getNegotiator().isPolite("alice")).isFalse();
    }

    @Test
    void createOfferSendsOfferAndWaitsForAnswer() {
        manager.createOffer("carol").join();

        assertThat(signaling.sent()).singleElement().satisfies(message -> {
            assertThat(message).isInstanceOf(SignalingMessage.Offer.class);
            assertThat(message.from()).isEqualTo("bob");
            assertThat(message.to()).isEqualTo("carol");
            assertThat(((SignalingMessage.Offer) message).sdp()).isEqualTo("offer-carol-1");
        });
        assertThat(transports.last("carol").getOfferOptions()).containsExactly(OfferOptions.sendReceive());
        assertThat(manager.getNegotiationState("carol")).contains(NegotiationState.HAVE_LOCAL_OFFER);
    }

    @Test
    void answerCompletesExchange() {
        manager.createOffer("carol").join();

        manager.handleAnswer("carol", "answer-sdp").join();

        assertThat(manager.getNegotiationState("carol")).contains(NegotiationState.STABLE);
        assertThat(transports.last("carol").getRemoteDescriptions())
            .containsExactly(SessionDescription.answer("answer-sdp"));
    }

    @Test
    void failedOfferKeepsConnectionForRetry() {
        PeerConnection connection = manager.getRegistry().getOrCreate("carol");
        transports.last("carol").failNextOffer(new IllegalStateException("encoder unavailable"));

        CompletableFuture<Void> attempt = manager.createOffer("carol");

        assertThatThrownBy(attempt::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(NegotiationException.class);
        assertThat(manager.getConnection("carol")).contains(connection);
        assertThat(connection.isMakingOffer()).isFalse();
        assertThat(signaling.sent()).isEmpty();

        manager.createOffer("carol").join();

        assertThat(signaling.sent(SignalingMessage.Type.OFFER)).hasSize(1);
        assertThat(transports.getCreateCount()).isEqualTo(1);
    }

    @Test
    void offerFromNewPeerIsAnswered() {
        manager.handleOffer("alice", "offer-from-alice").join();

        assertThat(signaling.sent(SignalingMessage.Type.ANSWER)).singleElement().satisfies(message -> {
            assertThat(message.to()).isEqualTo("alice");
            assertThat(((SignalingMessage.Answer) message).sdp()).isEqualTo("answer-alice");
        });
        assertThat(manager.getNegotiationState("alice")).contains(NegotiationState.STABLE);
    }

    @Test
    void answerFromUnknownPeerIsDropped() {
        manager.handleAnswer("mallory", "answer").join();

        assertThat(manager.getRemoteIds()).isEmpty();
        assertThat(transports.getCreateCount()).isZero();
    }

    @Test
    void answerInWrongStateCompletesNormally() {
        manager.getRegistry().getOrCreate("carol");

        manager.handleAnswer("carol", "unexpected").join();

        assertThat(manager.getNegotiationState("carol")).contains(NegotiationState.STABLE);
    }

    @Test
    void candidatesAreAddedOrDropped() {
        manager.createOffer("carol").join();
        FakeTransport transport = transports.last("carol");
        IceCandidate good = new IceCandidate("0", 0, "candidate:1 1 udp 2122260223 10.0.0.2 54321 typ host");

        manager.handleIceCandidate("carol", good);
        manager.handleIceCandidate("carol", new IceCandidate(null, -1, "candidate:2"));
        manager.handleIceCandidate("carol", new IceCandidate("0", 0, " "));
        manager.handleIceCandidate("carol", null);
        manager.handleIceCandidate("dave", good);

        assertThat(transport.getCandidates()).containsExactly(good);
        assertThat(manager.getRemoteIds()).containsExactly("carol");
    }

    @Test
    void candidateForClosedConnectionIsIgnored() {
        manager.createOffer("carol").join();
        PeerConnection connection = manager.getConnection("carol").orElseThrow();
        connection.getTransport().close();

        manager.handleIceCandidate("carol", new IceCandidate("0", 0, "candidate:1"));

        assertThat(transports.last("carol").getCandidates()).isEmpty();
    }

    @Test
    void localCandidatesAreForwarded() {
        manager.createOffer("carol").join();
        IceCandidate candidate = new IceCandidate("0", 0, "candidate:local");

        transports.last("carol").fireLocalCandidate(candidate);

        assertThat(signaling.sent(SignalingMessage.Type.ICE_CANDIDATE)).singleElement()
            .isEqualTo(new SignalingMessage.Candidate("bob", "carol", candidate));
    }

    @Test
    void closingMidNegotiationDropsRemainingSteps() {
        manager.getRegistry().getOrCreate("carol");
        FakeTransport transport = transports.last("carol");
        transport.holdNextOffer();

        CompletableFuture<Void> attempt = manager.createOffer("carol");
        manager.removePeer("carol");
        transport.releaseOffer();

        assertThat(attempt).isCompleted();
        assertThat(attempt.isCompletedExceptionally()).isFalse();
        assertThat(signaling.sent()).isEmpty();
        assertThat(transport.getLocalDescriptions()).isEmpty();
        assertThat(events.ended()).containsExactly("carol");
    }
}
