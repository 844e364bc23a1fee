package com.odin.call_signaling_service.call;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import com.odin.call_signaling_service.dto.AnswerMessage;
import com.odin.call_signaling_service.dto.IceCandidateMessage;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.OfferMessage;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.exception.NegotiationException;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.media.RtcPeerConnection;
import com.odin.call_signaling_service.media.RtcPeerConnectionObserver;
import com.odin.call_signaling_service.support.ManualEventLoop;

class PeerConnectionTest {

	private static final SdpPayload LOCAL_OFFER = SdpPayload.offer("v=0 local-offer");
	private static final SdpPayload LOCAL_ANSWER = SdpPayload.answer("v=0 local-answer");
	private static final SdpPayload REMOTE_OFFER = SdpPayload.offer("v=0 remote-offer");
	private static final SdpPayload REMOTE_ANSWER = SdpPayload.answer("v=0 remote-answer");

	private final ManualEventLoop loop = new ManualEventLoop();
	private MediaEngine engine;
	private RtcPeerConnection rtc;
	private PeerConnectionListener listener;
	private RtcPeerConnectionObserver observer;

	@BeforeEach
	void setUp() {
		engine = mock(MediaEngine.class);
		rtc = mock(RtcPeerConnection.class);
		listener = mock(PeerConnectionListener.class);
		when(engine.createPeerConnection(any(), any())).thenAnswer(invocation -> {
			observer = invocation.getArgument(1);
			return rtc;
		});
		when(rtc.createOffer()).thenReturn(CompletableFuture.completedFuture(LOCAL_OFFER));
		when(rtc.createAnswer()).thenReturn(CompletableFuture.completedFuture(LOCAL_ANSWER));
		when(rtc.setLocalDescription(any())).thenReturn(CompletableFuture.completedFuture(null));
		when(rtc.setRemoteDescription(any())).thenReturn(CompletableFuture.completedFuture(null));
		when(rtc.addIceCandidate(any())).thenReturn(CompletableFuture.completedFuture(null));
	}

	private PeerConnection aliceToBob() {
		return new PeerConnection("alice", "bob", true, engine, loop, listener);
	}

	private List<SignalingMessage> sent() {
		ArgumentCaptor<SignalingMessage> captor = ArgumentCaptor.forClass(SignalingMessage.class);
		verify(listener, atLeastOnce()).send(captor.capture());
		return captor.getAllValues();
	}

	private static IceCandidatePayload candidate(int port) {
		return new IceCandidatePayload("candidate:1 1 udp 1 10.0.0.1 " + port + " typ host", "0", 0);
	}

	@Test
	void initiatorReachesNegotiatingOnAnswerAndConnectedOnTransport() {
		PeerConnection peer = aliceToBob();

		peer.startAsInitiator();
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.LOCAL_OFFER_SENT);
		assertThat(sent()).singleElement().isInstanceOfSatisfying(OfferMessage.class, offer -> {
			assertThat(offer.getFrom()).isEqualTo("alice");
			assertThat(offer.getTo()).isEqualTo("bob");
			assertThat(offer.getSdp()).isEqualTo(LOCAL_OFFER);
		});

		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
		assertThat(peer.isRemoteDescriptionApplied()).isTrue();
		verify(rtc).setRemoteDescription(REMOTE_ANSWER);

		observer.onTransportConnected();
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CONNECTED);
		verify(listener).onConnected(peer);
	}

	@Test
	void responderAppliesOfferAndPublishesAnswer() {
		PeerConnection peer = aliceToBob();

		peer.onRemoteOffer(REMOTE_OFFER);
		assertThat(peer.getState()).isEqualTo(PeerConnectionState.REMOTE_OFFER_RECEIVED);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
		InOrder order = inOrder(rtc);
		order.verify(rtc).setRemoteDescription(REMOTE_OFFER);
		order.verify(rtc).createAnswer();
		order.verify(rtc).setLocalDescription(LOCAL_ANSWER);
		assertThat(sent()).singleElement().isInstanceOfSatisfying(AnswerMessage.class,
				answer -> assertThat(answer.getTo()).isEqualTo("bob"));
	}

	@Test
	void transportConnectedBeforeAnswerIsPublishedStillPromotes() {
		PeerConnection peer = aliceToBob();

		peer.onRemoteOffer(REMOTE_OFFER);
		observer.onTransportConnected();
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CONNECTED);
		verify(listener).onConnected(peer);
	}

	@Test
	void candidatesArrivingBeforeOfferAreBufferedAndAppliedOnceInOrder() {
		PeerConnection peer = aliceToBob();
		IceCandidatePayload first = candidate(5000);
		IceCandidatePayload second = candidate(5001);

		peer.onRemoteCandidate(first);
		peer.onRemoteCandidate(second);

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEW);
		assertThat(peer.getPendingRemoteCandidates()).containsExactly(first, second);
		verify(rtc, never()).addIceCandidate(any());

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		InOrder order = inOrder(rtc);
		order.verify(rtc).setRemoteDescription(REMOTE_OFFER);
		order.verify(rtc).addIceCandidate(first);
		order.verify(rtc).addIceCandidate(second);
		verify(rtc, times(2)).addIceCandidate(any());
		assertThat(peer.getPendingRemoteCandidates()).isEmpty();
		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
	}

	@Test
	void candidatesArrivingBeforeAnswerAreFlushedAfterIt() {
		PeerConnection peer = aliceToBob();
		peer.startAsInitiator();
		loop.runAll();

		IceCandidatePayload early = candidate(6000);
		peer.onRemoteCandidate(early);
		verify(rtc, never()).addIceCandidate(any());

		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();

		InOrder order = inOrder(rtc);
		order.verify(rtc).setRemoteDescription(REMOTE_ANSWER);
		order.verify(rtc).addIceCandidate(early);

		IceCandidatePayload late = candidate(6001);
		peer.onRemoteCandidate(late);
		loop.runAll();
		verify(rtc).addIceCandidate(late);
		verify(rtc, times(2)).addIceCandidate(any());
	}

	@Test
	void duplicateAnswerIsIgnored() {
		PeerConnection peer = aliceToBob();
		peer.startAsInitiator();
		loop.runAll();

		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();
		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
		verify(rtc, times(1)).setRemoteDescription(any());
	}

	@Test
	void duplicateOfferIsIgnoredOnceAnswering() {
		PeerConnection peer = aliceToBob();

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();
		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		verify(rtc, times(1)).setRemoteDescription(any());
		verify(rtc, times(1)).createAnswer();
		assertThat(sent()).hasSize(1);
	}

	@Test
	void answerWithoutOfferIsIgnored() {
		PeerConnection peer = aliceToBob();

		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEW);
		verify(rtc, never()).setRemoteDescription(any());
	}

	@Test
	void politePeerAbandonsItsOfferOnCollision() {
		PeerConnection peer = aliceToBob();
		assertThat(peer.isPolite()).isTrue();
		peer.startAsInitiator();
		loop.runAll();

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
		verify(rtc).setRemoteDescription(REMOTE_OFFER);
		assertThat(sent()).hasSize(2).last().isInstanceOf(AnswerMessage.class);
	}

	@Test
	void politePeerAbandonsOfferStillBeingCreated() {
		CompletableFuture<SdpPayload> pendingOffer = new CompletableFuture<>();
		when(rtc.createOffer()).thenReturn(pendingOffer);
		PeerConnection peer = aliceToBob();
		peer.startAsInitiator();

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();
		pendingOffer.complete(LOCAL_OFFER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
		assertThat(sent()).noneMatch(message -> message instanceof OfferMessage);
	}

	@Test
	void impolitePeerKeepsItsOfferAndRepublishesIt() {
		PeerConnection peer = new PeerConnection("bob", "alice", false, engine, loop, listener);
		peer.startAsInitiator();
		loop.runAll();

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.LOCAL_OFFER_SENT);
		verify(rtc, never()).setRemoteDescription(any());
		List<SignalingMessage> offers = sent().stream().filter(m -> m instanceof OfferMessage)
				.collect(Collectors.toList());
		assertThat(offers).hasSize(2).allSatisfy(m -> assertThat(((OfferMessage) m).getSdp()).isEqualTo(LOCAL_OFFER));
	}

	@Test
	void peerJoinedStartsNegotiationOrRepublishesPendingOffer() {
		PeerConnection peer = aliceToBob();

		peer.onPeerJoined();
		loop.runAll();
		assertThat(peer.getState()).isEqualTo(PeerConnectionState.LOCAL_OFFER_SENT);

		peer.onPeerJoined();
		loop.runAll();
		assertThat(sent()).hasSize(2).allMatch(m -> m instanceof OfferMessage);
		verify(rtc, times(1)).createOffer();
	}

	@Test
	void failureToApplyRemoteDescriptionClosesOnlyThisPeer() {
		when(rtc.setRemoteDescription(any()))
				.thenReturn(CompletableFuture.failedFuture(new NegotiationException("bad sdp")));
		PeerConnection peer = aliceToBob();

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CLOSED);
		verify(listener).onClosed(peer, true);
		verify(rtc).close();
		verify(rtc, never()).createAnswer();
	}

	@Test
	void failedCandidateClosesPeer() {
		when(rtc.addIceCandidate(any()))
				.thenReturn(CompletableFuture.failedFuture(new NegotiationException("bad candidate")));
		PeerConnection peer = aliceToBob();
		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		peer.onRemoteCandidate(candidate(7000));
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CLOSED);
		verify(listener).onClosed(peer, true);
	}

	@Test
	void transportFailureClosesPeer() {
		PeerConnection peer = aliceToBob();
		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		observer.onTransportFailed(new IllegalStateException("ice failed"));
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CLOSED);
		verify(listener).onClosed(peer, true);
	}

	@Test
	void closedPeerIgnoresEveryInput() {
		PeerConnection peer = aliceToBob();
		peer.close();
		peer.close();

		peer.onRemoteOffer(REMOTE_OFFER);
		peer.onRemoteAnswer(REMOTE_ANSWER);
		peer.onRemoteCandidate(candidate(8000));
		peer.onPeerJoined();
		peer.startAsInitiator();
		observer.onLocalCandidate(candidate(8001));
		observer.onTransportConnected();
		loop.runAll();

		assertThat(peer.getState()).isEqualTo(PeerConnectionState.CLOSED);
		assertThat(peer.getPendingRemoteCandidates()).isEmpty();
		verify(rtc, never()).setRemoteDescription(any());
		verify(rtc, never()).createOffer();
		verify(listener, never()).send(any());
		verify(listener, times(1)).onClosed(peer, false);
		verify(listener, never()).onClosed(peer, true);
	}

	@Test
	void localCandidatesAreSentToTheRemotePeer() {
		PeerConnection peer = aliceToBob();
		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();

		observer.onLocalCandidate(candidate(9000));
		loop.runAll();

		assertThat(sent()).filteredOn(m -> m instanceof IceCandidateMessage).singleElement()
				.satisfies(m -> assertThat(m.getTo()).isEqualTo("bob"));
		assertThat(peer.getState()).isEqualTo(PeerConnectionState.NEGOTIATING);
	}

	@Test
	void attachingTheSameTrackTwiceAddsItOnce() {
		MediaTrack track = mock(MediaTrack.class);
		when(track.getId()).thenReturn("mic-1");
		when(track.getKind()).thenReturn(MediaKind.AUDIO);
		PeerConnection peer = aliceToBob();

		assertThat(peer.attachTrack(track)).isTrue();
		assertThat(peer.attachTrack(track)).isFalse();

		verify(rtc, times(1)).addTrack(track);
		assertThat(peer.getAttachedTrackIds()).containsExactly("mic-1");
	}

	@Test
	void remoteTracksReachCallbacksAndListener() {
		MediaTrack remote = mock(MediaTrack.class);
		PeerConnection peer = aliceToBob();
		List<MediaTrack> seen = new ArrayList<>();
		peer.addRemoteMediaCallback(seen::add);

		observer.onRemoteTrack(remote);
		loop.runAll();

		assertThat(seen).containsExactly(remote);
		verify(listener).onRemoteTrack(peer, remote);
		verify(listener, never()).onClosed(any(), anyBoolean());
	}

	@Test
	void republishedOfferIsFollowedByItsCandidates() {
		PeerConnection peer = aliceToBob();
		peer.startAsInitiator();
		IceCandidatePayload gathered = candidate(4000);
		observer.onLocalCandidate(gathered);
		loop.runAll();
		assertThat(peer.getLocalOfferCandidates()).containsExactly(gathered);

		peer.onPeerJoined();
		loop.runAll();

		List<SignalingMessage> messages = sent();
		assertThat(messages).hasSize(4);
		assertThat(messages.get(2)).isInstanceOf(OfferMessage.class);
		assertThat(messages.get(3)).isInstanceOfSatisfying(IceCandidateMessage.class,
				message -> assertThat(message.getCandidate()).isEqualTo(gathered));
	}

	@Test
	void answeredOfferForgetsItsCandidates() {
		PeerConnection peer = aliceToBob();
		peer.startAsInitiator();
		loop.runAll();
		observer.onLocalCandidate(candidate(4001));
		loop.runAll();

		peer.onRemoteAnswer(REMOTE_ANSWER);
		loop.runAll();
		peer.onPeerJoined();
		loop.runAll();

		assertThat(peer.getLocalOfferCandidates()).isEmpty();
		assertThat(sent()).hasSize(2);
	}

	@Test
	void repeatedRemoteCandidateIsAppliedOnce() {
		PeerConnection peer = aliceToBob();
		IceCandidatePayload early = candidate(4100);

		peer.onRemoteCandidate(early);
		peer.onRemoteCandidate(early);
		assertThat(peer.getPendingRemoteCandidates()).containsExactly(early);

		peer.onRemoteOffer(REMOTE_OFFER);
		loop.runAll();
		peer.onRemoteCandidate(early);
		loop.runAll();

		verify(rtc, times(1)).addIceCandidate(early);
	}
}
