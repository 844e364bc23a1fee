package com.odin.call_signaling_service.call;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.AnswerMessage;
import com.odin.call_signaling_service.dto.IceCandidateMessage;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.OfferMessage;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.media.RtcPeerConnection;
import com.odin.call_signaling_service.media.RtcPeerConnectionObserver;

import lombok.extern.slf4j.Slf4j;

/**
 * Offer/answer negotiation with one remote participant.
 * <p>
 * Every method must be called on the device event loop; completions of the
 * media engine and its observer callbacks are marshalled back onto it. The
 * state never moves backwards and {@link PeerConnectionState#CLOSED} is final:
 * once closed, every input is ignored.
 * <p>
 * Offer collisions are resolved by politeness: the polite side abandons its
 * own offer and answers the remote one, the impolite side ignores the remote
 * offer and republishes its own.
 */
@Slf4j
public class PeerConnection {

	private final String localUserId;
	private final String remoteUserId;
	private final boolean polite;
	private final Executor eventLoop;
	private final PeerConnectionListener listener;
	private final RtcPeerConnection rtc;

	private final List<IceCandidatePayload> pendingRemoteCandidates = new ArrayList<>();
	private final Set<IceCandidatePayload> receivedRemoteCandidates = new HashSet<>();
	// gathered for pendingLocalOffer, replayed with it
	private final List<IceCandidatePayload> localOfferCandidates = new ArrayList<>();
	private final Set<String> attachedTrackIds = new HashSet<>();
	private final List<Consumer<MediaTrack>> remoteMediaCallbacks = new ArrayList<>();

	private PeerConnectionState state = PeerConnectionState.NEW;
	private boolean remoteDescriptionApplied;
	private boolean makingOffer;
	private boolean transportConnected;
	private SdpPayload pendingLocalOffer;

	public PeerConnection(String localUserId, String remoteUserId, boolean polite, MediaEngine mediaEngine,
			Executor eventLoop, PeerConnectionListener listener) {
		this.localUserId = localUserId;
		this.remoteUserId = remoteUserId;
		this.polite = polite;
		this.eventLoop = eventLoop;
		this.listener = listener;
		this.rtc = mediaEngine.createPeerConnection(remoteUserId, new EventLoopObserver());
	}

	public String getRemoteUserId() {
		return remoteUserId;
	}

	public PeerConnectionState getState() {
		return state;
	}

	public boolean isPolite() {
		return polite;
	}

	public boolean isRemoteDescriptionApplied() {
		return remoteDescriptionApplied;
	}

	public List<IceCandidatePayload> getPendingRemoteCandidates() {
		return Collections.unmodifiableList(pendingRemoteCandidates);
	}

	public List<IceCandidatePayload> getLocalOfferCandidates() {
		return Collections.unmodifiableList(localOfferCandidates);
	}

	public Set<String> getAttachedTrackIds() {
		return Collections.unmodifiableSet(attachedTrackIds);
	}

	/**
	 * Adds a local track for sending. A track already attached is skipped.
	 *
	 * @return true when the track was newly attached
	 */
	public boolean attachTrack(MediaTrack track) {
		if (state.isTerminal() || !attachedTrackIds.add(track.getId())) {
			return false;
		}
		rtc.addTrack(track);
		return true;
	}

	public void addRemoteMediaCallback(Consumer<MediaTrack> callback) {
		remoteMediaCallbacks.add(callback);
	}

	/**
	 * Initiator entry point: create, apply and publish a local offer.
	 */
	public void startAsInitiator() {
		if (state != PeerConnectionState.NEW || makingOffer) {
			log.debug("Not initiating to {}: state={}, makingOffer={}", remoteUserId, state, makingOffer);
			return;
		}
		makingOffer = true;
		rtc.createOffer()
				.thenCompose(offer -> rtc.setLocalDescription(offer).thenApply(applied -> offer))
				.whenCompleteAsync((offer, error) -> {
					makingOffer = false;
					if (state != PeerConnectionState.NEW) {
						log.debug("Discarding local offer to {}: connection moved to {}", remoteUserId, state);
						return;
					}
					if (error != null) {
						localOfferCandidates.clear();
						fail("create local offer", error);
						return;
					}
					pendingLocalOffer = offer;
					transition(PeerConnectionState.LOCAL_OFFER_SENT);
					listener.send(new OfferMessage(localUserId, remoteUserId, offer));
				}, eventLoop);
	}

	public void onRemoteOffer(SdpPayload offer) {
		switch (state) {
		case REMOTE_OFFER_RECEIVED:
		case NEGOTIATING:
		case CONNECTED:
		case CLOSED:
			log.debug("Ignoring offer from {} in state {}", remoteUserId, state);
			return;
		default:
			break;
		}

		boolean collision = makingOffer || state == PeerConnectionState.LOCAL_OFFER_SENT;
		if (collision && !polite) {
			log.info("Offer collision with {}: keeping local offer", remoteUserId);
			republishOffer();
			return;
		}
		if (collision) {
			log.info("Offer collision with {}: abandoning local offer", remoteUserId);
		}

		transition(PeerConnectionState.REMOTE_OFFER_RECEIVED);
		pendingLocalOffer = null;
		localOfferCandidates.clear();
		rtc.setRemoteDescription(offer).whenCompleteAsync((applied, error) -> {
			if (state.isTerminal()) {
				return;
			}
			if (error != null) {
				fail("apply remote offer", error);
				return;
			}
			remoteDescriptionApplied = true;
			flushPendingCandidates();
			createAndSendAnswer();
		}, eventLoop);
	}

	public void onRemoteAnswer(SdpPayload answer) {
		if (state != PeerConnectionState.LOCAL_OFFER_SENT) {
			log.debug("Ignoring answer from {} in state {}", remoteUserId, state);
			return;
		}
		transition(PeerConnectionState.NEGOTIATING);
		pendingLocalOffer = null;
		localOfferCandidates.clear();
		promoteIfTransportConnected();
		rtc.setRemoteDescription(answer).whenCompleteAsync((applied, error) -> {
			if (state.isTerminal()) {
				return;
			}
			if (error != null) {
				fail("apply remote answer", error);
				return;
			}
			remoteDescriptionApplied = true;
			flushPendingCandidates();
		}, eventLoop);
	}

	/**
	 * Applies a remote candidate, or buffers it until the remote description
	 * is in place. A candidate already received from this peer is ignored, so
	 * a replayed offer does not apply its candidates twice.
	 */
	public void onRemoteCandidate(IceCandidatePayload candidate) {
		if (state.isTerminal()) {
			return;
		}
		if (!receivedRemoteCandidates.add(candidate)) {
			log.debug("Ignoring repeated candidate from {}", remoteUserId);
			return;
		}
		if (!remoteDescriptionApplied) {
			pendingRemoteCandidates.add(candidate);
			log.debug("Buffered candidate from {} ({} pending)", remoteUserId, pendingRemoteCandidates.size());
			return;
		}
		applyCandidate(candidate);
	}

	/**
	 * The remote participant announced it is now listening on the call
	 * channel, so anything sent before may have been lost.
	 */
	public void onPeerJoined() {
		if (state == PeerConnectionState.NEW) {
			startAsInitiator();
		} else if (state == PeerConnectionState.LOCAL_OFFER_SENT) {
			republishOffer();
		} else {
			log.debug("Ignoring presence of {} in state {}", remoteUserId, state);
		}
	}

	public void close() {
		closeInternal(false);
	}

	private void createAndSendAnswer() {
		rtc.createAnswer()
				.thenCompose(answer -> rtc.setLocalDescription(answer).thenApply(applied -> answer))
				.whenCompleteAsync((answer, error) -> {
					if (state.isTerminal()) {
						return;
					}
					if (error != null) {
						fail("create answer", error);
						return;
					}
					listener.send(new AnswerMessage(localUserId, remoteUserId, answer));
					transition(PeerConnectionState.NEGOTIATING);
					promoteIfTransportConnected();
				}, eventLoop);
	}

	private void republishOffer() {
		if (pendingLocalOffer == null) {
			return;
		}
		log.info("Republishing pending offer to {} with {} candidate(s)", remoteUserId, localOfferCandidates.size());
		listener.send(new OfferMessage(localUserId, remoteUserId, pendingLocalOffer));
		for (IceCandidatePayload candidate : new ArrayList<>(localOfferCandidates)) {
			listener.send(new IceCandidateMessage(localUserId, remoteUserId, candidate));
		}
	}

	private void flushPendingCandidates() {
		if (pendingRemoteCandidates.isEmpty()) {
			return;
		}
		List<IceCandidatePayload> batch = new ArrayList<>(pendingRemoteCandidates);
		pendingRemoteCandidates.clear();
		log.info("Flushing {} buffered candidate(s) from {}", batch.size(), remoteUserId);
		for (IceCandidatePayload candidate : batch) {
			applyCandidate(candidate);
		}
	}

	private void applyCandidate(IceCandidatePayload candidate) {
		rtc.addIceCandidate(candidate).whenCompleteAsync((applied, error) -> {
			if (error != null && !state.isTerminal()) {
				fail("apply remote candidate", error);
			}
		}, eventLoop);
	}

	private void fail(String step, Throwable error) {
		Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
		log.error("Negotiation with {} failed to {}: {}", remoteUserId, step, cause.getMessage(), cause);
		closeInternal(true);
	}

	private void closeInternal(boolean failed) {
		if (state.isTerminal()) {
			return;
		}
		transition(PeerConnectionState.CLOSED);
		pendingRemoteCandidates.clear();
		localOfferCandidates.clear();
		pendingLocalOffer = null;
		try {
			rtc.close();
		} catch (Exception e) {
			log.error("Failed to close media connection to {}: {}", remoteUserId, e.getMessage(), e);
		}
		listener.onClosed(this, failed);
	}

	private void transition(PeerConnectionState target) {
		if (!state.canTransitionTo(target)) {
			throw new IllegalStateException("Illegal transition " + state + " -> " + target + " for " + remoteUserId);
		}
		log.info("PEER [{}] STATE {} → {}", remoteUserId, state, target);
		state = target;
	}

	private void onLocalCandidate(IceCandidatePayload candidate) {
		if (state.isTerminal()) {
			return;
		}
		if (state == PeerConnectionState.LOCAL_OFFER_SENT || (state == PeerConnectionState.NEW && makingOffer)) {
			localOfferCandidates.add(candidate);
		}
		listener.send(new IceCandidateMessage(localUserId, remoteUserId, candidate));
	}

	private void onTransportConnected() {
		if (state.isTerminal()) {
			return;
		}
		transportConnected = true;
		promoteIfTransportConnected();
	}

	// The engine may report the path before the answer was published.
	private void promoteIfTransportConnected() {
		if (!transportConnected || state != PeerConnectionState.NEGOTIATING) {
			return;
		}
		transition(PeerConnectionState.CONNECTED);
		listener.onConnected(this);
	}

	private void onRemoteTrack(MediaTrack track) {
		if (state.isTerminal()) {
			return;
		}
		for (Consumer<MediaTrack> callback : remoteMediaCallbacks) {
			callback.accept(track);
		}
		listener.onRemoteTrack(this, track);
	}

	private class EventLoopObserver implements RtcPeerConnectionObserver {

		@Override
		public void onLocalCandidate(IceCandidatePayload candidate) {
			eventLoop.execute(() -> PeerConnection.this.onLocalCandidate(candidate));
		}

		@Override
		public void onTransportConnected() {
			eventLoop.execute(PeerConnection.this::onTransportConnected);
		}

		@Override
		public void onTransportFailed(Throwable cause) {
			eventLoop.execute(() -> {
				if (!state.isTerminal()) {
					fail("keep transport", cause);
				}
			});
		}

		@Override
		public void onRemoteTrack(MediaTrack track) {
			eventLoop.execute(() -> PeerConnection.this.onRemoteTrack(track));
		}
	}
}
