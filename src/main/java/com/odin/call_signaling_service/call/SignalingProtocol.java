package com.odin.call_signaling_service.call;

import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.AnswerMessage;
import com.odin.call_signaling_service.dto.CallCancelledMessage;
import com.odin.call_signaling_service.dto.CallDeclinedMessage;
import com.odin.call_signaling_service.dto.CallEndedMessage;
import com.odin.call_signaling_service.dto.IceCandidateMessage;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.dto.OfferMessage;
import com.odin.call_signaling_service.dto.ParticipantJoinedMessage;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.dto.SignalingMessageVisitor;

import lombok.extern.slf4j.Slf4j;

/**
 * Routes messages received on a call channel to the peer connection of
 * their sender. Messages for another recipient, echoes of local messages and
 * messages from outside the roster never touch local state.
 */
@Slf4j
public class SignalingProtocol implements SignalingMessageVisitor<Void> {

	private final String localUserId;
	private final PeerConnectionRegistry registry;
	private final Consumer<String> remoteEndedHandler;

	public SignalingProtocol(String localUserId, PeerConnectionRegistry registry, Consumer<String> remoteEndedHandler) {
		this.localUserId = localUserId;
		this.registry = registry;
		this.remoteEndedHandler = remoteEndedHandler;
	}

	public void handle(SignalingMessage message) {
		if (localUserId.equals(message.getFrom())) {
			return;
		}
		if (!message.isAddressedTo(localUserId)) {
			log.trace("Ignoring {} for {}", message.getEvent(), message.getTo());
			return;
		}
		message.accept(this);
	}

	@Override
	public Void visitOffer(OfferMessage message) {
		registry.getOrCreate(message.getFrom()).ifPresent(peer -> peer.onRemoteOffer(message.getSdp()));
		return null;
	}

	@Override
	public Void visitAnswer(AnswerMessage message) {
		// an answer is only meaningful for a connection we offered on
		registry.get(message.getFrom()).ifPresent(peer -> peer.onRemoteAnswer(message.getSdp()));
		return null;
	}

	@Override
	public Void visitIceCandidate(IceCandidateMessage message) {
		registry.getOrCreate(message.getFrom()).ifPresent(peer -> peer.onRemoteCandidate(message.getCandidate()));
		return null;
	}

	@Override
	public Void visitParticipantJoined(ParticipantJoinedMessage message) {
		registry.getOrCreate(message.getFrom()).ifPresent(PeerConnection::onPeerJoined);
		return null;
	}

	@Override
	public Void visitCallEnded(CallEndedMessage message) {
		if (!registry.getRoster().contains(message.getFrom())) {
			log.warn("Ignoring call end from {}: not in roster", message.getFrom());
			return null;
		}
		remoteEndedHandler.accept(message.getFrom());
		return null;
	}

	@Override
	public Void visitInvite(InviteMessage message) {
		return ignoreOffChannel(message);
	}

	@Override
	public Void visitCallCancelled(CallCancelledMessage message) {
		return ignoreOffChannel(message);
	}

	@Override
	public Void visitCallDeclined(CallDeclinedMessage message) {
		return ignoreOffChannel(message);
	}

	private Void ignoreOffChannel(SignalingMessage message) {
		log.debug("Ignoring {} on call channel, it belongs on the invites channel", message.getEvent());
		return null;
	}
}
