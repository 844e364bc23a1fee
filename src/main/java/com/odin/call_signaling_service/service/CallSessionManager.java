package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.apache.commons.lang.StringUtils;

import com.odin.call_signaling_service.call.CallEventListener;
import com.odin.call_signaling_service.call.CallSession;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.AnswerMessage;
import com.odin.call_signaling_service.dto.CallCancelledMessage;
import com.odin.call_signaling_service.dto.CallDeclinedMessage;
import com.odin.call_signaling_service.dto.CallEndedMessage;
import com.odin.call_signaling_service.dto.CallIdentity;
import com.odin.call_signaling_service.dto.IceCandidateMessage;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.dto.OfferMessage;
import com.odin.call_signaling_service.dto.ParticipantJoinedMessage;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.dto.SignalingMessageVisitor;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.CallSessionException;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.transport.SignalingListener;
import com.odin.call_signaling_service.transport.SignalingTransport;
import com.odin.call_signaling_service.utility.CorrelationIdUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Call layer of one local device. Owns at most one {@link CallSession} and
 * the invitations still ringing on this device.
 * <p>
 * Public operations may be called from any thread; they are queued onto the
 * device event loop, which also receives every signaling message, so no
 * state here is ever touched concurrently.
 */
@Slf4j
public class CallSessionManager implements SignalingListener {

	private final String userId;
	private final MediaEngine mediaEngine;
	private final SignalingTransport transport;
	private final InvitationDispatcher invitationDispatcher;
	private final Executor eventLoop;
	private final CallEventListener listener;
	private final long ringTimeoutMs;

	private final Map<String, InviteMessage> pendingInvites = new LinkedHashMap<>();
	private final InviteChannelHandler inviteChannelHandler = new InviteChannelHandler();
	private CallSession activeSession;

	public CallSessionManager(String userId, MediaEngine mediaEngine, SignalingTransport transport,
			InvitationDispatcher invitationDispatcher, Executor deviceExecutor, CallEventListener listener) {
		this(userId, mediaEngine, transport, invitationDispatcher, deviceExecutor, listener,
				ApplicationConstants.DEFAULT_RING_TIMEOUT_MS);
	}

	/**
	 * @param ringTimeoutMs how long an invitation rings before it is dropped;
	 *                      0 keeps invitations until cancelled
	 */
	public CallSessionManager(String userId, MediaEngine mediaEngine, SignalingTransport transport,
			InvitationDispatcher invitationDispatcher, Executor deviceExecutor, CallEventListener listener,
			long ringTimeoutMs) {
		this.userId = userId;
		this.mediaEngine = mediaEngine;
		this.transport = transport;
		this.invitationDispatcher = invitationDispatcher;
		this.eventLoop = task -> {
			try {
				deviceExecutor.execute(CorrelationIdUtil.wrap(ApplicationConstants.MDC_USER_ID, userId, task));
			} catch (RejectedExecutionException e) {
				log.debug("Event loop of {} stopped, dropping task", userId);
			}
		};
		this.listener = listener;
		this.ringTimeoutMs = ringTimeoutMs;
	}

	public String getUserId() {
		return userId;
	}

	/**
	 * Only meaningful on the event loop or once it is idle.
	 */
	public CallSession getActiveSession() {
		return activeSession;
	}

	public boolean hasPendingInvite(String chatRoomId) {
		return pendingInvites.containsKey(chatRoomId);
	}

	public void startCall(String chatRoomId, List<String> participants, CallType callType) {
		if (StringUtils.isBlank(chatRoomId) || callType == null) {
			throw new CallSessionException("chatRoomId and callType are required");
		}
		Set<String> roster = new LinkedHashSet<>();
		roster.add(userId);
		if (participants != null) {
			participants.stream().filter(StringUtils::isNotBlank).forEach(roster::add);
		}
		if (roster.size() < 2) {
			throw new CallSessionException("A call needs at least one other participant");
		}
		CallIdentity identity = new CallIdentity(chatRoomId, callType);
		eventLoop.execute(() -> {
			if (rejectIfBusy(identity)) {
				return;
			}
			openSession(identity, userId, new ArrayList<>(roster));
		});
	}

	public void acceptIncoming(InviteMessage invite) {
		if (invite == null || StringUtils.isBlank(invite.getChatRoomId())) {
			throw new CallSessionException("invite with chatRoomId is required");
		}
		eventLoop.execute(() -> {
			CallIdentity identity = new CallIdentity(invite.getChatRoomId(), invite.getCallType());
			dropExpiredInvites();
			InviteMessage pending = pendingInvites.get(invite.getChatRoomId());
			if (pending == null) {
				log.warn("Invitation to {} is no longer pending, not accepting", invite.getChatRoomId());
				listener.onCallFailed(identity, "The call is no longer available");
				return;
			}
			if (rejectIfBusy(identity)) {
				return;
			}
			pendingInvites.remove(invite.getChatRoomId());
			Set<String> roster = new LinkedHashSet<>();
			roster.add(pending.getFrom());
			roster.addAll(pending.getParticipants());
			roster.add(userId);
			openSession(new CallIdentity(pending.getChatRoomId(), pending.getCallType()), pending.getFrom(),
					new ArrayList<>(roster));
		});
	}

	public void declineIncoming(InviteMessage invite) {
		if (invite == null || StringUtils.isBlank(invite.getChatRoomId())) {
			throw new CallSessionException("invite with chatRoomId is required");
		}
		eventLoop.execute(() -> {
			InviteMessage pending = pendingInvites.remove(invite.getChatRoomId());
			if (pending == null) {
				log.debug("Invitation to {} already gone, nothing to decline", invite.getChatRoomId());
				return;
			}
			invitationDispatcher.sendDecline(pending.getFrom(), pending.getChatRoomId(), userId);
		});
	}

	public void endCall() {
		eventLoop.execute(() -> {
			if (activeSession == null) {
				log.debug("No active call to end for {}", userId);
				return;
			}
			activeSession.hangUp();
		});
	}

	public void toggleMute() {
		eventLoop.execute(() -> {
			if (activeSession != null) {
				activeSession.toggleMute();
			}
		});
	}

	public void toggleVideo() {
		eventLoop.execute(() -> {
			if (activeSession != null) {
				activeSession.toggleVideo();
			}
		});
	}

	/**
	 * Ends the active call and forgets ringing invitations; the device is going
	 * away.
	 */
	public void shutdown() {
		eventLoop.execute(() -> {
			pendingInvites.clear();
			if (activeSession != null) {
				activeSession.end(CallEndReason.DEVICE_DISCONNECTED);
			}
		});
	}

	/**
	 * Entry point for messages routed from the invites channel.
	 */
	@Override
	public void onMessage(String channelName, SignalingMessage message) {
		eventLoop.execute(() -> {
			if (!userId.equals(message.getTo())) {
				return;
			}
			message.accept(inviteChannelHandler);
		});
	}

	private boolean rejectIfBusy(CallIdentity identity) {
		if (activeSession == null) {
			return false;
		}
		log.warn("Rejecting call {} for {}: call {} is still active", identity.getChatRoomId(), userId,
				activeSession.getIdentity().getChatRoomId());
		listener.onCallFailed(identity, "Another call is already active");
		return true;
	}

	private boolean isExpired(InviteMessage invite) {
		Long sentAt = invite.getTimestamp();
		return ringTimeoutMs > 0 && sentAt != null && System.currentTimeMillis() - sentAt > ringTimeoutMs;
	}

	private void dropExpiredInvites() {
		pendingInvites.values().removeIf(invite -> {
			if (!isExpired(invite)) {
				return false;
			}
			log.info("Invitation to {} from {} stopped ringing", invite.getChatRoomId(), invite.getFrom());
			return true;
		});
	}

	private void openSession(CallIdentity identity, String inviter, List<String> roster) {
		activeSession = new CallSession(identity, userId, inviter, roster, mediaEngine, transport,
				invitationDispatcher, eventLoop, listener, this::onSessionTerminated);
		activeSession.start();
	}

	private void onSessionTerminated(CallSession session) {
		if (activeSession == session) {
			activeSession = null;
		}
	}

	private class InviteChannelHandler implements SignalingMessageVisitor<Void> {

		@Override
		public Void visitInvite(InviteMessage invite) {
			if (activeSession != null && activeSession.getIdentity().getChatRoomId().equals(invite.getChatRoomId())) {
				// both sides called each other; treat the invite as presence
				if (activeSession.getRoster().contains(invite.getFrom())) {
					activeSession.onPeerPresent(invite.getFrom());
				}
				return null;
			}
			if (isExpired(invite)) {
				log.warn("Ignoring stale invitation to {} from {} sent at {}", invite.getChatRoomId(), invite.getFrom(),
						invite.getTimestamp());
				return null;
			}
			pendingInvites.put(invite.getChatRoomId(), invite);
			log.info("Incoming {} call {} from {}", invite.getCallType(), invite.getChatRoomId(), invite.getFrom());
			listener.onIncomingInvite(invite);
			return null;
		}

		@Override
		public Void visitCallCancelled(CallCancelledMessage message) {
			InviteMessage pending = pendingInvites.get(message.getChatRoomId());
			if (pending == null || !pending.getFrom().equals(message.getFrom())) {
				log.debug("Ignoring cancel of {} from {}: no matching invitation", message.getChatRoomId(),
						message.getFrom());
				return null;
			}
			pendingInvites.remove(message.getChatRoomId());
			log.info("Invitation to {} cancelled by {}", message.getChatRoomId(), message.getFrom());
			listener.onInviteCancelled(pending);
			return null;
		}

		@Override
		public Void visitCallDeclined(CallDeclinedMessage message) {
			if (activeSession != null && activeSession.getIdentity().getChatRoomId().equals(message.getChatRoomId())) {
				activeSession.onDeclined(message.getFrom());
			}
			return null;
		}

		@Override
		public Void visitOffer(OfferMessage message) {
			return unexpected(message);
		}

		@Override
		public Void visitAnswer(AnswerMessage message) {
			return unexpected(message);
		}

		@Override
		public Void visitIceCandidate(IceCandidateMessage message) {
			return unexpected(message);
		}

		@Override
		public Void visitParticipantJoined(ParticipantJoinedMessage message) {
			return unexpected(message);
		}

		@Override
		public Void visitCallEnded(CallEndedMessage message) {
			return unexpected(message);
		}

		private Void unexpected(SignalingMessage message) {
			log.debug("Ignoring {} on the invites channel", message.getEvent());
			return null;
		}
	}
}
