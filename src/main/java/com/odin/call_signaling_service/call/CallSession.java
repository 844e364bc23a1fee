package com.odin.call_signaling_service.call;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallEndedMessage;
import com.odin.call_signaling_service.dto.CallIdentity;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.dto.ParticipantJoinedMessage;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.CallSessionState;
import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.exception.SignalingTransportException;
import com.odin.call_signaling_service.media.LocalMediaHandle;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.service.InvitationDispatcher;
import com.odin.call_signaling_service.transport.ChannelSubscription;
import com.odin.call_signaling_service.transport.SignalingTransport;
import com.odin.call_signaling_service.utility.CorrelationIdUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * One call on one device: the roster, the local media and a peer connection
 * per remote participant.
 * <p>
 * Start order is media, then the call channel subscription, then the peer
 * connections with media attached, and only then offers and invitations (or
 * the presence announcement when joining). Teardown publishes the end of the
 * call, closes every peer, stops the local tracks and unsubscribes; each step
 * runs even when an earlier one failed.
 * <p>
 * All methods run on the device event loop.
 */
@Slf4j
public class CallSession implements PeerConnectionListener {

	private final CallIdentity identity;
	private final String localUserId;
	private final String inviterUserId;
	private final ParticipantRole role;
	private final List<String> roster;
	private final MediaEngine mediaEngine;
	private final SignalingTransport transport;
	private final InvitationDispatcher invitationDispatcher;
	private final Executor eventLoop;
	private final CallEventListener listener;
	private final Consumer<CallSession> onTerminated;

	private final PeerConnectionRegistry registry;
	private final SignalingProtocol protocol;

	private CallSessionState state = CallSessionState.ACQUIRING_MEDIA;
	private CompletableFuture<LocalMediaHandle> mediaRequest;
	private LocalMediaHandle localMedia;
	private ChannelSubscription subscription;
	private boolean invitesSent;
	private CallEndReason peerCloseReason;

	public CallSession(CallIdentity identity, String localUserId, String inviterUserId, List<String> roster,
			MediaEngine mediaEngine, SignalingTransport transport, InvitationDispatcher invitationDispatcher,
			Executor eventLoop, CallEventListener listener, Consumer<CallSession> onTerminated) {
		this.identity = identity;
		this.localUserId = localUserId;
		this.inviterUserId = inviterUserId;
		this.role = localUserId.equals(inviterUserId) ? ParticipantRole.CALLER : ParticipantRole.CALLEE;
		this.roster = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(roster)));
		this.mediaEngine = mediaEngine;
		this.transport = transport;
		this.invitationDispatcher = invitationDispatcher;
		this.eventLoop = eventLoop;
		this.listener = listener;
		this.onTerminated = onTerminated;
		this.registry = new PeerConnectionRegistry(localUserId, this.roster, mediaEngine, eventLoop, this);
		this.protocol = new SignalingProtocol(localUserId, registry, this::onRemoteEnded);
	}

	public CallIdentity getIdentity() {
		return identity;
	}

	public ParticipantRole getRole() {
		return role;
	}

	public CallSessionState getState() {
		return state;
	}

	public List<String> getRoster() {
		return roster;
	}

	public PeerConnectionRegistry getRegistry() {
		return registry;
	}

	public boolean isEnded() {
		return state == CallSessionState.ENDED;
	}

	public List<String> remoteParticipants() {
		List<String> remotes = new ArrayList<>(roster);
		remotes.remove(localUserId);
		return remotes;
	}

	public void start() {
		log.info("Starting {} call {} as {} with {}", identity.getCallType(), identity.getChatRoomId(), role,
				remoteParticipants());
		mediaRequest = mediaEngine.acquireLocalMedia(identity.getCallType());
		mediaRequest.whenCompleteAsync(this::onMediaAcquired, eventLoop);
	}

	private void onMediaAcquired(LocalMediaHandle handle, Throwable error) {
		if (state == CallSessionState.ENDED) {
			// released by end(), which may run after the event loop stopped
			return;
		}
		if (error != null) {
			Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause()
					: error;
			log.error("Media acquisition failed for call {}: {}", identity.getChatRoomId(), cause.getMessage(), cause);
			state = CallSessionState.ENDED;
			listener.onCallFailed(identity, cause.getMessage());
			onTerminated.accept(this);
			return;
		}

		localMedia = handle;
		try {
			subscription = transport.subscribe(identity.channelName(), (channel, message) -> eventLoop
					.execute(CorrelationIdUtil.wrap(ApplicationConstants.MDC_CALL_ID, identity.getChatRoomId(),
							() -> onSignalingMessage(message))));
		} catch (SignalingTransportException e) {
			log.error("Could not subscribe to {}: {}", identity.channelName(), e.getMessage(), e);
			state = CallSessionState.ENDED;
			handle.stopAll();
			listener.onCallFailed(identity, "Signaling unavailable");
			onTerminated.accept(this);
			return;
		}

		for (String remote : remoteParticipants()) {
			registry.getOrCreate(remote);
		}
		registry.useLocalMedia(handle);
		state = CallSessionState.ACTIVE;
		listener.onCallStarted(identity, role);
		listener.onLocalMediaChanged(identity, handle.isEnabled(MediaKind.AUDIO), handle.isEnabled(MediaKind.VIDEO));

		if (role == ParticipantRole.CALLER) {
			registry.all().forEach(PeerConnection::startAsInitiator);
			InviteMessage invite = new InviteMessage(identity.getChatRoomId(), identity.getCallType(), localUserId,
					null, roster, System.currentTimeMillis());
			invitationDispatcher.sendInvite(remoteParticipants(), invite);
			invitesSent = true;
		} else {
			send(new ParticipantJoinedMessage(localUserId));
		}
	}

	private void onSignalingMessage(SignalingMessage message) {
		if (state != CallSessionState.ACTIVE) {
			return;
		}
		protocol.handle(message);
	}

	public void hangUp() {
		end(CallEndReason.LOCAL_HANGUP);
	}

	/**
	 * A roster member announced itself outside the call channel, e.g. with
	 * its own invitation for this chat room.
	 */
	public void onPeerPresent(String userId) {
		if (state != CallSessionState.ACTIVE) {
			return;
		}
		registry.getOrCreate(userId).ifPresent(PeerConnection::onPeerJoined);
	}

	public void onDeclined(String userId) {
		if (state == CallSessionState.ENDED) {
			return;
		}
		log.info("{} declined call {}", userId, identity.getChatRoomId());
		closePeer(userId, CallEndReason.DECLINED);
	}

	public void onRemoteEnded(String userId) {
		if (state == CallSessionState.ENDED) {
			return;
		}
		if (userId.equals(inviterUserId)) {
			log.info("Inviter {} ended call {}", userId, identity.getChatRoomId());
			end(CallEndReason.REMOTE_ENDED);
			return;
		}
		log.info("{} left call {}", userId, identity.getChatRoomId());
		closePeer(userId, CallEndReason.REMOTE_ENDED);
	}

	private void closePeer(String userId, CallEndReason reason) {
		registry.get(userId).ifPresent(peer -> {
			peerCloseReason = reason;
			try {
				peer.close();
			} finally {
				peerCloseReason = null;
			}
		});
	}

	public void toggleMute() {
		toggle(MediaKind.AUDIO);
	}

	public void toggleVideo() {
		toggle(MediaKind.VIDEO);
	}

	private void toggle(MediaKind kind) {
		if (state != CallSessionState.ACTIVE || localMedia == null) {
			log.debug("Ignoring {} toggle for call {} in state {}", kind, identity.getChatRoomId(), state);
			return;
		}
		localMedia.toggle(kind).ifPresent(enabled -> {
			log.info("Local {} {} for call {}", kind, enabled ? "enabled" : "disabled", identity.getChatRoomId());
			listener.onLocalMediaChanged(identity, localMedia.isEnabled(MediaKind.AUDIO),
					localMedia.isEnabled(MediaKind.VIDEO));
		});
	}

	/**
	 * Tears the call down. Runs once; no step is skipped because an earlier
	 * one failed.
	 */
	public void end(CallEndReason reason) {
		if (state == CallSessionState.ENDED) {
			return;
		}
		boolean subscribed = subscription != null;
		state = CallSessionState.ENDED;
		log.info("Ending call {}: {}", identity.getChatRoomId(), reason);

		if (subscribed) {
			try {
				transport.publish(identity.channelName(), new CallEndedMessage(identity.getChatRoomId(), localUserId));
			} catch (Exception e) {
				log.error("Failed to publish end of call {}: {}", identity.getChatRoomId(), e.getMessage(), e);
			}
		}
		if (invitesSent) {
			try {
				List<String> ringing = registry.unanswered();
				if (!ringing.isEmpty()) {
					invitationDispatcher.sendCancel(ringing, identity.getChatRoomId(), localUserId);
				}
			} catch (Exception e) {
				log.error("Failed to cancel invitations for call {}: {}", identity.getChatRoomId(), e.getMessage(), e);
			}
		}
		try {
			registry.closeAll();
		} catch (Exception e) {
			log.error("Failed to close peer connections of call {}: {}", identity.getChatRoomId(), e.getMessage(), e);
		}
		if (localMedia != null) {
			try {
				localMedia.stopAll();
			} catch (Exception e) {
				log.error("Failed to stop local media of call {}: {}", identity.getChatRoomId(), e.getMessage(), e);
			}
		} else if (mediaRequest != null) {
			mediaRequest.thenAccept(this::releaseLateMedia);
		}
		if (subscribed) {
			try {
				subscription.unsubscribe();
			} catch (Exception e) {
				log.error("Failed to unsubscribe from {}: {}", identity.channelName(), e.getMessage(), e);
			}
		}

		try {
			listener.onCallEnded(identity, reason);
		} finally {
			onTerminated.accept(this);
		}
	}

	/**
	 * Runs on whichever thread completes the media request, not on the event
	 * loop, so devices are released even when the loop is already gone.
	 */
	private void releaseLateMedia(LocalMediaHandle handle) {
		log.info("Call {} ended while acquiring media, releasing {} track(s)", identity.getChatRoomId(),
				handle.getTracks().size());
		try {
			handle.stopAll();
		} catch (Exception e) {
			log.error("Failed to release late media of call {}: {}", identity.getChatRoomId(), e.getMessage(), e);
		}
	}

	@Override
	public void send(SignalingMessage message) {
		if (state != CallSessionState.ACTIVE) {
			return;
		}
		try {
			transport.publish(identity.channelName(), message);
		} catch (SignalingTransportException e) {
			log.error("Failed to publish {} on {}: {}", message.getEvent(), identity.channelName(), e.getMessage(), e);
		}
	}

	@Override
	public void onConnected(PeerConnection connection) {
		log.info("Connected to {} in call {}", connection.getRemoteUserId(), identity.getChatRoomId());
		listener.onRemoteParticipantConnected(identity, connection.getRemoteUserId());
	}

	@Override
	public void onRemoteTrack(PeerConnection connection, MediaTrack track) {
		listener.onRemoteMediaAttached(identity, connection.getRemoteUserId(), track);
	}

	@Override
	public void onClosed(PeerConnection connection, boolean failed) {
		if (state != CallSessionState.ACTIVE) {
			return;
		}
		if (failed) {
			log.warn("Connection to {} failed, call {} continues with the others", connection.getRemoteUserId(),
					identity.getChatRoomId());
		}
		if (registry.allClosed()) {
			end(peerCloseReason != null ? peerCloseReason : CallEndReason.ALL_PEERS_CLOSED);
		}
	}
}
