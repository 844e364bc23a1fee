package com.odin.call_signaling_service.support;

import java.util.ArrayList;
import java.util.List;

import com.odin.call_signaling_service.call.CallEventListener;
import com.odin.call_signaling_service.dto.CallIdentity;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.media.MediaTrack;

public class RecordingCallEventListener implements CallEventListener {

	public final List<InviteMessage> invites = new ArrayList<>();
	public final List<InviteMessage> cancelled = new ArrayList<>();
	public final List<ParticipantRole> started = new ArrayList<>();
	public final List<String> connected = new ArrayList<>();
	public final List<String> remoteMedia = new ArrayList<>();
	public final List<String> localMedia = new ArrayList<>();
	public final List<String> failures = new ArrayList<>();
	public final List<CallEndReason> ended = new ArrayList<>();

	@Override
	public void onIncomingInvite(InviteMessage invite) {
		invites.add(invite);
	}

	@Override
	public void onInviteCancelled(InviteMessage invite) {
		cancelled.add(invite);
	}

	@Override
	public void onCallStarted(CallIdentity call, ParticipantRole role) {
		started.add(role);
	}

	@Override
	public void onRemoteParticipantConnected(CallIdentity call, String userId) {
		connected.add(userId);
	}

	@Override
	public void onRemoteMediaAttached(CallIdentity call, String userId, MediaTrack track) {
		remoteMedia.add(userId);
	}

	@Override
	public void onLocalMediaChanged(CallIdentity call, boolean audioEnabled, boolean videoEnabled) {
		localMedia.add("audio=" + audioEnabled + ",video=" + videoEnabled);
	}

	@Override
	public void onCallFailed(CallIdentity call, String reason) {
		failures.add(reason);
	}

	@Override
	public void onCallEnded(CallIdentity call, CallEndReason reason) {
		ended.add(reason);
	}

	public InviteMessage lastInvite() {
		return invites.get(invites.size() - 1);
	}
}
