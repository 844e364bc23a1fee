package com.odin.call_signaling_service.call;

import com.odin.call_signaling_service.dto.CallIdentity;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.media.MediaTrack;

/**
 * Events a device's call layer reports to its UI. Invoked on the device event
 * loop; implementations must not block.
 */
public interface CallEventListener {

	default void onIncomingInvite(InviteMessage invite) {
	}

	default void onInviteCancelled(InviteMessage invite) {
	}

	default void onCallStarted(CallIdentity call, ParticipantRole role) {
	}

	default void onRemoteParticipantConnected(CallIdentity call, String userId) {
	}

	default void onRemoteMediaAttached(CallIdentity call, String userId, MediaTrack track) {
	}

	default void onLocalMediaChanged(CallIdentity call, boolean audioEnabled, boolean videoEnabled) {
	}

	default void onCallFailed(CallIdentity call, String reason) {
	}

	default void onCallEnded(CallIdentity call, CallEndReason reason) {
	}
}
