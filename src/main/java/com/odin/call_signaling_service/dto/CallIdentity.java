package com.odin.call_signaling_service.dto;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.enums.CallType;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identity of one call instance. Immutable for the lifetime of the session
 * and the scope of its signaling channel.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class CallIdentity {

	private final String chatRoomId;
	private final CallType callType;

	public String channelName() {
		return ApplicationConstants.CALL_CHANNEL_PREFIX + chatRoomId;
	}
}
