package com.odin.call_signaling_service.enums;

public enum CallEventType {
	INCOMING_INVITE,
	INVITE_CANCELLED,
	CALL_STARTED,
	PARTICIPANT_CONNECTED,
	REMOTE_MEDIA,
	LOCAL_MEDIA,
	CALL_FAILED,
	CALL_ENDED
}
