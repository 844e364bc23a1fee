package com.odin.call_signaling_service.enums;

public enum CallEndReason {
	LOCAL_HANGUP,
	REMOTE_ENDED,
	DECLINED,
	MEDIA_FAILURE,
	ALL_PEERS_CLOSED,
	DEVICE_DISCONNECTED
}
