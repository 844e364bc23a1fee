package com.odin.call_signaling_service.enums;

public enum CallSessionState {
	ACQUIRING_MEDIA,
	ACTIVE,
	ENDED
}
