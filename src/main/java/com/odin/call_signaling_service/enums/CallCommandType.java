package com.odin.call_signaling_service.enums;

public enum CallCommandType {
	START_CALL,
	ACCEPT,
	DECLINE,
	END,
	TOGGLE_MUTE,
	TOGGLE_VIDEO
}
