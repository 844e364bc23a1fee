package com.odin.call_signaling_service.enums;

public enum ParticipantRole {
	CALLER,
	CALLEE
}
