package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SdpType {

	OFFER,
	ANSWER;

	@JsonValue
	public String wireName() {
		return name().toLowerCase();
	}

	@JsonCreator
	public static SdpType fromWireName(String value) {
		return SdpType.valueOf(value.toUpperCase());
	}
}
