package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CallType {

	VOICE("voice"),
	VIDEO("video");

	private final String wireName;

	CallType(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String getWireName() {
		return wireName;
	}

	public boolean hasVideo() {
		return this == VIDEO;
	}

	@JsonCreator
	public static CallType fromWireName(String value) {
		for (CallType type : values()) {
			if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown call type: " + value);
	}
}
