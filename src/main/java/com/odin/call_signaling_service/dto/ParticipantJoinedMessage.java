package com.odin.call_signaling_service.dto;

import com.odin.call_signaling_service.constants.ApplicationConstants;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ParticipantJoinedMessage extends SignalingMessage {

	public ParticipantJoinedMessage(String from) {
		super(from, null);
	}

	@Override
	public <R> R accept(SignalingMessageVisitor<R> visitor) {
		return visitor.visitParticipantJoined(this);
	}

	@Override
	public String getEvent() {
		return ApplicationConstants.EVENT_PARTICIPANT_JOINED;
	}
}
