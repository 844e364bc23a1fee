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
public class AnswerMessage extends SignalingMessage {

	private SdpPayload sdp;

	public AnswerMessage(String from, String to, SdpPayload sdp) {
		super(from, to);
		this.sdp = sdp;
	}

	@Override
	public <R> R accept(SignalingMessageVisitor<R> visitor) {
		return visitor.visitAnswer(this);
	}

	@Override
	public String getEvent() {
		return ApplicationConstants.EVENT_ANSWER;
	}
}
