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
public class IceCandidateMessage extends SignalingMessage {

	private IceCandidatePayload candidate;

	public IceCandidateMessage(String from, String to, IceCandidatePayload candidate) {
		super(from, to);
		this.candidate = candidate;
	}

	@Override
	public <R> R accept(SignalingMessageVisitor<R> visitor) {
		return visitor.visitIceCandidate(this);
	}

	@Override
	public String getEvent() {
		return ApplicationConstants.EVENT_ICE_CANDIDATE;
	}
}
