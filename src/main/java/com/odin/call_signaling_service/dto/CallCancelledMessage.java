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
public class CallCancelledMessage extends SignalingMessage {

	private String chatRoomId;

	public CallCancelledMessage(String chatRoomId, String from, String to) {
		super(from, to);
		this.chatRoomId = chatRoomId;
	}

	@Override
	public <R> R accept(SignalingMessageVisitor<R> visitor) {
		return visitor.visitCallCancelled(this);
	}

	@Override
	public String getEvent() {
		return ApplicationConstants.EVENT_CALL_CANCELLED;
	}
}
