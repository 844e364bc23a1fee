package com.odin.call_signaling_service.dto;

import java.util.ArrayList;
import java.util.List;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.enums.CallType;

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
public class InviteMessage extends SignalingMessage {

	private String chatRoomId;
	private CallType callType;
	private List<String> participants = new ArrayList<>();
	private Long timestamp;

	public InviteMessage(String chatRoomId, CallType callType, String from, String to, List<String> participants,
			Long timestamp) {
		super(from, to);
		this.chatRoomId = chatRoomId;
		this.callType = callType;
		this.participants = participants == null ? new ArrayList<>() : new ArrayList<>(participants);
		this.timestamp = timestamp;
	}

	@Override
	public <R> R accept(SignalingMessageVisitor<R> visitor) {
		return visitor.visitInvite(this);
	}

	@Override
	public String getEvent() {
		return ApplicationConstants.EVENT_INCOMING_CALL;
	}
}
