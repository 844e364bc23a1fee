package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.CallEventType;
import com.odin.call_signaling_service.enums.CallType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event pushed to the local UI over the WebSocket bridge.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallEvent {

	private CallEventType type;
	private String chatRoomId;
	private CallType callType;
	private String userId;
	private String callerName;
	private InviteMessage invite;
	private CallEndReason reason;
	private String message;
	private Boolean audioEnabled;
	private Boolean videoEnabled;
	private String trackId;
	private Long timestamp;
}
