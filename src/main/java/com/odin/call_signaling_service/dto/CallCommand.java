package com.odin.call_signaling_service.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.odin.call_signaling_service.enums.CallCommandType;
import com.odin.call_signaling_service.enums.CallType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Command sent by the local UI over the WebSocket bridge.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CallCommand {

	private CallCommandType action;
	private String chatRoomId;
	private CallType callType;
	private List<String> participants;
	private InviteMessage invite;  // ACCEPT / DECLINE
}
