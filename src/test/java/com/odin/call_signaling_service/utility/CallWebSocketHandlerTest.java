package com.odin.call_signaling_service.utility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.call.CallEventListener;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.CallSessionException;
import com.odin.call_signaling_service.service.CallAgentRegistry;
import com.odin.call_signaling_service.service.CallSessionManager;
import com.odin.call_signaling_service.service.CallerProfileService;

class CallWebSocketHandlerTest {

	private JwtUtil jwtUtil;
	private CallAgentRegistry callAgentRegistry;
	private CallerProfileService callerProfileService;
	private CallSessionManager manager;
	private CallWebSocketHandler handler;

	@BeforeEach
	void setUp() {
		jwtUtil = mock(JwtUtil.class);
		callAgentRegistry = mock(CallAgentRegistry.class);
		callerProfileService = mock(CallerProfileService.class);
		manager = mock(CallSessionManager.class);
		when(jwtUtil.resolveUserId("good-token")).thenReturn("u1");
		when(callAgentRegistry.getAgent("u1")).thenReturn(Optional.of(manager));
		handler = new CallWebSocketHandler(jwtUtil, callAgentRegistry, callerProfileService, new ObjectMapper());
	}

	private static WebSocketSession socket(String id, String token) {
		WebSocketSession session = mock(WebSocketSession.class);
		when(session.getId()).thenReturn(id);
		when(session.getUri()).thenReturn(URI.create("ws://localhost:8085/call?token=" + token));
		when(session.isOpen()).thenReturn(true);
		return session;
	}

	private CallEventListener connect(WebSocketSession session) throws Exception {
		handler.afterConnectionEstablished(session);
		ArgumentCaptor<CallEventListener> listener = ArgumentCaptor.forClass(CallEventListener.class);
		verify(callAgentRegistry).connect(eq("u1"), listener.capture());
		return listener.getValue();
	}

	@Test
	void invalidTokenClosesTheSocket() throws Exception {
		WebSocketSession session = socket("s1", "forged");

		handler.afterConnectionEstablished(session);

		verify(session).close(CloseStatus.POLICY_VIOLATION);
		verify(callAgentRegistry, never()).connect(anyString(), any());
	}

	@Test
	void startCallCommandReachesTheAgent() throws Exception {
		WebSocketSession session = socket("s1", "good-token");
		connect(session);

		handler.handleMessage(session, new TextMessage(
				"{\"action\":\"START_CALL\",\"chatRoomId\":\"room-1\",\"callType\":\"video\",\"participants\":[\"u2\"]}"));

		verify(manager).startCall("room-1", List.of("u2"), CallType.VIDEO);
	}

	@Test
	void acceptCarriesTheInvitation() throws Exception {
		WebSocketSession session = socket("s1", "good-token");
		connect(session);

		handler.handleMessage(session, new TextMessage("{\"action\":\"ACCEPT\",\"invite\":{\"event\":\"incoming-call\","
				+ "\"chatRoomId\":\"room-1\",\"callType\":\"voice\",\"from\":\"u2\",\"to\":\"u1\"}}"));

		ArgumentCaptor<InviteMessage> invite = ArgumentCaptor.forClass(InviteMessage.class);
		verify(manager).acceptIncoming(invite.capture());
		assertThat(invite.getValue().getChatRoomId()).isEqualTo("room-1");
		assertThat(invite.getValue().getFrom()).isEqualTo("u2");
	}

	@Test
	void pingIsAnsweredWithPong() throws Exception {
		WebSocketSession session = socket("s1", "good-token");
		connect(session);

		handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));

		verify(session).sendMessage(new TextMessage("{\"type\":\"pong\"}"));
	}

	@Test
	void rejectedCommandIsReportedToTheDevice() throws Exception {
		WebSocketSession session = socket("s1", "good-token");
		connect(session);
		doThrow(new CallSessionException("A call needs at least one other participant")).when(manager)
				.startCall(anyString(), any(), any());

		handler.handleMessage(session, new TextMessage(
				"{\"action\":\"START_CALL\",\"chatRoomId\":\"room-1\",\"callType\":\"voice\",\"participants\":[]}"));

		ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
		verify(session).sendMessage(sent.capture());
		assertThat(sent.getValue().getPayload()).contains("CALL_FAILED")
				.contains("A call needs at least one other participant");
	}

	@Test
	void incomingInviteIsSentWithCallerName() throws Exception {
		WebSocketSession session = socket("s1", "good-token");
		CallEventListener listener = connect(session);
		when(callerProfileService.getDisplayName("u2")).thenReturn("Asha Rao");

		listener.onIncomingInvite(new InviteMessage("room-1", CallType.VIDEO, "u2", "u1", List.of("u1", "u2"), 1L));

		ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
		verify(session).sendMessage(sent.capture());
		assertThat(sent.getValue().getPayload()).contains("INCOMING_INVITE").contains("Asha Rao")
				.contains("\"event\":\"incoming-call\"");
	}

	@Test
	void closingAReplacedSocketKeepsTheNewerAgent() throws Exception {
		WebSocketSession first = socket("s1", "good-token");
		WebSocketSession second = socket("s2", "good-token");
		handler.afterConnectionEstablished(first);
		handler.afterConnectionEstablished(second);

		handler.afterConnectionClosed(first, CloseStatus.NORMAL);
		verify(callAgentRegistry, never()).disconnect("u1");

		handler.afterConnectionClosed(second, CloseStatus.NORMAL);
		verify(callAgentRegistry).disconnect("u1");
	}
}
