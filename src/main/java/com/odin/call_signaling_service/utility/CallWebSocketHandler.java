package com.odin.call_signaling_service.utility;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.call.CallEventListener;
import com.odin.call_signaling_service.dto.CallCommand;
import com.odin.call_signaling_service.dto.CallEvent;
import com.odin.call_signaling_service.dto.CallIdentity;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.enums.CallEndReason;
import com.odin.call_signaling_service.enums.CallEventType;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.exception.CallSessionException;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.service.CallAgentRegistry;
import com.odin.call_signaling_service.service.CallSessionManager;
import com.odin.call_signaling_service.service.CallerProfileService;

import lombok.extern.slf4j.Slf4j;

/**
 * Bridge between a device UI and its call agent: JSON {@link CallCommand}s in,
 * JSON {@link CallEvent}s out. One socket per user; a newer socket replaces
 * the agent of the older one.
 */
@Slf4j
@Component
public class CallWebSocketHandler implements WebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final JwtUtil jwtUtil;
    private final CallAgentRegistry callAgentRegistry;
    private final CallerProfileService callerProfileService;
    private final ObjectMapper objectMapper;

    // sessionId -> userId
    private final Map<String, String> userIdsBySession = new ConcurrentHashMap<>();
    // userId -> sessionId of the socket owning the agent
    private final Map<String, String> activeSessionByUser = new ConcurrentHashMap<>();
    // sessionId -> thread-safe sending view of the socket
    private final Map<String, WebSocketSession> outboundSessions = new ConcurrentHashMap<>();

    public CallWebSocketHandler(JwtUtil jwtUtil,
                                CallAgentRegistry callAgentRegistry,
                                CallerProfileService callerProfileService,
                                ObjectMapper objectMapper) {
        this.jwtUtil = jwtUtil;
        this.callAgentRegistry = callAgentRegistry;
        this.callerProfileService = callerProfileService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String userId = jwtUtil.resolveUserId(getQueryParam(session, "token"));
        if (userId == null) {
            log.warn("Invalid or missing token. Closing session: {}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS,
                SEND_BUFFER_LIMIT);
        outboundSessions.put(session.getId(), outbound);
        userIdsBySession.put(session.getId(), userId);
        activeSessionByUser.put(userId, session.getId());
        callAgentRegistry.connect(userId, new WebSocketCallEventListener(userId, outbound));

        log.info("User {} connected for calls with session {}", userId, session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
        String userId = userIdsBySession.get(session.getId());
        if (userId == null) {
            log.warn("Message on unauthenticated session {} dropped", session.getId());
            return;
        }
        WebSocketSession outbound = outboundSessions.getOrDefault(session.getId(), session);
        String payload = message.getPayload().toString();

        if (payload.contains("\"type\":\"ping\"")) {
            // Application-level heartbeat
            outbound.sendMessage(new TextMessage("{\"type\":\"pong\"}"));
            return;
        }

        CallSessionManager manager = callAgentRegistry.getAgent(userId).orElse(null);
        if (manager == null) {
            log.warn("No call agent for {}, dropping command", userId);
            return;
        }

        try {
            CallCommand command = objectMapper.readValue(payload, CallCommand.class);
            if (command.getAction() == null) {
                log.warn("Command without action from {}: {}", userId, payload);
                return;
            }
            log.info("Command {} from {} for chatRoom={}", command.getAction(), userId, command.getChatRoomId());
            dispatch(manager, command);
        } catch (CallSessionException e) {
            log.warn("Rejected command from {}: {}", userId, e.getMessage());
            sendEvent(outbound, CallEvent.builder()
                    .type(CallEventType.CALL_FAILED)
                    .message(e.getMessage())
                    .timestamp(System.currentTimeMillis())
                    .build());
        } catch (Exception e) {
            // the socket stays open
            log.error("Failed to handle command from {}: {}", userId, e.getMessage(), e);
        }
    }

    private void dispatch(CallSessionManager manager, CallCommand command) {
        switch (command.getAction()) {
            case START_CALL:
                manager.startCall(command.getChatRoomId(), command.getParticipants(), command.getCallType());
                break;
            case ACCEPT:
                manager.acceptIncoming(command.getInvite());
                break;
            case DECLINE:
                manager.declineIncoming(command.getInvite());
                break;
            case END:
                manager.endCall();
                break;
            case TOGGLE_MUTE:
                manager.toggleMute();
                break;
            case TOGGLE_VIDEO:
                manager.toggleVideo();
                break;
            default:
                log.warn("Unsupported command {}", command.getAction());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("Transport error for session {} (userId={}): {}",
                session.getId(), userIdsBySession.get(session.getId()), exception.getMessage(), exception);
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        outboundSessions.remove(session.getId());
        String userId = userIdsBySession.remove(session.getId());
        if (userId == null) {
            return;
        }
        log.info("Call socket of {} closed: code={}, reason={}", userId, closeStatus.getCode(),
                closeStatus.getReason());
        // a newer socket of the same user keeps its agent
        if (activeSessionByUser.remove(userId, session.getId())) {
            callAgentRegistry.disconnect(userId);
        }
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private String getQueryParam(WebSocketSession session, String name) {
        if (session.getUri() == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst(name);
    }

    private void sendEvent(WebSocketSession session, CallEvent event) {
        if (!session.isOpen()) {
            log.debug("Session {} closed, dropping {} event", session.getId(), event.getType());
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (IOException e) {
            log.error("Failed to send {} event on session {}: {}", event.getType(), session.getId(),
                    e.getMessage(), e);
        }
    }

    /**
     * Turns the call layer's callbacks into socket events for one user.
     */
    private class WebSocketCallEventListener implements CallEventListener {

        private final String userId;
        private final WebSocketSession session;

        WebSocketCallEventListener(String userId, WebSocketSession session) {
            this.userId = userId;
            this.session = session;
        }

        @Override
        public void onIncomingInvite(InviteMessage invite) {
            sendEvent(session, CallEvent.builder()
                    .type(CallEventType.INCOMING_INVITE)
                    .chatRoomId(invite.getChatRoomId())
                    .callType(invite.getCallType())
                    .userId(invite.getFrom())
                    .callerName(callerProfileService.getDisplayName(invite.getFrom()))
                    .invite(invite)
                    .timestamp(System.currentTimeMillis())
                    .build());
        }

        @Override
        public void onInviteCancelled(InviteMessage invite) {
            sendEvent(session, CallEvent.builder()
                    .type(CallEventType.INVITE_CANCELLED)
                    .chatRoomId(invite.getChatRoomId())
                    .userId(invite.getFrom())
                    .timestamp(System.currentTimeMillis())
                    .build());
        }

        @Override
        public void onCallStarted(CallIdentity call, ParticipantRole role) {
            sendEvent(session, event(CallEventType.CALL_STARTED, call)
                    .userId(userId)
                    .message(role.name())
                    .build());
        }

        @Override
        public void onRemoteParticipantConnected(CallIdentity call, String remoteUserId) {
            sendEvent(session, event(CallEventType.PARTICIPANT_CONNECTED, call)
                    .userId(remoteUserId)
                    .build());
        }

        @Override
        public void onRemoteMediaAttached(CallIdentity call, String remoteUserId, MediaTrack track) {
            sendEvent(session, event(CallEventType.REMOTE_MEDIA, call)
                    .userId(remoteUserId)
                    .trackId(track.getId())
                    .message(track.getKind().name())
                    .build());
        }

        @Override
        public void onLocalMediaChanged(CallIdentity call, boolean audioEnabled, boolean videoEnabled) {
            sendEvent(session, event(CallEventType.LOCAL_MEDIA, call)
                    .userId(userId)
                    .audioEnabled(audioEnabled)
                    .videoEnabled(videoEnabled)
                    .build());
        }

        @Override
        public void onCallFailed(CallIdentity call, String reason) {
            sendEvent(session, event(CallEventType.CALL_FAILED, call)
                    .message(reason)
                    .build());
        }

        @Override
        public void onCallEnded(CallIdentity call, CallEndReason reason) {
            sendEvent(session, event(CallEventType.CALL_ENDED, call)
                    .reason(reason)
                    .build());
        }

        private CallEvent.CallEventBuilder event(CallEventType type, CallIdentity call) {
            return CallEvent.builder()
                    .type(type)
                    .chatRoomId(call.getChatRoomId())
                    .callType(call.getCallType())
                    .timestamp(System.currentTimeMillis());
        }
    }
}
