package com.odin.call_signaling_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Logs WebSocket upgrade attempts on the call endpoint and their outcome.
 * The query string is left out since it carries the access token.
 */
@Slf4j
public class WebSocketLoggingInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        log.info("[HANDSHAKE] Call WebSocket upgrade requested - path={}, remote={}",
                request.getURI().getPath(), request.getRemoteAddress());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.error("[HANDSHAKE] Call WebSocket handshake failed - path={}: {}",
                    request.getURI().getPath(), exception.getMessage(), exception);
        } else {
            log.debug("[HANDSHAKE] Call WebSocket handshake completed - path={}", request.getURI().getPath());
        }
    }
}
