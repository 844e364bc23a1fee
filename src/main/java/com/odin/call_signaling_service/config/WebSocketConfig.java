package com.odin.call_signaling_service.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.odin.call_signaling_service.utility.CallWebSocketHandler;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CallWebSocketHandler callWebSocketHandler;

    @Value("${call.websocket.path:/call}")
    private String path;

    public WebSocketConfig(CallWebSocketHandler callWebSocketHandler) {
        this.callWebSocketHandler = callWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(callWebSocketHandler, path)
                .addInterceptors(new WebSocketLoggingInterceptor())
                .setAllowedOrigins("*");

        log.info("WebSocket handlers registered - Path: {}, Handler: CallWebSocketHandler", path);
    }

}
