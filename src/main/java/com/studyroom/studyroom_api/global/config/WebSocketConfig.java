package com.studyroom.studyroom_api.global.config;

import com.studyroom.studyroom_api.presence.websocket.MeetingSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String MEETING_SOCKET_PATH = "/ws/meetings";

    private final MeetingSocketHandler meetingSocketHandler;

    @Value("${websocket.allowed-origin-patterns:*}")
    private String[] allowedOriginPatterns;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(meetingSocketHandler, MEETING_SOCKET_PATH)
                .setAllowedOriginPatterns(allowedOriginPatterns);
    }
}
