package com.streetsweeping.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for reminder delivery.
 *
 * Clients connect to the reminder endpoint (default {@code /ws/reminders}) and subscribe
 * to {@code /topic/reminders}; every reminder is published there when it becomes due.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${sweeping.websocket.endpoint:/ws/reminders}")
    private String websocketEndpoint;

    @Value("${sweeping.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // /topic for broadcasts, /queue for per-session replies
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // SockJS fallback for browsers, plain endpoint for native clients
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
