package com.deliveryroute.tracking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP broker for dashboard push. Server to client only:
 *
 *   /topic/route-progress    progress snapshots, fixed arrivals and departures
 *   /topic/schedule-updates  recalculated schedules and recalculation failures
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String TOPIC_ROUTE_PROGRESS = "/topic/route-progress";

    public static final String TOPIC_SCHEDULE_UPDATES = "/topic/schedule-updates";

    private final String[] allowedOrigins;

    public WebSocketConfig(@Value("${tracking.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws/tracking")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
