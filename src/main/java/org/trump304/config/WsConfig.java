package org.trump304.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

/**
 * STOMP wiring for game tables. Clients connect on {@code /ws} (SockJS) or {@code /ws-native}
 * (raw WebSocket), send actions to {@code /app/games/{code}/action} and subscribe to
 * {@code /topic/games/{code}/{playerId}}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    static final String SOCKJS_ENDPOINT = "/ws";
    static final String NATIVE_ENDPOINT = "/ws-native";

    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    @Value("${app.ws.heartbeat-ms:10000}")
    private long heartbeatMs;

    // action frames are a few hundred bytes
    @Value("${app.ws.message-size-limit:8192}")
    private int messageSizeLimit;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = allowedOrigins.split("\\s*,\\s*");
        registry.addEndpoint(SOCKJS_ENDPOINT).setAllowedOriginPatterns(origins).withSockJS();
        registry.addEndpoint(NATIVE_ENDPOINT).setAllowedOriginPatterns(origins);
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        registry.setMessageSizeLimit(messageSizeLimit);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.setApplicationDestinationPrefixes("/app");
        var broker = registry.enableSimpleBroker("/topic");
        if (heartbeatMs > 0) {
            ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
            ts.setPoolSize(1);
            ts.setThreadNamePrefix("ws-heartbeat-");
            ts.initialize();
            broker.setTaskScheduler(ts).setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs});
        }
    }
}
