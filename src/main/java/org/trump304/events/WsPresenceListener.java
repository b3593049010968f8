package org.trump304.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.service.GameService;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which seats have a live socket. Clients send {@code game_code} and
 * {@code player_id} as native headers on CONNECT.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPresenceListener {

    private final GameService service;
    private final Map<String, Binding> sessions = new ConcurrentHashMap<>();

    record Binding(String code, String playerId) {}

    @EventListener
    public void onConnect(SessionConnectEvent e) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(e.getMessage());
        String code = first(acc.getNativeHeader("game_code"));
        String playerId = first(acc.getNativeHeader("player_id"));
        String sessionId = acc.getSessionId();
        if (code == null || playerId == null || sessionId == null) return;

        sessions.put(sessionId, new Binding(code, playerId));
        service.markConnected(code, playerId, true);
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        Binding b = sessions.remove(e.getSessionId());
        if (b != null) service.markConnected(b.code(), b.playerId(), false);
    }

    private static String first(List<String> values) {
        if (values == null || values.isEmpty()) return null;
        String v = values.get(0);
        return v == null || v.isBlank() ? null : v;
    }
}
