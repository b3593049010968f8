package org.trump304.service.game.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.dto.game.GameMessage;
import org.trump304.model.game.GameSession;
import org.trump304.model.game.Seat;
import org.trump304.service.game.engine.GameEvent;
import org.trump304.service.game.util.GameViews;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Delivery to players. Each player has a private topic named after their player id,
 * and only ever receives their own projection of the session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameBroadcaster {
    private final SimpMessagingTemplate broker;
    private final GameViews views;

    public static String destination(String code, String playerId) {
        return "/topic/games/" + code + "/" + playerId;
    }

    public void publish(GameSession s, List<GameEvent> events) {
        for (Seat seat : s.getSeats().values()) {
            if (!seat.isTaken()) continue;
            String dest = destination(s.getCode(), seat.getPlayerId());
            for (GameEvent e : events) {
                broker.convertAndSend(dest, GameMessage.builder()
                        .event(e.getType().name().toLowerCase())
                        .payload(e.getPayload())
                        .build());
            }
            broker.convertAndSend(dest, GameMessage.builder()
                    .event(GameMessage.STATE)
                    .payload(views.viewFor(s, seat.getIndex()))
                    .build());
        }
    }

    public void sendError(String code, String playerId, String message) {
        if (code == null || playerId == null) {
            log.debug("Dropping error without destination: {}", message);
            return;
        }
        broker.convertAndSend(destination(code, playerId), Map.of("error", message));
    }
}
