package org.trump304.service.game.entry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.dto.game.JoinResponse;
import org.trump304.model.game.*;
import org.trump304.service.game.registry.GameRegistry;
import org.trump304.service.game.util.GameViews;
import org.springframework.stereotype.Service;

import java.util.UUID;

/** Seating players in a game before it starts. Callers hold the game's lock. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryService {
    private static final int NAME_MAX = 20;

    private final GameRegistry registry;
    private final GameViews views;

    public JoinResponse create(int mode, String playerName) {
        if (mode < 2 || mode > 4) throw new GameRuleException(ErrorCode.INVALID_MODE);
        GameSession s = registry.create(mode);
        Seat seat = seat(s, s.seat(0), playerName);
        registry.put(s);
        return response(s, seat);
    }

    public JoinResponse join(String code, String playerName) {
        GameSession current = registry.get(code);
        if (current.getPhase() != GamePhase.WAITING) throw new GameRuleException(ErrorCode.GAME_ALREADY_STARTED);
        if (current.isFull()) throw new GameRuleException(ErrorCode.GAME_FULL);

        GameSession s = current.copy();
        Seat free = s.getSeats().values().stream().filter(x -> !x.isTaken()).findFirst()
                .orElseThrow(() -> new GameRuleException(ErrorCode.GAME_FULL));
        seat(s, free, playerName);
        registry.put(s);
        log.info("Player joined {} at seat {}", s.getCode(), free.getIndex());
        return response(s, free);
    }

    private Seat seat(GameSession s, Seat seat, String playerName) {
        seat.setPlayerId(UUID.randomUUID().toString());
        seat.setName(displayName(playerName, seat.getIndex()));
        return seat;
    }

    private String displayName(String name, int index) {
        String n = name == null ? "" : name.trim();
        if (n.isBlank()) n = "Player " + (index + 1);
        return n.length() > NAME_MAX ? n.substring(0, NAME_MAX) : n;
    }

    private JoinResponse response(GameSession s, Seat seat) {
        return JoinResponse.builder()
                .gameCode(s.getCode())
                .playerId(seat.getPlayerId())
                .seat(seat.getIndex())
                .mode(s.getMode())
                .players(views.players(s))
                .build();
    }
}
