package org.trump304.service.game.registry;

import lombok.extern.slf4j.Slf4j;
import org.trump304.model.game.ErrorCode;
import org.trump304.model.game.GameRuleException;
import org.trump304.model.game.GameSession;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory store of live sessions, keyed by their 6-character code. */
@Slf4j
@Service
public class GameRegistry {
    public static final int CODE_LENGTH = 6;
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final Map<String, GameSession> games = new ConcurrentHashMap<>();
    private final SecureRandom rnd = new SecureRandom();

    public Optional<GameSession> find(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(games.get(normalize(code)));
    }

    public GameSession get(String code) {
        return find(code).orElseThrow(() -> new GameRuleException(ErrorCode.GAME_NOT_FOUND));
    }

    public void put(GameSession s) {
        s.setLastActiveAt(Instant.now());
        games.put(s.getCode(), s);
    }

    public GameSession create(int mode) {
        while (true) {
            String code = newCode();
            GameSession s = new GameSession(code, mode);
            if (games.putIfAbsent(code, s) == null) {
                log.info("Game {} created ({} players)", code, mode);
                return s;
            }
        }
    }

    /** Drops sessions idle since before {@code cutoff}; returns their codes. */
    public List<String> evictIdleSince(Instant cutoff) {
        List<String> evicted = new ArrayList<>();
        games.values().removeIf(s -> {
            if (s.getLastActiveAt().isBefore(cutoff)) {
                evicted.add(s.getCode());
                return true;
            }
            return false;
        });
        return evicted;
    }

    private String newCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) sb.append(ALPHABET.charAt(rnd.nextInt(ALPHABET.length())));
        return sb.toString();
    }

    public static String normalize(String code) { return code.trim().toUpperCase(Locale.ROOT); }
}
