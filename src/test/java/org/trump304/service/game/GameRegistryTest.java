package org.trump304.service.game;

import org.trump304.model.game.ErrorCode;
import org.trump304.model.game.GameSession;
import org.trump304.service.game.registry.GameRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GameRegistryTest {

    private final GameRegistry registry = new GameRegistry();

    @Test
    void create_registersSessionUnderSixCharCode() {
        GameSession s = registry.create(3);

        assertThat(s.getCode()).matches("[A-Z0-9]{6}");
        assertThat(s.getMode()).isEqualTo(3);
        assertThat(registry.get(s.getCode())).isSameAs(s);
    }

    @Test
    void find_isCaseInsensitive() {
        GameSession s = registry.create(4);

        assertThat(registry.find(" " + s.getCode().toLowerCase() + " ")).contains(s);
    }

    @Test
    void get_unknown_gameNotFound() {
        assertThatThrownBy(() -> registry.get("NOPE00"))
                .extracting("code").isEqualTo(ErrorCode.GAME_NOT_FOUND);
    }

    @Test
    void put_replacesAndTouches() {
        GameSession s = registry.create(4);
        GameSession next = s.copy();
        next.setLastActiveAt(Instant.EPOCH);

        registry.put(next);

        assertThat(registry.get(s.getCode())).isSameAs(next);
        assertThat(next.getLastActiveAt()).isAfter(Instant.EPOCH);
    }

    @Test
    void evictIdleSince_dropsOnlyStaleSessions() {
        GameSession stale = registry.create(4);
        GameSession fresh = registry.create(4);
        stale.setLastActiveAt(Instant.now().minusSeconds(3600 * 25));

        var evicted = registry.evictIdleSince(Instant.now().minusSeconds(3600 * 24));

        assertThat(evicted).containsExactly(stale.getCode());
        assertThat(registry.find(stale.getCode())).isEmpty();
        assertThat(registry.find(fresh.getCode())).isPresent();
    }
}
