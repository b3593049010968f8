package org.trump304.service.game.engine;

import org.trump304.model.game.GameSession;

import java.util.List;

/**
 * Result of applying one action or timeout. {@code timer} is null when the
 * transition was a no-op and the armed timer must be left alone.
 */
public record Transition(GameSession session, List<GameEvent> events, TimerDirective timer) {

    public static Transition unchanged(GameSession session) {
        return new Transition(session, List.of(), null);
    }

    public boolean changed() { return timer != null; }
}
