package org.trump304.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.dto.game.JoinResponse;
import org.trump304.dto.game.PlayerView;
import org.trump304.model.game.*;
import org.trump304.service.game.access.GameBroadcaster;
import org.trump304.service.game.command.Command;
import org.trump304.service.game.engine.GameEngine;
import org.trump304.service.game.engine.TimerDirective;
import org.trump304.service.game.engine.Transition;
import org.trump304.service.game.entry.EntryService;
import org.trump304.service.game.registry.GameRegistry;
import org.trump304.service.game.util.GameViews;
import org.trump304.service.game.util.Locks;
import org.trump304.service.game.util.TurnTimer;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for everything that touches a session. All work on one game runs
 * under that game's lock; the engine computes the next session and this class
 * stores it, re-arms the turn timer and pushes the result to the players.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameRegistry registry;
    private final EntryService entry;
    private final GameEngine engine;
    private final GameBroadcaster broadcaster;
    private final GameViews views;
    private final TurnTimer timer;
    private final Locks locks;

    public JoinResponse create(int mode, String playerName) {
        JoinResponse res = entry.create(mode, playerName);
        log.info("Game {} opened by seat 0", res.getGameCode());
        return res;
    }

    public JoinResponse join(String code, String playerName) {
        synchronized (locks.of(code)) {
            JoinResponse res = entry.join(code, playerName);
            GameSession s = registry.get(code);
            broadcaster.publish(s, List.of());
            return res;
        }
    }

    public GameSession get(String code) { return registry.get(code); }

    public PlayerView view(String code, String playerId) {
        GameSession s = registry.get(code);
        Seat seat = s.seatOf(playerId).orElseThrow(() -> new GameRuleException(ErrorCode.UNKNOWN_PLAYER));
        return views.viewFor(s, seat.getIndex());
    }

    public Transition action(String code, String playerId, Command command) {
        synchronized (locks.of(code)) {
            GameSession current = registry.get(code);
            Seat seat = current.seatOf(playerId).orElseThrow(() -> new GameRuleException(ErrorCode.UNKNOWN_PLAYER));
            Transition t = engine.dispatch(current, seat.getIndex(), command);
            log.debug("{} by seat {} on {} -> {}", command.type(), seat.getIndex(), current.getCode(), t.session().getPhase());
            apply(t);
            return t;
        }
    }

    /** Fired by the turn timer; a deadline that lost the race with a real action does nothing. */
    public void onTimeout(String code, int seat, long seq) {
        synchronized (locks.of(code)) {
            GameSession current = registry.find(code).orElse(null);
            if (current == null) return;
            Transition t = engine.onTimeout(current, seat, seq);
            if (t.changed()) apply(t);
        }
    }

    /** Forfeits the hand for a play the rules forbid, regardless of the illegal-play policy. */
    public Transition adjudicateIllegalPlay(String code, int seat, Card card) {
        synchronized (locks.of(code)) {
            Transition t = engine.adjudicateIllegalPlay(registry.get(code), seat, card);
            apply(t);
            return t;
        }
    }

    public void markConnected(String code, String playerId, boolean connected) {
        synchronized (locks.of(code)) {
            GameSession current = registry.find(code).orElse(null);
            if (current == null) return;
            Seat seat = current.seatOf(playerId).orElse(null);
            if (seat == null || seat.isConnected() == connected) return;

            GameSession s = current.copy();
            s.seat(seat.getIndex()).setConnected(connected);
            registry.put(s);
            log.info("Seat {} on {} {}", seat.getIndex(), s.getCode(), connected ? "reconnected" : "disconnected");
            broadcaster.publish(s, List.of());
        }
    }

    public List<String> evictIdle(Instant cutoff) {
        List<String> evicted = registry.evictIdleSince(cutoff);
        evicted.forEach(timer::cancel);
        return evicted;
    }

    private void apply(Transition t) {
        GameSession s = t.session();
        registry.put(s);
        TimerDirective d = t.timer();
        String code = s.getCode();
        if (d.kind() == TimerDirective.Kind.ARM) {
            int seat = d.seat();
            long seq = d.seq();
            timer.schedule(code, d.timeout().toMillis(), () -> onTimeout(code, seat, seq));
        } else {
            timer.cancel(code);
        }
        broadcaster.publish(s, t.events());
    }
}
