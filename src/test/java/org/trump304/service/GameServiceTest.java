package org.trump304.service;

import org.trump304.model.game.*;
import org.trump304.service.game.access.GameBroadcaster;
import org.trump304.service.game.command.Command;
import org.trump304.service.game.engine.GameEngine;
import org.trump304.service.game.engine.GameEvent;
import org.trump304.service.game.engine.TimerDirective;
import org.trump304.service.game.engine.Transition;
import org.trump304.service.game.entry.EntryService;
import org.trump304.service.game.registry.GameRegistry;
import org.trump304.service.game.util.GameViews;
import org.trump304.service.game.util.Locks;
import org.trump304.service.game.util.TurnTimer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    @Mock GameRegistry registry;
    @Mock EntryService entry;
    @Mock GameEngine engine;
    @Mock GameBroadcaster broadcaster;
    @Mock GameViews views;
    @Mock TurnTimer timer;
    @Spy Locks locks = new Locks();

    @InjectMocks
    GameService service;

    private GameSession session;

    @BeforeEach
    void setup() {
        session = new GameSession("ABC123", 4);
        for (int i = 0; i < 4; i++) session.seat(i).setPlayerId("p" + i);
    }

    @Test
    void action_dispatchesForCallersSeat_storesArmsAndPublishes() {
        GameSession next = session.copy();
        List<GameEvent> events = List.of(GameEvent.of(GameEvent.Type.BID_PASSED, Map.of("seat", 2)));
        Command cmd = new Command.Pass(null);
        when(registry.get("ABC123")).thenReturn(session);
        when(engine.dispatch(session, 2, cmd))
                .thenReturn(new Transition(next, events, TimerDirective.arm(3, 9, Duration.ofSeconds(30))));

        service.action("ABC123", "p2", cmd);

        InOrder order = inOrder(registry, timer, broadcaster);
        order.verify(registry).put(next);
        order.verify(timer).schedule(eq("ABC123"), eq(30_000L), any(Runnable.class));
        order.verify(broadcaster).publish(next, events);
    }

    @Test
    void action_armedTimerCallsBackIntoTimeout() {
        GameSession next = session.copy();
        Command cmd = new Command.Pass(null);
        when(registry.get("ABC123")).thenReturn(session);
        when(engine.dispatch(session, 0, cmd))
                .thenReturn(new Transition(next, List.of(), TimerDirective.arm(1, 4, Duration.ofSeconds(5))));
        when(registry.find("ABC123")).thenReturn(Optional.of(next));
        when(engine.onTimeout(next, 1, 4)).thenReturn(Transition.unchanged(next));

        service.action("ABC123", "p0", cmd);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(timer).schedule(eq("ABC123"), eq(5_000L), task.capture());
        task.getValue().run();

        verify(engine).onTimeout(next, 1, 4);
    }

    @Test
    void action_cancelDirective_cancelsTimer() {
        GameSession next = session.copy();
        Command cmd = new Command.StartGame(null);
        when(registry.get("ABC123")).thenReturn(session);
        when(engine.dispatch(session, 0, cmd)).thenReturn(new Transition(next, List.of(), TimerDirective.cancel()));

        service.action("ABC123", "p0", cmd);

        verify(timer).cancel("ABC123");
        verify(timer, never()).schedule(anyString(), anyLong(), any());
    }

    @Test
    void action_unknownPlayer_rejected() {
        when(registry.get("ABC123")).thenReturn(session);

        assertThatThrownBy(() -> service.action("ABC123", "stranger", new Command.Pass(null)))
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_PLAYER);
        verifyNoInteractions(engine, broadcaster);
    }

    @Test
    void action_ruleViolation_nothingStored() {
        Command cmd = new Command.Pass(null);
        when(registry.get("ABC123")).thenReturn(session);
        when(engine.dispatch(session, 1, cmd)).thenThrow(new GameRuleException(ErrorCode.OUT_OF_TURN));

        assertThatThrownBy(() -> service.action("ABC123", "p1", cmd)).isInstanceOf(GameRuleException.class);
        verify(registry, never()).put(any());
        verifyNoInteractions(timer, broadcaster);
    }

    @Test
    void onTimeout_unchanged_leavesEverythingAlone() {
        when(registry.find("ABC123")).thenReturn(Optional.of(session));
        when(engine.onTimeout(session, 1, 3)).thenReturn(Transition.unchanged(session));

        service.onTimeout("ABC123", 1, 3);

        verify(registry, never()).put(any());
        verifyNoInteractions(timer, broadcaster);
    }

    @Test
    void onTimeout_evictedGame_ignored() {
        when(registry.find("ABC123")).thenReturn(Optional.empty());

        service.onTimeout("ABC123", 1, 3);

        verifyNoInteractions(engine);
    }

    @Test
    void markConnected_flipsFlagAndPublishesSnapshot() {
        when(registry.find("ABC123")).thenReturn(Optional.of(session));

        service.markConnected("ABC123", "p1", true);

        ArgumentCaptor<GameSession> stored = ArgumentCaptor.forClass(GameSession.class);
        verify(registry).put(stored.capture());
        assertThat(stored.getValue().seat(1).isConnected()).isTrue();
        assertThat(session.seat(1).isConnected()).isFalse();
        verify(broadcaster).publish(stored.getValue(), List.of());
    }

    @Test
    void markConnected_noChange_noBroadcast() {
        when(registry.find("ABC123")).thenReturn(Optional.of(session));

        service.markConnected("ABC123", "p1", false);

        verifyNoInteractions(broadcaster);
    }

    @Test
    void view_unknownPlayer_rejected() {
        when(registry.get("ABC123")).thenReturn(session);

        assertThatThrownBy(() -> service.view("ABC123", "nobody"))
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_PLAYER);
    }

    @Test
    void evictIdle_cancelsTimersOfEvictedGames() {
        Instant cutoff = Instant.now();
        when(registry.evictIdleSince(cutoff)).thenReturn(List.of("OLD001", "OLD002"));

        assertThat(service.evictIdle(cutoff)).containsExactly("OLD001", "OLD002");
        verify(timer).cancel("OLD001");
        verify(timer).cancel("OLD002");
    }
}
