package org.trump304.service.game.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.config.GameRulesProperties;
import org.trump304.model.game.*;
import org.trump304.model.game.rules.ScoringRules;
import org.trump304.model.game.rules.Teams;
import org.trump304.service.game.engine.GameEvent;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {
    private final GameRulesProperties rules;

    /** Points captured in tricks by the trumper's side so far. */
    public int trumperPoints(GameSession s) {
        int sum = 0;
        for (int seat : Teams.trumperTeam(s)) sum += Deck.points(s.getCaptured().getOrDefault(seat, List.of()));
        return sum;
    }

    /** Points captured by the other side; in 3p the center pile counts for them once the hand is over. */
    public int opposingPoints(GameSession s, boolean includeCenterPile) {
        List<Integer> trumperTeam = Teams.trumperTeam(s);
        int sum = 0;
        for (Map.Entry<Integer, List<Card>> e : s.getCaptured().entrySet()) {
            if (!trumperTeam.contains(e.getKey())) sum += Deck.points(e.getValue());
        }
        if (includeCenterPile && s.getMode() == 3) sum += Deck.points(s.getCenterPile());
        return sum;
    }

    public List<GameEvent> score(GameSession s) {
        int bid = s.getCurrentBid().amount();
        int trumperPoints = trumperPoints(s);
        int opposingPoints = opposingPoints(s, true);
        ScoringRules.Tier tier = ScoringRules.tier(bid);
        boolean won = ScoringRules.trumperWins(trumperPoints, bid);

        List<Integer> awarded = won ? Teams.trumperTeam(s) : Teams.opponentsOf(s, s.trumperSeat());
        int points = won ? tier.win() : tier.lose();
        award(s, awarded, points);

        HandOutcome outcome = new HandOutcome(HandOutcome.Kind.SCORED, bid, trumperPoints, opposingPoints,
                won, awarded, points, null);
        finish(s, outcome);
        log.info("Hand {} scored on {}: bid {} trumper {} pts, {} awarded to {}",
                s.getGamesPlayed(), s.getCode(), bid, trumperPoints, points, awarded);
        return List.of(GameEvent.of(GameEvent.Type.HAND_SCORED, payload(s, outcome)));
    }

    /** Illegal play committed by {@code offender}: their opponents take the hand plus bonus tokens. */
    public List<GameEvent> forfeit(GameSession s, int offender) {
        int bid = s.getCurrentBid() != null ? s.getCurrentBid().amount() : rules.minBid();
        List<Integer> awarded = Teams.opponentsOf(s, offender);
        int points = ScoringRules.tier(bid).win() + rules.forfeitBonus();
        award(s, awarded, points);

        boolean trumperWon = s.trumperSeat() != null && awarded.contains(s.trumperSeat());
        HandOutcome outcome = new HandOutcome(HandOutcome.Kind.FORFEIT, bid, trumperPoints(s),
                opposingPoints(s, false), trumperWon, awarded, points, offender);
        finish(s, outcome);
        log.warn("Hand forfeited on {}: illegal play by seat {}, {} awarded to {}", s.getCode(), offender, points, awarded);
        return List.of(GameEvent.of(GameEvent.Type.HAND_FORFEITED, payload(s, outcome)));
    }

    private void award(GameSession s, List<Integer> seats, int points) {
        for (int seat : seats) s.getScores().merge(seat, points, Integer::sum);
    }

    private void finish(GameSession s, HandOutcome outcome) {
        s.setLastOutcome(outcome);
        s.setGamesPlayed(s.getGamesPlayed() + 1);
        s.setPhase(GamePhase.SCORING);
        s.setTurnSeat(null);
    }

    private Map<String, Object> payload(GameSession s, HandOutcome o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("bid", o.bid());
        m.put("trumperSeat", s.trumperSeat());
        m.put("trumperPoints", o.trumperPoints());
        m.put("opposingPoints", o.opposingPoints());
        m.put("trumperWon", o.trumperWon());
        m.put("awardedSeats", o.awardedSeats());
        m.put("pointsAwarded", o.pointsAwarded());
        if (o.offenderSeat() != null) m.put("offenderSeat", o.offenderSeat());
        m.put("scores", new TreeMap<>(s.getScores()));
        return m;
    }
}
