package org.trump304.service.game.util;

import lombok.RequiredArgsConstructor;
import org.trump304.dto.game.PlayerView;
import org.trump304.model.game.*;
import org.trump304.service.game.scoring.ScoringService;
import org.trump304.service.game.trick.TrickService;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Per-viewer projection of the canonical session. Other seats' hands and a
 * face-down trump never leave through here.
 */
@Component
@RequiredArgsConstructor
public class GameViews {
    private final TrickService tricks;
    private final ScoringService scoring;

    public PlayerView viewFor(GameSession s, int seat) {
        TrumpState t = s.getTrump();
        boolean showTrump = t.isSelected() && (t.isRevealed() || s.isTrumper(seat));

        Map<String, Integer> teamPoints = new LinkedHashMap<>();
        if (s.trumperSeat() != null) {
            teamPoints.put("trumper", scoring.trumperPoints(s));
            teamPoints.put("opposing", scoring.opposingPoints(s, false));
        }

        return PlayerView.builder()
                .gameCode(s.getCode())
                .mode(s.getMode())
                .phase(s.getPhase().name())
                .players(players(s))
                .dealerSeat(s.getDealerSeat())
                .yourSeat(seat)
                .yourHand(List.copyOf(s.seat(seat).getHand()))
                .bids(List.copyOf(s.getBids()))
                .currentBid(s.getCurrentBid())
                .bidTurnSeat(s.getPhase() == GamePhase.BIDDING ? s.getBidTurnSeat() : null)
                .trumperSeat(s.trumperSeat())
                .trumpRevealed(t.isRevealed())
                .trumpSuit(showTrump ? t.getSuit().getLabel() : null)
                .trumpCard(showTrump ? t.getCard() : null)
                .currentTrick(s.getCurrentTrick().stream()
                        .map(tc -> new PlayerView.TrickCardView(tc.seat(), tc.card())).toList())
                .turnSeat(s.getTurnSeat())
                .trickNumber(s.getTrickNumber())
                .scores(new TreeMap<>(s.getScores()))
                .gamesPlayed(s.getGamesPlayed())
                .validCards(tricks.validCardsFor(s, seat))
                .teamTricksPoints(teamPoints)
                .centerPileCount(s.getMode() == 4 ? null : s.getCenterPile().size())
                .actionSeq(s.getActionSeq())
                .lastOutcome(s.getLastOutcome())
                .build();
    }

    public List<PlayerView.PlayerInfo> players(GameSession s) {
        List<PlayerView.PlayerInfo> out = new ArrayList<>();
        for (Seat seat : s.getSeats().values()) {
            if (!seat.isTaken()) continue;
            out.add(PlayerView.PlayerInfo.builder()
                    .seat(seat.getIndex())
                    .name(seat.getName())
                    .connected(seat.isConnected())
                    .build());
        }
        return out;
    }
}
