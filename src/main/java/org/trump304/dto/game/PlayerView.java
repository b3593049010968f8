package org.trump304.dto.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import org.trump304.model.game.Bid;
import org.trump304.model.game.Card;
import org.trump304.model.game.HandOutcome;

import java.util.List;
import java.util.Map;

/** Snapshot of a session as one seat is allowed to see it. */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlayerView {
    private String gameCode;
    private int mode;
    private String phase;
    private List<PlayerInfo> players;
    private int dealerSeat;
    private int yourSeat;
    private List<Card> yourHand;
    private List<Bid> bids;
    private Bid currentBid;
    private Integer bidTurnSeat;
    private Integer trumperSeat;
    private boolean trumpRevealed;
    private String trumpSuit;   // trumper, or everyone once revealed
    private Card trumpCard;     // same
    private List<TrickCardView> currentTrick;
    private Integer turnSeat;
    private int trickNumber;
    private Map<Integer, Integer> scores;
    private int gamesPlayed;
    private List<Card> validCards;
    private Map<String, Integer> teamTricksPoints;
    private Integer centerPileCount;
    private long actionSeq;
    private HandOutcome lastOutcome;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PlayerInfo {
        private int seat;
        private String name;
        private boolean connected;
    }

    public record TrickCardView(int seat, Card card) {}
}
