package org.trump304.model.game;

import lombok.Data;

import java.time.Instant;
import java.util.*;

@Data
public class GameSession {
    private final String code;
    private final int mode;

    private final Map<Integer, Seat> seats = new TreeMap<>();
    private GamePhase phase = GamePhase.WAITING;
    private int dealerSeat = 0;

    private final List<Bid> bids = new ArrayList<>();
    private Bid currentBid;
    private Integer bidTurnSeat;
    private final Set<Integer> passedSeats = new TreeSet<>();

    private TrumpState trump = new TrumpState();
    private boolean exchangeDone = false;

    private final List<Card> centerPile = new ArrayList<>();
    private final List<TrickCard> currentTrick = new ArrayList<>();
    private final Map<Integer, List<Card>> captured = new TreeMap<>();
    private Integer turnSeat;
    private int trickNumber = 0;

    private final Map<Integer, Integer> scores = new TreeMap<>();
    private int gamesPlayed = 0;
    private HandOutcome lastOutcome;

    private long actionSeq = 0;
    private Instant createdAt = Instant.now();
    private Instant lastActiveAt = Instant.now();

    public GameSession(String code, int mode) {
        if (mode < 2 || mode > 4) throw new GameRuleException(ErrorCode.INVALID_MODE);
        this.code = code;
        this.mode = mode;
        for (int i = 0; i < mode; i++) {
            seats.put(i, new Seat(i));
            scores.put(i, 0);
        }
    }

    public Seat seat(int index) {
        Seat s = seats.get(index);
        if (s == null) throw new GameRuleException(ErrorCode.UNKNOWN_PLAYER);
        return s;
    }

    public Optional<Seat> seatOf(String playerId) {
        if (playerId == null) return Optional.empty();
        return seats.values().stream().filter(s -> playerId.equals(s.getPlayerId())).findFirst();
    }

    public boolean isFull() {
        return seats.values().stream().allMatch(Seat::isTaken);
    }

    public int nextSeat(int seat) { return (seat + 1) % mode; }

    public Integer trumperSeat() { return trump.getTrumperSeat(); }

    public boolean isTrumper(int seat) { return Objects.equals(seat, trump.getTrumperSeat()); }

    public Card.Suit leadSuit() {
        return currentTrick.isEmpty() ? null : currentTrick.get(0).card().getSuit();
    }

    public long nextSeq() { return ++actionSeq; }

    /** Clears all per-hand state; seats, scores and games played survive. */
    public void resetHand() {
        for (Seat s : seats.values()) s.getHand().clear();
        bids.clear();
        currentBid = null;
        bidTurnSeat = null;
        passedSeats.clear();
        trump = new TrumpState();
        exchangeDone = false;
        centerPile.clear();
        currentTrick.clear();
        captured.clear();
        turnSeat = null;
        trickNumber = 0;
    }

    public GameSession copy() {
        GameSession c = new GameSession(code, mode);
        for (Seat s : seats.values()) c.seats.put(s.getIndex(), s.copy());
        c.phase = phase;
        c.dealerSeat = dealerSeat;
        c.bids.addAll(bids);
        c.currentBid = currentBid;
        c.bidTurnSeat = bidTurnSeat;
        c.passedSeats.addAll(passedSeats);
        c.trump = trump.copy();
        c.exchangeDone = exchangeDone;
        c.centerPile.addAll(centerPile);
        c.currentTrick.addAll(currentTrick);
        captured.forEach((seat, cards) -> c.captured.put(seat, new ArrayList<>(cards)));
        c.turnSeat = turnSeat;
        c.trickNumber = trickNumber;
        c.scores.putAll(scores);
        c.gamesPlayed = gamesPlayed;
        c.lastOutcome = lastOutcome;
        c.actionSeq = actionSeq;
        c.createdAt = createdAt;
        c.lastActiveAt = lastActiveAt;
        return c;
    }
}
