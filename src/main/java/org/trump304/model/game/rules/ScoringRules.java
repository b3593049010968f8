package org.trump304.model.game.rules;

public final class ScoringRules {
    private ScoringRules(){}

    public static final int ALL_POINTS = 304;

    public record Tier(int win, int lose) {}

    public static Tier tier(int bid) {
        if (bid >= ALL_POINTS) return new Tier(10, 7);
        if (bid >= 200) return new Tier(6, 5);
        return new Tier(5, 3);
    }

    public static boolean trumperWins(int trumperPoints, int bid) {
        return trumperPoints >= bid;
    }
}
