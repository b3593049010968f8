package org.trump304.model.game;

/** A bid or, when {@code amount} is null, a pass. */
public record Bid(int seat, Integer amount) {
    public boolean isPass() { return amount == null; }

    public static Bid pass(int seat) { return new Bid(seat, null); }
}
