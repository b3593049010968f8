package org.trump304.model.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    public int points() { return rank.getPoints(); }

    /** Wire id, e.g. {@code J_hearts}. */
    @JsonValue
    public String id() { return rank.getLabel() + "_" + suit.getLabel(); }

    @JsonCreator
    public static Card fromId(String id) {
        if (id == null) throw new GameRuleException(ErrorCode.UNKNOWN_CARD);
        int sep = id.lastIndexOf('_');
        if (sep <= 0 || sep == id.length() - 1) throw new GameRuleException(ErrorCode.UNKNOWN_CARD);
        return new Card(Rank.fromLabel(id.substring(0, sep)), Suit.fromLabel(id.substring(sep + 1)));
    }

    @Override
    public String toString() { return id(); }

    @Getter
    @AllArgsConstructor
    public enum Suit {
        HEARTS("hearts"), DIAMONDS("diamonds"), CLUBS("clubs"), SPADES("spades");

        @JsonValue
        private final String label;

        @JsonCreator
        public static Suit fromLabel(String label) {
            for (Suit s : values()) if (s.label.equals(label)) return s;
            throw new GameRuleException(ErrorCode.UNKNOWN_CARD);
        }
    }

    // points and trick strength are separate: 10 is worth less than A but they order J > 9 > A > 10
    @Getter
    @AllArgsConstructor
    public enum Rank {
        SEVEN("7", 0, 0), EIGHT("8", 0, 1), QUEEN("Q", 2, 2), KING("K", 3, 3),
        TEN("10", 10, 4), ACE("A", 11, 5), NINE("9", 20, 6), JACK("J", 30, 7);

        private final String label;
        private final int points;
        private final int strength;

        public static Rank fromLabel(String label) {
            for (Rank r : values()) if (r.label.equals(label)) return r;
            throw new GameRuleException(ErrorCode.UNKNOWN_CARD);
        }
    }
}
