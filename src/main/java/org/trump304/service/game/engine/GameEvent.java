package org.trump304.service.game.engine;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/** Outbound event. Payloads only ever carry information every viewer may see. */
@Data
@Builder
public class GameEvent {
    private Type type;
    private Map<String, Object> payload;

    public enum Type {
        HAND_DEALT,
        BID_PLACED,
        BID_PASSED,
        BIDDING_CLOSED,
        TRUMP_SELECTED,
        CARDS_EXCHANGED,
        EXCHANGE_SKIPPED,
        TRUMP_REVEALED,
        CARD_PLAYED,
        TRICK_WON,
        CARDS_DRAWN,
        HAND_SCORED,
        HAND_SPOILT,
        HAND_FORFEITED,
        TURN_TIMEOUT
    }

    public static GameEvent of(Type type, Map<String, Object> payload) {
        return GameEvent.builder().type(type).payload(payload).build();
    }
}
