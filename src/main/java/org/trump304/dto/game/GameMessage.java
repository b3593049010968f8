package org.trump304.dto.game;

import lombok.Builder;
import lombok.Data;

/** Envelope on a player's topic: {@code game_state} snapshots and engine events. */
@Data
@Builder
public class GameMessage {
    public static final String STATE = "game_state";

    private String event;
    private Object payload;
}
