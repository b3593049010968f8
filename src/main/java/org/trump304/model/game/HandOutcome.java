package org.trump304.model.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HandOutcome(
        Kind kind,
        int bid,
        int trumperPoints,
        int opposingPoints,
        boolean trumperWon,
        List<Integer> awardedSeats,
        int pointsAwarded,
        Integer offenderSeat
) {
    public enum Kind { SCORED, FORFEIT }
}
