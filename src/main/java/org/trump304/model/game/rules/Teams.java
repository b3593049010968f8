package org.trump304.model.game.rules;

import org.trump304.model.game.GameSession;

import java.util.ArrayList;
import java.util.List;

/**
 * Team membership is derived from the mode and the current trumper, never stored.
 * 4p plays fixed pairs; in 2p and 3p the trumper plays alone against everyone else.
 */
public final class Teams {
    private Teams(){}

    public static Integer partnerOf(int mode, int seat) {
        return mode == 4 ? (seat + 2) % 4 : null;
    }

    public static List<Integer> teamOf(GameSession s, int seat) {
        int mode = s.getMode();
        if (mode == 4) return List.of(Math.min(seat, (seat + 2) % 4), Math.max(seat, (seat + 2) % 4));
        Integer trumper = s.trumperSeat();
        if (trumper == null || trumper == seat) return List.of(seat);
        List<Integer> rest = new ArrayList<>();
        for (int i = 0; i < mode; i++) if (i != trumper) rest.add(i);
        return rest;
    }

    public static List<Integer> trumperTeam(GameSession s) {
        Integer trumper = s.trumperSeat();
        return trumper == null ? List.of() : teamOf(s, trumper);
    }

    public static List<Integer> opponentsOf(GameSession s, int seat) {
        List<Integer> mine = teamOf(s, seat);
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < s.getMode(); i++) if (!mine.contains(i)) out.add(i);
        return out;
    }

    public static boolean sameTeam(GameSession s, int a, int b) {
        return teamOf(s, a).contains(b);
    }
}
