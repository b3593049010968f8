package org.trump304.service.game.engine;

import java.time.Duration;

/** What the boundary should do with the session's turn timer after a transition. */
public record TimerDirective(Kind kind, Integer seat, long seq, Duration timeout) {

    public enum Kind { ARM, CANCEL }

    public static TimerDirective arm(int seat, long seq, Duration timeout) {
        return new TimerDirective(Kind.ARM, seat, seq, timeout);
    }

    public static TimerDirective cancel() {
        return new TimerDirective(Kind.CANCEL, null, 0L, Duration.ZERO);
    }
}
