package org.trump304.service.game.util;

/** One cancellable turn deadline per game. Arming replaces whatever was armed before. */
public interface TurnTimer {
    void schedule(String code, long delayMs, Runnable task);

    void cancel(String code);
}
