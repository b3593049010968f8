package org.trump304.service.game.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

@Slf4j
@Component
public class Timeouts implements TurnTimer {
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(3);
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    @Override
    public void schedule(String code, long delayMs, Runnable task) {
        cancel(code);
        tasks.put(code, scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Turn timer failed for game {}", code, e);
            }
        }, delayMs, TimeUnit.MILLISECONDS));
    }

    @Override
    public void cancel(String code) {
        ScheduledFuture<?> f = tasks.remove(code);
        if (f != null) f.cancel(false);
    }

    @PreDestroy
    public void shutdown() { scheduler.shutdownNow(); }
}
