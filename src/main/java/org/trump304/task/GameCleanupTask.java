package org.trump304.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.service.GameService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class GameCleanupTask {

    private final GameService service;

    @Value("${game.session-ttl-hours:24}")
    private long ttlHours;

    // every 10 minutes
    @Scheduled(fixedRate = 600_000)
    public void evictIdleGames() {
        List<String> evicted = service.evictIdle(Instant.now().minus(Duration.ofHours(ttlHours)));
        if (!evicted.isEmpty()) log.info("Evicted {} idle game(s): {}", evicted.size(), evicted);
    }
}
