package com.example.rcaengine.service;

import com.example.rcaengine.config.EngineProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Ordering lanes for correlation. Each lane is a single-threaded executor;
 * work for one key always lands on the same lane and so runs in submission
 * order, while different lanes run in parallel.
 */
@Slf4j
@Component
public class AlertLaneDispatcher {

    private final List<ThreadPoolTaskExecutor> lanes = new ArrayList<>();

    public AlertLaneDispatcher(EngineProperties properties) {
        int count = Math.max(1, properties.getCorrelation().getOrderingLanes());
        for (int i = 0; i < count; i++) {
            ThreadPoolTaskExecutor lane = new ThreadPoolTaskExecutor();
            lane.setCorePoolSize(1);
            lane.setMaxPoolSize(1);
            lane.setThreadNamePrefix("lane-" + i + "-");
            lane.setWaitForTasksToCompleteOnShutdown(true);
            lane.setAwaitTerminationSeconds(10);
            lane.initialize();
            lanes.add(lane);
        }
        log.info("Started {} correlation lanes", count);
    }

    public <T> CompletableFuture<T> submit(String key, Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, lanes.get(laneFor(key)));
    }

    public int laneFor(String key) {
        return key == null ? 0 : Math.floorMod(key.hashCode(), lanes.size());
    }

    public int getLaneCount() {
        return lanes.size();
    }

    @PreDestroy
    public void shutdown() {
        lanes.forEach(ThreadPoolTaskExecutor::shutdown);
    }
}
