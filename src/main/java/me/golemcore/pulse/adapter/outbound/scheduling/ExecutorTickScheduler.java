package me.golemcore.pulse.adapter.outbound.scheduling;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pulse.port.outbound.TickScheduler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TickScheduler} on a small pool of daemon threads. Uses fixed-delay
 * scheduling, so a run of one task never overlaps the next run of the same
 * task.
 */
@Component
@Slf4j
public class ExecutorTickScheduler implements TickScheduler {

    private static final int POOL_SIZE = 4;

    private final ScheduledExecutorService scheduler;

    public ExecutorTickScheduler() {
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(POOL_SIZE, r -> {
            Thread t = new Thread(r, "pulse-loop-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Handle schedule(String name, Runnable task, Duration initialDelay, Duration interval) {
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                task,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.debug("[Loops] Scheduled {} every {} ms", name, interval.toMillis());
        return () -> future.cancel(false);
    }

    @PreDestroy
    @Override
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
