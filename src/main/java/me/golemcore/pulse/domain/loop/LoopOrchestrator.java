package me.golemcore.pulse.domain.loop;

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

import me.golemcore.pulse.domain.model.LoopStatus;
import me.golemcore.pulse.domain.service.JobRepository;
import me.golemcore.pulse.port.outbound.TickScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every registered {@link PulseLoop} on its own interval.
 *
 * <p>
 * Each loop carries an {@code executing} guard: a tick that finds the previous
 * one still in progress is skipped, so a loop never overlaps itself. A failing
 * tick is logged and counted, and the loop keeps its schedule.
 *
 * <p>
 * {@link #start()} performs crash recovery exactly once before arming any loop,
 * then fires one immediate tick per loop. {@link #stop()} only disarms future
 * ticks.
 *
 * @see TickScheduler
 */
@Service
@Slf4j
public class LoopOrchestrator {

    private final TickScheduler tickScheduler;
    private final JobRepository jobRepository;
    private final Clock clock;
    private final Map<String, LoopState> loops = new LinkedHashMap<>();

    private boolean running;

    public LoopOrchestrator(TickScheduler tickScheduler, JobRepository jobRepository, Clock clock) {
        this.tickScheduler = tickScheduler;
        this.jobRepository = jobRepository;
        this.clock = clock;
    }

    public synchronized void register(PulseLoop loop) {
        if (loop.getInterval() == null || loop.getInterval().isNegative() || loop.getInterval().isZero()) {
            throw new IllegalArgumentException("Loop '" + loop.getName() + "' needs a positive interval");
        }
        if (loops.containsKey(loop.getName())) {
            throw new IllegalArgumentException("Loop already registered: " + loop.getName());
        }
        LoopState state = new LoopState(loop);
        loops.put(loop.getName(), state);
        log.debug("[Loops] Registered {} every {}", loop.getName(), loop.getInterval());
        if (running) {
            arm(state);
        }
    }

    public void register(String name, Duration interval, PulseLoop.Tick tick) {
        register(PulseLoop.of(name, interval, tick));
    }

    /**
     * Recovers stuck jobs, then arms every loop with an immediate first tick.
     * Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        jobRepository.resetStuck();
        running = true;
        for (LoopState state : loops.values()) {
            arm(state);
        }
        log.info("[Loops] Started {} loop(s): {}", loops.size(), loops.keySet());
    }

    /**
     * Disarms all loops. A tick already in flight runs to completion.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (LoopState state : loops.values()) {
            TickScheduler.Handle handle = state.handle;
            if (handle != null) {
                handle.cancel();
                state.handle = null;
            }
        }
        log.info("[Loops] Stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized List<LoopStatus> status() {
        List<LoopStatus> statuses = new ArrayList<>();
        for (LoopState state : loops.values()) {
            statuses.add(state.snapshot());
        }
        return statuses;
    }

    private void arm(LoopState state) {
        state.handle = tickScheduler.schedule(state.loop.getName(), () -> runTick(state),
                Duration.ZERO, state.loop.getInterval());
    }

    private void runTick(LoopState state) {
        if (!state.executing.compareAndSet(false, true)) {
            log.debug("[Loops] {} tick skipped: previous tick still in progress", state.loop.getName());
            return;
        }
        Instant now = clock.instant();
        try {
            state.loop.tick(now);
            state.lastError = null;
        } catch (Exception e) {
            state.failureCount.incrementAndGet();
            state.lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Loops] {} tick failed: {}", state.loop.getName(), e.getMessage(), e);
        } finally {
            state.tickCount.incrementAndGet();
            state.lastTickAt = now;
            state.executing.set(false);
        }
    }

    private static final class LoopState {
        private final PulseLoop loop;
        private final AtomicBoolean executing = new AtomicBoolean(false);
        private final AtomicLong tickCount = new AtomicLong();
        private final AtomicLong failureCount = new AtomicLong();
        private volatile TickScheduler.Handle handle;
        private volatile Instant lastTickAt;
        private volatile String lastError;

        private LoopState(PulseLoop loop) {
            this.loop = loop;
        }

        private LoopStatus snapshot() {
            return new LoopStatus(loop.getName(), loop.getInterval(), handle != null, executing.get(),
                    tickCount.get(), failureCount.get(), lastTickAt, lastError);
        }
    }
}
