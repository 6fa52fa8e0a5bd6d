package me.golemcore.pulse.port.outbound;

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

import java.time.Duration;

/**
 * Drives the periodic ticks of the loop orchestrator. Production runs on a
 * scheduled executor; tests substitute a virtual-time implementation and step
 * it explicitly.
 *
 * <p>
 * Implementations must run the next tick of a task only after the previous
 * one has returned (fixed delay, never fixed rate).
 */
public interface TickScheduler {

    /**
     * Schedule {@code task} to run after {@code initialDelay}, then repeatedly
     * with {@code interval} between the end of one run and the start of the
     * next.
     */
    Handle schedule(String name, Runnable task, Duration initialDelay, Duration interval);

    /**
     * Release scheduler threads. Further scheduling is not supported.
     */
    void shutdown();

    /**
     * Cancels future runs of one scheduled task. A run in progress is allowed
     * to finish.
     */
    interface Handle {
        void cancel();
    }
}
