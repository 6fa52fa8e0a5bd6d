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

import java.time.Duration;
import java.time.Instant;

/**
 * One periodic concern of the engine, driven by {@link LoopOrchestrator}.
 */
public interface PulseLoop {

    String getName();

    Duration getInterval();

    /**
     * Performs one pass. Exceptions are logged by the orchestrator and never
     * stop the loop.
     */
    void tick(Instant now) throws Exception;

    static PulseLoop of(String name, Duration interval, Tick tick) {
        return new PulseLoop() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Duration getInterval() {
                return interval;
            }

            @Override
            public void tick(Instant now) throws Exception {
                tick.run(now);
            }
        };
    }

    @FunctionalInterface
    interface Tick {
        void run(Instant now) throws Exception;
    }
}
