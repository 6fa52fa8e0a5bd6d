package me.golemcore.pulse.domain.model;

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

import me.golemcore.pulse.domain.exception.JobValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rule producing the next run time of a recurring job from the last scheduled
 * one.
 *
 * <p>
 * {@link #advance(Instant)} adds exactly one unit to the <em>scheduled</em>
 * time, never to the wall clock at execution. A process that stalled past
 * several cycles therefore fires once on resume and keeps its original cadence.
 */
public enum Recurrence {

    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7));

    private final Duration step;

    Recurrence(Duration step) {
        this.step = step;
    }

    public Duration getStep() {
        return step;
    }

    public Instant advance(Instant scheduledAt) {
        return scheduledAt.plus(step);
    }

    /**
     * Parses a recurrence name (case-insensitive).
     *
     * @param value
     *            "hourly", "daily", "weekly", or null/blank for a one-time job
     * @return the recurrence, or null for one-time jobs
     * @throws JobValidationException
     *             if the value is not recognized
     */
    public static Recurrence parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(values())
                    .map(r -> r.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new JobValidationException("Invalid recurrence '" + value + "'. Use: " + allowed);
        }
    }
}
