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

import me.golemcore.pulse.domain.service.DedupLedger;
import me.golemcore.pulse.domain.service.ReminderService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Retention sweep over the dedup ledger and fired reminders.
 */
@Component
public class CleanupLoop implements PulseLoop {

    private final DedupLedger dedupLedger;
    private final ReminderService reminderService;
    private final Duration interval;
    private final Duration retention;

    public CleanupLoop(DedupLedger dedupLedger, ReminderService reminderService, PulseProperties properties) {
        this.dedupLedger = dedupLedger;
        this.reminderService = reminderService;
        this.interval = properties.getLoops().getCleanup();
        this.retention = properties.getNotifications().getRetention();
    }

    @Override
    public String getName() {
        return "cleanup";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void tick(Instant now) {
        Instant cutoff = now.minus(retention);
        dedupLedger.purgeOlderThan(cutoff);
        reminderService.purgeTriggeredBefore(cutoff);
    }
}
