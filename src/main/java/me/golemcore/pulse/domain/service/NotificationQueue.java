package me.golemcore.pulse.domain.service;

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

import me.golemcore.pulse.domain.model.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Outbound notification buffer between the engine and whatever delivers to the
 * user. Publishing never blocks; order is preserved within the process.
 */
@Component
@Slf4j
public class NotificationQueue {

    private final ConcurrentLinkedQueue<Notification> pending = new ConcurrentLinkedQueue<>();

    public void publish(Notification notification) {
        pending.add(notification);
        log.debug("[Notifier] Queued {} ({})", notification.getId(), notification.getSource());
    }

    /**
     * Removes and returns everything published so far, oldest first.
     */
    public List<Notification> drain() {
        List<Notification> batch = new ArrayList<>();
        Notification next;
        while ((next = pending.poll()) != null) {
            batch.add(next);
        }
        return batch;
    }

    public int size() {
        return pending.size();
    }
}
