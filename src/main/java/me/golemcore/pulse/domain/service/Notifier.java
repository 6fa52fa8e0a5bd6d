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
import me.golemcore.pulse.domain.model.NotificationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Single entry point for user-facing notifications. A request is published only
 * if its {@code (subjectId, source, sourceEventId)} has never been seen.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Notifier {

    private final DedupLedger dedupLedger;
    private final NotificationQueue notificationQueue;
    private final Clock clock;

    /**
     * @return true if the notification was published, false if it was a
     *         duplicate
     */
    public boolean notify(NotificationRequest request) {
        if (!dedupLedger.shouldNotify(request.getSubjectId(), request.getSource(), request.getSourceEventId())) {
            return false;
        }

        Notification notification = Notification.builder()
                .id(UUID.randomUUID().toString())
                .subjectId(request.getSubjectId())
                .source(request.getSource())
                .sourceEventId(request.getSourceEventId())
                .priority(request.getPriority())
                .title(request.getTitle())
                .body(request.getBody())
                .actions(request.getActions())
                .timestamp(clock.instant())
                .build();
        notificationQueue.publish(notification);
        log.info("[Notifier] {} [{}] {} -> {}", notification.getPriority().wireName(), notification.getSource(),
                notification.getTitle(), notification.getSubjectId());
        return true;
    }
}
