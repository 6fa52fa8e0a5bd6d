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

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.loop.RepositoryWebhookLoop;
import me.golemcore.pulse.domain.model.NotificationAction;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reacts to repository events delivered by webhook.
 */
@Service
@Slf4j
public class RepositoryEventService {

    static final String ISSUE_SOURCE = "github-issue";

    private final RepositoryWebhookLoop repositoryWebhookLoop;
    private final RepositoryAlertService alertService;
    private final Notifier notifier;
    private final String subjectId;

    public RepositoryEventService(RepositoryWebhookLoop repositoryWebhookLoop, RepositoryAlertService alertService,
            Notifier notifier, PulseProperties properties) {
        this.repositoryWebhookLoop = repositoryWebhookLoop;
        this.alertService = alertService;
        this.notifier = notifier;
        this.subjectId = properties.getDefaultSubject();
    }

    /**
     * A push landed: make sure the repository's hook is current, then scan it.
     *
     * @return true if a security alert was emitted
     */
    public boolean onPush(String repository) {
        try {
            repositoryWebhookLoop.ensureHook(repository);
        } catch (TransientExternalException e) {
            log.warn("[Webhooks] Could not ensure hook on {}: {}", repository, e.getMessage());
        }
        boolean alerted = alertService.scanAndAlert(subjectId, repository);
        log.info("[Webhooks] Push on {} scanned{}", repository, alerted ? ", alert raised" : "");
        return alerted;
    }

    /**
     * @return true if the issue was not announced before
     */
    public boolean onIssueOpened(String repository, long number, String title, String url) {
        NotificationRequest.NotificationRequestBuilder request = NotificationRequest.builder()
                .subjectId(subjectId)
                .source(ISSUE_SOURCE)
                .sourceEventId(repository + "#" + number)
                .priority(NotificationPriority.IMPORTANT)
                .title("[Issue] " + repository + "#" + number)
                .body(title != null ? title : "");
        if (url != null && !url.isBlank()) {
            request.action(NotificationAction.openUrl("Open issue", url));
        }
        return notifier.notify(request.build());
    }
}
