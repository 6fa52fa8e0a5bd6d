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

import me.golemcore.pulse.domain.model.NotificationAction;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.domain.model.RiskFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raises security alerts for a repository keyed by the content of its
 * findings, so an unchanged set of problems is reported at most once per day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepositoryAlertService {

    static final String SOURCE = "repo-risk";

    private final RepositoryRiskScanner riskScanner;
    private final Notifier notifier;
    private final Clock clock;

    /**
     * @return true if an alert was emitted
     */
    public boolean scanAndAlert(String subjectId, String repository) {
        List<RiskFinding> findings = riskScanner.scan(repository);
        List<String> descriptions = findings.stream().map(RiskFinding::describe).toList();
        String signature = ContentSignature.of(descriptions);
        if (ContentSignature.CLEAN.equals(signature)) {
            log.debug("[Webhooks] {} is clean", repository);
            return false;
        }

        Instant now = clock.instant();
        boolean critical = findings.stream().anyMatch(f -> f.severity() == RiskFinding.Severity.CRITICAL);
        return notifier.notify(NotificationRequest.builder()
                .subjectId(subjectId)
                .source(SOURCE)
                .sourceEventId(repository + ":" + ContentSignature.dayBucket(signature, now))
                .priority(critical ? NotificationPriority.URGENT : NotificationPriority.IMPORTANT)
                .title("Security alert: " + repository)
                .body(descriptions.stream().collect(Collectors.joining("\n")))
                .action(NotificationAction.openUrl("Open repository", "https://github.com/" + repository))
                .build());
    }
}
