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

import me.golemcore.pulse.domain.model.RiskFinding;
import me.golemcore.pulse.port.outbound.WebhookHostPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a repository for files that should never be committed.
 */
@Service
@RequiredArgsConstructor
public class RepositoryRiskScanner {

    private final WebhookHostPort hostPort;

    public List<RiskFinding> scan(String repository) {
        List<RiskFinding> findings = new ArrayList<>();
        if (hostPort.pathExists(repository, ".env")) {
            findings.add(new RiskFinding(RiskFinding.Severity.CRITICAL, ".env file committed to " + repository));
        }
        if (hostPort.pathExists(repository, "node_modules")) {
            findings.add(new RiskFinding(RiskFinding.Severity.WARNING,
                    "node_modules directory committed to " + repository));
        }
        return findings;
    }
}
