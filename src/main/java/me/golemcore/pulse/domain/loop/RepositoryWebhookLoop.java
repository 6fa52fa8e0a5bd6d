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

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.service.WebhookRegistrar;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.PublicEndpointPort;
import me.golemcore.pulse.port.outbound.WebhookHostPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Points a webhook of every owned repository at the engine's current public
 * endpoint. Skips quietly while the endpoint is unknown.
 */
@Component
@Slf4j
public class RepositoryWebhookLoop implements PulseLoop {

    private final WebhookRegistrar registrar;
    private final WebhookHostPort hostPort;
    private final PublicEndpointPort publicEndpoint;
    private final PulseProperties.WebhooksProperties settings;
    private final Duration interval;

    public RepositoryWebhookLoop(WebhookRegistrar registrar, WebhookHostPort hostPort,
            PublicEndpointPort publicEndpoint, PulseProperties properties) {
        this.registrar = registrar;
        this.hostPort = hostPort;
        this.publicEndpoint = publicEndpoint;
        this.settings = properties.getWebhooks();
        this.interval = properties.getLoops().getRepositories();
    }

    @Override
    public String getName() {
        return "repositories";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    /**
     * @throws TransientExternalException
     *             after all repositories were tried, if any of them failed
     */
    @Override
    public void tick(Instant now) {
        if (!settings.isEnabled() || !hostPort.isAvailable()) {
            return;
        }
        Optional<String> callbackUrl = currentCallbackUrl();
        if (callbackUrl.isEmpty()) {
            log.debug("[Webhooks] Public endpoint unknown, skipping");
            return;
        }

        List<String> repositories = hostPort.listResources();
        int failures = 0;
        TransientExternalException lastFailure = null;
        for (String repository : repositories) {
            try {
                registrar.ensure(repository, callbackUrl.get());
            } catch (TransientExternalException e) {
                failures++;
                lastFailure = e;
                log.warn("[Webhooks] Failed to ensure hook on {}: {}", repository, e.getMessage());
            }
        }
        if (lastFailure != null) {
            throw new TransientExternalException(
                    "Webhook registration failed for " + failures + " of " + repositories.size() + " repositories",
                    lastFailure);
        }
    }

    /**
     * Ensures the hook of a single repository, e.g. on an incoming push.
     *
     * @return the outcome, or empty when webhooks are off or the endpoint is
     *         unknown
     */
    public Optional<WebhookRegistrar.Outcome> ensureHook(String repository) {
        if (!settings.isEnabled() || !hostPort.isAvailable()) {
            return Optional.empty();
        }
        return currentCallbackUrl().map(url -> registrar.ensure(repository, url));
    }

    private Optional<String> currentCallbackUrl() {
        return publicEndpoint.currentBaseUrl().map(base -> {
            registrar.beginGeneration(base);
            return stripTrailingSlash(base) + settings.getCallbackPath();
        });
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
