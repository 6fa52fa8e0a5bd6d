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

import me.golemcore.pulse.domain.exception.WebhookApiException;
import me.golemcore.pulse.domain.exception.WebhookConflictException;
import me.golemcore.pulse.domain.model.RemoteHook;
import me.golemcore.pulse.domain.model.WebhookRegistration;
import me.golemcore.pulse.port.outbound.WebhookHostPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps exactly one webhook per external resource pointed at the engine's
 * current public endpoint.
 *
 * <p>
 * Registrations are remembered per endpoint generation: when the public base
 * URL changes (a new tunnel), {@link #beginGeneration(String)} forgets them and
 * the next {@link #ensure} call replaces the stale hook.
 */
@Service
@Slf4j
public class WebhookRegistrar {

    public enum Outcome {
        /** Already registered in this generation, nothing called. */
        UNCHANGED,
        /** A hook at the desired URL already existed on the host. */
        ADOPTED,
        CREATED,
        /** Stale hooks were deleted and a new one created. */
        REPLACED,
        /** Host answered 422: the hook exists. */
        ALREADY_EXISTS,
        /** Host answered 404/403: resource gone or not ours. */
        SKIPPED
    }

    private final WebhookHostPort hostPort;
    private final Clock clock;
    private final Map<String, WebhookRegistration> registrations = new ConcurrentHashMap<>();

    private String generationBase;

    public WebhookRegistrar(WebhookHostPort hostPort, Clock clock) {
        this.hostPort = hostPort;
        this.clock = clock;
    }

    /**
     * Starts a new generation if {@code baseUrl} differs from the current one.
     *
     * @return true if previous registrations were forgotten
     */
    public synchronized boolean beginGeneration(String baseUrl) {
        if (baseUrl.equals(generationBase)) {
            return false;
        }
        boolean hadPrevious = generationBase != null;
        generationBase = baseUrl;
        registrations.clear();
        if (hadPrevious) {
            log.info("[Webhooks] Public endpoint changed to {}, re-registering", baseUrl);
        }
        return hadPrevious;
    }

    /**
     * Makes sure {@code resourceId} has a hook at {@code desiredUrl}.
     *
     * @throws WebhookApiException
     *             for host errors other than 422, 404 and 403
     */
    public synchronized Outcome ensure(String resourceId, String desiredUrl) {
        WebhookRegistration current = registrations.get(resourceId);
        if (current != null && current.callbackUrl().equals(desiredUrl)) {
            return Outcome.UNCHANGED;
        }

        try {
            List<RemoteHook> hooks = hostPort.listHooks(resourceId);
            int deleted = deleteStale(resourceId, hooks, desiredUrl);
            if (hooks.stream().anyMatch(hook -> desiredUrl.equals(hook.url()))) {
                remember(resourceId, desiredUrl);
                log.debug("[Webhooks] {} already points at {}", resourceId, desiredUrl);
                return deleted > 0 ? Outcome.REPLACED : Outcome.ADOPTED;
            }

            hostPort.createHook(resourceId, desiredUrl);
            remember(resourceId, desiredUrl);
            log.info("[Webhooks] Registered {} -> {}", resourceId, desiredUrl);
            return deleted > 0 ? Outcome.REPLACED : Outcome.CREATED;
        } catch (WebhookConflictException e) {
            remember(resourceId, desiredUrl);
            log.debug("[Webhooks] {} hook already exists", resourceId);
            return Outcome.ALREADY_EXISTS;
        } catch (WebhookApiException e) {
            if (e.isInaccessible()) {
                log.warn("[Webhooks] Skipping {}: HTTP {}", resourceId, e.getStatus());
                return Outcome.SKIPPED;
            }
            throw e;
        }
    }

    private int deleteStale(String resourceId, List<RemoteHook> hooks, String desiredUrl) {
        int deleted = 0;
        for (RemoteHook hook : hooks) {
            if (isStale(hook.url(), desiredUrl)) {
                hostPort.deleteHook(resourceId, hook.id());
                deleted++;
                log.info("[Webhooks] Deleted stale hook {} on {} ({})", hook.id(), resourceId, hook.url());
            }
        }
        return deleted;
    }

    public Optional<WebhookRegistration> registration(String resourceId) {
        return Optional.ofNullable(registrations.get(resourceId));
    }

    public List<WebhookRegistration> registrations() {
        return new ArrayList<>(registrations.values());
    }

    private void remember(String resourceId, String callbackUrl) {
        registrations.put(resourceId, new WebhookRegistration(resourceId, callbackUrl, clock.instant()));
    }

    /**
     * A hook is stale when it lives on the same provider domain as the desired
     * URL (e.g. an older tunnel subdomain) but at a different host or path.
     */
    static boolean isStale(String hookUrl, String desiredUrl) {
        if (hookUrl == null || hookUrl.equals(desiredUrl)) {
            return false;
        }
        String hookDomain = providerDomain(hookUrl);
        return hookDomain != null && hookDomain.equals(providerDomain(desiredUrl));
    }

    private static String providerDomain(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        String[] labels = host.toLowerCase(Locale.ROOT).split("\\.");
        if (labels.length < 2) {
            return host.toLowerCase(Locale.ROOT);
        }
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }
}
