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

package me.golemcore.pulse.adapter.inbound.webhook;

import me.golemcore.pulse.adapter.inbound.webhook.dto.WebhookResponse;
import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.service.RepositoryEventService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;

/**
 * Receives GitHub deliveries at {@code POST /webhooks/github}.
 *
 * <ul>
 * <li>{@code ping} - acknowledged</li>
 * <li>{@code push} - hook refreshed and repository scanned for risks (202)</li>
 * <li>{@code issues} with action {@code opened} - announced (202)</li>
 * </ul>
 *
 * <p>
 * Returns 404 while webhooks are disabled and 401 on a bad signature.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GitHubWebhookController {

    static final String EVENT_HEADER = "X-GitHub-Event";

    private final PulseProperties properties;
    private final GitHubSignatureVerifier signatureVerifier;
    private final RepositoryEventService repositoryEventService;
    private final ObjectMapper objectMapper;

    @PostMapping("${pulse.webhooks.callback-path:/webhooks/github}")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestHeader(value = EVENT_HEADER, required = false) String event,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        return Mono.fromCallable(() -> handle(event, headers, body != null ? body : new byte[0]))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<WebhookResponse> handle(String event, HttpHeaders headers, byte[] body) {
        if (!properties.getWebhooks().isEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(WebhookResponse.error("Webhooks are not enabled"));
        }
        if (!signatureVerifier.verify(headers, body)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(WebhookResponse.error("Invalid signature"));
        }
        if (event == null || event.isBlank()) {
            return ResponseEntity.badRequest().body(WebhookResponse.error(EVENT_HEADER + " header is required"));
        }
        if ("ping".equals(event)) {
            return ResponseEntity.ok(WebhookResponse.accepted(event, null));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(WebhookResponse.error("Malformed JSON payload"));
        }
        String repository = payload == null ? "" : payload.path("repository").path("full_name").asText("");
        if (repository.isEmpty()) {
            return ResponseEntity.badRequest().body(WebhookResponse.error("repository.full_name is required"));
        }

        try {
            if ("push".equals(event)) {
                repositoryEventService.onPush(repository);
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(WebhookResponse.accepted(event, repository));
            }
            if ("issues".equals(event) && "opened".equals(payload.path("action").asText())) {
                JsonNode issue = payload.path("issue");
                repositoryEventService.onIssueOpened(repository, issue.path("number").asLong(),
                        issue.path("title").asText(null), issue.path("html_url").asText(null));
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(WebhookResponse.accepted(event, repository));
            }
        } catch (TransientExternalException e) {
            log.warn("[Webhooks] {} on {} not processed: {}", event, repository, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(WebhookResponse.error(e.getMessage()));
        }

        log.debug("[Webhooks] Ignoring {} event on {}", event, repository);
        return ResponseEntity.ok(WebhookResponse.ignored(event));
    }
}
