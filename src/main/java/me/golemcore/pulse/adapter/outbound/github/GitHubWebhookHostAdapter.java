package me.golemcore.pulse.adapter.outbound.github;

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
import me.golemcore.pulse.domain.exception.WebhookApiException;
import me.golemcore.pulse.domain.exception.WebhookConflictException;
import me.golemcore.pulse.domain.model.RemoteHook;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.WebhookHostPort;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub REST implementation of {@link WebhookHostPort}. Resources are
 * repositories named {@code owner/repo}.
 *
 * <p>
 * HTTP 422 surfaces as {@link WebhookConflictException}, any other non-2xx as
 * {@link WebhookApiException} with the status, and I/O failures as
 * {@link TransientExternalException}.
 */
@Component
@Slf4j
public class GitHubWebhookHostAdapter implements WebhookHostPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int NOT_FOUND = 404;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PulseProperties.WebhooksProperties webhooks;
    private final PulseProperties.GitHubProperties github;

    public GitHubWebhookHostAdapter(OkHttpClient httpClient, ObjectMapper objectMapper,
            PulseProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhooks = properties.getWebhooks();
        this.github = properties.getWebhooks().getGithub();
    }

    @Override
    public boolean isAvailable() {
        return github.getToken() != null && !github.getToken().isBlank();
    }

    @Override
    public List<String> listResources() {
        HttpUrl url = apiUrl("user", "repos").newBuilder()
                .addQueryParameter("affiliation", "owner")
                .addQueryParameter("sort", "updated")
                .addQueryParameter("per_page", String.valueOf(github.getRepositoryLimit()))
                .build();
        JsonNode repos = execute(request(url).get().build(), "list repositories");
        List<String> names = new ArrayList<>();
        for (JsonNode repo : repos) {
            String fullName = repo.path("full_name").asText("");
            if (!fullName.isEmpty()) {
                names.add(fullName);
            }
        }
        return names;
    }

    @Override
    public List<RemoteHook> listHooks(String resourceId) {
        JsonNode hooks = execute(request(repoUrl(resourceId, "hooks")).get().build(), "list hooks of " + resourceId);
        List<RemoteHook> result = new ArrayList<>();
        for (JsonNode hook : hooks) {
            result.add(new RemoteHook(
                    hook.path("id").asText(),
                    hook.path("config").path("url").asText(null),
                    hook.path("active").asBoolean(true)));
        }
        return result;
    }

    @Override
    public RemoteHook createHook(String resourceId, String callbackUrl) {
        String secret = webhooks.getSecret() != null && !webhooks.getSecret().isBlank() ? webhooks.getSecret() : null;
        CreateHookRequest payload = new CreateHookRequest("web", true, github.getEvents(),
                new HookConfig(callbackUrl, "json", "0", secret));
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize hook request", e);
        }
        JsonNode hook = execute(request(repoUrl(resourceId, "hooks")).post(RequestBody.create(body, JSON)).build(),
                "create hook on " + resourceId);
        return new RemoteHook(hook.path("id").asText(), callbackUrl, hook.path("active").asBoolean(true));
    }

    @Override
    public void deleteHook(String resourceId, String hookId) {
        execute(request(repoUrl(resourceId, "hooks", hookId)).delete().build(),
                "delete hook " + hookId + " on " + resourceId);
    }

    @Override
    public boolean pathExists(String resourceId, String path) {
        Request request = request(repoUrl(resourceId, "contents", path)).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == NOT_FOUND) {
                return false;
            }
            if (!response.isSuccessful()) {
                throw toApiException(response, "read " + path + " of " + resourceId);
            }
            return true;
        } catch (IOException e) {
            throw new TransientExternalException("GitHub request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode execute(Request request, String action) {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw toApiException(response, action);
            }
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new TransientExternalException("GitHub request failed (" + action + "): " + e.getMessage(), e);
        }
    }

    private WebhookApiException toApiException(Response response, String action) throws IOException {
        ResponseBody responseBody = response.body();
        String detail = responseBody != null ? responseBody.string() : "";
        String message = "GitHub " + action + " failed: HTTP " + response.code()
                + (detail.isBlank() ? "" : " " + abbreviate(detail));
        log.debug("[Webhooks] {}", message);
        if (response.code() == WebhookConflictException.STATUS) {
            return new WebhookConflictException(message);
        }
        return new WebhookApiException(response.code(), message);
    }

    private Request.Builder request(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + github.getToken())
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");
    }

    private HttpUrl repoUrl(String resourceId, String... segments) {
        String[] ownerAndRepo = resourceId.split("/", 2);
        if (ownerAndRepo.length != 2 || ownerAndRepo[0].isBlank() || ownerAndRepo[1].isBlank()) {
            throw new IllegalArgumentException("Repository must be owner/repo: " + resourceId);
        }
        HttpUrl.Builder builder = apiUrl("repos", ownerAndRepo[0], ownerAndRepo[1]).newBuilder();
        for (String segment : segments) {
            builder.addPathSegments(segment);
        }
        return builder.build();
    }

    private HttpUrl apiUrl(String... segments) {
        HttpUrl base = HttpUrl.get(github.getApiUrl());
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    record CreateHookRequest(String name, boolean active, List<String> events, HookConfig config) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record HookConfig(String url,
            @JsonProperty("content_type") String contentType,
            @JsonProperty("insecure_ssl") String insecureSsl,
            String secret) {
    }
}
