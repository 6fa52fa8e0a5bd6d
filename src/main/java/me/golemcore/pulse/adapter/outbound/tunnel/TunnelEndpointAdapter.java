package me.golemcore.pulse.adapter.outbound.tunnel;

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

import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.PublicEndpointPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Public base URL of the engine: the configured {@code pulse.webhooks.public-url}
 * if set, otherwise the first HTTPS tunnel reported by the local tunnel agent
 * API ({@code GET /api/tunnels}).
 */
@Component
@Slf4j
public class TunnelEndpointAdapter implements PublicEndpointPort {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PulseProperties.WebhooksProperties config;

    public TunnelEndpointAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, PulseProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getWebhooks();
    }

    @Override
    public Optional<String> currentBaseUrl() {
        if (config.getPublicUrl() != null && !config.getPublicUrl().isBlank()) {
            return Optional.of(config.getPublicUrl().trim());
        }
        if (config.getTunnelApiUrl() == null || config.getTunnelApiUrl().isBlank()) {
            return Optional.empty();
        }

        Request request = new Request.Builder()
                .url(config.getTunnelApiUrl() + "/api/tunnels")
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.debug("[Tunnel] Tunnel API returned HTTP {}", response.code());
                return Optional.empty();
            }
            return findHttpsTunnel(objectMapper.readTree(body.string()));
        } catch (IOException e) {
            // Tunnel agent not running: the endpoint is simply unknown for now.
            log.debug("[Tunnel] Tunnel API unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> findHttpsTunnel(JsonNode root) {
        for (JsonNode tunnel : root.path("tunnels")) {
            String publicUrl = tunnel.path("public_url").asText("");
            if ("https".equals(tunnel.path("proto").asText()) && !publicUrl.isEmpty()) {
                return Optional.of(publicUrl);
            }
        }
        return Optional.empty();
    }
}
