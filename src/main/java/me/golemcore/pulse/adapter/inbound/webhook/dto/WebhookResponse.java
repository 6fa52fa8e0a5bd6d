package me.golemcore.pulse.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body for inbound repository webhooks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {
    private String status;
    private String event;
    private String repository;
    private String error;

    public static WebhookResponse accepted(String event, String repository) {
        return WebhookResponse.builder().status("accepted").event(event).repository(repository).build();
    }

    public static WebhookResponse ignored(String event) {
        return WebhookResponse.builder().status("ignored").event(event).build();
    }

    public static WebhookResponse error(String message) {
        return WebhookResponse.builder().status("error").error(message).build();
    }
}
