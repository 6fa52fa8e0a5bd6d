package me.golemcore.pulse.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the pulse engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pulse.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where the durable store lives</li>
 * <li>{@link LoopsProperties} - per-loop tick intervals</li>
 * <li>{@link JobsProperties} - handler timeout and creation tolerance</li>
 * <li>{@link NotificationsProperties} - dedup retention</li>
 * <li>{@link WebhooksProperties} - public endpoint and GitHub access</li>
 * <li>{@link MailProperties} - SMTP/IMAP credentials</li>
 * <li>{@link CalendarProperties} - upcoming-meeting alerts</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pulse")
@Data
public class PulseProperties {

    private boolean enabled = true;
    private String defaultSubject = "system";
    private List<String> subjects = new ArrayList<>();
    private StorageProperties storage = new StorageProperties();
    private LoopsProperties loops = new LoopsProperties();
    private JobsProperties jobs = new JobsProperties();
    private NotificationsProperties notifications = new NotificationsProperties();
    private WebhooksProperties webhooks = new WebhooksProperties();
    private MailProperties mail = new MailProperties();
    private CalendarProperties calendar = new CalendarProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/pulse";
    }

    @Data
    public static class LoopsProperties {
        private Duration jobs = Duration.ofSeconds(30);
        private Duration reminders = Duration.ofSeconds(10);
        private Duration mailbox = Duration.ofMinutes(5);
        private Duration calendar = Duration.ofMinutes(10);
        private Duration repositories = Duration.ofMinutes(10);
        private Duration cleanup = Duration.ofHours(1);
    }

    @Data
    public static class JobsProperties {
        private Duration handlerTimeout = Duration.ofMinutes(2);
        private Duration creationGrace = Duration.ofSeconds(60);
        private int workerThreads = 2;
    }

    @Data
    public static class NotificationsProperties {
        private Duration retention = Duration.ofDays(30);
    }

    // ==================== WEBHOOKS ====================

    @Data
    public static class WebhooksProperties {
        private boolean enabled = false;
        private String publicUrl = "";
        private String tunnelApiUrl = "http://127.0.0.1:4040";
        private String callbackPath = "/webhooks/github";
        private String secret = "";
        private GitHubProperties github = new GitHubProperties();
    }

    @Data
    public static class GitHubProperties {
        private String apiUrl = "https://api.github.com";
        private String token = "";
        private int repositoryLimit = 50;
        private List<String> events = new ArrayList<>(List.of("push", "issues"));
    }

    // ==================== MAIL ====================

    @Data
    public static class MailProperties {
        private SmtpProperties smtp = new SmtpProperties();
        private ImapProperties imap = new ImapProperties();
    }

    @Data
    public static class SmtpProperties {
        private boolean enabled = false;
        private String host = "";
        private int port = 587;
        private String username = "";
        private String password = "";
        private String security = "starttls";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class ImapProperties {
        private boolean enabled = false;
        private String host = "";
        private int port = 993;
        private String username = "";
        private String password = "";
        private String security = "ssl";
        private String folder = "INBOX";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
        private int maxMessages = 10;
        private Duration lookback = Duration.ofHours(1);
        private List<String> ignoredSubjectMarkers = new ArrayList<>(
                List.of("pulse", "push summary:", "security alert:", "pr for #"));
    }

    // ==================== CALENDAR ====================

    @Data
    public static class CalendarProperties {
        private boolean enabled = false;
        private String apiUrl = "https://www.googleapis.com/calendar/v3";
        private String calendarId = "primary";
        private String accessToken = "";
        private Duration lookahead = Duration.ofMinutes(20);
        private Duration notifyWithin = Duration.ofMinutes(17);
        private int maxResults = 5;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
