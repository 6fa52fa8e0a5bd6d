package me.golemcore.pulse.adapter.outbound.mail;

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

import me.golemcore.pulse.domain.component.ExternalEventSource;
import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import jakarta.mail.Address;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.ReceivedDateTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Mailbox poller: unread messages received within the lookback window become
 * events, newest first, one per message id.
 *
 * <p>
 * Messages sent by the assistant itself are recognized by subject markers and
 * skipped. Priority is a keyword heuristic on the subject.
 */
@Component
@Slf4j
@SuppressWarnings({ "PMD.ReplaceJavaUtilDate", "PMD.UseTryWithResources" })
public class ImapInboxEventSource implements ExternalEventSource {

    static final String SOURCE = "email";
    private static final List<String> URGENT_KEYWORDS = List.of(
            "urgent", "asap", "emergency", "critical", "deadline", "immediate", "action required");
    private static final List<String> IMPORTANT_KEYWORDS = List.of("invitation", "re:", "meeting");
    private static final String NO_SUBJECT = "(No Subject)";
    private static final int SNIPPET_LENGTH = 200;

    private final PulseProperties.ImapProperties config;
    private final Duration interval;
    private final Clock clock;

    public ImapInboxEventSource(PulseProperties properties, Clock clock) {
        this.config = properties.getMail().getImap();
        this.interval = properties.getLoops().getMailbox();
        this.clock = clock;
    }

    @Override
    public String getSource() {
        return SOURCE;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled()
                && config.getHost() != null && !config.getHost().isBlank()
                && config.getUsername() != null && !config.getUsername().isBlank();
    }

    @Override
    public List<ExternalEvent> poll(String subjectId) {
        try (Store store = connectStore()) {
            Folder folder = store.getFolder(config.getFolder());
            if (!folder.exists()) {
                throw new TransientExternalException("Folder not found: " + config.getFolder());
            }
            folder.open(Folder.READ_ONLY);
            try {
                Date since = Date.from(clock.instant().minus(config.getLookback()));
                Message[] unread = folder.search(new AndTerm(
                        new FlagTerm(new Flags(Flags.Flag.SEEN), false),
                        new ReceivedDateTerm(ComparisonTerm.GE, since)));

                List<ExternalEvent> events = new ArrayList<>();
                int startIdx = Math.max(0, unread.length - config.getMaxMessages());
                for (int i = unread.length - 1; i >= startIdx; i--) {
                    Message message = unread[i];
                    String subject = message.getSubject() != null ? message.getSubject() : NO_SUBJECT;
                    if (isOwnMessage(subject)) {
                        continue;
                    }
                    events.add(toEvent(messageId(folder, message), subject, formatAddress(message.getFrom()),
                            snippet(message)));
                }
                return events;
            } finally {
                folder.close(false);
            }
        } catch (MessagingException e) {
            throw new TransientExternalException("IMAP poll failed: " + e.getMessage(), e);
        }
    }

    Store connectStore() throws MessagingException {
        MailSessionFactory.Security security = MailSessionFactory.Security.parse(config.getSecurity());
        Session session = MailSessionFactory.createImapSession(
                config.getHost(), config.getPort(),
                config.getUsername(), config.getPassword(),
                security, config.getConnectTimeout(), config.getReadTimeout());

        Store store = session.getStore(security.protocol("imap"));
        store.connect(config.getHost(), config.getPort(), config.getUsername(), config.getPassword());
        return store;
    }

    boolean isOwnMessage(String subject) {
        String lower = subject.toLowerCase(Locale.ROOT);
        return config.getIgnoredSubjectMarkers().stream()
                .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }

    static NotificationPriority classify(String subject) {
        String lower = subject == null ? "" : subject.toLowerCase(Locale.ROOT);
        if (URGENT_KEYWORDS.stream().anyMatch(lower::contains)) {
            return NotificationPriority.URGENT;
        }
        if (IMPORTANT_KEYWORDS.stream().anyMatch(lower::contains)) {
            return NotificationPriority.IMPORTANT;
        }
        return NotificationPriority.INFO;
    }

    static ExternalEvent toEvent(String messageId, String subject, String from, String snippet) {
        NotificationPriority priority = classify(subject);
        String prefix = priority == NotificationPriority.URGENT ? "[URGENT] " : "[Email] ";
        return ExternalEvent.builder()
                .sourceEventId(messageId)
                .priority(priority)
                .title(prefix + subject)
                .body("From: " + from + (snippet.isEmpty() ? "" : "\n" + snippet))
                .build();
    }

    private String messageId(Folder folder, Message message) throws MessagingException {
        String[] header = message.getHeader("Message-ID");
        if (header != null && header.length > 0 && !header[0].isBlank()) {
            return header[0].trim();
        }
        UIDFolder uidFolder = (UIDFolder) folder;
        return uidFolder.getUIDValidity() + ":" + uidFolder.getUID(message);
    }

    private String snippet(Message message) throws MessagingException {
        try {
            Object content = message.getContent();
            if (!(content instanceof String text)) {
                return "";
            }
            String collapsed = text.replaceAll("\\s+", " ").trim();
            return collapsed.length() > SNIPPET_LENGTH ? collapsed.substring(0, SNIPPET_LENGTH) + "..." : collapsed;
        } catch (IOException e) {
            log.debug("[IMAP] Could not read body: {}", e.getMessage());
            return "";
        }
    }

    private static String formatAddress(Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return "Unknown";
        }
        return Arrays.stream(addresses)
                .map(a -> a instanceof InternetAddress internet ? internet.toUnicodeString() : a.toString())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Unknown");
    }
}
