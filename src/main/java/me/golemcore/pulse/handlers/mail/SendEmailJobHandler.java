package me.golemcore.pulse.handlers.mail;

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

import me.golemcore.pulse.domain.component.JobHandler;
import me.golemcore.pulse.domain.exception.JobValidationException;
import me.golemcore.pulse.domain.model.JobContext;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.domain.service.JobRunner;
import me.golemcore.pulse.domain.service.Notifier;
import me.golemcore.pulse.port.outbound.MailSenderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@code send_email} jobs: deliver a plain-text email through
 * {@link MailSenderPort}, then confirm with an info notification.
 *
 * <p>
 * Payload: {@code to} (comma-separated), {@code subject}, {@code body}, optional
 * {@code cc}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendEmailJobHandler implements JobHandler {

    public static final String TYPE = "send_email";
    static final String PARAM_TO = "to";
    static final String PARAM_CC = "cc";
    static final String PARAM_SUBJECT = "subject";
    static final String PARAM_BODY = "body";

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private final MailSenderPort mailSender;
    private final Notifier notifier;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public boolean isEnabled() {
        return mailSender.isAvailable();
    }

    @Override
    public void validate(Map<String, Object> payload) {
        Object to = payload.get(PARAM_TO);
        if (to == null || to.toString().isBlank()) {
            throw new JobValidationException("Recipient (to) is required");
        }
        validateRecipients(to.toString());
        Object cc = payload.get(PARAM_CC);
        if (cc != null && !cc.toString().isBlank()) {
            validateRecipients(cc.toString());
        }
        Object subject = payload.get(PARAM_SUBJECT);
        if (subject == null || subject.toString().isBlank()) {
            throw new JobValidationException("Subject is required");
        }
    }

    @Override
    public void handle(JobContext context) {
        String to = context.getString(PARAM_TO);
        String subject = context.getString(PARAM_SUBJECT);
        mailSender.send(to, context.getString(PARAM_CC), subject, context.getString(PARAM_BODY));

        notifier.notify(NotificationRequest.builder()
                .subjectId(context.ownerId())
                .source(JobRunner.NOTIFICATION_SOURCE)
                .sourceEventId(context.cycleKey())
                .priority(NotificationPriority.INFO)
                .title("[OK] Scheduled email sent")
                .body("To: " + to + "\nSubject: " + subject)
                .build());
        log.info("[Jobs] Email sent to {}: \"{}\"", to, subject);
    }

    static void validateRecipients(String recipients) {
        List<String> invalid = new ArrayList<>();
        for (String address : recipients.split(",")) {
            String trimmed = address.trim();
            if (!EMAIL_PATTERN.matcher(trimmed).matches()) {
                invalid.add(trimmed);
            }
        }
        if (!invalid.isEmpty()) {
            throw new JobValidationException("Invalid email address: " + String.join(", ", invalid));
        }
    }
}
