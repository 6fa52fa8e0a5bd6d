package me.golemcore.pulse.handlers;

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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@code reminder} jobs: raise an important notification with the payload's
 * title and body. Each scheduled cycle of a recurring reminder notifies once.
 */
@Component
@RequiredArgsConstructor
public class ReminderJobHandler implements JobHandler {

    public static final String TYPE = "reminder";
    static final String PARAM_TITLE = "title";
    static final String PARAM_BODY = "body";
    private static final String DEFAULT_TITLE = "Scheduled Reminder";

    private final Notifier notifier;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void validate(Map<String, Object> payload) {
        Object title = payload.get(PARAM_TITLE);
        if (title == null || title.toString().isBlank()) {
            throw new JobValidationException("Reminder title is required");
        }
    }

    @Override
    public void handle(JobContext context) {
        String title = context.getString(PARAM_TITLE);
        String body = context.getString(PARAM_BODY);
        notifier.notify(NotificationRequest.builder()
                .subjectId(context.ownerId())
                .source(JobRunner.NOTIFICATION_SOURCE)
                .sourceEventId(context.cycleKey())
                .priority(NotificationPriority.IMPORTANT)
                .title("[Reminder] " + (title != null ? title : DEFAULT_TITLE))
                .body(body != null ? body : (title != null ? title : ""))
                .build());
    }
}
