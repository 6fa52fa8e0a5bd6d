package me.golemcore.pulse.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Idempotency entry proving that a notification for
 * {@code (subjectId, source, sourceEventId)} has been emitted. Records are
 * persisted in {@code notifications/ledger.json}, never updated, and purged
 * after the retention window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DedupRecord {

    private String subjectId;
    private String source;
    private String sourceEventId;
    private Instant loggedAt;

    public Key key() {
        return new Key(subjectId, source, sourceEventId);
    }

    /**
     * Composite identity of a record.
     */
    public record Key(String subjectId, String source, String sourceEventId) {
    }
}
