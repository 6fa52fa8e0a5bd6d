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

import me.golemcore.pulse.domain.model.DedupRecord;
import me.golemcore.pulse.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Durable "already notified" ledger keyed by
 * {@code (subjectId, source, sourceEventId)}.
 *
 * <p>
 * {@link #shouldNotify} is a check-and-insert under the ledger monitor and is
 * persisted before it returns true, so a key is never reported as new twice,
 * even across restarts.
 */
@Service
@Slf4j
public class DedupLedger {

    private static final String LEDGER_DIR = "notifications";
    private static final String LEDGER_FILE = "ledger.json";
    private static final TypeReference<List<DedupRecord>> RECORD_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Map<DedupRecord.Key, DedupRecord> recordsCache;

    public DedupLedger(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Records the key if absent.
     *
     * @return true only for the first caller presenting this key
     * @throws IllegalStateException
     *             if the record could not be persisted; the key stays absent
     */
    public synchronized boolean shouldNotify(String subjectId, String source, String sourceEventId) {
        DedupRecord candidate = DedupRecord.builder()
                .subjectId(subjectId)
                .source(source)
                .sourceEventId(sourceEventId)
                .loggedAt(clock.instant())
                .build();
        DedupRecord.Key key = candidate.key();
        if (records().containsKey(key)) {
            log.debug("[Notifier] Already notified: {}/{}/{}", subjectId, source, sourceEventId);
            return false;
        }

        Map<DedupRecord.Key, DedupRecord> next = new LinkedHashMap<>(records());
        next.put(key, candidate);
        persist(next);
        return true;
    }

    public synchronized boolean contains(String subjectId, String source, String sourceEventId) {
        return records().containsKey(new DedupRecord.Key(subjectId, source, sourceEventId));
    }

    /**
     * Drops records logged before {@code cutoff}.
     *
     * @return number of purged records
     */
    public synchronized int purgeOlderThan(Instant cutoff) {
        Map<DedupRecord.Key, DedupRecord> next = new LinkedHashMap<>();
        for (Map.Entry<DedupRecord.Key, DedupRecord> entry : records().entrySet()) {
            if (!entry.getValue().getLoggedAt().isBefore(cutoff)) {
                next.put(entry.getKey(), entry.getValue());
            }
        }
        int purged = records().size() - next.size();
        if (purged > 0) {
            persist(next);
            log.info("[Notifier] Purged {} dedup record(s) older than {}", purged, cutoff);
        }
        return purged;
    }

    public synchronized int size() {
        return records().size();
    }

    private Map<DedupRecord.Key, DedupRecord> records() {
        if (recordsCache == null) {
            recordsCache = loadRecords();
        }
        return recordsCache;
    }

    private void persist(Map<DedupRecord.Key, DedupRecord> next) {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(next.values()));
            storagePort.putTextAtomic(LEDGER_DIR, LEDGER_FILE, json, true).join();
            recordsCache = next;
        } catch (JsonProcessingException | CompletionException e) {
            throw new IllegalStateException("Failed to persist dedup ledger", e);
        }
    }

    private Map<DedupRecord.Key, DedupRecord> loadRecords() {
        Map<DedupRecord.Key, DedupRecord> loaded = new LinkedHashMap<>();
        try {
            String json = storagePort.getText(LEDGER_DIR, LEDGER_FILE).join();
            if (json != null && !json.isBlank()) {
                for (DedupRecord record : objectMapper.readValue(json, RECORD_LIST_TYPE_REF)) {
                    loaded.put(record.key(), record);
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start empty rather than fail boot
            log.warn("[Notifier] No dedup ledger found or failed to parse: {}", e.getMessage());
        }
        return loaded;
    }
}
