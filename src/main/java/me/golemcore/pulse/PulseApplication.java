package me.golemcore.pulse;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Pulse.
 *
 * <p>
 * Pulse is the autonomous background engine of the assistant. It runs
 * independently of any foreground conversation and keeps a set of periodic
 * loops alive.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Scheduled Jobs</b> - one-time and recurring (hourly, daily, weekly)
 * jobs dispatched to pluggable handlers</li>
 * <li><b>Crash Recovery</b> - jobs left running by an unclean shutdown are
 * made eligible again on start</li>
 * <li><b>Deduplicated Notifications</b> - a durable ledger guarantees at most
 * one notification per event</li>
 * <li><b>Webhook Upkeep</b> - repository webhooks follow the current public
 * endpoint</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, GitHub webhook receiver
 * Domain Layer       → LoopOrchestrator, JobRunner, Notifier, DedupLedger
 * Infrastructure     → Storage/Mail/GitHub/Tunnel adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code pulse.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseApplication.class, args);
    }

}
