package me.golemcore.pulse.domain.component;

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

import me.golemcore.pulse.domain.model.JobContext;

import java.util.Map;

/**
 * Executes jobs of one type. Handlers are collected into a
 * {@link me.golemcore.pulse.domain.service.JobHandlerRegistry} keyed by
 * {@link #getType()} and dispatched by the job runner.
 *
 * <p>
 * A job is re-run after a crash mid-execution, so handlers must be safe to
 * retry at the job granularity. Blocking I/O is allowed; the runner bounds each
 * call with a timeout.
 */
public interface JobHandler extends Component {

    @Override
    default String getComponentType() {
        return "job-handler";
    }

    /**
     * Job type tag this handler serves, e.g. {@code "reminder"}.
     */
    String getType();

    /**
     * Checks a payload before the job is accepted. Default accepts anything.
     *
     * @throws me.golemcore.pulse.domain.exception.JobValidationException
     *             if the payload cannot be executed
     */
    default void validate(Map<String, Object> payload) {
        // Default no-op
    }

    /**
     * Executes one cycle of the job. Any exception marks the cycle failed and
     * its message is shown in the failure notification.
     */
    void handle(JobContext context) throws Exception;
}
