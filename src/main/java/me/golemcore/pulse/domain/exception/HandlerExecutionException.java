package me.golemcore.pulse.domain.exception;

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

/**
 * A job handler threw or exceeded its timeout. The message is the one shown in
 * the failure notification.
 */
public class HandlerExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean timedOut;

    public HandlerExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    private HandlerExecutionException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public static HandlerExecutionException timeout(String jobType, long timeoutMillis) {
        return new HandlerExecutionException(
                "Handler '" + jobType + "' timed out after " + timeoutMillis + " ms", true);
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
