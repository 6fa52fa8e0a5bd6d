package me.golemcore.pulse.port.outbound;

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

import me.golemcore.pulse.domain.model.RemoteHook;

import java.util.List;

/**
 * Port to the system hosting the external resources that call us back (GitHub
 * repositories).
 *
 * <p>
 * Every method throws {@link me.golemcore.pulse.domain.exception.WebhookApiException}
 * for a non-success status and
 * {@link me.golemcore.pulse.domain.exception.TransientExternalException} for
 * transport failures.
 */
public interface WebhookHostPort {

    boolean isAvailable();

    /**
     * Resources owned by the configured account, e.g. {@code owner/repo}.
     */
    List<String> listResources();

    List<RemoteHook> listHooks(String resourceId);

    RemoteHook createHook(String resourceId, String callbackUrl);

    void deleteHook(String resourceId, String hookId);

    /**
     * Whether a path exists in the resource's default branch.
     */
    boolean pathExists(String resourceId, String path);
}
