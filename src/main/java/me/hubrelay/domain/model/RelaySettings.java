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

package me.hubrelay.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration snapshot handed to every core component.
 *
 * <p>
 * Built once at startup from the bound properties. The allow-list doubles as
 * the notification subscriber set: every allowed chat receives every relayed
 * event. An empty allow-list puts command intake in open mode and disables
 * notification fan-out.
 *
 * @since 1.0
 */
@Builder
public record RelaySettings(
        Set<Long> allowedChatIds,
        String webhookSecret,
        int rateLimitRequests,
        int rateLimitWindowSeconds,
        NotifyFlags notifyFlags,
        String githubUsername,
        String serviceName,
        String webhookUrl) {

    public RelaySettings {
        allowedChatIds = allowedChatIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedChatIds));
        notifyFlags = notifyFlags == null ? NotifyFlags.all() : notifyFlags;
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isEmpty();
    }

    /**
     * Delivery targets for notifications, in configuration order.
     */
    public List<Long> subscribers() {
        return List.copyOf(allowedChatIds);
    }
}
