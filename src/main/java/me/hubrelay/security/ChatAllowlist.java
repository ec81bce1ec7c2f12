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

package me.hubrelay.security;

import me.hubrelay.domain.model.RelaySettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Validates chats against the configured allow-list.
 *
 * <p>
 * If the allow-list is empty, every chat is permitted (open mode). Otherwise a
 * chat is permitted only if its id is on the list. The list is fixed at
 * startup.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatAllowlist {

    private final RelaySettings settings;

    /**
     * Check if a chat may use the bot.
     */
    public boolean isAllowed(long chatId) {
        boolean allowed = isAllowed(chatId, settings.allowedChatIds());
        if (!allowed) {
            log.warn("[Security] Unauthorized chat: {}", chatId);
        }
        return allowed;
    }

    public static boolean isAllowed(long chatId, Set<Long> allowList) {
        if (allowList == null || allowList.isEmpty()) {
            return true;
        }
        return allowList.contains(chatId);
    }
}
