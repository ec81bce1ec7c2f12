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

package me.hubrelay.infrastructure.i18n;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Access to the user-facing bot texts.
 *
 * <p>
 * Texts are loaded from the {@code messages.properties} resource bundle and
 * support parametric messages using {@link MessageFormat} syntax. A missing
 * key is logged and returned as-is so a broken bundle never breaks a reply.
 *
 * <p>
 * Bundle values are already escaped for Telegram MarkdownV2; arguments are
 * inserted verbatim, so callers escape user-controlled arguments first.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    private static final String BUNDLE_NAME = "messages";

    private final ResourceBundle bundle;

    public MessageService() {
        this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        log.info("Loaded message bundle: {}", BUNDLE_NAME);
    }

    public String getMessage(String key, Object... args) {
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return new MessageFormat(message, Locale.ROOT).format(args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {}", key);
            return key;
        }
    }

    public boolean hasMessage(String key) {
        return bundle.containsKey(key);
    }
}
