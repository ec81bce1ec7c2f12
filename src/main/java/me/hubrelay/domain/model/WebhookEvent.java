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

import java.nio.charset.StandardCharsets;

/**
 * One inbound webhook delivery as received: the event type header, the raw
 * body bytes exactly as signed, and the signature header (may be
 * {@code null}).
 */
public record WebhookEvent(
        String eventType,
        byte[] rawBody,
        String signatureHeader) {

    public WebhookEvent {
        rawBody = rawBody == null ? new byte[0] : rawBody.clone();
    }

    @Override
    public byte[] rawBody() {
        return rawBody.clone();
    }

    public String bodyAsString() {
        return new String(rawBody, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "WebhookEvent[eventType=" + eventType + ", bytes=" + rawBody.length + "]";
    }
}
