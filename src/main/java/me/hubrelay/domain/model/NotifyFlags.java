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

/**
 * Per-event-type notification switches. {@code ping} events are not gated by
 * these flags.
 */
public record NotifyFlags(
        boolean push,
        boolean issues,
        boolean pullRequests,
        boolean releases) {

    public static NotifyFlags all() {
        return new NotifyFlags(true, true, true, true);
    }

    public static NotifyFlags none() {
        return new NotifyFlags(false, false, false, false);
    }
}
