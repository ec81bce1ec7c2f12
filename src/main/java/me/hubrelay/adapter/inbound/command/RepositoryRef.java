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

package me.hubrelay.adapter.inbound.command;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A validated {@code owner/repo} reference.
 */
public record RepositoryRef(String owner, String repo) {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    /**
     * Parse {@code owner/repo}. Both parts must be non-empty and consist of
     * letters, digits, {@code .}, {@code _} or {@code -}.
     */
    public static Optional<RepositoryRef> parse(String path) {
        if (path == null) {
            return Optional.empty();
        }
        int slash = path.indexOf('/');
        if (slash < 0) {
            return Optional.empty();
        }
        String owner = path.substring(0, slash);
        String repo = path.substring(slash + 1);
        if (!NAME_PATTERN.matcher(owner).matches() || !NAME_PATTERN.matcher(repo).matches()) {
            return Optional.empty();
        }
        return Optional.of(new RepositoryRef(owner, repo));
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
