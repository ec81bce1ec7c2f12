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

package me.hubrelay.port.outbound;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Port for read-only GitHub REST API lookups used by bot commands.
 *
 * <p>
 * Every operation is a fallible lookup: any HTTP error (including 403 and 404),
 * timeout or network fault yields {@link Optional#empty()}. Nothing is retried.
 */
public interface GitHubPort {

    /**
     * Fetch a user profile.
     *
     * @param username
     *            login to look up, or {@code null} for the authenticated user
     */
    Optional<JsonNode> getUser(String username);

    /**
     * Most recently updated repositories of a user, as a JSON array.
     *
     * @param username
     *            login to look up, or {@code null} for the authenticated user
     * @param limit
     *            maximum number of entries (capped at 100)
     */
    Optional<JsonNode> getUserRepositories(String username, int limit);

    Optional<JsonNode> getRepository(String owner, String repo);

    Optional<JsonNode> getCommits(String owner, String repo, int limit);

    Optional<JsonNode> getOpenIssues(String owner, String repo, int limit);

    /**
     * Search repositories ordered by stars, descending.
     */
    Optional<JsonNode> searchRepositories(String query, int limit);

    /**
     * Current API quota of the configured token.
     */
    Optional<JsonNode> getRateLimit();
}
