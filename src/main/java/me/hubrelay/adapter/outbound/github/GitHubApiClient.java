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

package me.hubrelay.adapter.outbound.github;

import me.hubrelay.infrastructure.config.RelayProperties;
import me.hubrelay.port.outbound.GitHubPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * GitHub REST API v3 adapter over OkHttp.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /user, /users/{user} - profile</li>
 * <li>GET /user/repos, /users/{user}/repos - repositories, most recently
 * updated first</li>
 * <li>GET /repos/{owner}/{repo} - repository details</li>
 * <li>GET /repos/{owner}/{repo}/commits - latest commits</li>
 * <li>GET /repos/{owner}/{repo}/issues - open issues</li>
 * <li>GET /search/repositories - search ordered by stars</li>
 * <li>GET /rate_limit - API quota</li>
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code relay.github.token} - personal access token</li>
 * <li>{@code relay.github.api-url} - API base URL</li>
 * <li>{@code relay.github.timeout-seconds} - per-call timeout</li>
 * </ul>
 *
 * <p>
 * Only HTTP 200 counts as success. Every other status, timeout or I/O failure
 * is logged and returned as {@link Optional#empty()}.
 *
 * @see GitHubPort
 */
@Component
@Slf4j
public class GitHubApiClient implements GitHubPort {

    static final String ACCEPT = "application/vnd.github.v3+json";
    static final String USER_AGENT = "hubrelay/1.0";
    private static final int MAX_PER_PAGE = 100;

    private final RelayProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubApiClient(RelayProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getGithub().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public Optional<JsonNode> getUser(String username) {
        if (isBlank(username)) {
            return get(Map.of(), "user");
        }
        return get(Map.of(), "users", username);
    }

    @Override
    public Optional<JsonNode> getUserRepositories(String username, int limit) {
        Map<String, String> params = Map.of("sort", "updated", "per_page", perPage(limit));
        if (isBlank(username)) {
            return get(params, "user", "repos");
        }
        return get(params, "users", username, "repos");
    }

    @Override
    public Optional<JsonNode> getRepository(String owner, String repo) {
        return get(Map.of(), "repos", owner, repo);
    }

    @Override
    public Optional<JsonNode> getCommits(String owner, String repo, int limit) {
        return get(Map.of("per_page", perPage(limit)), "repos", owner, repo, "commits");
    }

    @Override
    public Optional<JsonNode> getOpenIssues(String owner, String repo, int limit) {
        return get(Map.of("state", "open", "per_page", perPage(limit)), "repos", owner, repo, "issues");
    }

    @Override
    public Optional<JsonNode> searchRepositories(String query, int limit) {
        Map<String, String> params = Map.of(
                "q", query,
                "sort", "stars",
                "order", "desc",
                "per_page", perPage(limit));
        return get(params, "search", "repositories")
                .map(result -> result.path("items"))
                .filter(JsonNode::isArray);
    }

    @Override
    public Optional<JsonNode> getRateLimit() {
        return get(Map.of(), "rate_limit");
    }

    private Optional<JsonNode> get(Map<String, String> params, String... segments) {
        HttpUrl base = HttpUrl.parse(properties.getGithub().getApiUrl());
        if (base == null) {
            log.error("[GitHub] Invalid API URL: {}", properties.getGithub().getApiUrl());
            return Optional.empty();
        }
        HttpUrl.Builder urlBuilder = base.newBuilder();
        for (String segment : segments) {
            urlBuilder.addPathSegment(segment);
        }
        params.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> urlBuilder.addQueryParameter(e.getKey(), e.getValue()));
        HttpUrl url = urlBuilder.build();

        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .get()
                .header("Accept", ACCEPT)
                .header("User-Agent", USER_AGENT);
        String token = properties.getGithub().getToken();
        if (!isBlank(token)) {
            requestBuilder.header("Authorization", "token " + token);
        }

        String endpoint = url.encodedPath();
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (response.code() == 200 && body != null) {
                return Optional.ofNullable(objectMapper.readTree(body.string()))
                        .filter(node -> !node.isMissingNode());
            }
            if (response.code() == 404) {
                log.warn("[GitHub] Resource not found: {}", endpoint);
            } else if (response.code() == 403) {
                log.error("[GitHub] API rate limit exceeded or forbidden: {}", endpoint);
            } else {
                log.error("[GitHub] API error {} for {}", response.code(), endpoint);
            }
            return Optional.empty();
        } catch (IOException e) {
            log.error("[GitHub] Request error for {}: {}", endpoint, e.getMessage());
            return Optional.empty();
        }
    }

    private static String perPage(int limit) {
        return String.valueOf(Math.max(1, Math.min(limit, MAX_PER_PAGE)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
