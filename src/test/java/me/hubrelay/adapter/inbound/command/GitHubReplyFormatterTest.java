package me.hubrelay.adapter.inbound.command;

import me.hubrelay.domain.model.NotifyFlags;
import me.hubrelay.domain.model.RelaySettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GitHubReplyFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GitHubReplyFormatter formatter = new GitHubReplyFormatter();

    // ==================== Timestamps ====================

    @Test
    void shouldFormatIsoTimestampInUtc() {
        assertEquals("2024-03-05 14:07 UTC", GitHubReplyFormatter.formatTimestamp("2024-03-05T14:07:59Z"));
        assertEquals("2024-03-05 12:07 UTC", GitHubReplyFormatter.formatTimestamp("2024-03-05T14:07:00+02:00"));
    }

    @Test
    void shouldFallBackToUnknownDate() {
        assertEquals("Unknown date", GitHubReplyFormatter.formatTimestamp("yesterday"));
        assertEquals("Unknown date", GitHubReplyFormatter.formatTimestamp(""));
        assertEquals("Unknown date", GitHubReplyFormatter.formatTimestamp(null));
    }

    @Test
    void shouldFormatEpochSeconds() {
        assertEquals("1970-01-01 00:01 UTC", GitHubReplyFormatter.formatEpochSeconds(60));
    }

    // ==================== Descriptions ====================

    @Test
    void shouldTruncateLongDescriptions() {
        String longText = "x".repeat(150);

        String truncated = GitHubReplyFormatter.truncate(longText);

        assertEquals(103, truncated.length());
        assertTrue(truncated.endsWith("..."));
        assertEquals("short", GitHubReplyFormatter.truncate("short"));
        assertEquals("y".repeat(100), GitHubReplyFormatter.truncate("y".repeat(100)));
    }

    @Test
    void shouldEscapeTruncatedSearchDescription() throws Exception {
        JsonNode results = objectMapper.readTree("""
                [{"name":"app","full_name":"octo/app","description":"%s","stargazers_count":7,
                  "html_url":"https://github.com/octo/app"}]
                """.formatted("d".repeat(120)));

        String reply = formatter.formatSearchResults("app", results);

        assertTrue(reply.contains("📝 " + "d".repeat(100) + "\\.\\.\\.\n"));
        assertTrue(reply.contains("⭐ 7 stars • [View](https://github.com/octo/app)"));
    }

    // ==================== Profiles and repositories ====================

    @Test
    void shouldOmitMissingProfileFields() throws Exception {
        JsonNode user = objectMapper.readTree("""
                {"login":"octocat","name":"The Octocat","bio":null,"public_repos":8,"followers":3,"following":1,
                 "created_at":"2011-01-25T18:44:36Z","html_url":"https://github.com/octocat"}
                """);

        String reply = formatter.formatProfile(user);

        assertTrue(reply.startsWith("👤 *GitHub Profile: octocat*\n\n🏷️ *Name:* The Octocat\n"));
        assertFalse(reply.contains("Bio"));
        assertFalse(reply.contains("Location"));
        assertTrue(reply.contains("• 📦 Repositories: 8\n"));
        assertTrue(reply.contains("📅 *Joined:* 2011\\-01\\-25 18:44 UTC\n"));
        assertTrue(reply.endsWith("🔗 [View Profile](https://github.com/octocat)"));
    }

    @Test
    void shouldListRepositoriesWithStars() throws Exception {
        JsonNode repos = objectMapper.readTree("""
                [{"name":"hello-world","stargazers_count":12},{"name":"dotfiles"}]
                """);

        assertEquals("📚 *Repositories:*\n\n📦 *hello\\-world* \\- ⭐ 12 stars\n📦 *dotfiles* \\- ⭐ 0 stars",
                formatter.formatRepositories(repos));
    }

    @Test
    void shouldRenderRepositoryDefaults() throws Exception {
        JsonNode repo = objectMapper.readTree("""
                {"full_name":"octo/app","description":null,"private":true}
                """);

        String reply = formatter.formatRepository(repo);

        assertTrue(reply.contains("📝 *Description:* No description\n"));
        assertTrue(reply.contains("• 💻 Language: Unknown\n"));
        assertTrue(reply.contains("• 🔒 Visibility: Private"));
    }

    // ==================== Commits and issues ====================

    @Test
    void shouldRenderCommitWithShortShaLink() throws Exception {
        JsonNode commits = objectMapper.readTree("""
                [{"sha":"abcdef1234567890","html_url":"https://github.com/octo/app/commit/abcdef1",
                  "commit":{"message":"Fix (parser)","author":{"name":"Ada","date":"2024-01-02T03:04:05Z"}}}]
                """);

        String reply = formatter.formatCommits(new RepositoryRef("octo", "app"), commits);

        assertTrue(reply.startsWith("📝 *Recent Commits for octo/app:*\n\n"));
        assertTrue(reply.contains("🔸 *Fix \\(parser\\)*\n"));
        assertTrue(reply.contains("👤 Ada • 🕒 2024\\-01\\-02 03:04 UTC\n"));
        assertTrue(reply.endsWith("🔗 [`abcdef1`](https://github.com/octo/app/commit/abcdef1)"));
    }

    @Test
    void shouldShowUnknownDateForCommitWithoutDate() throws Exception {
        JsonNode commits = objectMapper.readTree("""
                [{"sha":"abc","commit":{"message":"m","author":{"name":"Ada"}}}]
                """);

        String reply = formatter.formatCommits(new RepositoryRef("octo", "app"), commits);

        assertTrue(reply.contains("🕒 Unknown date"));
        assertTrue(reply.endsWith("🔗 `abc`"));
    }

    @Test
    void shouldMarkClosedIssuesRed() throws Exception {
        JsonNode issues = objectMapper.readTree("""
                [{"number":1,"title":"a","state":"closed","user":{"login":"bob"}}]
                """);

        String reply = formatter.formatIssues(new RepositoryRef("octo", "app"), issues);

        assertTrue(reply.contains("🔴 *\\#1: a*\n👤 bob • 📋 closed"));
    }

    // ==================== Status ====================

    @Test
    void shouldRenderConnectedStatusWithQuota() throws Exception {
        JsonNode rateLimit = objectMapper.readTree("""
                {"resources":{"core":{"limit":5000,"remaining":4990,"reset":60}},
                 "rate":{"limit":5000,"remaining":4990,"reset":60}}
                """);
        RelaySettings settings = RelaySettings.builder()
                .rateLimitRequests(10)
                .rateLimitWindowSeconds(60)
                .notifyFlags(NotifyFlags.all())
                .build();

        String reply = formatter.formatStatus(Optional.of(rateLimit), settings);

        assertTrue(reply.contains("🔧 *GitHub API:* Connected\n"));
        assertTrue(reply.contains("📈 *API Limits:* 4990/5000 remaining\n"));
        assertTrue(reply.contains("🔄 *Reset:* 1970\\-01\\-01 00:01 UTC\n"));
        assertTrue(reply.endsWith("• Releases: Enabled"));
    }

    @Test
    void shouldReadCoreQuotaFromResources() throws Exception {
        JsonNode rateLimit = objectMapper.readTree("""
                {"resources":{"core":{"limit":60,"remaining":59}}}
                """);
        RelaySettings settings = RelaySettings.builder().rateLimitRequests(5).rateLimitWindowSeconds(30).build();

        String reply = formatter.formatStatus(Optional.of(rateLimit), settings);

        assertTrue(reply.contains("📈 *API Limits:* 59/60 remaining\n"));
        assertFalse(reply.contains("Reset"));
        assertTrue(reply.contains("• Rate limit: 5 req/30s\n"));
    }
}
