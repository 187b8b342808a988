package dev.providers.engine;

import dev.providers.error.ConfigValidationException;
import dev.providers.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderLoaderTest {

    private static final String CONFIG = """
        {
          "providers": [
            {
              "name": "claude",
              "kind": "local",
              "command": "claude",
              "args": ["-p", "--output-format", "json"],
              "capabilities": ["review", "code-gen"]
            },
            {
              "name": "codex",
              "kind": "local",
              "command": "codex",
              "args": ["exec", "--json"],
              "sandboxFlag": "--sandbox",
              "pricing": { "inputPerMillion": 10.0, "outputPerMillion": 40.0 }
            },
            {
              "name": "deepseek",
              "kind": "remoteApi",
              "baseUrl": "https://api.deepseek.com",
              "model": "deepseek-coder",
              "maxRetries": 5,
              "pricing": { "input": 0.00014, "output": 0.00028, "unit": "1K" },
              "rateLimits": { "requestsPerMinute": 60, "tokensPerMinute": 100000 },
              "capabilities": ["review"]
            },
            {
              "name": "devserver-claude",
              "kind": "devserver",
              "devserverUrl": "https://devserver.example.com",
              "remoteProvider": "claude",
              "pollIntervalMs": 500
            }
          ]
        }
        """;

    @Test
    void loadsAllThreeKinds() {
        Map<String, ProviderDescriptor> providers = ProviderLoader.loadFromString(CONFIG);

        assertThat(providers).containsOnlyKeys("claude", "codex", "deepseek", "devserver-claude");
        assertThat(providers.keySet()).containsExactly("claude", "codex", "deepseek", "devserver-claude");

        ProviderDescriptor claude = providers.get("claude");
        assertThat(claude.kind()).isEqualTo("local");
        assertThat(claude.backend()).isInstanceOf(Backend.Local.class);
        assertThat(((Backend.Local) claude.backend()).args()).containsExactly("-p", "--output-format", "json");
        assertThat(claude.capabilities()).containsExactlyInAnyOrder("review", "code-gen");
        assertThat(claude.pricing()).isNull();
        assertThat(claude.rateLimits()).isNull();

        var codex = (Backend.Local) providers.get("codex").backend();
        assertThat(codex.sandboxFlag()).isEqualTo("--sandbox");
        assertThat(providers.get("codex").pricing()).isEqualTo(Pricing.perMillion(10.0, 40.0));

        ProviderDescriptor deepseek = providers.get("deepseek");
        var api = (Backend.RemoteApi) deepseek.backend();
        assertThat(api.baseUrl()).isEqualTo("https://api.deepseek.com");
        assertThat(api.model()).isEqualTo("deepseek-coder");
        assertThat(api.maxRetries()).isEqualTo(5);
        assertThat(api.retryDelayMs()).isEqualTo(Backend.RemoteApi.DEFAULT_RETRY_DELAY_MS);
        assertThat(deepseek.pricing().unit()).isEqualTo(PricingUnit.PER_THOUSAND);
        assertThat(deepseek.rateLimits()).isEqualTo(new RateLimits(60, 100_000));

        var devserver = (Backend.Devserver) providers.get("devserver-claude").backend();
        assertThat(devserver.url()).isEqualTo("https://devserver.example.com");
        assertThat(devserver.remoteProvider()).isEqualTo("claude");
        assertThat(devserver.pollIntervalMs()).isEqualTo(500);
        assertThat(devserver.maxPollTimeMs()).isEqualTo(Backend.Devserver.DEFAULT_MAX_POLL_TIME_MS);
    }

    @Test
    void acceptsBareArrayAndLegacyKindNames() {
        String json = """
            [
              { "name": "gemini", "type": "cli", "command": "gemini", "headlessArgs": ["-p"] },
              { "name": "mistral", "type": "api", "baseUrl": "https://api.mistral.ai", "model": "mistral-large" }
            ]
            """;

        Map<String, ProviderDescriptor> providers = ProviderLoader.loadFromString(json);

        assertThat(providers.get("gemini").kind()).isEqualTo("local");
        assertThat(((Backend.Local) providers.get("gemini").backend()).args()).containsExactly("-p");
        assertThat(providers.get("mistral").kind()).isEqualTo("remoteApi");
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("providers.json");
        Files.writeString(file, CONFIG);

        assertThat(ProviderLoader.loadFromFile(file)).hasSize(4);
    }

    @Test
    void rejectsUnknownKind() {
        String json = """
            { "providers": [ { "name": "x", "kind": "carrier-pigeon" } ] }
            """;

        assertThatThrownBy(() -> ProviderLoader.loadFromString(json))
            .isInstanceOf(ConfigValidationException.class)
            .hasMessageContaining("unknown kind 'carrier-pigeon'");
    }

    @Test
    void reportsEveryInvalidProvider() {
        String json = """
            { "providers": [
                { "name": "a", "kind": "local" },
                { "name": "b", "kind": "remoteApi", "model": "m" },
                { "kind": "devserver", "devserverUrl": "https://d.example" }
            ] }
            """;

        assertThatThrownBy(() -> ProviderLoader.loadFromString(json))
            .isInstanceOf(ConfigValidationException.class)
            .satisfies(e -> assertThat(((ConfigValidationException) e).errors()).hasSize(3));
    }

    @Test
    void rejectsDuplicateNames() {
        String json = """
            [
              { "name": "claude", "kind": "local", "command": "claude" },
              { "name": "claude", "kind": "local", "command": "claude" }
            ]
            """;

        assertThatThrownBy(() -> ProviderLoader.loadFromString(json))
            .isInstanceOf(ConfigValidationException.class)
            .hasMessageContaining("Duplicate provider name: claude");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> ProviderLoader.loadFromString("{ not json"))
            .isInstanceOf(ConfigValidationException.class)
            .hasMessageContaining("Malformed JSON");
    }
}
