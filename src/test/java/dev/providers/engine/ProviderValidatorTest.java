package dev.providers.engine;

import dev.providers.error.ConfigValidationException;
import dev.providers.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderValidatorTest {

    @Test
    void validDescriptorsReturnNoErrors() {
        var local = ProviderDescriptor.of("claude", new Backend.Local("claude", List.of("-p"), null));
        var api = ProviderDescriptor.of("deepseek", new Backend.RemoteApi("https://api.deepseek.com", "deepseek-coder"));
        var devserver = ProviderDescriptor.of("remote-claude", new Backend.Devserver("http://devserver.local:3000"));

        assertThat(ProviderValidator.validate(local)).isEmpty();
        assertThat(ProviderValidator.validate(api)).isEmpty();
        assertThat(ProviderValidator.validate(devserver)).isEmpty();
    }

    @Test
    void detectsMissingName() {
        var descriptor = ProviderDescriptor.of(" ", new Backend.Local("claude", List.of(), null));

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("name is required"));
    }

    @Test
    void detectsMissingKind() {
        var descriptor = ProviderDescriptor.of("claude", null);

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("has no kind"));
    }

    @Test
    void localRequiresCommand() {
        var descriptor = ProviderDescriptor.of("claude", new Backend.Local(null, List.of("-p"), null));

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("require a command"));
    }

    @Test
    void remoteApiRequiresBaseUrl() {
        var descriptor = ProviderDescriptor.of("deepseek", new Backend.RemoteApi(null, "deepseek-coder"));

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("baseUrl is required"));
    }

    @Test
    void devserverRequiresUrl() {
        var descriptor = ProviderDescriptor.of("remote", new Backend.Devserver(""));

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("devserverUrl is required"));
    }

    @Test
    void rejectsNonHttpUrl() {
        var descriptor = ProviderDescriptor.of("deepseek", new Backend.RemoteApi("ftp://api.deepseek.com", "m"));

        assertThat(ProviderValidator.validate(descriptor)).anyMatch(e -> e.contains("absolute http(s) URL"));
    }

    @Test
    void rejectsBadRetryAndPollSettings() {
        var api = ProviderDescriptor.of("api", new Backend.RemoteApi("https://x.example", "m", 0, -1));
        var devserver = ProviderDescriptor.of("dev", new Backend.Devserver("https://x.example", null, 0, 0));

        assertThat(ProviderValidator.validate(api)).hasSize(2);
        assertThat(ProviderValidator.validate(devserver)).hasSize(2);
    }

    @Test
    void rejectsNegativePricingAndLimits() {
        var descriptor = new ProviderDescriptor("api", new Backend.RemoteApi("https://x.example", "m"),
            Pricing.perMillion(-1, 2), new RateLimits(-5, 0), Set.of(), null);

        var errors = ProviderValidator.validate(descriptor);

        assertThat(errors).anyMatch(e -> e.contains("pricing must not be negative"));
        assertThat(errors).anyMatch(e -> e.contains("rate limits must not be negative"));
    }

    @Test
    void requireValidThrowsWithAllErrors() {
        var descriptor = ProviderDescriptor.of("", new Backend.Local("", List.of(), null));

        assertThatThrownBy(() -> ProviderValidator.requireValid(descriptor))
            .isInstanceOf(ConfigValidationException.class)
            .satisfies(e -> assertThat(((ConfigValidationException) e).errors()).hasSize(2));
    }
}
