package dev.providers.backend;

import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;

/**
 * One way of executing a coding-assistance request: local CLI tool, remote API, or devserver.
 */
public interface ProviderBackend {

    /**
     * Execute a prompt and return the normalized result.
     *
     * @param prompt  the full prompt text
     * @param options per-call options; never null
     * @return the normalized result
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
     */
    ProviderResult run(String prompt, RunOptions options);

    /** Get backend display name. */
    String getName();
}
