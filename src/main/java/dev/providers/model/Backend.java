package dev.providers.model;

import java.util.List;

/**
 * Where a provider's requests are executed.
 * Exactly one of three forms: local CLI tool, remote chat-completion API, or devserver.
 */
public sealed interface Backend {

    /** Config string naming this variant ("local", "remoteApi", "devserver"). */
    String kind();

    /** A command-line tool spawned once per request; the prompt is the last argument. */
    record Local(
        String command,
        List<String> args,
        String sandboxFlag // nullable: flag that carries RunOptions.sandbox, e.g. "--sandbox"
    ) implements Backend {
        public Local {
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public String kind() { return "local"; }
    }

    /** An OpenAI-compatible {@code /v1/chat/completions} endpoint. */
    record RemoteApi(
        String baseUrl,
        String model,
        int maxRetries,
        long retryDelayMs
    ) implements Backend {
        public static final int DEFAULT_MAX_RETRIES = 3;
        public static final long DEFAULT_RETRY_DELAY_MS = 1000;

        public RemoteApi(String baseUrl, String model) {
            this(baseUrl, model, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MS);
        }

        @Override
        public String kind() { return "remoteApi"; }
    }

    /** A devserver that runs the request asynchronously and is polled for the result. */
    record Devserver(
        String url,
        String remoteProvider, // nullable: provider name on the devserver side, defaults to descriptor name
        long pollIntervalMs,
        long maxPollTimeMs
    ) implements Backend {
        public static final long DEFAULT_POLL_INTERVAL_MS = 1000;
        public static final long DEFAULT_MAX_POLL_TIME_MS = 300_000;

        public Devserver(String url) {
            this(url, null, DEFAULT_POLL_INTERVAL_MS, DEFAULT_MAX_POLL_TIME_MS);
        }

        @Override
        public String kind() { return "devserver"; }
    }
}
