package dev.providers.error;

/**
 * Either the provider's own per-minute window denied the call, or the remote
 * endpoint kept answering 429 until retries ran out.
 */
public class RateLimitExceededException extends ProviderException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
