package dev.providers.error;

/**
 * A {@code GET /api/task/{id}} request failed.
 */
public class DevserverPollException extends ProviderException {

    public DevserverPollException(String message) {
        super(message);
    }

    public DevserverPollException(String message, Throwable cause) {
        super(message, cause);
    }
}
