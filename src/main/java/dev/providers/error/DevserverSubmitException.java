package dev.providers.error;

/**
 * The initial {@code POST /api/run} failed, so there is no task to poll.
 */
public class DevserverSubmitException extends ProviderException {

    public DevserverSubmitException(String message) {
        super(message);
    }

    public DevserverSubmitException(String message, Throwable cause) {
        super(message, cause);
    }
}
