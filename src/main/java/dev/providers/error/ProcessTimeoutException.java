package dev.providers.error;

/**
 * The local command ran past its wall-clock timeout and was sent a termination signal.
 */
public class ProcessTimeoutException extends ProviderException {

    private final long timeoutMs;

    public ProcessTimeoutException(String command, long timeoutMs) {
        super("Process '%s' timeout after %d ms".formatted(command, timeoutMs));
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
