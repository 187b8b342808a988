package dev.providers.error;

/**
 * No terminal status was observed before the client's poll deadline.
 */
public class DevserverPollTimeoutException extends ProviderException {

    private final String taskId;

    public DevserverPollTimeoutException(String taskId, long maxPollTimeMs) {
        super("Devserver task %s timeout: no result after %d ms".formatted(taskId, maxPollTimeMs));
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
