package dev.providers.error;

/**
 * A queued task ran longer than the queue's per-task timeout; its worker was interrupted.
 */
public class QueueTimeoutException extends ProviderException {

    public QueueTimeoutException(String taskId, long timeoutMs) {
        super("Task '%s' timeout after %d ms".formatted(taskId, timeoutMs));
    }
}
