package dev.providers.error;

/**
 * A pending task was dropped because the queue was cleared before it started.
 */
public class QueueClearedException extends ProviderException {

    public QueueClearedException(String taskId) {
        super("Queue cleared before task '%s' started".formatted(taskId));
    }
}
