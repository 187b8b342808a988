package dev.providers.error;

/**
 * The devserver reported the task as failed.
 */
public class DevserverTaskFailedException extends ProviderException {

    private final String taskId;

    public DevserverTaskFailedException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
