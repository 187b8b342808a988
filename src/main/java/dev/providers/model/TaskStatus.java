package dev.providers.model;

/**
 * Devserver task states as reported by the server.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Map a server status string. Anything unrecognised ("pending", "started", ...)
     * is treated as still running so the client keeps polling.
     */
    public static TaskStatus fromWire(String value) {
        if (value == null) {
            return RUNNING;
        }
        return switch (value.trim().toLowerCase()) {
            case "queued", "pending" -> QUEUED;
            case "completed", "complete", "done" -> COMPLETED;
            case "failed", "error" -> FAILED;
            default -> RUNNING;
        };
    }
}
