package dev.providers.model;

/**
 * Client-side view of one devserver task.
 */
public record DevserverTask(
    String taskId,
    TaskStatus status,
    ProviderResult result, // present only when COMPLETED
    String error           // set by the server when FAILED
) {}
