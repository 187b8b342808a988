package dev.providers.error;

/**
 * The local command could not be started (not found, not executable, bad cwd).
 */
public class ProcessSpawnException extends ProviderException {

    public ProcessSpawnException(String command, Throwable cause) {
        super("Failed to start '%s': %s".formatted(command, cause.getMessage()), cause);
    }
}
