package dev.providers.error;

import java.util.List;

/**
 * A provider descriptor or config file is malformed. Raised at setup, never retried.
 */
public class ConfigValidationException extends ProviderException {

    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super("Invalid provider configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigValidationException(String error) {
        this(List.of(error));
    }

    public ConfigValidationException(String error, Throwable cause) {
        super("Invalid provider configuration: " + error, cause);
        this.errors = List.of(error);
    }

    public List<String> errors() {
        return errors;
    }
}
