package dev.providers.error;

/**
 * A remote endpoint answered with a non-2xx status other than 429.
 */
public class HttpStatusException extends ProviderException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
