package tech.bookverse.sdk.exception;

import java.util.Map;

/**
 * Base exception for Trust Registry SDK errors.
 */
public class TrustRegistryException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public TrustRegistryException(String message) {
        this(message, 0, null, Map.of());
    }

    public TrustRegistryException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public TrustRegistryException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public TrustRegistryException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    public static TrustRegistryException malformedResponse(Throwable cause) {
        return new TrustRegistryException("Failed to parse response", cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
