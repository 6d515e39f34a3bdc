package tech.bookverse.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when the registry cannot be reached or answers with a server error.
 */
public class RegistryUnavailableException extends TrustRegistryException {

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, 0, cause, Map.of());
    }

    public RegistryUnavailableException(String message, int statusCode, Map<String, Object> context) {
        super(message, statusCode, null, context);
    }

    public static RegistryUnavailableException timeout(String method, String endpoint, Throwable cause) {
        return new RegistryUnavailableException("Request timed out: " + method + " " + endpoint, cause);
    }

    public static RegistryUnavailableException ioError(String method, String endpoint, Throwable cause) {
        return new RegistryUnavailableException(
            "Registry unreachable: " + method + " " + endpoint + " (" + cause.getMessage() + ")", cause
        );
    }

    public static RegistryUnavailableException interrupted(String method, String endpoint, Throwable cause) {
        return new RegistryUnavailableException("Request interrupted: " + method + " " + endpoint, cause);
    }
}
