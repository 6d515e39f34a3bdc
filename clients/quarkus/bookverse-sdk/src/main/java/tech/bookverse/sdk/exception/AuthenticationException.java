package tech.bookverse.sdk.exception;

/**
 * Exception thrown when authentication fails.
 */
public class AuthenticationException extends TrustRegistryException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException tokenRejected() {
        return new AuthenticationException("Access token expired or invalid");
    }

    public static AuthenticationException invalidCredentials() {
        return new AuthenticationException("Invalid client credentials");
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException(
            "Either trust-registry.access-token or client ID and secret are required"
        );
    }
}
