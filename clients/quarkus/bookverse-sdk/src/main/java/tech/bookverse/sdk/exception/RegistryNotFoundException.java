package tech.bookverse.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when a referenced application or version does not exist.
 */
public class RegistryNotFoundException extends TrustRegistryException {

    public RegistryNotFoundException(String message) {
        super(message, 404);
    }

    public RegistryNotFoundException(String message, Map<String, Object> context) {
        super(message, 404, null, context);
    }

    public static RegistryNotFoundException application(String appKey) {
        return new RegistryNotFoundException("Application not found: " + appKey);
    }

    public static RegistryNotFoundException version(String appKey, String version) {
        return new RegistryNotFoundException(
            "Version " + version + " not found for application " + appKey
        );
    }
}
