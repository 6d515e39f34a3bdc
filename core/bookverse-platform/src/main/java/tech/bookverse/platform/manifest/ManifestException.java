package tech.bookverse.platform.manifest;

import java.nio.file.Path;

/**
 * Exception thrown when a platform manifest cannot be assembled or written.
 */
public class ManifestException extends RuntimeException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ManifestException configNotFound(Path path) {
        return new ManifestException("Services config not found: " + path);
    }

    public static ManifestException configUnreadable(Path path, Throwable cause) {
        return new ManifestException("Services config could not be read: " + path, cause);
    }

    public static ManifestException noServices() {
        return new ManifestException("Config 'services' must be a non-empty list");
    }

    public static ManifestException incompleteService(Object entry) {
        return new ManifestException("Service config missing required fields: " + entry);
    }

    public static ManifestException noProductionVersion(String appKey) {
        return new ManifestException("No PROD version found for application " + appKey);
    }

    public static ManifestException unsupportedStage(String stage) {
        return new ManifestException("Platform aggregation only supports source stage PROD, got: " + stage);
    }

    public static ManifestException writeFailed(Path path, Throwable cause) {
        return new ManifestException("Failed to write manifest: " + path, cause);
    }
}
