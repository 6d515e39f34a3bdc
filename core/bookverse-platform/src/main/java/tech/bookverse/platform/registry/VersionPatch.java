package tech.bookverse.platform.registry;

import java.util.List;
import java.util.Map;

/**
 * A mutation of one version's tag and properties.
 *
 * @param version          the version to change
 * @param tag              new tag, or null to leave the tag alone
 * @param setProperties    properties to add or overwrite
 * @param deleteProperties property keys to remove
 */
public record VersionPatch(
    String version,
    String tag,
    Map<String, List<String>> setProperties,
    List<String> deleteProperties
) {
    public VersionPatch {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version is required");
        }
        setProperties = setProperties != null ? Map.copyOf(setProperties) : Map.of();
        deleteProperties = deleteProperties != null ? List.copyOf(deleteProperties) : List.of();
    }

    /**
     * Retag a version, recording its previous tag under {@code backupKey}.
     * The backup value is a single-element list.
     */
    public static VersionPatch retagWithBackup(String version, String newTag, String backupKey, String previousTag) {
        return new VersionPatch(version, newTag, Map.of(backupKey, List.of(previousTag)), List.of());
    }

    /**
     * Retag a version and drop a backup property that is no longer needed.
     */
    public static VersionPatch restore(String version, String restoredTag, String backupKey) {
        return new VersionPatch(version, restoredTag, Map.of(), List.of(backupKey));
    }
}
