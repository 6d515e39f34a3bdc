package tech.bookverse.platform.registry;

import tech.bookverse.sdk.dto.ApplicationVersion;
import tech.bookverse.sdk.dto.SourceVersion;
import tech.bookverse.sdk.dto.VersionContent;

import java.util.List;
import java.util.Optional;

/**
 * Access to application versions held by the Trust Registry.
 *
 * <p>Calls are independent: there is no batching and no transaction spanning two
 * patches. Failures surface as {@link tech.bookverse.sdk.exception.TrustRegistryException}
 * subclasses, with {@link tech.bookverse.sdk.exception.RegistryUnavailableException} for
 * transport problems and {@link tech.bookverse.sdk.exception.RegistryNotFoundException}
 * for unknown applications or versions.
 */
public interface RegistryClient {

    /**
     * All known versions of an application. Implementations usually return the newest
     * created first; callers must not depend on any order.
     */
    List<ApplicationVersion> listVersions(String appKey);

    /**
     * Apply a tag and/or property change to one version.
     */
    void patchVersion(String appKey, VersionPatch patch);

    /**
     * The version string of the most recently created version, if any.
     */
    Optional<String> latestCreatedVersion(String appKey);

    /**
     * Sources and releasables of one version.
     */
    VersionContent versionContent(String appKey, String version);

    /**
     * Create a version of {@code appKey} composed of the given source versions.
     */
    void createVersion(String appKey, String version, List<SourceVersion> sources);
}
