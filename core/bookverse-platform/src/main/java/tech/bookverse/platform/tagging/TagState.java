package tech.bookverse.platform.tagging;

import tech.bookverse.platform.semver.SemVers;
import tech.bookverse.sdk.dto.ApplicationVersion;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of an application's production-eligible versions, partitioned by tag.
 *
 * <p>Built fresh from a registry listing on every reconciliation; nothing is kept
 * between runs.
 */
public final class TagState {

    private final String appKey;
    private final List<ApplicationVersion> allVersions;
    private final List<ApplicationVersion> productionVersions;

    private TagState(String appKey, List<ApplicationVersion> allVersions) {
        this.appKey = appKey;
        this.allVersions = List.copyOf(allVersions);
        this.productionVersions = this.allVersions.stream()
            .filter(ApplicationVersion::isProductionEligible)
            .toList();
    }

    public static TagState of(String appKey, List<ApplicationVersion> versions) {
        return new TagState(appKey, versions);
    }

    public String appKey() {
        return appKey;
    }

    /**
     * Versions in RELEASED or TRUSTED_RELEASE status, in listing order.
     */
    public List<ApplicationVersion> productionVersions() {
        return productionVersions;
    }

    public List<ApplicationVersion> quarantined() {
        return productionVersions.stream()
            .filter(v -> TagNames.isQuarantined(v.tag()))
            .toList();
    }

    /**
     * Versions currently tagged latest. More than one only after overlapping runs.
     */
    public List<ApplicationVersion> latestHolders() {
        return productionVersions.stream()
            .filter(v -> TagNames.isLatest(v.tag()))
            .toList();
    }

    public List<ApplicationVersion> others() {
        return productionVersions.stream()
            .filter(v -> !TagNames.isLatest(v.tag()) && !TagNames.isQuarantined(v.tag()))
            .toList();
    }

    /**
     * The version that should carry the latest tag: the highest semantic version
     * among production versions that are not quarantined.
     */
    public Optional<ApplicationVersion> desiredLatest() {
        return highestCandidate(productionVersions, null);
    }

    /**
     * Production version with exactly this version string.
     */
    public Optional<ApplicationVersion> findProductionVersion(String version) {
        return productionVersions.stream()
            .filter(v -> v.version().equals(version))
            .findFirst();
    }

    /**
     * Any listed version with exactly this version string, eligible or not.
     */
    public Optional<ApplicationVersion> findAnyVersion(String version) {
        return allVersions.stream()
            .filter(v -> v.version().equals(version))
            .findFirst();
    }

    /**
     * Highest semantic version among {@code versions} that is neither {@code excludedVersion}
     * nor quarantined. Unparseable versions are never picked.
     */
    static Optional<ApplicationVersion> highestCandidate(List<ApplicationVersion> versions, String excludedVersion) {
        List<ApplicationVersion> candidates = versions.stream()
            .filter(v -> !v.version().equals(excludedVersion))
            .filter(v -> !TagNames.isQuarantined(v.tag()))
            .toList();
        return SemVers.highest(candidates, ApplicationVersion::version);
    }
}
