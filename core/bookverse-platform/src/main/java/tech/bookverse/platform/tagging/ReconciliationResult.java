package tech.bookverse.platform.tagging;

import tech.bookverse.platform.registry.VersionPatch;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of enforcing the latest-tag invariants for one application.
 *
 * @param latestVersion the version holding latest afterwards, null if none is eligible
 * @param patches       patches issued, in issue order
 */
public record ReconciliationResult(
    String appKey,
    Outcome outcome,
    String latestVersion,
    List<VersionPatch> patches
) {
    public ReconciliationResult {
        patches = List.copyOf(patches);
    }

    public enum Outcome {
        /** No production version outside quarantine; nothing to tag */
        NO_ELIGIBLE_VERSION,

        /** The right version already was the only latest holder */
        ALREADY_CONVERGED,

        /** Tags were moved */
        LATEST_REASSIGNED
    }

    static ReconciliationResult noEligibleVersion(String appKey) {
        return new ReconciliationResult(appKey, Outcome.NO_ELIGIBLE_VERSION, null, List.of());
    }

    static ReconciliationResult converged(String appKey, String latestVersion) {
        return new ReconciliationResult(appKey, Outcome.ALREADY_CONVERGED, latestVersion, List.of());
    }

    public Optional<String> latest() {
        return Optional.ofNullable(latestVersion);
    }
}
