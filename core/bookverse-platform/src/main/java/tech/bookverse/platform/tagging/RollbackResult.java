package tech.bookverse.platform.tagging;

import tech.bookverse.platform.registry.VersionPatch;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of quarantining a rolled-back version.
 *
 * @param promotedVersion the version that now holds latest because of this rollback, or null
 * @param patches         patches issued, in issue order
 */
public record RollbackResult(
    String appKey,
    String rolledBackVersion,
    Outcome outcome,
    String promotedVersion,
    List<VersionPatch> patches
) {
    public RollbackResult {
        patches = List.copyOf(patches);
    }

    public enum Outcome {
        /** Quarantined; it was not latest, so no other version changed */
        QUARANTINED,

        /** Quarantined, and the next eligible version took over latest */
        QUARANTINED_AND_PROMOTED,

        /** Quarantined while latest, and no version is left to take over */
        QUARANTINED_NO_LATEST,

        /** Already carried its quarantine tag; nothing changed */
        ALREADY_QUARANTINED
    }

    public Optional<String> promoted() {
        return Optional.ofNullable(promotedVersion);
    }

    /**
     * True when the application is left without any latest version.
     */
    public boolean leftWithoutLatest() {
        return outcome == Outcome.QUARANTINED_NO_LATEST;
    }
}
