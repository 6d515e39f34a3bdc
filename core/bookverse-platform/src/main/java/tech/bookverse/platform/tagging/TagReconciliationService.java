package tech.bookverse.platform.tagging;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.platform.registry.RegistryClient;
import tech.bookverse.platform.registry.VersionPatch;
import tech.bookverse.sdk.dto.ApplicationVersion;
import tech.bookverse.sdk.exception.RegistryNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static tech.bookverse.platform.tagging.TagNames.BACKUP_BEFORE_LATEST;
import static tech.bookverse.platform.tagging.TagNames.BACKUP_BEFORE_QUARANTINE;
import static tech.bookverse.platform.tagging.TagNames.DEFAULT_RESTORE_TAG;
import static tech.bookverse.platform.tagging.TagNames.LATEST;

/**
 * Keeps the {@code latest} tag on the right version of an application.
 *
 * <p>Invariants maintained:
 * <ul>
 *   <li>at most one production version carries {@code latest}</li>
 *   <li>that version is the highest semantic version that is not quarantined</li>
 *   <li>every tag this service overwrites is first saved in a backup property,
 *       and the backup is removed when the tag is given back</li>
 *   <li>a quarantined version is tagged exactly {@code quarantine-<version>}</li>
 * </ul>
 *
 * <p>Every call recomputes the desired state from a fresh listing and issues its patches
 * one at a time. A failing patch aborts the call with the registry's exception; patches
 * issued before it stay applied. Running {@link #enforceLatestTagInvariants(String)} again
 * converges from any such intermediate state, so retrying the whole call is the recovery
 * path. Concurrent calls for the same application are not coordinated here and must be
 * serialized by the caller.
 */
@ApplicationScoped
public class TagReconciliationService {

    private static final Logger LOG = Logger.getLogger(TagReconciliationService.class);

    private final RegistryClient registry;

    @Inject
    public TagReconciliationService(RegistryClient registry) {
        this.registry = registry;
    }

    /**
     * Move {@code latest} to the highest eligible version if it is not already there.
     *
     * <p>The new holder is tagged first; former holders are restored afterwards from their
     * {@value TagNames#BACKUP_BEFORE_LATEST} property, falling back to
     * {@value TagNames#DEFAULT_RESTORE_TAG}.
     */
    public ReconciliationResult enforceLatestTagInvariants(String appKey) {
        TagState state = loadState(appKey);

        Optional<ApplicationVersion> desired = state.desiredLatest();
        if (desired.isEmpty()) {
            LOG.infof("No eligible version for latest in %s, nothing to do", appKey);
            return ReconciliationResult.noEligibleVersion(appKey);
        }

        ApplicationVersion target = desired.get();
        List<ApplicationVersion> formerHolders = state.latestHolders().stream()
            .filter(v -> !v.version().equals(target.version()))
            .toList();
        boolean targetHoldsLatest = TagNames.isLatest(target.tag());

        if (targetHoldsLatest && formerHolders.isEmpty()) {
            LOG.infof("Latest tag of %s already on %s", appKey, target.version());
            return ReconciliationResult.converged(appKey, target.version());
        }

        List<VersionPatch> issued = new ArrayList<>();

        if (!targetHoldsLatest) {
            apply(appKey, VersionPatch.retagWithBackup(
                target.version(), LATEST, BACKUP_BEFORE_LATEST, target.tag()), issued);
        }

        for (ApplicationVersion former : formerHolders) {
            String restoredTag = former.firstPropertyValue(BACKUP_BEFORE_LATEST).orElse(DEFAULT_RESTORE_TAG);
            apply(appKey, VersionPatch.restore(former.version(), restoredTag, BACKUP_BEFORE_LATEST), issued);
        }

        LOG.infof("Latest tag of %s moved to %s (%d patches)", appKey, target.version(), issued.size());
        return new ReconciliationResult(appKey, ReconciliationResult.Outcome.LATEST_REASSIGNED,
            target.version(), issued);
    }

    /**
     * Highest semantic version in {@code prodVersions} that is neither
     * {@code excludedVersion} nor quarantined. Issues no registry calls.
     */
    public Optional<ApplicationVersion> pickNextLatest(List<ApplicationVersion> prodVersions, String excludedVersion) {
        return TagState.highestCandidate(prodVersions, excludedVersion);
    }

    /**
     * Quarantine a rolled-back version and, if it was latest, hand latest to the next
     * eligible version.
     *
     * <p>The quarantine patch is always issued first. When no replacement exists the
     * application is left without a latest version, reported as
     * {@link RollbackResult.Outcome#QUARANTINED_NO_LATEST}.
     *
     * @throws RegistryNotFoundException if the version is not a production version of the application
     */
    public RollbackResult handleRollbackTagging(String appKey, String rolledBackVersion) {
        TagState state = loadState(appKey);

        ApplicationVersion target = state.findProductionVersion(rolledBackVersion)
            .orElseThrow(() -> notFound(state, rolledBackVersion));

        String quarantineTag = TagNames.quarantineTag(rolledBackVersion);
        if (quarantineTag.equals(target.tag())) {
            LOG.infof("%s of %s is already quarantined", rolledBackVersion, appKey);
            return new RollbackResult(appKey, rolledBackVersion,
                RollbackResult.Outcome.ALREADY_QUARANTINED, null, List.of());
        }

        String originalTag = target.tag();
        List<VersionPatch> issued = new ArrayList<>();

        apply(appKey, VersionPatch.retagWithBackup(
            rolledBackVersion, quarantineTag, BACKUP_BEFORE_QUARANTINE, originalTag), issued);

        if (!TagNames.isLatest(originalTag)) {
            return new RollbackResult(appKey, rolledBackVersion,
                RollbackResult.Outcome.QUARANTINED, null, issued);
        }

        Optional<ApplicationVersion> next = pickNextLatest(state.productionVersions(), rolledBackVersion);
        if (next.isEmpty()) {
            LOG.warnf("Rolled back %s of %s was latest and no other version is eligible; %s has no latest now",
                rolledBackVersion, appKey, appKey);
            return new RollbackResult(appKey, rolledBackVersion,
                RollbackResult.Outcome.QUARANTINED_NO_LATEST, null, issued);
        }

        ApplicationVersion replacement = next.get();
        if (!TagNames.isLatest(replacement.tag())) {
            apply(appKey, VersionPatch.retagWithBackup(
                replacement.version(), LATEST, BACKUP_BEFORE_LATEST, replacement.tag()), issued);
        }

        return new RollbackResult(appKey, rolledBackVersion,
            RollbackResult.Outcome.QUARANTINED_AND_PROMOTED, replacement.version(), issued);
    }

    private TagState loadState(String appKey) {
        TagState state = TagState.of(appKey, registry.listVersions(appKey));
        LOG.debugf("%s: %d production versions (%d latest, %d quarantined, %d other)",
            appKey,
            state.productionVersions().size(),
            state.latestHolders().size(),
            state.quarantined().size(),
            state.others().size());
        return state;
    }

    private void apply(String appKey, VersionPatch patch, List<VersionPatch> issued) {
        LOG.infof("Patching %s %s: tag=%s set=%s delete=%s",
            appKey, patch.version(), patch.tag(), patch.setProperties(), patch.deleteProperties());
        registry.patchVersion(appKey, patch);
        issued.add(patch);
    }

    private static RegistryNotFoundException notFound(TagState state, String version) {
        return state.findAnyVersion(version)
            .map(v -> new RegistryNotFoundException("Version " + version + " of " + state.appKey()
                + " is not a production version (status " + v.releaseStatus() + ")"))
            .orElseGet(() -> RegistryNotFoundException.version(state.appKey(), version));
    }
}
