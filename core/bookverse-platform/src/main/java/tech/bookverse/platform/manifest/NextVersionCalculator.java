package tech.bookverse.platform.manifest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.platform.registry.RegistryClient;
import tech.bookverse.platform.semver.SemVer;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.util.Optional;

/**
 * Next semantic version for an application: the patch-bumped most recently created version.
 */
@ApplicationScoped
public class NextVersionCalculator {

    private static final Logger LOG = Logger.getLogger(NextVersionCalculator.class);

    static final String INITIAL_VERSION = "1.0.0";

    private final RegistryClient registry;

    @Inject
    public NextVersionCalculator(RegistryClient registry) {
        this.registry = registry;
    }

    /**
     * Falls back to {@value #INITIAL_VERSION} when the application has no version yet,
     * when the latest one is not a semantic version, or when it cannot be read.
     */
    public String nextVersion(String appKey) {
        Optional<String> latest;
        try {
            latest = registry.latestCreatedVersion(appKey);
        } catch (TrustRegistryException e) {
            LOG.warnf(e, "Could not read latest version of %s, starting at %s", appKey, INITIAL_VERSION);
            return INITIAL_VERSION;
        }

        return latest
            .flatMap(SemVer::parse)
            .map(SemVer::nextPatch)
            .orElse(INITIAL_VERSION);
    }
}
