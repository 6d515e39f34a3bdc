package tech.bookverse.platform.manifest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.platform.registry.RegistryClient;
import tech.bookverse.platform.semver.SemVers;
import tech.bookverse.platform.tagging.TagNames;
import tech.bookverse.sdk.dto.ApplicationVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks, for every configured service, the version currently promoted to production.
 */
@ApplicationScoped
public class PromotedVersionResolver {

    private static final Logger LOG = Logger.getLogger(PromotedVersionResolver.class);

    private final RegistryClient registry;

    @Inject
    public PromotedVersionResolver(RegistryClient registry) {
        this.registry = registry;
    }

    public List<ResolvedService> resolve(List<ServiceDefinition> services) {
        List<ResolvedService> resolved = new ArrayList<>();
        for (ServiceDefinition service : services) {
            if (!service.isComplete()) {
                throw ManifestException.incompleteService(service);
            }
            String version = pickLatestProdVersion(service.apptrustApplication())
                .orElseThrow(() -> ManifestException.noProductionVersion(service.apptrustApplication()));
            LOG.infof("Resolved %s (%s) to %s", service.name(), service.apptrustApplication(), version);
            resolved.add(new ResolvedService(service.name(), service.apptrustApplication(), version));
        }
        return resolved;
    }

    /**
     * Highest semantic version in RELEASED or TRUSTED_RELEASE status, skipping quarantined ones.
     */
    public Optional<String> pickLatestProdVersion(String appKey) {
        List<ApplicationVersion> prod = registry.listVersions(appKey).stream()
            .filter(ApplicationVersion::isProductionEligible)
            .filter(v -> !TagNames.isQuarantined(v.tag()))
            .toList();
        return SemVers.highest(prod, ApplicationVersion::version).map(ApplicationVersion::version);
    }
}
