package tech.bookverse.platform.registry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.client.resources.ApplicationVersions.CreateVersionRequest;
import tech.bookverse.sdk.client.resources.ApplicationVersions.PatchVersionRequest;
import tech.bookverse.sdk.dto.ApplicationVersion;
import tech.bookverse.sdk.dto.SourceVersion;
import tech.bookverse.sdk.dto.VersionContent;

import java.util.List;
import java.util.Optional;

/**
 * {@link RegistryClient} backed by the Trust Registry REST API.
 */
@ApplicationScoped
public class TrustRegistryAdapter implements RegistryClient {

    private static final Logger LOG = Logger.getLogger(TrustRegistryAdapter.class);

    private final TrustRegistryClient client;

    @Inject
    public TrustRegistryAdapter(TrustRegistryClient client) {
        this.client = client;
    }

    @Override
    public List<ApplicationVersion> listVersions(String appKey) {
        List<ApplicationVersion> versions = client.applicationVersions().list(appKey);
        LOG.debugf("Listed %d versions of %s", versions.size(), appKey);
        return versions;
    }

    @Override
    public void patchVersion(String appKey, VersionPatch patch) {
        var request = new PatchVersionRequest(
            patch.tag(),
            patch.setProperties().isEmpty() ? null : patch.setProperties(),
            patch.deleteProperties().isEmpty() ? null : patch.deleteProperties()
        );
        client.applicationVersions().patch(appKey, patch.version(), request);
    }

    @Override
    public Optional<String> latestCreatedVersion(String appKey) {
        return client.applicationVersions().list(appKey, 1).stream()
            .findFirst()
            .map(ApplicationVersion::version);
    }

    @Override
    public VersionContent versionContent(String appKey, String version) {
        return client.applicationVersions().content(appKey, version);
    }

    @Override
    public void createVersion(String appKey, String version, List<SourceVersion> sources) {
        var response = client.applicationVersions().create(appKey, CreateVersionRequest.of(version, sources));
        LOG.infof("Created version %s of %s from %d sources: %s", version, appKey, sources.size(), response);
    }
}
