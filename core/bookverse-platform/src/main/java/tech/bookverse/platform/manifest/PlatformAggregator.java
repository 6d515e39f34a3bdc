package tech.bookverse.platform.manifest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.platform.registry.RegistryClient;
import tech.bookverse.sdk.dto.SourceVersion;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Produces a platform release: resolves the production version of every configured
 * service, builds the manifest and, unless previewing, writes it and registers the
 * platform version in the Trust Registry.
 */
@ApplicationScoped
public class PlatformAggregator {

    private static final Logger LOG = Logger.getLogger(PlatformAggregator.class);

    private final ServicesConfigLoader configLoader;
    private final PromotedVersionResolver resolver;
    private final ManifestBuilder manifestBuilder;
    private final NextVersionCalculator versionCalculator;
    private final ManifestWriter writer;
    private final RegistryClient registry;

    @Inject
    public PlatformAggregator(ServicesConfigLoader configLoader,
                              PromotedVersionResolver resolver,
                              ManifestBuilder manifestBuilder,
                              NextVersionCalculator versionCalculator,
                              ManifestWriter writer,
                              RegistryClient registry) {
        this.configLoader = configLoader;
        this.resolver = resolver;
        this.manifestBuilder = manifestBuilder;
        this.versionCalculator = versionCalculator;
        this.writer = writer;
        this.registry = registry;
    }

    public AggregationResult aggregate(AggregationRequest request) {
        ManifestBuilder.requireSupportedStage(request.sourceStage());

        List<ServiceDefinition> services = configLoader.load(request.servicesConfig());
        List<ResolvedService> resolved = request.overrides().applyTo(resolver.resolve(services));

        PlatformManifest manifest = manifestBuilder.build(resolved, request.sourceStage());

        // the manifest version stays timestamp based; the platform app gets a semantic version
        String platformVersion = versionCalculator.nextVersion(request.platformApp());
        manifest = manifest.withPlatformAppVersion(platformVersion);

        String summary = writer.summary(manifest);

        if (request.preview()) {
            LOG.info("Preview: resolved live versions; no files written and no registry changes");
            return new AggregationResult(manifest, summary, Optional.empty(), false);
        }

        Path written = writer.write(request.outputDir(), manifest);

        List<SourceVersion> sources = resolved.stream()
            .map(ResolvedService::toSourceVersion)
            .toList();
        registry.createVersion(request.platformApp(), platformVersion, sources);

        return new AggregationResult(manifest, summary, Optional.of(written), true);
    }

    public record AggregationRequest(
        Path servicesConfig,
        Path outputDir,
        String sourceStage,
        String platformApp,
        boolean preview,
        VersionOverrides overrides
    ) {
        public AggregationRequest {
            overrides = overrides != null ? overrides : VersionOverrides.none();
        }
    }

    /**
     * @param manifestFile         the written manifest, empty in preview mode
     * @param platformVersionCreated whether the platform version was registered
     */
    public record AggregationResult(
        PlatformManifest manifest,
        String summary,
        Optional<Path> manifestFile,
        boolean platformVersionCreated
    ) {}
}
