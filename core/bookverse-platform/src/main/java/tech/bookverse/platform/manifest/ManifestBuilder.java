package tech.bookverse.platform.manifest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bookverse.platform.registry.RegistryClient;
import tech.bookverse.sdk.dto.VersionContent;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a {@link PlatformManifest} from resolved service versions.
 */
@ApplicationScoped
public class ManifestBuilder {

    public static final String PROD_STAGE = "PROD";

    static final String NOTES = "Auto-generated by platform-aggregator (applications & versions)";

    private static final DateTimeFormatter VERSION_FORMAT =
        DateTimeFormatter.ofPattern("yyyy.MM.dd.HHmmss").withZone(ZoneOffset.UTC);

    private final RegistryClient registry;
    private final Clock clock;

    @Inject
    public ManifestBuilder(RegistryClient registry) {
        this(registry, Clock.systemUTC());
    }

    ManifestBuilder(RegistryClient registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public static void requireSupportedStage(String sourceStage) {
        if (!PROD_STAGE.equals(sourceStage)) {
            throw ManifestException.unsupportedStage(sourceStage);
        }
    }

    /**
     * Build the manifest, fetching the content of every resolved version.
     * The platform application version is left empty.
     */
    public PlatformManifest build(List<ResolvedService> services, String sourceStage) {
        requireSupportedStage(sourceStage);

        Instant now = clock.instant();

        List<PlatformManifest.Application> applications = new ArrayList<>();
        for (ResolvedService service : services) {
            VersionContent content = registry.versionContent(service.appKey(), service.version());
            applications.add(new PlatformManifest.Application(
                service.appKey(),
                service.version(),
                content.sources(),
                content.releasables()
            ));
        }

        return new PlatformManifest(
            VERSION_FORMAT.format(now),
            DateTimeFormatter.ISO_INSTANT.format(now),
            sourceStage,
            applications,
            PlatformManifest.Provenance.signaturesRequired(),
            NOTES,
            null
        );
    }
}
