package tech.bookverse.platform.cli;

import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.bookverse.platform.config.PlatformConfig;
import tech.bookverse.platform.manifest.ManifestException;
import tech.bookverse.platform.manifest.PlatformAggregator;
import tech.bookverse.platform.manifest.PlatformAggregator.AggregationRequest;
import tech.bookverse.platform.manifest.PlatformAggregator.AggregationResult;
import tech.bookverse.platform.manifest.VersionOverrides;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "aggregate", mixinStandardHelpOptions = true,
    description = "Generate a platform manifest from the latest PROD version of every configured service")
public class AggregateCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(AggregateCommand.class);

    @Inject
    PlatformAggregator aggregator;

    @Inject
    TrustRegistryClient registryClient;

    @Inject
    PlatformConfig config;

    @Spec
    CommandSpec spec;

    @Option(names = "--config", description = "Path to services.yaml (default: platform.services-config)")
    Path servicesConfig;

    @Option(names = "--output-dir", description = "Directory to write manifests into (default: platform.output-dir)")
    Path outputDir;

    @Option(names = "--source-stage", description = "Source stage, only PROD is supported (default: platform.source-stage)")
    String sourceStage;

    @Option(names = "--platform-app", description = "Platform application key (default: platform.platform-app)")
    String platformApp;

    @Option(names = "--preview", defaultValue = "false",
        description = "Resolve live versions and print the summary only; no files written and no registry changes")
    boolean preview;

    @Option(names = "--override", paramLabel = "SERVICE=VERSION",
        description = "Pin a service version, e.g. inventory=1.8.2 (repeatable)")
    List<String> overrides = new ArrayList<>();

    @Override
    public Integer call() {
        if (!registryClient.isConfigured()) {
            LOG.error("Missing trust-registry.base-url or registry credentials");
            return ExitCodes.NOT_CONFIGURED;
        }

        AggregationRequest request = new AggregationRequest(
            servicesConfig != null ? servicesConfig : Path.of(config.servicesConfig()),
            outputDir != null ? outputDir : Path.of(config.outputDir()),
            sourceStage != null ? sourceStage : config.sourceStage(),
            platformApp != null ? platformApp : config.platformApp(),
            preview,
            VersionOverrides.parse(overrides)
        );

        AggregationResult result;
        try {
            result = aggregator.aggregate(request);
        } catch (ManifestException | TrustRegistryException e) {
            LOG.errorf(e, "Platform aggregation failed: %s", e.getMessage());
            return ExitCodes.FAILURE;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println(result.summary());
        result.manifestFile().ifPresent(path -> out.println("Wrote manifest: " + path));
        if (result.platformVersionCreated()) {
            out.println("Created platform version " + result.manifest().platformAppVersion()
                + " of " + request.platformApp());
        } else {
            out.println("Preview: no files written and no registry changes. Omit --preview to create the platform version.");
        }
        out.flush();
        return ExitCodes.OK;
    }
}
