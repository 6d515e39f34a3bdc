package tech.bookverse.platform.cli;

import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.bookverse.platform.tagging.RollbackResult;
import tech.bookverse.platform.tagging.TagReconciliationService;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.util.concurrent.Callable;

// --version names the rolled-back version here, so help is declared by hand
@Command(name = "rollback",
    description = "Quarantine a rolled-back version and hand latest to the next eligible version")
public class RollbackCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(RollbackCommand.class);

    @Inject
    TagReconciliationService reconciliationService;

    @Inject
    TrustRegistryClient registryClient;

    @Spec
    CommandSpec spec;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    boolean helpRequested;

    @Option(names = {"-a", "--app"}, required = true, description = "Application key")
    String appKey;

    @Option(names = "--version", required = true, description = "Version being rolled back")
    String version;

    @Override
    public Integer call() {
        if (!registryClient.isConfigured()) {
            LOG.error("Missing trust-registry.base-url or registry credentials");
            return ExitCodes.NOT_CONFIGURED;
        }

        RollbackResult result;
        try {
            result = reconciliationService.handleRollbackTagging(appKey, version);
        } catch (TrustRegistryException e) {
            LOG.errorf(e, "Rollback tagging of %s %s failed: %s", appKey, version, e.getMessage());
            return ExitCodes.FAILURE;
        }

        if (result.leftWithoutLatest()) {
            LOG.warnf("%s has no latest version after rolling back %s", appKey, version);
        }
        spec.commandLine().getOut().printf("%s %s: %s, promoted=%s, patches=%d%n",
            appKey, version, result.outcome(), result.promoted().orElse("none"), result.patches().size());
        spec.commandLine().getOut().flush();
        return ExitCodes.OK;
    }
}
