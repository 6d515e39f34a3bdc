package tech.bookverse.platform.cli;

import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.bookverse.platform.tagging.ReconciliationResult;
import tech.bookverse.platform.tagging.TagReconciliationService;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.util.concurrent.Callable;

@Command(name = "enforce-latest", mixinStandardHelpOptions = true,
    description = "Move the latest tag to the highest non-quarantined production version")
public class EnforceLatestCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(EnforceLatestCommand.class);

    @Inject
    TagReconciliationService reconciliationService;

    @Inject
    TrustRegistryClient registryClient;

    @Spec
    CommandSpec spec;

    @Option(names = {"-a", "--app"}, required = true, description = "Application key")
    String appKey;

    @Override
    public Integer call() {
        if (!registryClient.isConfigured()) {
            LOG.error("Missing trust-registry.base-url or registry credentials");
            return ExitCodes.NOT_CONFIGURED;
        }

        ReconciliationResult result;
        try {
            result = reconciliationService.enforceLatestTagInvariants(appKey);
        } catch (TrustRegistryException e) {
            LOG.errorf(e, "Enforcing latest tag of %s failed: %s", appKey, e.getMessage());
            return ExitCodes.FAILURE;
        }

        spec.commandLine().getOut().printf("%s: %s, latest=%s, patches=%d%n",
            appKey, result.outcome(), result.latest().orElse("none"), result.patches().size());
        spec.commandLine().getOut().flush();
        return ExitCodes.OK;
    }
}
