package tech.bookverse.platform.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@TopCommand
@Command(name = "bookverse-platform", mixinStandardHelpOptions = true, version = "1.0",
    description = "BookVerse platform release tooling: platform manifests and latest-tag reconciliation",
    subcommands = {AggregateCommand.class, EnforceLatestCommand.class, RollbackCommand.class})
public class PlatformCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.NOT_CONFIGURED;
    }
}
