package tech.bookverse.platform.cli;

/**
 * Process exit codes of the platform commands.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** The operation was attempted and failed */
    public static final int FAILURE = 1;

    /** Registry URL or credentials missing, or no subcommand given */
    public static final int NOT_CONFIGURED = 2;

    private ExitCodes() {
    }
}
