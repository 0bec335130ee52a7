package com.vivek.dispatch.cli;

/**
 * Process exit codes returned by the CLI commands.
 */
final class ExitCodes {

    static final int OK = 0;
    /** The run finished but at least one work item failed. */
    static final int ITEMS_FAILED = 1;
    /** The run was aborted, or the command could not be carried out. */
    static final int ABORTED = 2;

    private ExitCodes() {}
}
