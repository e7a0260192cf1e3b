package work.labsim.simulator.cli;

/**
 * Process exit statuses of {@code labsim-simulate}.
 */
final class ExitCodes {
    static final int OK = 0;
    /** Parse, configuration, resource or execution failure of the simulation itself. */
    static final int SIMULATION_FAILED = 1;
    static final int USAGE = 2;
    /** Anything that is not a simulation failure; always a bug. */
    static final int INTERNAL_ERROR = 70;

    private ExitCodes() {}
}
