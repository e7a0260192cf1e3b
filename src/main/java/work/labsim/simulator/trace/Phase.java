package work.labsim.simulator.trace;

/**
 * Side of a command boundary announced on the bus.
 */
public enum Phase {
    BEFORE,
    AFTER
}
