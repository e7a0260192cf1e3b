package work.labsim.simulator.api;

import java.util.Objects;
import java.util.Optional;
import work.labsim.simulator.bundle.BundleContents;
import work.labsim.simulator.format.RunLogFormatter;
import work.labsim.simulator.trace.RunLog;

/**
 * Result of a successful simulation: the frozen run log and, when one was assembled, a bundle.
 */
public record SimulationOutcome(RunLog runLog, Optional<BundleContents> bundle) {
    public SimulationOutcome {
        Objects.requireNonNull(runLog, "runLog");
        Objects.requireNonNull(bundle, "bundle");
    }

    public String formattedRunLog() {
        return RunLogFormatter.format(runLog);
    }
}
