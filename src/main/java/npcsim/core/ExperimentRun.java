package npcsim.core;

import java.util.List;

/** Result of {@link Orchestrator#runExperiment}: the experiment opened and the steps run for it. */
public record ExperimentRun(String experimentId, String secret, String seedAgent, int rounds,
                            List<StepOutcome> outcomes) {

  public ExperimentRun {
    outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
  }
}
