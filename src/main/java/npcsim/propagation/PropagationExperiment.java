package npcsim.propagation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One injected secret and everything observed about it since. Mutated only by
 * {@link PropagationTracker} under its lock; {@link #view()} hands out an immutable copy.
 */
public class PropagationExperiment {
  public record SeedAgent(String id, String name) {}

  public record View(String experimentId, String secret, SeedAgent seedAgent, long startTimeMs, int startTurn,
                     boolean open, int turnsElapsed, List<String> agentsReached, double propagationRate,
                     List<ExperimentTrace> traces) {}

  private final String id;
  private final String secret;
  private final String seedAgentId;
  private final String seedAgentName;
  private final long startTimeMs;
  private final int startTurn;
  private final List<ExperimentTrace> traces = new ArrayList<>();
  private final Set<String> agentsReached = new LinkedHashSet<>();
  private int turnsObserved = 0;
  private boolean open = true;

  PropagationExperiment(String id, String secret, String seedAgentId, String seedAgentName, int startTurn) {
    this.id = id;
    this.secret = secret;
    this.seedAgentId = seedAgentId;
    this.seedAgentName = seedAgentName;
    this.startTimeMs = System.currentTimeMillis();
    this.startTurn = startTurn;
  }

  public String id() {
    return id;
  }

  public String secret() {
    return secret;
  }

  public String seedAgentName() {
    return seedAgentName;
  }

  public boolean open() {
    return open;
  }

  void close() {
    open = false;
  }

  void countTurn() {
    turnsObserved += 1;
  }

  void record(ExperimentTrace trace) {
    traces.add(trace);
    agentsReached.add(trace.listenerId());
  }

  int turnsElapsed() {
    return turnsObserved;
  }

  List<ExperimentTrace> traces() {
    return traces;
  }

  Set<String> agentsReached() {
    return agentsReached;
  }

  double propagationRate() {
    return turnsObserved == 0 ? 0.0 : (double) agentsReached.size() / turnsObserved;
  }

  View view() {
    return new View(id, secret, new SeedAgent(seedAgentId, seedAgentName), startTimeMs, startTurn, open,
        turnsObserved, List.copyOf(agentsReached), propagationRate(), List.copyOf(traces));
  }
}
