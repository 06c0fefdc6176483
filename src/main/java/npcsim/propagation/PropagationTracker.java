package npcsim.propagation;

import npcsim.core.SimulationLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Follows injected secrets as they are retold. Every completed turn is shown to the open
 * experiment; a line similar enough to the secret becomes a trace and marks its listener as
 * reached. Injecting a new secret closes the previous experiment, which stays in the timeline.
 */
public class PropagationTracker {
  private final PropagationSettings settings;
  private final SimilarityFunction similarity;
  private final Map<String, PropagationExperiment> experiments = new LinkedHashMap<>();
  private final Map<String, PersonalityType> personalities = new HashMap<>();
  private PropagationExperiment current;
  private int experimentSeq = 0;

  public PropagationTracker(PropagationSettings settings, SimilarityFunction similarity) {
    this.settings = settings == null ? PropagationSettings.defaults() : settings;
    this.similarity = similarity == null ? new LexicalSimilarity() : similarity;
  }

  public PropagationTracker() {
    this(PropagationSettings.defaults(), new LexicalSimilarity());
  }

  public PropagationSettings settings() {
    return settings;
  }

  public synchronized String open(String secret, String seedAgentId, String seedAgentName, int turn) {
    if (secret == null || secret.isBlank()) throw new IllegalArgumentException("Secret is required");
    if (current != null) {
      current.close();
      SimulationLogger.log("[Propagation] Closed " + current.id() + " after " + current.turnsElapsed() + " turns");
    }
    experimentSeq += 1;
    String id = String.format(Locale.ROOT, "exp-%03d", experimentSeq);
    current = new PropagationExperiment(id, secret.trim(), seedAgentId, seedAgentName, turn);
    experiments.put(id, current);
    SimulationLogger.log("[Propagation] Injected into " + seedAgentName + ": \"" + abbreviate(secret, 60)
        + "\" (" + id + ")");
    return id;
  }

  /**
   * Shows one completed turn to the open experiment. Returns the trace it produced, or null when
   * no experiment is open or the line is unrelated to the secret.
   */
  public synchronized ExperimentTrace observe(int turn, String speakerId, String speakerName,
                                              Collection<String> speakerTraits, String listenerId,
                                              String listenerName, String content) {
    if (current == null) return null;
    current.countTurn();
    double score = similarity.similarity(content, current.secret());
    if (score <= settings.traceThreshold()) return null;

    PersonalityType type = personalities.computeIfAbsent(speakerId, k -> settings.personalityOf(speakerTraits));
    ExperimentTrace trace = new ExperimentTrace(
        turn, speakerId, speakerName, listenerId, listenerName, type,
        abbreviate(content, 200), round(score), settings.classify(score),
        drift(content, current.secret()), System.currentTimeMillis());
    current.record(trace);
    SimulationLogger.log("[Propagation] " + speakerName + " -> " + listenerName + " turn " + turn
        + String.format(Locale.ROOT, " similarity %.2f (%s)", score, trace.mutation().key()));
    return trace;
  }

  public synchronized boolean active() {
    return current != null;
  }

  public synchronized PropagationStats stats() {
    if (current == null) return PropagationStats.inactive();
    return statsFor(current);
  }

  public synchronized PropagationStats stats(String experimentId) {
    PropagationExperiment experiment = experiments.get(experimentId);
    if (experiment == null) throw new IllegalArgumentException("Unknown experiment: " + experimentId);
    return statsFor(experiment);
  }

  public synchronized List<PropagationExperiment.View> timeline() {
    List<PropagationExperiment.View> out = new ArrayList<>();
    for (PropagationExperiment experiment : experiments.values()) {
      out.add(experiment.view());
    }
    return out;
  }

  public synchronized void clear() {
    experiments.clear();
    personalities.clear();
    current = null;
  }

  /** Markdown summary over every experiment in the timeline. */
  public synchronized String report() {
    List<ExperimentTrace> all = new ArrayList<>();
    int reached = 0;
    for (PropagationExperiment experiment : experiments.values()) {
      all.addAll(experiment.traces());
      reached += experiment.agentsReached().size();
    }

    StringBuilder sb = new StringBuilder();
    sb.append("# Information Propagation Report\n\n");
    sb.append("## Overview\n");
    sb.append("- **Experiments**: ").append(experiments.size()).append('\n');
    sb.append("- **Agents reached (sum over experiments)**: ").append(reached).append('\n');
    sb.append("- **Traces**: ").append(all.size()).append("\n\n");

    sb.append("## By Personality\n\n");
    sb.append("| Personality | Traces | Mean similarity | Mutation rate |\n");
    sb.append("|-------------|--------|-----------------|---------------|\n");
    for (PersonalityType type : PersonalityType.values()) {
      List<ExperimentTrace> ofType = all.stream().filter(t -> t.personalityType() == type).toList();
      sb.append("| ").append(type.key())
          .append(" | ").append(ofType.size())
          .append(" | ").append(format(meanSimilarity(ofType)))
          .append(" | ").append(format(mutationRate(ofType)))
          .append(" |\n");
    }

    sb.append("\n## Findings\n\n");
    sb.append("- **Overall fidelity**: ").append(format(meanSimilarity(all))).append('\n');
    long gossip = all.stream().filter(t -> t.personalityType() == PersonalityType.GOSSIP).count();
    long stoic = all.stream().filter(t -> t.personalityType() == PersonalityType.STOIC).count();
    sb.append("- **Gossip traces vs stoic traces**: ").append(gossip).append(" / ").append(stoic).append('\n');

    sb.append("\n## Experiments\n");
    for (PropagationExperiment experiment : experiments.values()) {
      sb.append("\n### ").append(experiment.id()).append(experiment.open() ? " (open)" : "").append('\n');
      sb.append("- **Secret**: \"").append(experiment.secret()).append("\"\n");
      sb.append("- **Seed agent**: ").append(experiment.seedAgentName()).append('\n');
      sb.append("- **Turns**: ").append(experiment.turnsElapsed()).append('\n');
      sb.append("- **Agents reached**: ").append(experiment.agentsReached().size()).append('\n');
      sb.append("- **Propagation rate**: ").append(format(experiment.propagationRate())).append(" agents/turn\n");
    }
    return sb.toString();
  }

  private PropagationStats statsFor(PropagationExperiment experiment) {
    int turns = experiment.turnsElapsed();
    List<ExperimentTrace> traces = experiment.traces();

    Map<String, PersonalityStats> byType = new LinkedHashMap<>();
    Map<PersonalityType, Double> velocity = new HashMap<>();
    for (PersonalityType type : PersonalityType.values()) {
      List<ExperimentTrace> ofType = traces.stream().filter(t -> t.personalityType() == type).toList();
      if (ofType.isEmpty()) continue;
      Set<String> listeners = new LinkedHashSet<>();
      for (ExperimentTrace trace : ofType) listeners.add(trace.listenerId());
      double spread = turns == 0 ? 0.0 : (double) listeners.size() / turns;
      velocity.put(type, spread);
      byType.put(type.key(), new PersonalityStats(ofType.size(), round(meanSimilarity(ofType)),
          round(mutationRate(ofType)), round(spread)));
    }

    Double ratio = null;
    double stoicVelocity = velocity.getOrDefault(PersonalityType.STOIC, 0.0);
    if (stoicVelocity > 0) {
      ratio = round(velocity.getOrDefault(PersonalityType.GOSSIP, 0.0) / stoicVelocity);
    }

    return new PropagationStats(
        experiment.open(),
        null,
        experiment.id(),
        experiment.secret(),
        experiment.seedAgentName(),
        turns,
        List.copyOf(experiment.agentsReached()),
        round(experiment.propagationRate()),
        round(meanSimilarity(traces)),
        byType,
        ratio);
  }

  private static double meanSimilarity(List<ExperimentTrace> traces) {
    if (traces.isEmpty()) return 0.0;
    double sum = 0.0;
    for (ExperimentTrace trace : traces) sum += trace.similarity();
    return sum / traces.size();
  }

  private static double mutationRate(List<ExperimentTrace> traces) {
    if (traces.isEmpty()) return 0.0;
    long changed = traces.stream().filter(t -> t.mutation() != MutationClass.UNCHANGED).count();
    return (double) changed / traces.size();
  }

  /** Content words added to and lost from the secret, e.g. "added: cellar; lost: vault". */
  static String drift(String content, String secret) {
    Set<String> said = LexicalSimilarity.tokens(content);
    Set<String> original = LexicalSimilarity.tokens(secret);
    List<String> added = said.stream().filter(w -> !original.contains(w)).limit(3).toList();
    List<String> lost = original.stream().filter(w -> !said.contains(w)).limit(3).toList();
    List<String> parts = new ArrayList<>();
    if (!added.isEmpty()) parts.add("added: " + String.join(", ", added));
    if (!lost.isEmpty()) parts.add("lost: " + String.join(", ", lost));
    return parts.isEmpty() ? "minimal drift" : String.join("; ", parts);
  }

  private static double round(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  private static String abbreviate(String text, int max) {
    if (text == null) return "";
    return text.length() <= max ? text : text.substring(0, max);
  }
}
