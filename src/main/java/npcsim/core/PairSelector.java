package npcsim.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Weighted choice of who talks to whom. Agents with fresh news are likelier to speak; agents who
 * have heard less are likelier to be told.
 */
public class PairSelector {
  public record Pair(String speakerId, String listenerId) {}

  private final double pendingBias;

  public PairSelector(double pendingBias) {
    if (pendingBias < 0) throw new IllegalArgumentException("pendingBias must be >= 0");
    this.pendingBias = pendingBias;
  }

  public Pair select(List<String> roster, Map<String, Integer> pending, Map<String, Integer> heard, Random random) {
    if (roster == null || roster.size() < 2) {
      throw new IllegalStateException("Need at least two agents to hold a conversation");
    }
    double[] speakerWeights = new double[roster.size()];
    for (int i = 0; i < roster.size(); i++) {
      speakerWeights[i] = 1.0 + pendingBias * pending.getOrDefault(roster.get(i), 0);
    }
    String speaker = roster.get(pick(speakerWeights, random));

    List<String> others = new ArrayList<>(roster);
    others.remove(speaker);
    double[] listenerWeights = new double[others.size()];
    for (int i = 0; i < others.size(); i++) {
      listenerWeights[i] = 1.0 / (1.0 + heard.getOrDefault(others.get(i), 0));
    }
    String listener = others.get(pick(listenerWeights, random));
    return new Pair(speaker, listener);
  }

  private static int pick(double[] weights, Random random) {
    double total = 0.0;
    for (double w : weights) total += w;
    double roll = random.nextDouble() * total;
    for (int i = 0; i < weights.length; i++) {
      roll -= weights[i];
      if (roll < 0) return i;
    }
    return weights.length - 1;
  }
}
