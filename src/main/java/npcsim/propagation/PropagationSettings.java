package npcsim.propagation;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record PropagationSettings(double traceThreshold, double unchangedThreshold, double paraphrasedThreshold,
                                  Set<String> gossipTraits, Set<String> stoicTraits) {

  public PropagationSettings {
    if (!(traceThreshold >= 0 && traceThreshold <= 1)) {
      throw new IllegalArgumentException("traceThreshold must be within [0, 1]");
    }
    if (paraphrasedThreshold > unchangedThreshold) {
      throw new IllegalArgumentException("paraphrasedThreshold must not exceed unchangedThreshold");
    }
    gossipTraits = lowered(gossipTraits);
    stoicTraits = lowered(stoicTraits);
  }

  public static PropagationSettings defaults() {
    return new PropagationSettings(0.15, 0.85, 0.5,
        Set.of("curious", "talkative", "dramatic", "theatrical"),
        Set.of("reserved", "guarded", "careful", "quiet"));
  }

  public MutationClass classify(double similarity) {
    if (similarity >= unchangedThreshold) return MutationClass.UNCHANGED;
    if (similarity >= paraphrasedThreshold) return MutationClass.PARAPHRASED;
    return MutationClass.MUTATED;
  }

  /** Gossip traits win over stoic ones when a persona carries both. */
  public PersonalityType personalityOf(Collection<String> traits) {
    if (traits == null) return PersonalityType.NEUTRAL;
    Set<String> normalized = lowered(traits);
    if (normalized.stream().anyMatch(gossipTraits::contains)) return PersonalityType.GOSSIP;
    if (normalized.stream().anyMatch(stoicTraits::contains)) return PersonalityType.STOIC;
    return PersonalityType.NEUTRAL;
  }

  private static Set<String> lowered(Collection<String> values) {
    if (values == null) return Set.of();
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
