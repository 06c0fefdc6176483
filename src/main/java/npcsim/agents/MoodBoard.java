package npcsim.agents;

import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current mood of every npc in a session. Moods start from a persona's mood pool and drift toward
 * the sentiment of each conversation the npc takes part in.
 */
public class MoodBoard {
  private static final Map<String, Double> SENTIMENT_VALENCE = Map.ofEntries(
      Map.entry("urgent", -0.6), Map.entry("tense", -0.4), Map.entry("worried", -0.3),
      Map.entry("angry", -0.7), Map.entry("bitter", -0.5), Map.entry("fearful", -0.6),
      Map.entry("suspicious", -0.3), Map.entry("sad", -0.4),
      Map.entry("neutral", 0.0), Map.entry("calm", 0.2), Map.entry("curious", 0.2),
      Map.entry("hopeful", 0.4), Map.entry("amused", 0.4), Map.entry("excited", 0.5),
      Map.entry("happy", 0.6), Map.entry("relieved", 0.5));

  private final Map<String, Mood> moods = new ConcurrentHashMap<>();
  private final Map<String, String> startingLabels = new ConcurrentHashMap<>();
  private final double driftRate;

  public MoodBoard(double driftRate) {
    if (driftRate < 0 || driftRate > 1) throw new IllegalArgumentException("driftRate must be within [0, 1]");
    this.driftRate = driftRate;
  }

  public Mood init(String agentId, Persona persona, Random random) {
    String label = persona.moods.isEmpty() ? "neutral" : persona.moods.get(random.nextInt(persona.moods.size()));
    Mood mood = new Mood(label, 0.0);
    startingLabels.put(agentId, label);
    moods.put(agentId, mood);
    return mood;
  }

  public Mood mood(String agentId) {
    Mood mood = moods.get(agentId);
    if (mood == null) throw new IllegalArgumentException("No mood for agent: " + agentId);
    return mood;
  }

  public Map<String, Mood> all() {
    return Map.copyOf(moods);
  }

  public Mood drift(String agentId, String sentiment) {
    Mood current = mood(agentId);
    double target = valenceOf(sentiment);
    double valence = current.valence() + (target - current.valence()) * driftRate;
    Mood next = new Mood(labelFor(agentId, valence), valence);
    moods.put(agentId, next);
    return next;
  }

  static double valenceOf(String sentiment) {
    if (sentiment == null) return 0.0;
    return SENTIMENT_VALENCE.getOrDefault(sentiment.trim().toLowerCase(Locale.ROOT), 0.0);
  }

  private String labelFor(String agentId, double valence) {
    if (Math.abs(valence) <= 0.15) return startingLabels.getOrDefault(agentId, "neutral");
    if (valence <= -0.45) return "agitated";
    if (valence < 0) return "uneasy";
    if (valence >= 0.45) return "buoyant";
    return "cheerful";
  }
}
