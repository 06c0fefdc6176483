package npcsim.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Offline dialogue source built from canned openers and reactions. Output is deterministic for a
 * given seed and request sequence, which keeps the simulation runnable without a model provider.
 */
public class TemplateGenerator implements DialogueGenerator {
  private static final Map<String, List<String>> OPENERS = Map.of(
      "anxious", List.of("Keep your voice down, but", "I shouldn't be saying this, yet", "Did you hear?"),
      "grumpy", List.of("Listen here,", "Don't make me repeat it:", "Bah, fine, here it is:"),
      "smooth", List.of("Between us,", "A little bird tells me", "Word on the docks is"),
      "theatrical", List.of("Gather close, friend!", "Hear this tale:", "You will not believe it:"),
      "scattered", List.of("Wait, where was I? Right:", "Gears and springs, listen:", "Before I forget:"),
      "calm", List.of("Breathe a moment.", "I have been listening, and", "Quietly now:"));

  private static final Map<String, List<String>> REACTIONS = Map.of(
      "worried", List.of("and I don't like where it leads.", "and nobody is sleeping well over it."),
      "suspicious", List.of("and someone is lying about it.", "and I'd check who benefits."),
      "excited", List.of("and the whole market will be talking by dusk!", "and it's the best news all week!"),
      "bitter", List.of("and of course we'll be the ones paying for it.", "and nobody listens to us anyway."),
      "knowing", List.of("and I suspect I know who's behind it.", "and it's only the first thread of it."));

  private static final Map<String, String> TRAIT_VOICES = Map.ofEntries(
      Map.entry("anxious", "anxious"), Map.entry("nervous", "anxious"),
      Map.entry("grumpy", "grumpy"), Map.entry("gruff", "grumpy"),
      Map.entry("smooth", "smooth"), Map.entry("sly", "smooth"),
      Map.entry("theatrical", "theatrical"), Map.entry("dramatic", "theatrical"),
      Map.entry("scattered", "scattered"), Map.entry("distracted", "scattered"),
      Map.entry("calm", "calm"), Map.entry("serene", "calm"));

  private static final Map<String, String> MOOD_REACTIONS = Map.ofEntries(
      Map.entry("irritable", "bitter"), Map.entry("calculating", "knowing"),
      Map.entry("secretly thrilled", "excited"), Map.entry("suspicious", "suspicious"),
      Map.entry("sleep-deprived", "worried"), Map.entry("determined", "knowing"),
      Map.entry("paranoid", "suspicious"), Map.entry("grimly focused", "worried"),
      Map.entry("playful", "excited"), Map.entry("defiant", "bitter"),
      Map.entry("dangerously amused", "knowing"), Map.entry("melodramatic", "excited"),
      Map.entry("mischievous", "knowing"), Map.entry("wistful", "worried"),
      Map.entry("gleefully conspiratorial", "excited"), Map.entry("wired", "excited"),
      Map.entry("hopeful", "excited"), Map.entry("frazzled", "worried"),
      Map.entry("manically focused", "suspicious"), Map.entry("serene", "knowing"),
      Map.entry("concerned", "worried"), Map.entry("quietly furious", "bitter"),
      Map.entry("knowingly patient", "knowing"), Map.entry("uneasy", "worried"),
      Map.entry("agitated", "suspicious"), Map.entry("cheerful", "excited"),
      Map.entry("buoyant", "excited"), Map.entry("content", "knowing"));

  private final ObjectMapper mapper = new ObjectMapper();
  private final Random random;

  public TemplateGenerator(long seed) {
    this.random = new Random(seed);
  }

  @Override
  public String name() {
    return "template";
  }

  @Override
  public synchronized String generate(GenerationRequest request, LLMRequestOptions options) {
    String reaction = MOOD_REACTIONS.getOrDefault(normalize(request.speakerMood()), "worried");
    String opener = pick(OPENERS.get(voiceOf(request.speakerTraits())));
    String thread = stripEnd(request.topic());
    String utterance = opener + " " + lowerFirst(thread) + ", " + pick(REACTIONS.get(reaction));

    double moodBoost = reaction.equals("excited") || reaction.equals("suspicious") ? 1.2 : 1.0;
    double bias = request.rumorBias() <= 0 ? 1.0 : request.rumorBias();
    double delta = (0.05 + random.nextDouble() * 0.20) * bias * moodBoost;
    delta = Math.max(0.05, Math.min(0.35, delta));
    delta = Math.round(delta * 1000.0) / 1000.0;

    ObjectNode out = mapper.createObjectNode();
    out.put("utterance", utterance);
    out.put("rumor_delta", delta);
    out.put("sentiment", sentimentFor(delta));
    out.put("internal_monologue", request.speakerName() + " wonders what " + request.listenerName()
        + " already knows about it.");
    out.put("new_memory", "Told " + request.listenerName() + " that " + lowerFirst(thread) + ".");
    return out.toString();
  }

  static String sentimentFor(double delta) {
    if (delta > 0.28) return "urgent";
    if (delta > 0.18) return "tense";
    return "worried";
  }

  static String voiceOf(List<String> traits) {
    for (String trait : traits) {
      String voice = TRAIT_VOICES.get(normalize(trait));
      if (voice != null) return voice;
    }
    return "calm";
  }

  private String pick(List<String> options) {
    return options.get(random.nextInt(options.size()));
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }

  private static String stripEnd(String text) {
    if (text == null || text.isBlank()) return "nothing much is happening";
    String trimmed = text.trim();
    while (!trimmed.isEmpty() && ".!?".indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static String lowerFirst(String text) {
    if (text.isEmpty()) return text;
    return Character.toLowerCase(text.charAt(0)) + text.substring(1);
  }
}
