package npcsim.agents;

import java.util.List;
import java.util.Set;

public class Persona {
  public final String key;
  public final String name;
  public final String title;
  public final String profession;
  public final String voice;
  public final Set<String> traits;
  public final List<String> goals;
  public final List<String> forbiddenTopics;
  public final List<String> quirks;
  public final List<String> moods;
  public final List<String> aliases;
  public final double rumorBias;
  public final List<String> defaultTopics;

  public Persona(String key, String name, String title, String profession, String voice,
                 Set<String> traits, List<String> goals, List<String> forbiddenTopics,
                 List<String> quirks, List<String> moods, List<String> aliases,
                 double rumorBias, List<String> defaultTopics) {
    this.key = key;
    this.name = name;
    this.title = title;
    this.profession = profession;
    this.voice = voice;
    this.traits = traits;
    this.goals = goals;
    this.forbiddenTopics = forbiddenTopics;
    this.quirks = quirks;
    this.moods = moods;
    this.aliases = aliases;
    this.rumorBias = rumorBias;
    this.defaultTopics = defaultTopics;
  }

  /** Character sheet used in generation prompts. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append(title).append(" (").append(profession).append(")");
    if (voice != null && !voice.isBlank()) sb.append("\nVoice: ").append(voice);
    if (!traits.isEmpty()) sb.append("\nTraits: ").append(String.join(", ", traits));
    if (!goals.isEmpty()) sb.append("\nWants: ").append(String.join("; ", goals));
    if (!quirks.isEmpty()) sb.append("\nQuirks: ").append(String.join("; ", quirks));
    if (!forbiddenTopics.isEmpty()) sb.append("\nWill not talk about: ").append(String.join(", ", forbiddenTopics));
    return sb.toString();
  }
}
