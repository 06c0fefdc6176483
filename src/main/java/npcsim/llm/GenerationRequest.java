package npcsim.llm;

import java.util.List;

/**
 * Everything a generator may use to write one line of dialogue: who speaks to whom, in what mood,
 * about which thread, and what each side remembers.
 */
public record GenerationRequest(
    String speakerId,
    String speakerName,
    String speakerTitle,
    String speakerProfile,
    List<String> speakerTraits,
    double rumorBias,
    String speakerMood,
    String listenerName,
    String listenerTitle,
    String listenerProfile,
    String listenerMood,
    String topic,
    String lastEvent,
    double rumorHeat,
    List<String> recentHistory,
    List<String> speakerContext,
    List<String> listenerContext,
    boolean strict) {

  public GenerationRequest {
    speakerTraits = speakerTraits == null ? List.of() : List.copyOf(speakerTraits);
    recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    speakerContext = speakerContext == null ? List.of() : List.copyOf(speakerContext);
    listenerContext = listenerContext == null ? List.of() : List.copyOf(listenerContext);
  }

  /** The same request with the stricter output instructions used on a retry. */
  public GenerationRequest strictCopy() {
    return new GenerationRequest(speakerId, speakerName, speakerTitle, speakerProfile, speakerTraits, rumorBias,
        speakerMood, listenerName, listenerTitle, listenerProfile, listenerMood, topic, lastEvent, rumorHeat,
        recentHistory, speakerContext, listenerContext, true);
  }
}
