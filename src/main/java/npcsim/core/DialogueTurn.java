package npcsim.core;

import java.util.List;

public record DialogueTurn(
    int turn,
    String speakerId,
    String speaker,
    String speakerProfession,
    String speakerMood,
    String listenerId,
    String listener,
    String listenerProfession,
    String listenerMood,
    String content,
    String internalMonologue,
    String sentiment,
    double rumorDelta,
    List<String> graphContext,
    long timestamp) {

  public DialogueTurn {
    graphContext = graphContext == null ? List.of() : List.copyOf(graphContext);
  }
}
