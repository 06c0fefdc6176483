package npcsim.llm;

import java.util.List;
import java.util.Locale;

public class PromptBuilder {
  public static final String SYSTEM_PROMPT = """
You write dialogue for characters in a small fantasy market town.
Each reply is one short spoken line from the named speaker to the named listener.
Stay in character, lean on what the speaker remembers, and let rumors bend a little as they travel.
Always answer with a single JSON object and nothing else.
""";

  public String buildDialoguePrompt(GenerationRequest request) {
    String prompt = """
SCENE:
%s is talking with %s in the market square.
Current thread: %s
Last event: %s
Rumor tension: %s (%.2f)

SPEAKER:
%s
Current mood: %s

LISTENER:
%s
Current mood: %s

RECENT CONVERSATION:
%s

WHAT %s REMEMBERS:
%s

WHAT %s HAS HEARD:
%s

Return STRICT JSON with keys:
utterance (string, what %s says aloud, 1-2 sentences),
rumor_delta (number -1..1, how much this line raises (+) or calms (-) the rumor),
sentiment (one word such as worried, tense, urgent, calm, excited),
internal_monologue (string, one private thought),
new_memory (string, what %s will remember from this exchange),
new_development (string, optional: a short new twist if the story moved on, otherwise omit it).
Mention places, objects and people by name when you refer to them.
No extra keys. No markdown.
""".formatted(
        request.speakerName(), request.listenerName(),
        orNone(request.topic()), orNone(request.lastEvent()),
        tensionLabel(request.rumorHeat()), request.rumorHeat(),
        request.speakerProfile(), orNone(request.speakerMood()),
        request.listenerProfile(), orNone(request.listenerMood()),
        bullets(request.recentHistory()),
        request.speakerName().toUpperCase(Locale.ROOT), bullets(request.speakerContext()),
        request.listenerName().toUpperCase(Locale.ROOT), bullets(request.listenerContext()),
        request.speakerName(), request.speakerName());
    if (request.strict()) {
      prompt += "\nReturn compact JSON only. No extra text. rumor_delta must be a plain number.";
    }
    return prompt;
  }

  static String tensionLabel(double heat) {
    if (heat >= 0.75) return "boiling";
    if (heat >= 0.5) return "high";
    if (heat >= 0.25) return "rising";
    return "low";
  }

  private static String bullets(List<String> lines) {
    if (lines == null || lines.isEmpty()) return "(none)";
    StringBuilder sb = new StringBuilder();
    for (String line : lines) {
      if (sb.length() > 0) sb.append('\n');
      sb.append("- ").append(line);
    }
    return sb.toString();
  }

  private static String orNone(String value) {
    return value == null || value.isBlank() ? "(none)" : value;
  }
}
