package npcsim.llm;

/** Cuts the JSON value out of a model reply that may be wrapped in a code fence or chatter. */
final class JsonPayloads {
  private JsonPayloads() {}

  static String extract(String text) {
    if (text == null) return "";
    String trimmed = text.trim();

    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      if (firstNewline >= 0) {
        trimmed = trimmed.substring(firstNewline + 1);
      }
      int lastFence = trimmed.lastIndexOf("```");
      if (lastFence >= 0) {
        trimmed = trimmed.substring(0, lastFence);
      }
      trimmed = trimmed.trim();
    }

    int firstObj = trimmed.indexOf('{');
    int lastObj = trimmed.lastIndexOf('}');
    if (firstObj >= 0 && lastObj > firstObj) {
      return trimmed.substring(firstObj, lastObj + 1).trim();
    }
    return trimmed;
  }
}
