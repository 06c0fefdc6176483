package npcsim.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import npcsim.llm.InvalidGenerationResponseException;

/** Validated output of one generation call. */
public class DialogueResult {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public String utterance;
  public double rumorDelta;
  public String sentiment;
  public String internalMonologue;
  public String newMemory;
  public String newDevelopment;

  public static DialogueResult fromJson(String json) throws InvalidGenerationResponseException {
    if (json == null || json.isBlank()) {
      throw new InvalidGenerationResponseException("Empty generation response");
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (Exception e) {
      throw new InvalidGenerationResponseException("Response is not valid JSON: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new InvalidGenerationResponseException("Expected JSON object for dialogue result");
    }
    ObjectNode obj = (ObjectNode) root;

    DialogueResult out = new DialogueResult();
    out.utterance = firstText(obj, "utterance", "dialogue");
    Double delta = firstNumber(obj, "rumor_delta", "rumorDelta");
    out.sentiment = firstText(obj, "sentiment");
    out.internalMonologue = firstText(obj, "internal_monologue", "internalMonologue");
    out.newMemory = firstText(obj, "new_memory", "newMemory");
    out.newDevelopment = firstText(obj, "new_development", "newDevelopment");

    if (out.utterance == null || out.utterance.isBlank()) {
      throw new InvalidGenerationResponseException("Missing required fields: utterance");
    }
    if (delta == null) {
      throw new InvalidGenerationResponseException("Missing required fields: rumor_delta");
    }
    if (delta.isNaN() || delta.isInfinite() || delta < -1.0 || delta > 1.0) {
      throw new InvalidGenerationResponseException("rumor_delta out of range [-1, 1]: " + delta);
    }
    out.rumorDelta = delta;
    if (out.sentiment == null || out.sentiment.isBlank()) {
      out.sentiment = "neutral";
    }
    if (out.internalMonologue == null) {
      out.internalMonologue = "";
    }
    if (out.newMemory == null || out.newMemory.isBlank()) {
      out.newMemory = out.utterance;
    }
    if (out.newDevelopment == null) {
      out.newDevelopment = "";
    }
    return out;
  }

  private static String firstText(ObjectNode obj, String... keys) throws InvalidGenerationResponseException {
    for (String key : keys) {
      JsonNode node = obj.get(key);
      if (node == null || node.isNull()) continue;
      if (!node.isTextual()) {
        throw new InvalidGenerationResponseException("Field " + key + " must be a string");
      }
      if (!node.asText().isBlank()) return node.asText().trim();
    }
    return null;
  }

  private static Double firstNumber(ObjectNode obj, String... keys) throws InvalidGenerationResponseException {
    for (String key : keys) {
      JsonNode node = obj.get(key);
      if (node == null || node.isNull()) continue;
      if (node.isNumber()) return node.asDouble();
      if (node.isTextual()) {
        try {
          return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
          throw new InvalidGenerationResponseException("Field " + key + " is not a number: " + node.asText());
        }
      }
      throw new InvalidGenerationResponseException("Field " + key + " must be a number");
    }
    return null;
  }
}
