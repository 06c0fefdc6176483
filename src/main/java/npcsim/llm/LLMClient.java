package npcsim.llm;

/**
 * A chat-style text model that is asked for a single JSON object. Implementations return the raw
 * JSON text; validation belongs to the caller.
 */
public interface LLMClient {
  String generateJson(String systemPrompt, String prompt, LLMRequestOptions options) throws Exception;

  default String generateJson(String prompt, LLMRequestOptions options) throws Exception {
    return generateJson("", prompt, options);
  }

  default String name() {
    return getClass().getSimpleName();
  }
}
