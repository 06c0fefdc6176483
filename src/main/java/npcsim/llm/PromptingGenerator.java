package npcsim.llm;

/** Generates dialogue by prompting a text model through an {@link LLMClient}. */
public class PromptingGenerator implements DialogueGenerator {
  private final LLMClient client;
  private final PromptBuilder prompts;

  public PromptingGenerator(LLMClient client, PromptBuilder prompts) {
    if (client == null) throw new IllegalArgumentException("LLM client is required");
    this.client = client;
    this.prompts = prompts == null ? new PromptBuilder() : prompts;
  }

  @Override
  public String name() {
    return client.name();
  }

  @Override
  public String generate(GenerationRequest request, LLMRequestOptions options) throws GenerationException {
    String prompt = prompts.buildDialoguePrompt(request);
    String raw;
    try {
      raw = client.generateJson(PromptBuilder.SYSTEM_PROMPT, prompt, options);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Interrupted while waiting for " + client.name(), e);
    } catch (Exception e) {
      throw new InvalidGenerationResponseException("Provider call failed: " + e.getMessage(), e);
    }
    if (raw == null || raw.isBlank()) {
      throw new InvalidGenerationResponseException("Empty response from " + client.name());
    }
    return raw;
  }
}
