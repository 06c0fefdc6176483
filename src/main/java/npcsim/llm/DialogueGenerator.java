package npcsim.llm;

/**
 * Turns a generation request into the raw JSON text of one dialogue line. Implementations must
 * report every failure as a {@link GenerationException}; the returned text is validated by the
 * caller.
 */
public interface DialogueGenerator {
  String generate(GenerationRequest request, LLMRequestOptions options) throws GenerationException;

  default String name() {
    return getClass().getSimpleName();
  }
}
