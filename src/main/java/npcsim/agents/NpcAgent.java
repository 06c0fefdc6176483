package npcsim.agents;

import npcsim.core.SimulationLogger;
import npcsim.llm.DialogueGenerator;
import npcsim.llm.GenerationException;
import npcsim.llm.GenerationRequest;
import npcsim.llm.LLMRequestOptions;

public class NpcAgent {
  private static final int NUM_PREDICT_DEFAULT = 500;
  private static final int NUM_PREDICT_RETRY = 800;

  private final String id;
  private final Persona persona;
  private final DialogueGenerator generator;

  public NpcAgent(String id, Persona persona, DialogueGenerator generator) {
    this.id = id;
    this.persona = persona;
    this.generator = generator;
  }

  public String id() {
    return id;
  }

  public String name() {
    return persona.name;
  }

  public Persona persona() {
    return persona;
  }

  /**
   * Asks the generator for one line. An invalid or timed-out first attempt is retried once with
   * stricter instructions and a larger token budget; a second failure is thrown to the caller.
   */
  public DialogueResult converse(GenerationRequest request) throws GenerationException {
    try {
      String json = generator.generate(request, LLMRequestOptions.withNumPredict(NUM_PREDICT_DEFAULT));
      return DialogueResult.fromJson(json);
    } catch (GenerationException e) {
      if (Thread.currentThread().isInterrupted()) throw e;
      SimulationLogger.log("[LLM] " + e.getMessage() + " (" + name() + "). Retrying...");
      String retryJson = generator.generate(request.strictCopy(), LLMRequestOptions.withNumPredict(NUM_PREDICT_RETRY));
      return DialogueResult.fromJson(retryJson);
    }
  }
}
