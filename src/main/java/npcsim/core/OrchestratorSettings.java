package npcsim.core;

public record OrchestratorSettings(int promptHistoryTurns, long loopDelayMs, double pendingBias,
                                   int listenerMemories) {

  public OrchestratorSettings {
    if (promptHistoryTurns < 0) throw new IllegalArgumentException("promptHistoryTurns must be >= 0");
    if (loopDelayMs < 0) throw new IllegalArgumentException("loopDelayMs must be >= 0");
    if (listenerMemories < 1) throw new IllegalArgumentException("listenerMemories must be >= 1");
  }

  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(4, 5000L, 1.5, 2);
  }

  public OrchestratorSettings withLoopDelayMs(long delayMs) {
    return new OrchestratorSettings(promptHistoryTurns, delayMs, pendingBias, listenerMemories);
  }
}
