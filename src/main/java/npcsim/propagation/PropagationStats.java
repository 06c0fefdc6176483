package npcsim.propagation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropagationStats(
    boolean active,
    String message,
    String experimentId,
    String secret,
    String seedAgent,
    Integer turnsElapsed,
    List<String> agentsReached,
    Double propagationRate,
    Double overallFidelity,
    Map<String, PersonalityStats> byPersonality,
    Double gossipToStoicRatio) {

  public static PropagationStats inactive() {
    return new PropagationStats(false, "No experiment running. Inject a secret to start one.",
        null, null, null, null, null, null, null, null, null);
  }
}
