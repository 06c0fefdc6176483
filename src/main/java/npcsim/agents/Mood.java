package npcsim.agents;

/** A mood label plus a valence in [-1, 1]; negative is sour, positive is buoyant. */
public record Mood(String label, double valence) {
  public Mood {
    if (label == null || label.isBlank()) throw new IllegalArgumentException("Mood label is required");
    valence = Math.max(-1.0, Math.min(1.0, valence));
  }
}
