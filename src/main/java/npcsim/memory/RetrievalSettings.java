package npcsim.memory;

public record RetrievalSettings(int maxHops, int maxResults, double overlapWeight, double pathWeight,
                                double recencyWeight, double recencyDecay) {

  public RetrievalSettings {
    if (maxHops < 0) throw new IllegalArgumentException("maxHops must be >= 0");
    if (maxResults < 1) throw new IllegalArgumentException("maxResults must be >= 1");
    if (recencyDecay < 0) throw new IllegalArgumentException("recencyDecay must be >= 0");
  }

  public static RetrievalSettings defaults() {
    return new RetrievalSettings(2, 4, 1.0, 1.0, 0.5, 0.25);
  }

  public RetrievalSettings withMaxResults(int results) {
    return new RetrievalSettings(maxHops, results, overlapWeight, pathWeight, recencyWeight, recencyDecay);
  }
}
