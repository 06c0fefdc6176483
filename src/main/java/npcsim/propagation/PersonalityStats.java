package npcsim.propagation;

public record PersonalityStats(int count, double meanSimilarity, double mutationRate, double spreadVelocity) {}
