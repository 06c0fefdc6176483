package npcsim.memory;

public record Neighbor(Relationship edge, Entity entity) {}
