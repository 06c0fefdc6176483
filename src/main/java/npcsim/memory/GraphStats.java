package npcsim.memory;

import java.util.Map;

public record GraphStats(int entityCount, int edgeCount,
                         Map<String, Integer> entitiesByType, Map<String, Integer> edgesByType) {}
