package npcsim.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the memory bundle an agent brings into a conversation about a topic.
 *
 * Candidates are the agent's own memories mentioning a topic entity, plus hearsay: memories held
 * by other npcs reachable over social edges within {@code maxHops}. Each candidate is scored by
 * topic overlap, path length and recency, and rendered with a line describing how the agent came
 * to know it.
 */
public class ContextRetriever {
  private static final Set<RelationType> REMEMBERS = EnumSet.of(RelationType.REMEMBERS);
  private static final Set<RelationType> MENTIONS = EnumSet.of(RelationType.MENTIONS);
  private static final String[] NUMBER_WORDS = {
      "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten"
  };

  private record Hop(String nodeId, List<Relationship> path) {}

  private record Candidate(Entity memory, String holderId, List<Relationship> path, List<String> overlap) {
    int pathLength() {
      return path.size() + 1;
    }
  }

  private final KnowledgeGraph graph;
  private final EntityExtractor extractor;
  private final RetrievalSettings settings;

  public ContextRetriever(KnowledgeGraph graph, EntityExtractor extractor, RetrievalSettings settings) {
    this.graph = graph;
    this.extractor = extractor;
    this.settings = settings == null ? RetrievalSettings.defaults() : settings;
  }

  public RetrievalSettings settings() {
    return settings;
  }

  public List<RetrievedMemory> retrieve(String agentId, String topic) {
    return retrieve(agentId, topic, settings.maxHops(), settings.maxResults());
  }

  public List<RetrievedMemory> retrieve(String agentId, String topic, int maxHops, int maxResults) {
    return graph.read(() -> collect(agentId, topic, maxHops, maxResults));
  }

  private List<RetrievedMemory> collect(String agentId, String topic, int maxHops, int maxResults) {
    Entity agent = graph.entity(agentId);
    if (agent == null) throw new UnknownEntityException(agentId);
    Set<String> topicIds = extractor.extract(topic);
    if (topicIds.isEmpty() || maxResults <= 0) return List.of();

    Map<String, Candidate> candidates = new LinkedHashMap<>();
    collectHeld(agentId, List.of(), topicIds, candidates);

    Set<String> visited = new HashSet<>();
    visited.add(agentId);
    Deque<Hop> queue = new ArrayDeque<>();
    queue.add(new Hop(agentId, List.of()));
    while (!queue.isEmpty()) {
      Hop hop = queue.poll();
      if (hop.path().size() >= maxHops) continue;
      for (Neighbor neighbor : graph.neighbors(hop.nodeId(), RelationType.SOCIAL, Direction.BOTH)) {
        Entity next = neighbor.entity();
        if (!visited.add(next.id())) continue;
        List<Relationship> path = new ArrayList<>(hop.path());
        path.add(neighbor.edge());
        if (next.type() == EntityType.NPC) {
          collectHeld(next.id(), path, topicIds, candidates);
        } else if (next.type() == EntityType.MEMORY) {
          consider(next, holderOf(next), path, topicIds, candidates);
        }
        queue.add(new Hop(next.id(), List.copyOf(path)));
      }
    }

    int now = graph.clock();
    List<RetrievedMemory> scored = new ArrayList<>();
    for (Candidate candidate : candidates.values()) {
      scored.add(toRetrieved(agent, candidate, now));
    }
    scored.sort(Comparator.comparingDouble(RetrievedMemory::score).reversed()
        .thenComparingInt(RetrievedMemory::pathLength)
        .thenComparing(Comparator.comparingInt(RetrievedMemory::createdAt).reversed())
        .thenComparing(RetrievedMemory::memoryId));
    return scored.size() > maxResults ? List.copyOf(scored.subList(0, maxResults)) : List.copyOf(scored);
  }

  private void collectHeld(String holderId, List<Relationship> path, Set<String> topicIds,
                           Map<String, Candidate> candidates) {
    for (Neighbor held : graph.neighbors(holderId, REMEMBERS, Direction.OUTGOING)) {
      consider(held.entity(), holderId, path, topicIds, candidates);
    }
  }

  private void consider(Entity memory, String holderId, List<Relationship> path, Set<String> topicIds,
                        Map<String, Candidate> candidates) {
    if (memory.type() != EntityType.MEMORY || candidates.containsKey(memory.id())) return;
    List<String> overlap = new ArrayList<>();
    for (Neighbor mention : graph.neighbors(memory.id(), MENTIONS, Direction.OUTGOING)) {
      String mentioned = mention.entity().id();
      if (topicIds.contains(mentioned) && !overlap.contains(mentioned)) overlap.add(mentioned);
    }
    if (overlap.isEmpty()) return;
    candidates.put(memory.id(), new Candidate(memory, holderId, List.copyOf(path), overlap));
  }

  private String holderOf(Entity memory) {
    String owner = memory.attribute("owner");
    return owner.isBlank() ? memory.id() : owner;
  }

  private RetrievedMemory toRetrieved(Entity agent, Candidate candidate, int now) {
    int pathLength = candidate.pathLength();
    int age = Math.max(0, now - candidate.memory().createdAt());
    double recency = 1.0 / (1.0 + age * settings.recencyDecay());
    double score = candidate.overlap().size() * settings.overlapWeight()
        + (1.0 / pathLength) * settings.pathWeight()
        + recency * settings.recencyWeight();
    return new RetrievedMemory(
        candidate.memory().id(),
        candidate.memory().attribute("content"),
        candidate.holderId(),
        score,
        pathLength,
        candidate.memory().createdAt(),
        candidate.overlap(),
        provenance(agent, candidate, now));
  }

  private String provenance(Entity agent, Candidate candidate, int now) {
    String topic = describe(graph.entity(candidate.overlap().get(0)));
    if (candidate.path().isEmpty()) {
      Relationship remembers = rememberEdge(agent.id(), candidate.memory().id());
      String via = remembers == null ? "" : remembers.attribute("via");
      int age = Math.max(0, now - (remembers == null ? candidate.memory().createdAt() : remembers.createdAt()));
      Entity teller = via.isBlank() ? null : graph.entity(via);
      if (teller != null) {
        return teller.name() + " told " + agent.name() + " about " + topic + " " + ageLabel(age);
      }
      return agent.name() + " noted " + topic + " " + ageLabel(age);
    }

    List<Relationship> path = candidate.path();
    List<String> steps = new ArrayList<>();
    for (int i = path.size() - 1; i >= 0; i--) {
      Relationship edge = path.get(i);
      steps.add(nameOf(edge.sourceId()) + " " + edge.type().verb() + " " + nameOf(edge.targetId()));
    }
    int age = Math.max(0, now - path.get(0).createdAt());
    return String.join(", then ", steps) + " about " + topic + " " + ageLabel(age);
  }

  private Relationship rememberEdge(String agentId, String memoryId) {
    for (Neighbor neighbor : graph.neighbors(agentId, REMEMBERS, Direction.OUTGOING)) {
      if (neighbor.entity().id().equals(memoryId)) return neighbor.edge();
    }
    return null;
  }

  private String nameOf(String id) {
    Entity entity = graph.entity(id);
    return entity == null ? id : describe(entity);
  }

  private static String describe(Entity entity) {
    if (entity == null) return "something";
    return switch (entity.type()) {
      case LOCATION, OBJECT -> "the " + entity.name();
      case EVENT -> "\"" + entity.name() + "\"";
      default -> entity.name();
    };
  }

  static String ageLabel(int age) {
    if (age <= 0) return "just now";
    if (age == 1) return "one turn ago";
    if (age < NUMBER_WORDS.length) return NUMBER_WORDS[age] + " turns ago";
    return age + " turns ago";
  }
}
