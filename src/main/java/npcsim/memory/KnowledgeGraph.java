package npcsim.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * KnowledgeGraph is the shared memory of one simulation session: a directed, labeled multigraph
 * of typed entities joined by typed relationships.
 *
 * Entities are never removed; a session reset builds a fresh graph. Reads may run concurrently,
 * writes are serialized through the write lock. {@link #atomically(Runnable)} groups several writes
 * so readers observe all of them or none.
 */
public class KnowledgeGraph {
  public record Link(String type, String targetId, String targetName, String targetType) {}

  public record Connected(String id, String name, String type, int distance) {}

  public record EntityContext(Entity entity, List<Link> relationships, List<Connected> connected) {}

  private final Map<String, Entity> entities = new LinkedHashMap<>();
  private final Map<EntityType, List<Entity>> byType = new EnumMap<>(EntityType.class);
  private final Map<String, List<Relationship>> outgoing = new HashMap<>();
  private final Map<String, List<Relationship>> incoming = new HashMap<>();
  private final Map<RelationType, Integer> edgeCounts = new EnumMap<>(RelationType.class);
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private long edgeSeq = 0L;
  private int memorySeq = 0;
  private int edgeCount = 0;
  private int clock = 0;
  private int vocabularyVersion = 0;

  /** Current turn index stamped on new entities and edges. */
  public int clock() {
    return read(() -> clock);
  }

  /** Bumped whenever a non-memory entity is added, so name lookups can be cached between changes. */
  public int vocabularyVersion() {
    return read(() -> vocabularyVersion);
  }

  public void setClock(int turn) {
    write(() -> clock = Math.max(0, turn));
  }

  public String addEntity(EntityType type, String name, Map<String, Object> attributes) {
    if (type == null) throw new IllegalArgumentException("Entity type is required");
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Entity name is required");
    String id = Entity.idFor(type, name);
    lock.writeLock().lock();
    try {
      if (!entities.containsKey(id)) {
        Entity entity = new Entity(id, type, name.trim(), attributes, clock);
        entities.put(id, entity);
        byType.computeIfAbsent(type, k -> new ArrayList<>()).add(entity);
        if (type != EntityType.MEMORY) vocabularyVersion += 1;
      }
      return id;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Relationship addRelationship(String sourceId, String targetId, RelationType type,
                                      Map<String, Object> attributes) {
    return addRelationship(sourceId, targetId, type, 1.0, attributes);
  }

  public Relationship addRelationship(String sourceId, String targetId, RelationType type, double weight,
                                      Map<String, Object> attributes) {
    if (type == null) throw new IllegalArgumentException("Relationship type is required");
    lock.writeLock().lock();
    try {
      requireEntity(sourceId);
      requireEntity(targetId);
      Relationship edge = new Relationship(++edgeSeq, sourceId, targetId, type, clock, weight, attributes);
      outgoing.computeIfAbsent(sourceId, k -> new ArrayList<>()).add(edge);
      incoming.computeIfAbsent(targetId, k -> new ArrayList<>()).add(edge);
      edgeCounts.merge(type, 1, Integer::sum);
      edgeCount += 1;
      return edge;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Creates a memory entity owned by {@code ownerId} together with its single {@code remembers} edge.
   * Returns the new memory id.
   */
  public String addMemory(String ownerId, String content, int turn) {
    if (content == null || content.isBlank()) throw new IllegalArgumentException("Memory content is required");
    lock.writeLock().lock();
    try {
      requireEntity(ownerId);
      int previousClock = clock;
      clock = Math.max(0, turn);
      try {
        memorySeq += 1;
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("content", content.trim());
        attrs.put("owner", ownerId);
        String memoryId = addEntity(EntityType.MEMORY, "m" + memorySeq, attrs);
        addRelationship(ownerId, memoryId, RelationType.REMEMBERS, Map.of());
        return memoryId;
      } finally {
        clock = previousClock;
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Runs {@code block} holding the write lock; nested graph writes inside it are reentrant. */
  public void atomically(Runnable block) {
    lock.writeLock().lock();
    try {
      block.run();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Runs {@code query} holding the read lock so it sees one consistent version of the graph. */
  public <T> T read(Supplier<T> query) {
    lock.readLock().lock();
    try {
      return query.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  public Entity entity(String id) {
    if (id == null) return null;
    return read(() -> entities.get(id));
  }

  public Entity entity(EntityType type, String name) {
    if (type == null || name == null) return null;
    return entity(Entity.idFor(type, name));
  }

  public boolean contains(String id) {
    return entity(id) != null;
  }

  public List<Entity> entitiesByType(EntityType type) {
    return read(() -> List.copyOf(byType.getOrDefault(type, List.of())));
  }

  public List<Entity> allEntities() {
    return read(() -> List.copyOf(entities.values()));
  }

  public List<Neighbor> neighbors(String id) {
    return neighbors(id, null, Direction.BOTH);
  }

  public List<Neighbor> neighbors(String id, Collection<RelationType> types, Direction direction) {
    Direction dir = direction == null ? Direction.BOTH : direction;
    Set<RelationType> filter = types == null || types.isEmpty() ? null : Set.copyOf(types);
    return read(() -> {
      requireEntity(id);
      List<Neighbor> out = new ArrayList<>();
      if (dir != Direction.INCOMING) {
        for (Relationship edge : outgoing.getOrDefault(id, List.of())) {
          if (filter == null || filter.contains(edge.type())) {
            out.add(new Neighbor(edge, entities.get(edge.targetId())));
          }
        }
      }
      if (dir != Direction.OUTGOING) {
        for (Relationship edge : incoming.getOrDefault(id, List.of())) {
          if (filter == null || filter.contains(edge.type())) {
            out.add(new Neighbor(edge, entities.get(edge.sourceId())));
          }
        }
      }
      return Collections.unmodifiableList(out);
    });
  }

  public GraphStats stats() {
    return read(() -> {
      Map<String, Integer> entityTypes = new TreeMap<>();
      for (Map.Entry<EntityType, List<Entity>> entry : byType.entrySet()) {
        entityTypes.put(entry.getKey().key(), entry.getValue().size());
      }
      Map<String, Integer> edgeTypes = new TreeMap<>();
      for (Map.Entry<RelationType, Integer> entry : edgeCounts.entrySet()) {
        edgeTypes.put(entry.getKey().key(), entry.getValue());
      }
      return new GraphStats(entities.size(), edgeCount, entityTypes, edgeTypes);
    });
  }

  /**
   * Outgoing relationships of an entity plus the non-memory entities reachable within
   * {@code depth} hops in either direction. Returns null when the entity does not exist.
   */
  public EntityContext entityContext(String id, int depth) {
    return read(() -> {
      Entity entity = entities.get(id);
      if (entity == null) return null;
      List<Link> links = new ArrayList<>();
      for (Relationship edge : outgoing.getOrDefault(id, List.of())) {
        Entity target = entities.get(edge.targetId());
        links.add(new Link(edge.type().key(), target.id(), target.name(), target.type().key()));
      }

      List<Connected> connected = new ArrayList<>();
      Set<String> visited = new LinkedHashSet<>();
      visited.add(id);
      List<String> frontier = List.of(id);
      for (int distance = 1; distance <= Math.max(0, depth) && !frontier.isEmpty(); distance++) {
        List<String> next = new ArrayList<>();
        for (String nodeId : frontier) {
          for (Relationship edge : adjacent(nodeId)) {
            String otherId = edge.otherEnd(nodeId);
            if (!visited.add(otherId)) continue;
            Entity other = entities.get(otherId);
            next.add(otherId);
            if (other.type() != EntityType.MEMORY) {
              connected.add(new Connected(other.id(), other.name(), other.type().key(), distance));
            }
          }
        }
        frontier = next;
      }
      return new EntityContext(entity, List.copyOf(links), List.copyOf(connected));
    });
  }

  private List<Relationship> adjacent(String id) {
    List<Relationship> out = new ArrayList<>(outgoing.getOrDefault(id, List.of()));
    out.addAll(incoming.getOrDefault(id, List.of()));
    return out;
  }

  private void write(Runnable block) {
    atomically(block);
  }

  private void requireEntity(String id) {
    if (id == null || !entities.containsKey(id)) {
      throw new UnknownEntityException(id);
    }
  }
}
