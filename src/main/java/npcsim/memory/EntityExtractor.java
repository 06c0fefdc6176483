package npcsim.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds references to known entities in free text. The vocabulary is every non-memory entity's
 * name plus its {@code aliases} attribute (events only by alias, their names are whole sentences).
 * Matching is case-insensitive, whole-word and longest-first; text consumed by a longer match is
 * not matched again.
 */
public class EntityExtractor {
  private record Term(String text, String entityId) {}

  private record Vocabulary(int version, List<Term> terms) {}

  private final KnowledgeGraph graph;
  private volatile Vocabulary cached = new Vocabulary(-1, List.of());

  public EntityExtractor(KnowledgeGraph graph) {
    this.graph = graph;
  }

  /** Entity ids referenced by {@code text}, in order of first appearance. */
  public Set<String> extract(String text) {
    if (text == null || text.isBlank()) return Set.of();
    String lower = text.toLowerCase(Locale.ROOT);
    boolean[] consumed = new boolean[lower.length()];
    Map<Integer, String> hits = new TreeMap<>();

    for (Term term : vocabulary()) {
      int from = 0;
      while (from <= lower.length() - term.text().length()) {
        int start = lower.indexOf(term.text(), from);
        if (start < 0) break;
        int end = start + term.text().length();
        if (isBoundary(lower, start - 1) && isBoundary(lower, end) && !overlaps(consumed, start, end)) {
          for (int i = start; i < end; i++) consumed[i] = true;
          hits.put(start, term.entityId());
        }
        from = start + 1;
      }
    }
    return new LinkedHashSet<>(hits.values());
  }

  /** Adds one {@code mentions} edge from the memory to each entity referenced by {@code text}. */
  public Set<String> linkMentions(String memoryId, String text, int turn) {
    Set<String> mentioned = new LinkedHashSet<>(extract(text));
    mentioned.remove(memoryId);
    if (mentioned.isEmpty()) return Set.of();
    graph.atomically(() -> {
      int previous = graph.clock();
      graph.setClock(turn);
      try {
        for (String entityId : mentioned) {
          graph.addRelationship(memoryId, entityId, RelationType.MENTIONS, 0.5, Map.of());
        }
      } finally {
        graph.setClock(previous);
      }
    });
    return mentioned;
  }

  private List<Term> vocabulary() {
    Vocabulary current = cached;
    if (current.version() == graph.vocabularyVersion()) return current.terms();
    Vocabulary rebuilt = graph.read(() -> {
      List<Term> terms = new ArrayList<>();
      for (EntityType type : EntityType.values()) {
        if (type == EntityType.MEMORY) continue;
        for (Entity entity : graph.entitiesByType(type)) {
          if (type != EntityType.EVENT) addTerm(terms, entity.name(), entity.id());
          for (String alias : entity.aliases()) {
            addTerm(terms, alias, entity.id());
          }
        }
      }
      terms.sort(Comparator.comparingInt((Term t) -> t.text().length()).reversed()
          .thenComparing(Term::text)
          .thenComparing(Term::entityId));
      return new Vocabulary(graph.vocabularyVersion(), List.copyOf(terms));
    });
    cached = rebuilt;
    return rebuilt.terms();
  }

  private static void addTerm(List<Term> terms, String text, String entityId) {
    if (text == null) return;
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    if (!normalized.isEmpty()) terms.add(new Term(normalized, entityId));
  }

  private static boolean isBoundary(String text, int index) {
    return index < 0 || index >= text.length() || !Character.isLetterOrDigit(text.charAt(index));
  }

  private static boolean overlaps(boolean[] consumed, int start, int end) {
    for (int i = start; i < end; i++) {
      if (consumed[i]) return true;
    }
    return false;
  }
}
