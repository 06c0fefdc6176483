package npcsim.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Most recent dialogue turns, oldest first. Appends come from the orchestrator only; readers get
 * the immutable list published after each append.
 */
public class TurnHistory {
  private final int limit;
  private volatile List<DialogueTurn> entries = List.of();

  public TurnHistory(int limit) {
    if (limit < 1) throw new IllegalArgumentException("History limit must be positive");
    this.limit = limit;
  }

  void add(DialogueTurn turn) {
    if (turn == null) return;
    List<DialogueTurn> next = new ArrayList<>(entries);
    next.add(turn);
    if (next.size() > limit) {
      next = next.subList(next.size() - limit, next.size());
    }
    entries = List.copyOf(next);
  }

  public List<DialogueTurn> entries() {
    return entries;
  }

  public List<DialogueTurn> last(int count) {
    List<DialogueTurn> snapshot = entries;
    if (count <= 0) return List.of();
    if (count >= snapshot.size()) return snapshot;
    return snapshot.subList(snapshot.size() - count, snapshot.size());
  }
}
