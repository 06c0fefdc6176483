package npcsim.web;

import npcsim.core.TurnEvent;
import npcsim.core.TurnListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Completed turns for clients that poll {@code /events?since=N}. */
public class TurnFeed implements TurnListener {
  private final int maxEvents;
  private final List<TurnEvent> events = new ArrayList<>();
  private int dropped = 0;

  public TurnFeed(int maxEvents) {
    if (maxEvents < 1) throw new IllegalArgumentException("maxEvents must be positive");
    this.maxEvents = maxEvents;
  }

  @Override
  public synchronized void onTurn(TurnEvent event) {
    events.add(event);
    if (events.size() > maxEvents) {
      events.remove(0);
      dropped += 1;
    }
  }

  @Override
  public void onReset() {
    clear();
  }

  /** Forgets buffered events without rewinding indices. */
  public synchronized void clear() {
    dropped += events.size();
    events.clear();
  }

  public synchronized FeedSnapshot snapshotFrom(int startIndex) {
    int relative = Math.max(0, Math.min(startIndex - dropped, events.size()));
    List<TurnEvent> slice = new ArrayList<>(events.subList(relative, events.size()));
    return new FeedSnapshot(Collections.unmodifiableList(slice), dropped + events.size());
  }

  public static class FeedSnapshot {
    public final List<TurnEvent> events;
    public final int nextIndex;

    public FeedSnapshot(List<TurnEvent> events, int nextIndex) {
      this.events = events;
      this.nextIndex = nextIndex;
    }
  }
}
