package npcsim.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/** Mutable world variables. Written only by the orchestrator while it holds the step lock. */
public class WorldState {
  private final WorldDynamics dynamics;
  private final String lastEvent;
  private final Deque<WorldSnapshot.RumorEntry> rumorLog = new ArrayDeque<>();
  private final Deque<String> beats = new ArrayDeque<>();
  private double rumorHeat;
  private double guardAlertLevel;
  private double shopPriceModifier = 1.0;
  private String currentThread;

  public WorldState(String seedEvent, WorldDynamics dynamics) {
    if (seedEvent == null || seedEvent.isBlank()) throw new IllegalArgumentException("Seed event is required");
    this.dynamics = dynamics == null ? WorldDynamics.defaults() : dynamics;
    this.lastEvent = seedEvent.trim();
    this.currentThread = this.lastEvent;
    this.rumorHeat = this.dynamics.heatBaseline();
    this.guardAlertLevel = this.dynamics.guardBaseline();
  }

  public void applyRumor(String speaker, double delta, String content, String newDevelopment) {
    rumorHeat = dynamics.nextHeat(rumorHeat, delta);
    guardAlertLevel = dynamics.nextGuard(guardAlertLevel, delta);
    shopPriceModifier = dynamics.nextPrice(shopPriceModifier, delta);
    push(rumorLog, new WorldSnapshot.RumorEntry(speaker, content, String.format(Locale.ROOT, "%+.2f", delta)),
        dynamics.rumorLogLimit());
    if (newDevelopment != null && !newDevelopment.isBlank()) {
      currentThread = newDevelopment.trim();
      push(beats, currentThread, dynamics.beatLimit());
    }
  }

  /** Points the conversation at a new thread, e.g. an injected secret. */
  public void redirect(String thread) {
    if (thread == null || thread.isBlank()) return;
    currentThread = thread.trim();
    push(beats, currentThread, dynamics.beatLimit());
  }

  public String conversationTopic() {
    return currentThread == null || currentThread.isBlank() ? lastEvent : currentThread;
  }

  public WorldSnapshot snapshot() {
    return new WorldSnapshot(round(rumorHeat), round(guardAlertLevel), round(shopPriceModifier), lastEvent,
        conversationTopic(), List.copyOf(rumorLog), List.copyOf(beats));
  }

  private static <T> void push(Deque<T> deque, T value, int limit) {
    deque.addLast(value);
    while (deque.size() > limit) deque.removeFirst();
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
