package npcsim.core;

import npcsim.agents.DialogueResult;
import npcsim.agents.Mood;
import npcsim.agents.NpcAgent;
import npcsim.llm.GenerationException;
import npcsim.llm.GenerationRequest;
import npcsim.memory.Entity;
import npcsim.memory.EntityType;
import npcsim.memory.GraphStats;
import npcsim.memory.KnowledgeGraph;
import npcsim.memory.RelationType;
import npcsim.memory.RetrievedMemory;
import npcsim.propagation.PropagationTracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the conversation: picks a pair, gathers what both remember, asks the speaker's generator
 * for a line, and writes the outcome back into the graph and the world.
 *
 * All session mutation happens while holding {@code stepLock}. A step that cannot take the lock
 * reports {@link StepOutcome.Status#BUSY} instead of waiting. Readers use the snapshots published
 * at the end of each step.
 */
public class Orchestrator {
  public static final String DEFAULT_EXPERIMENT_SECRET =
      "The mayor has been secretly meeting with the rebel faction.";

  private final SessionFactory sessions;
  private final OrchestratorSettings settings;
  private final PairSelector selector;
  private final ReentrantLock stepLock = new ReentrantLock();
  private final List<TurnListener> listeners = new CopyOnWriteArrayList<>();
  private final Object loopSignal = new Object();
  private final ExecutorService loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
    Thread thread = new Thread(runnable, "dialogue-loop");
    thread.setDaemon(true);
    return thread;
  });

  private volatile Session session;
  private volatile OrchestratorState state = OrchestratorState.IDLE;
  private volatile PropagationTracker tracker;
  private AtomicBoolean loopCancel = new AtomicBoolean(true);

  public Orchestrator(SessionFactory sessions, OrchestratorSettings settings, String seedEvent,
                      List<String> rosterKeys) {
    this.sessions = sessions;
    this.settings = settings == null ? OrchestratorSettings.defaults() : settings;
    this.selector = new PairSelector(this.settings.pendingBias());
    this.session = sessions.create(seedEvent, rosterKeys);
  }

  public void attachTracker(PropagationTracker tracker) {
    this.tracker = tracker;
  }

  public PropagationTracker tracker() {
    return tracker;
  }

  public void addListener(TurnListener listener) {
    if (listener != null) listeners.add(listener);
  }

  public OrchestratorState state() {
    return state;
  }

  public Session session() {
    return session;
  }

  // --- commands ---

  public StepOutcome step() {
    ensureRunning();
    if (state == OrchestratorState.RUNNING_LOOP) {
      return StepOutcome.busy("Dialogue loop is running");
    }
    return runStep(false);
  }

  /** Runs up to {@code count} manual steps, stopping early at the first step that does not complete. */
  public List<StepOutcome> runSteps(int count) {
    List<StepOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      StepOutcome outcome = step();
      outcomes.add(outcome);
      if (!outcome.completed()) break;
    }
    return outcomes;
  }

  public synchronized boolean startLoop() {
    ensureRunning();
    if (state == OrchestratorState.RUNNING_LOOP) return false;
    AtomicBoolean cancel = new AtomicBoolean(false);
    loopCancel = cancel;
    state = OrchestratorState.RUNNING_LOOP;
    loopExecutor.submit(() -> runLoop(cancel));
    SimulationLogger.log("Loop", "Started (delay " + settings.loopDelayMs() + " ms)");
    return true;
  }

  /** Stops loop mode. A step already in flight finishes; no new step starts afterwards. */
  public synchronized boolean stopLoop() {
    if (state != OrchestratorState.RUNNING_LOOP) return false;
    loopCancel.set(true);
    state = OrchestratorState.IDLE;
    synchronized (loopSignal) {
      loopSignal.notifyAll();
    }
    SimulationLogger.log("Loop", "Stopped");
    return true;
  }

  /**
   * Replaces the session with a fresh seed-only one and clears the propagation timeline.
   * Refused while the loop runs; otherwise waits for an in-flight step to finish.
   */
  public void reset(String seedEvent, List<String> rosterKeys) {
    ensureRunning();
    if (state == OrchestratorState.RUNNING_LOOP) {
      throw new BusyException("Stop the dialogue loop before resetting");
    }
    stepLock.lock();
    try {
      Session next = sessions.create(seedEvent, rosterKeys);
      session = next;
      PropagationTracker t = tracker;
      if (t != null) t.clear();
      for (TurnListener l : listeners) {
        try {
          l.onReset();
        } catch (RuntimeException e) {
          SimulationLogger.log("Reset", "Listener failed: " + e);
        }
      }
      SimulationLogger.log("Reset", "New session: \"" + next.seedEvent() + "\" with "
          + String.join(", ", names(next)));
    } finally {
      stepLock.unlock();
    }
  }

  /**
   * Plants {@code secret} as a memory of the seed agent, points the conversation at it and, when a
   * tracker is attached, opens a new experiment. Returns the experiment id, or null without a tracker.
   */
  public String injectSecret(String secret, String seedAgentRef) {
    ensureRunning();
    if (secret == null || secret.isBlank()) throw new IllegalArgumentException("Secret is required");
    stepLock.lock();
    try {
      Session s = session;
      NpcAgent seed = s.findAgent(seedAgentRef);
      if (seed == null) throw new IllegalArgumentException("Unknown agent: " + seedAgentRef);
      int turn = s.turn();
      KnowledgeGraph graph = s.graph();
      graph.atomically(() -> {
        graph.setClock(turn);
        String memoryId = graph.addMemory(seed.id(), secret.trim(), turn);
        s.extractor().linkMentions(memoryId, secret, turn);
      });
      s.markLearned(seed.id());
      s.world().redirect(secret);
      s.publish();

      PropagationTracker t = tracker;
      if (t == null) {
        SimulationLogger.log("Propagation", "Secret planted in " + seed.name() + " without a tracker");
        return null;
      }
      return t.open(secret, seed.id(), seed.name(), turn);
    } finally {
      stepLock.unlock();
    }
  }

  /**
   * Runs a whole propagation experiment: a fresh session over the current seed event and cast,
   * {@code secret} planted in the first agent of the roster, then {@code rounds} tracked steps.
   */
  public ExperimentRun runExperiment(String secret, int rounds) {
    ensureRunning();
    if (tracker == null) throw new IllegalStateException("Propagation tracking is disabled");
    if (rounds < 1) throw new IllegalArgumentException("rounds must be positive");
    String planted = secret == null || secret.isBlank() ? DEFAULT_EXPERIMENT_SECRET : secret.trim();

    Session current = session;
    List<String> cast = current.agents().values().stream().map(agent -> agent.persona().key).toList();
    reset(current.seedEvent(), cast);
    NpcAgent seed = session.agents().values().iterator().next();
    String experimentId = injectSecret(planted, seed.id());
    List<StepOutcome> outcomes = runSteps(rounds);
    SimulationLogger.log("Propagation", experimentId + " ran " + outcomes.size() + " of " + rounds + " rounds");
    return new ExperimentRun(experimentId, planted, seed.name(), rounds, outcomes);
  }

  public synchronized void shutdown() {
    if (state == OrchestratorState.STOPPED) return;
    loopCancel.set(true);
    synchronized (loopSignal) {
      loopSignal.notifyAll();
    }
    state = OrchestratorState.STOPPED;
    loopExecutor.shutdown();
    try {
      if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        loopExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      loopExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    listeners.clear();
    SimulationLogger.log("Loop", "Orchestrator stopped");
  }

  // --- queries ---

  public SimulationSnapshot snapshot() {
    Session s = session;
    Session.View v = s.view();
    return new SimulationSnapshot(state, v.turn(), s.seedEvent(), v.world(), v.history(), v.agents(), v.graph());
  }

  public List<DialogueTurn> history(int limit) {
    List<DialogueTurn> entries = session.view().history();
    if (limit <= 0) return List.of();
    return limit >= entries.size() ? entries : entries.subList(entries.size() - limit, entries.size());
  }

  public GraphStats graphStats() {
    return session.view().graph();
  }

  public KnowledgeGraph.EntityContext entityContext(String type, String name) {
    EntityType entityType = EntityType.fromKey(type);
    return session.graph().entityContext(Entity.idFor(entityType, name), 2);
  }

  // --- internals ---

  private StepOutcome runStep(boolean fromLoop) {
    if (!stepLock.tryLock()) {
      return StepOutcome.busy("Another step is in flight");
    }
    try {
      if (!fromLoop) {
        if (state != OrchestratorState.IDLE) return StepOutcome.busy("Orchestrator is " + state);
        state = OrchestratorState.RUNNING_SINGLE_STEP;
      }
      return executeStep(session);
    } finally {
      if (!fromLoop && state == OrchestratorState.RUNNING_SINGLE_STEP) {
        state = OrchestratorState.IDLE;
      }
      stepLock.unlock();
    }
  }

  private void runLoop(AtomicBoolean cancel) {
    while (!cancel.get()) {
      try {
        StepOutcome outcome = runStep(true);
        if (outcome.status == StepOutcome.Status.BUSY) {
          SimulationLogger.log("Loop", "Skipped a beat: " + outcome.reason);
        }
      } catch (RuntimeException e) {
        SimulationLogger.log("Loop", "Step crashed: " + e);
      }
      synchronized (loopSignal) {
        if (cancel.get()) break;
        try {
          loopSignal.wait(Math.max(1L, settings.loopDelayMs()));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
  }

  private StepOutcome executeStep(Session s) {
    PairSelector.Pair pair = selector.select(s.roster(), s.pending(), s.heard(), s.random());
    NpcAgent speaker = s.agent(pair.speakerId());
    NpcAgent listener = s.agent(pair.listenerId());
    int turnIndex = s.turn() + 1;
    String topic = s.world().conversationTopic();
    WorldSnapshot before = s.published();

    List<RetrievedMemory> speakerMemories = s.retriever().retrieve(speaker.id(), topic);
    List<RetrievedMemory> listenerMemories = s.retriever().retrieve(listener.id(), topic,
        s.retriever().settings().maxHops(), settings.listenerMemories());
    Mood speakerMood = s.moods().mood(speaker.id());
    Mood listenerMood = s.moods().mood(listener.id());

    GenerationRequest request = new GenerationRequest(
        speaker.id(),
        speaker.name(),
        speaker.persona().title,
        speaker.persona().describe(),
        List.copyOf(speaker.persona().traits),
        speaker.persona().rumorBias,
        speakerMood.label(),
        listener.name(),
        listener.persona().title,
        listener.persona().describe(),
        listenerMood.label(),
        topic,
        before.lastEvent(),
        before.rumorHeat(),
        recentLines(s),
        render(speakerMemories),
        render(listenerMemories),
        false);

    DialogueResult result;
    try {
      result = speaker.converse(request);
    } catch (GenerationException e) {
      SimulationLogger.log("Turn", turnIndex + " abandoned (" + speaker.name() + " -> " + listener.name() + "): "
          + e.getMessage());
      return StepOutcome.failed(e.getMessage());
    }

    KnowledgeGraph graph = s.graph();
    graph.atomically(() -> {
      graph.setClock(turnIndex);
      String memoryId = graph.addMemory(speaker.id(), result.newMemory, turnIndex);
      s.extractor().linkMentions(memoryId, result.newMemory + "\n" + result.utterance, turnIndex);
      Map<String, Object> told = new LinkedHashMap<>();
      told.put("memory", memoryId);
      told.put("utterance", abbreviate(result.utterance, 200));
      told.put("sentiment", result.sentiment);
      graph.addRelationship(speaker.id(), listener.id(), RelationType.TOLD, told);
      graph.addRelationship(listener.id(), memoryId, RelationType.REMEMBERS, Map.of("via", speaker.id()));
    });

    DialogueTurn turn = new DialogueTurn(
        turnIndex,
        speaker.id(),
        speaker.persona().title,
        speaker.persona().profession,
        speakerMood.label(),
        listener.id(),
        listener.persona().title,
        listener.persona().profession,
        listenerMood.label(),
        result.utterance,
        result.internalMonologue,
        result.sentiment,
        result.rumorDelta,
        speakerMemories.stream().map(RetrievedMemory::provenance).toList(),
        System.currentTimeMillis());

    s.moods().drift(speaker.id(), result.sentiment);
    s.moods().drift(listener.id(), result.sentiment);
    s.markSpoke(speaker.id());
    s.markHeard(listener.id());
    s.world().applyRumor(speaker.persona().title, result.rumorDelta, result.utterance, result.newDevelopment);
    s.history().add(turn);
    s.advance(turnIndex);
    s.publish();
    WorldSnapshot after = s.published();

    SimulationLogger.log("Turn", turnIndex + " " + speaker.name() + " -> " + listener.name() + ": "
        + abbreviate(result.utterance, 120) + " (heat " + after.rumorHeat() + ")");

    PropagationTracker t = tracker;
    if (t != null) {
      t.observe(turnIndex, speaker.id(), speaker.name(), speaker.persona().traits,
          listener.id(), listener.name(), result.utterance);
    }
    TurnEvent event = new TurnEvent(turn, after);
    for (TurnListener l : listeners) {
      try {
        l.onTurn(event);
      } catch (RuntimeException e) {
        SimulationLogger.log("Turn", "Listener failed: " + e);
      }
    }
    return StepOutcome.completed(turn, after);
  }

  private List<String> recentLines(Session s) {
    List<String> lines = new ArrayList<>();
    for (DialogueTurn turn : s.history().last(settings.promptHistoryTurns())) {
      lines.add(turn.speaker() + " to " + turn.listener() + ": " + turn.content());
    }
    return lines;
  }

  private static List<String> render(List<RetrievedMemory> memories) {
    return memories.stream().map(RetrievedMemory::render).toList();
  }

  private static List<String> names(Session s) {
    return s.agents().values().stream().map(NpcAgent::name).toList();
  }

  private void ensureRunning() {
    if (state == OrchestratorState.STOPPED) {
      throw new IllegalStateException("Orchestrator has been shut down");
    }
  }

  private static String abbreviate(String text, int max) {
    if (text == null) return "";
    return text.length() <= max ? text : text.substring(0, max - 3) + "...";
  }
}
