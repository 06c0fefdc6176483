package npcsim.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import npcsim.agents.PersonaCatalog;
import npcsim.config.WorldSeeder;
import npcsim.config.WorldVocabulary;
import npcsim.llm.BoundedGenerator;
import npcsim.llm.DialogueGenerator;
import npcsim.llm.GenerationException;
import npcsim.llm.GenerationRequest;
import npcsim.llm.InvalidGenerationResponseException;
import npcsim.llm.LLMRequestOptions;
import npcsim.llm.TemplateGenerator;
import npcsim.memory.GraphStats;
import npcsim.memory.KnowledgeGraph;
import npcsim.memory.RetrievalSettings;
import npcsim.propagation.ExperimentTrace;
import npcsim.propagation.MutationClass;
import npcsim.propagation.PropagationExperiment;
import npcsim.propagation.PropagationStats;
import npcsim.propagation.PropagationTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorTest {
  private static final String EVENT = "Vault door left ajar last night.";
  private static final String SECRET = "The vault door was left ajar";
  private static final List<String> ROSTER = List.of("shopkeeper", "guard", "bard", "herbalist");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static PersonaCatalog catalog;
  private static WorldVocabulary vocabulary;

  private final List<Orchestrator> created = new ArrayList<>();

  @BeforeAll
  static void loadWorld() throws IOException {
    catalog = PersonaCatalog.load("");
    vocabulary = WorldVocabulary.load("");
  }

  @AfterEach
  void shutdownAll() {
    for (Orchestrator orchestrator : created) {
      orchestrator.shutdown();
    }
  }

  private Orchestrator orchestrator(DialogueGenerator generator) {
    WorldSeeder seeder = new WorldSeeder(catalog, vocabulary, generator, RetrievalSettings.defaults(),
        WorldDynamics.defaults(), new WorldSeeder.Settings(List.of(EVENT), 3, List.of(), 50, 0.35, 42L));
    Orchestrator orchestrator = new Orchestrator(seeder, OrchestratorSettings.defaults().withLoopDelayMs(10),
        EVENT, ROSTER);
    created.add(orchestrator);
    return orchestrator;
  }

  /** Repeats the current thread word for word. */
  private static class EchoGenerator implements DialogueGenerator {
    final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();

    @Override
    public String generate(GenerationRequest request, LLMRequestOptions options) throws GenerationException {
      requests.add(request);
      ObjectNode out = MAPPER.createObjectNode();
      out.put("utterance", request.topic());
      out.put("rumor_delta", 0.1);
      out.put("sentiment", "tense");
      out.put("new_memory", request.topic());
      return out.toString();
    }
  }

  private static class FailingGenerator implements DialogueGenerator {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public String generate(GenerationRequest request, LLMRequestOptions options) throws GenerationException {
      calls.incrementAndGet();
      throw new InvalidGenerationResponseException("model returned garbage");
    }
  }

  @Test
  void stepWritesTheTurnEverywhere() {
    Orchestrator orchestrator = orchestrator(new TemplateGenerator(1));
    GraphStats baseline = orchestrator.graphStats();

    StepOutcome outcome = orchestrator.step();

    assertTrue(outcome.completed());
    DialogueTurn turn = outcome.turn;
    assertEquals(1, turn.turn());
    assertNotEquals(turn.speakerId(), turn.listenerId());
    assertFalse(turn.content().isBlank());

    SimulationSnapshot snapshot = orchestrator.snapshot();
    assertEquals(OrchestratorState.IDLE, snapshot.state());
    assertEquals(1, snapshot.turn());
    assertEquals(List.of(turn), snapshot.history());
    assertEquals(1, snapshot.world().rumorLog().size());
    assertTrue(snapshot.world().rumorHeat() > 0.0);

    GraphStats after = orchestrator.graphStats();
    assertEquals(baseline.entitiesByType().get("memory") + 1, after.entitiesByType().get("memory"));
    assertEquals(baseline.edgesByType().get("remembers") + 2, after.edgesByType().get("remembers"));
    assertEquals(1, after.edgesByType().get("told"));
  }

  @Test
  void failedGenerationLeavesTheSessionUntouched() {
    FailingGenerator generator = new FailingGenerator();
    Orchestrator orchestrator = orchestrator(generator);
    GraphStats baseline = orchestrator.graphStats();
    WorldSnapshot worldBefore = orchestrator.snapshot().world();

    StepOutcome outcome = orchestrator.step();

    assertEquals(StepOutcome.Status.FAILED, outcome.status);
    assertNotNull(outcome.reason);
    assertEquals(2, generator.calls.get());
    assertEquals(baseline, orchestrator.graphStats());
    assertEquals(worldBefore, orchestrator.snapshot().world());
    assertEquals(0, orchestrator.snapshot().turn());
    assertTrue(orchestrator.history(10).isEmpty());
    assertEquals(OrchestratorState.IDLE, orchestrator.state());
  }

  @Test
  void invalidReplyIsRetriedOnceWithStricterInstructions() {
    EchoGenerator echo = new EchoGenerator();
    List<Boolean> strictness = new CopyOnWriteArrayList<>();
    AtomicInteger calls = new AtomicInteger();
    Orchestrator orchestrator = orchestrator((request, options) -> {
      strictness.add(request.strict());
      if (calls.incrementAndGet() == 1) return "I would rather not say.";
      return echo.generate(request, options);
    });

    StepOutcome outcome = orchestrator.step();

    assertTrue(outcome.completed());
    assertEquals(List.of(false, true), strictness);
    assertEquals(EVENT, outcome.turn.content());
  }

  @Test
  void slowGenerationTimesOutAndFailsTheStep() {
    DialogueGenerator slow = (request, options) -> {
      try {
        Thread.sleep(5_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationException("cancelled", e);
      }
      return "{}";
    };
    try (BoundedGenerator bounded = new BoundedGenerator(slow, Duration.ofMillis(100))) {
      Orchestrator orchestrator = orchestrator(bounded);
      GraphStats baseline = orchestrator.graphStats();

      StepOutcome outcome = orchestrator.step();

      assertEquals(StepOutcome.Status.FAILED, outcome.status);
      assertTrue(outcome.reason.contains("timed out"));
      assertEquals(baseline, orchestrator.graphStats());
    }
  }

  @Test
  void manualStepsAreRefusedWhileTheLoopRuns() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    EchoGenerator echo = new EchoGenerator();
    Orchestrator orchestrator = orchestrator((request, options) -> {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationException("interrupted", e);
      }
      return echo.generate(request, options);
    });

    assertTrue(orchestrator.startLoop());
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    assertEquals(OrchestratorState.RUNNING_LOOP, orchestrator.state());
    assertFalse(orchestrator.startLoop());
    assertEquals(StepOutcome.Status.BUSY, orchestrator.step().status);
    assertThrows(BusyException.class, () -> orchestrator.reset(null, null));

    assertTrue(orchestrator.stopLoop());
    assertEquals(OrchestratorState.IDLE, orchestrator.state());
    assertEquals(StepOutcome.Status.BUSY, orchestrator.step().status);
    release.countDown();

    long deadline = System.currentTimeMillis() + 5_000;
    while (orchestrator.snapshot().turn() < 1 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(1, orchestrator.snapshot().turn());
    Thread.sleep(100);
    assertEquals(1, orchestrator.snapshot().turn());
    assertTrue(orchestrator.step().completed());
  }

  @Test
  void loopKeepsTalkingUntilStopped() throws Exception {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());

    orchestrator.startLoop();
    long deadline = System.currentTimeMillis() + 5_000;
    while (orchestrator.snapshot().turn() < 3 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    orchestrator.stopLoop();

    assertTrue(orchestrator.snapshot().turn() >= 3);
  }

  @Test
  void resetRestoresTheSeedOnlySession() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    orchestrator.attachTracker(new PropagationTracker());
    GraphStats baseline = orchestrator.graphStats();
    WorldSnapshot worldBefore = orchestrator.snapshot().world();

    orchestrator.injectSecret(SECRET, "shopkeeper");
    orchestrator.runSteps(3);
    orchestrator.reset(EVENT, ROSTER);

    SimulationSnapshot snapshot = orchestrator.snapshot();
    assertEquals(baseline, snapshot.graph());
    assertEquals(worldBefore, snapshot.world());
    assertEquals(0, snapshot.turn());
    assertTrue(snapshot.history().isEmpty());
    assertFalse(orchestrator.tracker().stats().active());
    assertTrue(orchestrator.tracker().timeline().isEmpty());
  }

  @Test
  void verbatimRelayReachesEveryListenerUnchanged() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    orchestrator.attachTracker(new PropagationTracker());

    String experimentId = orchestrator.injectSecret(SECRET, "Mara");
    List<StepOutcome> outcomes = orchestrator.runSteps(10);

    assertEquals("exp-001", experimentId);
    assertEquals(10, outcomes.size());
    assertTrue(outcomes.stream().allMatch(StepOutcome::completed));

    Set<String> listeners = new HashSet<>();
    for (DialogueTurn turn : orchestrator.history(10)) {
      assertEquals(SECRET, turn.content());
      listeners.add(turn.listenerId());
    }
    PropagationStats stats = orchestrator.tracker().stats();
    assertEquals(10, stats.turnsElapsed());
    assertEquals(listeners, new HashSet<>(stats.agentsReached()));
    assertEquals(1.0, stats.overallFidelity());

    PropagationExperiment.View view = orchestrator.tracker().timeline().get(0);
    assertEquals(10, view.traces().size());
    for (ExperimentTrace trace : view.traces()) {
      assertEquals(MutationClass.UNCHANGED, trace.mutation());
    }
  }

  @Test
  void injectedSecretBecomesTheSeedAgentsMemoryAndTheTopic() {
    EchoGenerator echo = new EchoGenerator();
    Orchestrator orchestrator = orchestrator(echo);

    assertNull(orchestrator.injectSecret(SECRET, "npc:mara"));
    assertEquals(SECRET, orchestrator.snapshot().world().currentThread());

    orchestrator.runSteps(6);
    boolean maraRemembered = echo.requests.stream()
        .filter(r -> r.speakerId().equals("npc:mara"))
        .anyMatch(r -> r.speakerContext().stream().anyMatch(line -> line.contains(SECRET)));
    boolean maraSpoke = echo.requests.stream().anyMatch(r -> r.speakerId().equals("npc:mara"));
    assertEquals(maraSpoke, maraRemembered);
  }

  @Test
  void injectionNeedsAKnownAgentAndASecret() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());

    assertThrows(IllegalArgumentException.class, () -> orchestrator.injectSecret(SECRET, "Iris"));
    assertThrows(IllegalArgumentException.class, () -> orchestrator.injectSecret(" ", "Mara"));
  }

  @Test
  void listenersHearEveryCompletedTurn() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    List<TurnEvent> events = new CopyOnWriteArrayList<>();
    orchestrator.addListener(event -> {
      throw new IllegalStateException("listener bug");
    });
    orchestrator.addListener(events::add);

    orchestrator.runSteps(3);

    assertEquals(3, events.size());
    assertEquals(3, events.get(2).turn().turn());
    assertEquals(orchestrator.snapshot().world(), events.get(2).world());
  }

  @Test
  void entityContextLooksUpSeededEntities() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());

    KnowledgeGraph.EntityContext vault = orchestrator.entityContext("location", "vault");

    assertNotNull(vault);
    assertTrue(vault.connected().stream().anyMatch(c -> c.id().equals("object:door")));
    assertNull(orchestrator.entityContext("npc", "Nobody"));
    assertThrows(IllegalArgumentException.class, () -> orchestrator.entityContext("dragon", "x"));
  }

  @Test
  void seedSessionGivesEveryAgentTheEvent() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    GraphStats stats = orchestrator.graphStats();

    assertEquals(4, stats.entitiesByType().get("npc"));
    assertEquals(1, stats.entitiesByType().get("event"));
    assertEquals(4, stats.entitiesByType().get("memory"));
    assertEquals(1, stats.edgesByType().get("witnessed"));
    assertEquals(4, orchestrator.snapshot().agents().size());
  }

  @Test
  void shutDownOrchestratorRefusesWork() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    orchestrator.shutdown();

    assertEquals(OrchestratorState.STOPPED, orchestrator.state());
    assertThrows(IllegalStateException.class, orchestrator::step);
  }

  @Test
  void readersNeverSeeAHalfWrittenStep() throws Exception {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    int seedMemories = orchestrator.snapshot().graph().entitiesByType().get("memory");
    AtomicBoolean done = new AtomicBoolean(false);
    AtomicInteger reads = new AtomicInteger();
    List<String> torn = new CopyOnWriteArrayList<>();

    Thread reader = new Thread(() -> {
      while (!done.get()) {
        SimulationSnapshot snap = orchestrator.snapshot();
        int memories = snap.graph().entitiesByType().get("memory");
        reads.incrementAndGet();
        if (snap.history().size() != snap.turn()
            || memories != seedMemories + snap.turn()
            || snap.world().rumorLog().size() != Math.min(snap.turn(), 10)) {
          torn.add("turn=" + snap.turn() + " history=" + snap.history().size() + " memories=" + memories
              + " rumorLog=" + snap.world().rumorLog().size());
        }
      }
    }, "snapshot-reader");
    reader.start();

    List<StepOutcome> outcomes = orchestrator.runSteps(40);
    done.set(true);
    reader.join(TimeUnit.SECONDS.toMillis(5));

    assertEquals(40, outcomes.size());
    assertTrue(outcomes.stream().allMatch(StepOutcome::completed));
    assertTrue(reads.get() > 0);
    assertEquals(List.of(), torn);
    assertEquals(seedMemories + 40, orchestrator.graphStats().entitiesByType().get("memory"));
  }

  @Test
  void experimentRunStartsFreshAndTracksEveryRound() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    PropagationTracker tracker = new PropagationTracker();
    orchestrator.attachTracker(tracker);
    orchestrator.runSteps(3);

    ExperimentRun run = orchestrator.runExperiment(null, 5);

    assertEquals("exp-001", run.experimentId());
    assertEquals(Orchestrator.DEFAULT_EXPERIMENT_SECRET, run.secret());
    assertEquals("Mara", run.seedAgent());
    assertEquals(5, run.outcomes().size());
    assertTrue(run.outcomes().stream().allMatch(StepOutcome::completed));

    SimulationSnapshot snapshot = orchestrator.snapshot();
    assertEquals(5, snapshot.turn());
    assertEquals(EVENT, snapshot.seedEvent());
    assertEquals(ROSTER.size(), snapshot.agents().size());

    PropagationStats stats = tracker.stats();
    assertEquals("exp-001", stats.experimentId());
    assertEquals(5, stats.turnsElapsed());
    assertFalse(stats.agentsReached().isEmpty());
    assertEquals(1.0, stats.overallFidelity());
  }

  @Test
  void experimentRunNeedsATrackerAndAtLeastOneRound() {
    Orchestrator orchestrator = orchestrator(new EchoGenerator());
    assertThrows(IllegalStateException.class, () -> orchestrator.runExperiment("x", 3));

    orchestrator.attachTracker(new PropagationTracker());
    assertThrows(IllegalArgumentException.class, () -> orchestrator.runExperiment("x", 0));
  }
}
