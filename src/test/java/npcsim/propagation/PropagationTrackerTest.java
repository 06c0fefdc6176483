package npcsim.propagation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropagationTrackerTest {
  private static final String SECRET = "The vault door was left ajar";
  private static final Set<String> GOSSIP = Set.of("theatrical", "dramatic", "talkative");
  private static final Set<String> STOIC = Set.of("calm", "quiet", "observant");

  private PropagationTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new PropagationTracker();
  }

  @Test
  void statsAreInactiveBeforeAnyInjection() {
    PropagationStats stats = tracker.stats();

    assertFalse(stats.active());
    assertNotNull(stats.message());
    assertNull(stats.experimentId());
    assertFalse(tracker.active());
    assertNull(tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET));
  }

  @Test
  void verbatimRetellingIsTracedAsUnchanged() {
    String id = tracker.open(SECRET, "npc:mara", "Mara", 0);

    ExperimentTrace trace = tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET);

    assertEquals("exp-001", id);
    assertNotNull(trace);
    assertEquals(1.0, trace.similarity());
    assertEquals(MutationClass.UNCHANGED, trace.mutation());
    assertEquals(PersonalityType.GOSSIP, trace.personalityType());
    assertEquals("minimal drift", trace.drift());

    PropagationStats stats = tracker.stats();
    assertTrue(stats.active());
    assertEquals(List.of("npc:suna"), stats.agentsReached());
    assertEquals(1, stats.turnsElapsed());
    assertEquals(1.0, stats.overallFidelity());
    assertEquals(1.0, stats.propagationRate());
  }

  @Test
  void emptyLineIsBelowTheTraceThreshold() {
    tracker.open("The blacksmith is a spy", "npc:mara", "Mara", 0);

    assertNull(tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", ""));

    PropagationStats stats = tracker.stats();
    assertEquals(1, stats.turnsElapsed());
    assertTrue(stats.agentsReached().isEmpty());
    assertTrue(tracker.timeline().get(0).traces().isEmpty());
    assertTrue(tracker.timeline().get(0).agentsReached().isEmpty());
  }

  @Test
  void unrelatedTurnsCountButLeaveNoTrace() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);

    assertNull(tracker.observe(1, "npc:kel", "Kel", Set.of("inventive"), "npc:suna", "Suna",
        "Fresh bread at the market today"));

    PropagationStats stats = tracker.stats();
    assertEquals(1, stats.turnsElapsed());
    assertTrue(stats.agentsReached().isEmpty());
    assertEquals(0.0, stats.propagationRate());
    assertTrue(stats.byPersonality().isEmpty());
  }

  @Test
  void paraphrasesAndMutationsAreClassifiedBySimilarity() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);

    ExperimentTrace paraphrased = tracker.observe(1, "npc:iris", "Iris", Set.of("curious"), "npc:kel", "Kel",
        "Vault door left wide open");
    ExperimentTrace mutated = tracker.observe(2, "npc:kel", "Kel", Set.of("inventive"), "npc:suna", "Suna",
        "A dragon melted the vault");

    assertEquals(MutationClass.PARAPHRASED, paraphrased.mutation());
    assertEquals(MutationClass.MUTATED, mutated.mutation());
    assertEquals(PersonalityType.NEUTRAL, mutated.personalityType());
    assertTrue(mutated.drift().contains("lost: door"));
    assertEquals(1.0, tracker.stats().byPersonality().get("neutral").mutationRate());
    assertEquals(0.0, tracker.stats().byPersonality().get("gossip").mutationRate());
  }

  @Test
  void gossipToStoicRatioNeedsStoicSpread() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);
    tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET);
    tracker.observe(2, "npc:theron", "Theron", GOSSIP, "npc:kel", "Kel", SECRET);

    assertNull(tracker.stats().gossipToStoicRatio());

    tracker.observe(3, "npc:suna", "Suna", STOIC, "npc:rylan", "Rylan", SECRET);
    tracker.observe(4, "npc:kel", "Kel", Set.of("inventive"), "npc:mara", "Mara", "Nothing to report");

    PropagationStats stats = tracker.stats();
    assertEquals(2.0, stats.gossipToStoicRatio());
    assertEquals(0.5, stats.byPersonality().get("gossip").spreadVelocity());
    assertEquals(0.25, stats.byPersonality().get("stoic").spreadVelocity());
    assertEquals(4, stats.turnsElapsed());
    assertEquals(List.of("npc:suna", "npc:kel", "npc:rylan"), stats.agentsReached());
  }

  @Test
  void newInjectionClosesThePreviousExperiment() {
    String first = tracker.open(SECRET, "npc:mara", "Mara", 0);
    tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET);
    String second = tracker.open("Counterfeit coins at the docks", "npc:iris", "Iris", 1);

    List<PropagationExperiment.View> timeline = tracker.timeline();

    assertEquals("exp-002", second);
    assertEquals(2, timeline.size());
    assertEquals(first, timeline.get(0).experimentId());
    assertFalse(timeline.get(0).open());
    assertEquals(1, timeline.get(0).traces().size());
    assertTrue(timeline.get(1).open());
    assertEquals(second, tracker.stats().experimentId());
    assertFalse(tracker.stats(first).active());
    assertThrows(IllegalArgumentException.class, () -> tracker.stats("exp-999"));
  }

  @Test
  void personalityIsResolvedOncePerAgent() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);
    tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET);
    ExperimentTrace later = tracker.observe(2, "npc:theron", "Theron", STOIC, "npc:kel", "Kel", SECRET);

    assertEquals(PersonalityType.GOSSIP, later.personalityType());
  }

  @Test
  void reportSummarizesEveryExperiment() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);
    tracker.observe(1, "npc:theron", "Theron", GOSSIP, "npc:suna", "Suna", SECRET);

    String report = tracker.report();

    assertTrue(report.startsWith("# Information Propagation Report"));
    assertTrue(report.contains("### exp-001 (open)"));
    assertTrue(report.contains("| gossip | 1 | 1.000 | 0.000 |"));
  }

  @Test
  void clearForgetsTheTimeline() {
    tracker.open(SECRET, "npc:mara", "Mara", 0);
    tracker.clear();

    assertFalse(tracker.active());
    assertTrue(tracker.timeline().isEmpty());
    assertFalse(tracker.stats().active());
  }

  @Test
  void blankSecretIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> tracker.open("  ", "npc:mara", "Mara", 0));
  }

  @Test
  void gossipTraitsWinOverStoicOnes() {
    PropagationSettings settings = PropagationSettings.defaults();
    assertEquals(PersonalityType.GOSSIP, settings.personalityOf(Set.of("Curious", "guarded")));
    assertEquals(PersonalityType.STOIC, settings.personalityOf(Set.of("guarded")));
    assertEquals(PersonalityType.NEUTRAL, settings.personalityOf(null));
  }
}
