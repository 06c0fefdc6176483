package npcsim.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextRetrieverTest {
  private KnowledgeGraph graph;
  private EntityExtractor extractor;
  private ContextRetriever retriever;
  private String mara;
  private String rylan;
  private String iris;

  @BeforeEach
  void setUp() {
    graph = new KnowledgeGraph();
    extractor = new EntityExtractor(graph);
    retriever = new ContextRetriever(graph, extractor, RetrievalSettings.defaults());
    mara = graph.addEntity(EntityType.NPC, "Mara", Map.of());
    rylan = graph.addEntity(EntityType.NPC, "Rylan", Map.of());
    iris = graph.addEntity(EntityType.NPC, "Iris", Map.of());
    graph.addEntity(EntityType.LOCATION, "vault", Map.of());
    graph.addEntity(EntityType.LOCATION, "docks", Map.of());
  }

  private String remember(String owner, String content, int turn) {
    String memoryId = graph.addMemory(owner, content, turn);
    extractor.linkMentions(memoryId, content, turn);
    return memoryId;
  }

  @Test
  void ownMemoryIsRenderedAsANote() {
    remember(mara, "The vault door was open.", 1);
    graph.setClock(3);

    List<RetrievedMemory> found = retriever.retrieve(mara, "What about the vault?");

    assertEquals(1, found.size());
    RetrievedMemory memory = found.get(0);
    assertFalse(memory.hearsay());
    assertEquals(1, memory.pathLength());
    assertEquals("Mara noted the vault two turns ago", memory.provenance());
    assertEquals("Mara noted the vault two turns ago: \"The vault door was open.\"", memory.render());
  }

  @Test
  void hearsayCarriesTheChainItTravelled() {
    remember(mara, "The vault door was open.", 1);
    graph.setClock(2);
    graph.addRelationship(mara, rylan, RelationType.TOLD, Map.of());

    List<RetrievedMemory> found = retriever.retrieve(rylan, "the vault");

    assertEquals(1, found.size());
    RetrievedMemory memory = found.get(0);
    assertTrue(memory.hearsay());
    assertEquals(2, memory.pathLength());
    assertEquals(mara, memory.holderId());
    assertEquals("Mara told Rylan about the vault just now", memory.provenance());
  }

  @Test
  void memoryHandedOverInConversationNamesTheTeller() {
    String memoryId = remember(mara, "The vault door was open.", 4);
    graph.setClock(4);
    graph.addRelationship(mara, rylan, RelationType.TOLD, Map.of("memory", memoryId));
    graph.addRelationship(rylan, memoryId, RelationType.REMEMBERS, Map.of("via", mara));
    graph.setClock(6);

    List<RetrievedMemory> found = retriever.retrieve(rylan, "vault");

    assertEquals(1, found.size());
    assertEquals(1, found.get(0).pathLength());
    assertEquals("Mara told Rylan about the vault two turns ago", found.get(0).provenance());
  }

  @Test
  void twoHopChainsAreListedInTellingOrder() {
    remember(mara, "Gold missing from the vault.", 1);
    graph.setClock(2);
    graph.addRelationship(mara, rylan, RelationType.TOLD, Map.of());
    graph.setClock(3);
    graph.addRelationship(rylan, iris, RelationType.TOLD, Map.of());

    List<RetrievedMemory> found = retriever.retrieve(iris, "vault");

    assertEquals(1, found.size());
    assertEquals(3, found.get(0).pathLength());
    assertEquals("Mara told Rylan, then Rylan told Iris about the vault just now", found.get(0).provenance());
    assertTrue(retriever.retrieve(iris, "vault", 1, 4).isEmpty());
  }

  @Test
  void ownMemoriesOutrankHearsayOnTheSameTopic() {
    remember(mara, "Someone was near the vault.", 1);
    remember(rylan, "The vault lock was scratched.", 1);
    graph.setClock(1);
    graph.addRelationship(mara, rylan, RelationType.TOLD, Map.of());

    List<RetrievedMemory> found = retriever.retrieve(rylan, "vault");

    assertEquals(2, found.size());
    assertEquals(rylan, found.get(0).holderId());
    assertEquals(mara, found.get(1).holderId());
    assertTrue(found.get(0).score() > found.get(1).score());
  }

  @Test
  void cyclesTerminateAndEachMemoryAppearsOnce() {
    remember(mara, "The vault is empty.", 1);
    remember(iris, "Smugglers at the docks near the vault.", 1);
    graph.addRelationship(mara, rylan, RelationType.TOLD, Map.of());
    graph.addRelationship(rylan, iris, RelationType.TOLD, Map.of());
    graph.addRelationship(iris, mara, RelationType.TOLD, Map.of());
    graph.addRelationship(rylan, mara, RelationType.KNOWS, Map.of());

    List<RetrievedMemory> found = retriever.retrieve(rylan, "vault docks");

    assertEquals(2, found.size());
    assertEquals(2, found.stream().map(RetrievedMemory::memoryId).distinct().count());
    assertEquals(found, retriever.retrieve(rylan, "vault docks"));
  }

  @Test
  void resultsAreCappedAndOrderedByScore() {
    for (int turn = 1; turn <= 6; turn++) {
      remember(mara, "Vault note " + turn, turn);
    }
    graph.setClock(6);

    List<RetrievedMemory> found = retriever.retrieve(mara, "vault", 2, 3);

    assertEquals(3, found.size());
    assertEquals(List.of(6, 5, 4), found.stream().map(RetrievedMemory::createdAt).toList());
  }

  @Test
  void topicWithoutKnownEntitiesYieldsNothing() {
    remember(mara, "The vault door was open.", 1);
    assertTrue(retriever.retrieve(mara, "the weather today").isEmpty());
  }

  @Test
  void unknownAgentIsRejected() {
    assertThrows(UnknownEntityException.class, () -> retriever.retrieve("npc:nobody", "vault"));
  }

  @Test
  void ageLabelsUseWordsForShortSpans() {
    assertEquals("just now", ContextRetriever.ageLabel(0));
    assertEquals("one turn ago", ContextRetriever.ageLabel(1));
    assertEquals("three turns ago", ContextRetriever.ageLabel(3));
    assertEquals("12 turns ago", ContextRetriever.ageLabel(12));
  }
}
