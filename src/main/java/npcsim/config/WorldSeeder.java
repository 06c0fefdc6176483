package npcsim.config;

import npcsim.agents.MoodBoard;
import npcsim.agents.NpcAgent;
import npcsim.agents.Persona;
import npcsim.agents.PersonaCatalog;
import npcsim.core.Session;
import npcsim.core.SessionFactory;
import npcsim.core.TurnHistory;
import npcsim.core.WorldDynamics;
import npcsim.core.WorldState;
import npcsim.llm.DialogueGenerator;
import npcsim.memory.ContextRetriever;
import npcsim.memory.EntityExtractor;
import npcsim.memory.EntityType;
import npcsim.memory.KnowledgeGraph;
import npcsim.memory.RelationType;
import npcsim.memory.RetrievalSettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Builds seed-only sessions: the world vocabulary, one npc entity per persona on the roster, the
 * seed event with one witness, and a memory of the event for every npc.
 */
public class WorldSeeder implements SessionFactory {
  public record Settings(List<String> rumorSeeds, int rosterSize, List<String> rosterPool, int historyLimit,
                         double moodDriftRate, long randomSeed) {

    public Settings {
      rumorSeeds = rumorSeeds == null ? List.of() : List.copyOf(rumorSeeds);
      rosterPool = rosterPool == null ? List.of() : List.copyOf(rosterPool);
      if (rumorSeeds.isEmpty()) throw new IllegalArgumentException("At least one rumor seed is required");
    }
  }

  private final PersonaCatalog catalog;
  private final WorldVocabulary vocabulary;
  private final DialogueGenerator generator;
  private final RetrievalSettings retrieval;
  private final WorldDynamics dynamics;
  private final Settings settings;
  private final Random picker;

  public WorldSeeder(PersonaCatalog catalog, WorldVocabulary vocabulary, DialogueGenerator generator,
                     RetrievalSettings retrieval, WorldDynamics dynamics, Settings settings) {
    this.catalog = catalog;
    this.vocabulary = vocabulary == null ? WorldVocabulary.empty() : vocabulary;
    this.generator = generator;
    this.retrieval = retrieval == null ? RetrievalSettings.defaults() : retrieval;
    this.dynamics = dynamics == null ? WorldDynamics.defaults() : dynamics;
    this.settings = settings;
    this.picker = new Random(settings.randomSeed());
  }

  @Override
  public synchronized Session create(String seedEvent, List<String> rosterKeys) {
    String event = seedEvent == null || seedEvent.isBlank()
        ? settings.rumorSeeds().get(picker.nextInt(settings.rumorSeeds().size()))
        : seedEvent.trim();
    List<String> roster = rosterKeys == null || rosterKeys.isEmpty()
        ? catalog.sample(settings.rosterSize(), settings.rosterPool(), picker)
        : validateRoster(rosterKeys);
    Random random = new Random(settings.randomSeed() ^ event.hashCode() ^ roster.hashCode());

    KnowledgeGraph graph = new KnowledgeGraph();
    EntityExtractor extractor = new EntityExtractor(graph);
    vocabulary.seed(graph);

    MoodBoard moods = new MoodBoard(settings.moodDriftRate());
    List<NpcAgent> agents = new ArrayList<>();
    for (String key : roster) {
      Persona persona = catalog.get(key);
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put("persona", persona.key);
      attrs.put("title", persona.title);
      attrs.put("profession", persona.profession);
      attrs.put("aliases", persona.aliases);
      String id = graph.addEntity(EntityType.NPC, persona.name, attrs);
      agents.add(new NpcAgent(id, persona, generator));
      moods.init(id, persona, random);
    }

    String eventId = graph.addEntity(EntityType.EVENT, event, Map.of("aliases", List.of()));
    for (String mentioned : extractor.extract(event)) {
      graph.addRelationship(eventId, mentioned, RelationType.RELATED_TO, Map.of());
    }
    for (NpcAgent agent : agents) {
      String memoryId = graph.addMemory(agent.id(), event, 0);
      extractor.linkMentions(memoryId, event, 0);
      graph.addRelationship(memoryId, eventId, RelationType.MENTIONS, 0.5, Map.of());
    }
    NpcAgent witness = agents.get(random.nextInt(agents.size()));
    graph.addRelationship(witness.id(), eventId, RelationType.WITNESSED, Map.of());

    return new Session(event, graph, extractor, new ContextRetriever(graph, extractor, retrieval),
        new WorldState(event, dynamics), new TurnHistory(settings.historyLimit()), moods, agents, random);
  }

  private List<String> validateRoster(List<String> keys) {
    Set<String> unique = new LinkedHashSet<>();
    for (String key : keys) {
      unique.add(catalog.get(key).key);
    }
    if (unique.size() < 2) throw new IllegalArgumentException("A roster needs at least two distinct personas");
    return List.copyOf(unique);
  }
}
