package npcsim.core;

import npcsim.agents.Mood;
import npcsim.agents.MoodBoard;
import npcsim.agents.NpcAgent;
import npcsim.agents.Persona;
import npcsim.memory.ContextRetriever;
import npcsim.memory.EntityExtractor;
import npcsim.memory.GraphStats;
import npcsim.memory.KnowledgeGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Everything one run of the simulation owns: graph, world, history, moods and roster. A reset
 * replaces the whole session rather than clearing it.
 *
 * Readers see the session through {@link #view()}, which is replaced in one write after every
 * completed mutation and so never mixes state from before and after a step.
 */
public class Session {
  /** Turn, world, history, moods and graph counts as of the same instant. */
  public record View(int turn, WorldSnapshot world, List<DialogueTurn> history, List<AgentView> agents,
                     GraphStats graph) {}

  private final String seedEvent;
  private final KnowledgeGraph graph;
  private final EntityExtractor extractor;
  private final ContextRetriever retriever;
  private final WorldState world;
  private final TurnHistory history;
  private final MoodBoard moods;
  private final Map<String, NpcAgent> agents;
  private final Map<String, Integer> pending = new HashMap<>();
  private final Map<String, Integer> heard = new HashMap<>();
  private final Random random;
  private volatile View view;
  private volatile int turn = 0;

  public Session(String seedEvent, KnowledgeGraph graph, EntityExtractor extractor, ContextRetriever retriever,
                 WorldState world, TurnHistory history, MoodBoard moods, List<NpcAgent> agents, Random random) {
    if (agents == null || agents.size() < 2) throw new IllegalArgumentException("A session needs at least two agents");
    this.seedEvent = seedEvent;
    this.graph = graph;
    this.extractor = extractor;
    this.retriever = retriever;
    this.world = world;
    this.history = history;
    this.moods = moods;
    Map<String, NpcAgent> byId = new LinkedHashMap<>();
    for (NpcAgent agent : agents) {
      byId.put(agent.id(), agent);
      pending.put(agent.id(), 0);
      heard.put(agent.id(), 0);
    }
    this.agents = Collections.unmodifiableMap(byId);
    this.random = random;
    publish();
  }

  public String seedEvent() { return seedEvent; }
  public KnowledgeGraph graph() { return graph; }
  public EntityExtractor extractor() { return extractor; }
  public ContextRetriever retriever() { return retriever; }
  public WorldState world() { return world; }
  public TurnHistory history() { return history; }
  public MoodBoard moods() { return moods; }
  public Random random() { return random; }
  public int turn() { return turn; }
  public WorldSnapshot published() { return view.world(); }
  public View view() { return view; }

  public Map<String, NpcAgent> agents() {
    return agents;
  }

  public List<String> roster() {
    return new ArrayList<>(agents.keySet());
  }

  public NpcAgent agent(String id) {
    NpcAgent agent = agents.get(id);
    if (agent == null) throw new IllegalArgumentException("Unknown agent: " + id);
    return agent;
  }

  /** Finds an agent by entity id, persona key or display name, ignoring case. */
  public NpcAgent findAgent(String ref) {
    if (ref == null || ref.isBlank()) return null;
    String needle = ref.trim();
    for (NpcAgent agent : agents.values()) {
      if (agent.id().equalsIgnoreCase(needle)
          || agent.persona().key.equalsIgnoreCase(needle)
          || agent.name().equalsIgnoreCase(needle)
          || agent.persona().title.equalsIgnoreCase(needle)) {
        return agent;
      }
    }
    return null;
  }

  Map<String, Integer> pending() { return pending; }
  Map<String, Integer> heard() { return heard; }

  void markSpoke(String speakerId) {
    pending.put(speakerId, 0);
  }

  void markHeard(String listenerId) {
    pending.merge(listenerId, 1, Integer::sum);
    heard.merge(listenerId, 1, Integer::sum);
  }

  void markLearned(String agentId) {
    pending.merge(agentId, 1, Integer::sum);
  }

  void advance(int completedTurn) {
    turn = completedTurn;
  }

  void publish() {
    List<AgentView> agentViews = new ArrayList<>();
    for (NpcAgent agent : agents.values()) {
      Persona persona = agent.persona();
      Mood mood = moods.mood(agent.id());
      agentViews.add(new AgentView(agent.id(), persona.key, persona.name, persona.title, persona.profession,
          List.copyOf(persona.traits), mood.label(), Math.round(mood.valence() * 100.0) / 100.0));
    }
    view = new View(turn, world.snapshot(), history.entries(), List.copyOf(agentViews), graph.stats());
  }
}
