package npcsim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import npcsim.memory.EntityType;
import npcsim.memory.KnowledgeGraph;
import npcsim.memory.RelationType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Places, objects and concepts every session starts with, plus the links between them. */
public class WorldVocabulary {
  public static final String DEFAULT_RESOURCE = "/world.json";

  private final WorldConfig config;

  private WorldVocabulary(WorldConfig config) {
    this.config = config;
  }

  public static WorldVocabulary load(String path) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    WorldConfig config;
    if (path == null || path.isBlank()) {
      try (InputStream in = WorldVocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) throw new IOException("Missing classpath resource " + DEFAULT_RESOURCE);
        config = mapper.readValue(in, WorldConfig.class);
      }
    } else {
      config = mapper.readValue(Files.readString(Path.of(path)), WorldConfig.class);
    }
    return new WorldVocabulary(config);
  }

  public static WorldVocabulary empty() {
    return new WorldVocabulary(new WorldConfig());
  }

  public int size() {
    return count(config.locations) + count(config.objects) + count(config.concepts);
  }

  public void seed(KnowledgeGraph graph) {
    addAll(graph, EntityType.LOCATION, config.locations);
    addAll(graph, EntityType.OBJECT, config.objects);
    addAll(graph, EntityType.CONCEPT, config.concepts);
    if (config.links == null) return;
    for (LinkConfig link : config.links) {
      graph.addRelationship(link.from, link.to, RelationType.RELATED_TO, Map.of());
    }
  }

  private static void addAll(KnowledgeGraph graph, EntityType type, List<TermConfig> terms) {
    if (terms == null) return;
    for (TermConfig term : terms) {
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put("aliases", term.aliases == null ? List.of() : List.copyOf(term.aliases));
      graph.addEntity(type, term.name, attrs);
    }
  }

  private static int count(List<?> values) {
    return values == null ? 0 : values.size();
  }

  private static class WorldConfig {
    public List<TermConfig> locations;
    public List<TermConfig> objects;
    public List<TermConfig> concepts;
    public List<LinkConfig> links;
  }

  private static class TermConfig {
    public String name;
    public List<String> aliases;
  }

  private static class LinkConfig {
    public String from;
    public String to;
  }
}
