package npcsim.agents;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/** The archetypes a session roster is drawn from, keyed by persona key ("shopkeeper", "guard", ...). */
public class PersonaCatalog {
  public static final String DEFAULT_RESOURCE = "/personas.json";

  private final Map<String, Persona> personas;

  public PersonaCatalog(List<Persona> personas) {
    Map<String, Persona> byKey = new LinkedHashMap<>();
    for (Persona persona : personas) {
      if (byKey.put(normalizeKey(persona.key), persona) != null) {
        throw new IllegalArgumentException("Duplicate persona key: " + persona.key);
      }
    }
    this.personas = Collections.unmodifiableMap(byKey);
  }

  public static PersonaCatalog load(String path) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    PersonaConfig[] configs;
    if (path == null || path.isBlank()) {
      try (InputStream in = PersonaCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) throw new IOException("Missing classpath resource " + DEFAULT_RESOURCE);
        configs = mapper.readValue(in, PersonaConfig[].class);
      }
    } else {
      configs = mapper.readValue(Files.readString(Path.of(path)), PersonaConfig[].class);
    }

    List<Persona> out = new ArrayList<>();
    for (PersonaConfig pc : configs) {
      if (pc.key == null || pc.key.isBlank() || pc.name == null || pc.name.isBlank()) {
        throw new IllegalArgumentException("Persona entries need a key and a name");
      }
      out.add(new Persona(
          normalizeKey(pc.key),
          pc.name.trim(),
          pc.title == null || pc.title.isBlank() ? pc.name.trim() : pc.title.trim(),
          pc.profession == null ? "" : pc.profession.trim(),
          pc.voice == null ? "" : pc.voice.trim(),
          Collections.unmodifiableSet(new LinkedHashSet<>(lowered(pc.traits))),
          copy(pc.goals),
          copy(pc.forbiddenTopics),
          copy(pc.quirks),
          copy(pc.moods),
          copy(pc.aliases),
          pc.rumorBias == null ? 1.0 : pc.rumorBias,
          copy(pc.defaultTopics)
      ));
    }
    return new PersonaCatalog(out);
  }

  public List<String> keys() {
    return List.copyOf(personas.keySet());
  }

  public boolean contains(String key) {
    return key != null && personas.containsKey(normalizeKey(key));
  }

  public Persona get(String key) {
    Persona persona = key == null ? null : personas.get(normalizeKey(key));
    if (persona == null) throw new IllegalArgumentException("Unknown persona: " + key);
    return persona;
  }

  /**
   * Draws {@code size} distinct persona keys from {@code pool} (all personas when the pool is
   * empty), keeping catalog order in the result.
   */
  public List<String> sample(int size, List<String> pool, Random random) {
    List<String> candidates = new ArrayList<>();
    for (String key : pool == null || pool.isEmpty() ? keys() : pool) {
      String normalized = get(key).key;
      if (!candidates.contains(normalized)) candidates.add(normalized);
    }
    if (size < 2) throw new IllegalArgumentException("A roster needs at least two personas");
    if (candidates.size() < size) {
      throw new IllegalArgumentException("Persona pool has " + candidates.size() + " entries, need " + size);
    }
    Collections.shuffle(candidates, random);
    List<String> picked = new ArrayList<>(candidates.subList(0, size));
    List<String> order = keys();
    picked.sort((a, b) -> Integer.compare(order.indexOf(a), order.indexOf(b)));
    return List.copyOf(picked);
  }

  private static String normalizeKey(String key) {
    return key.trim().toLowerCase(Locale.ROOT);
  }

  private static List<String> copy(List<String> values) {
    return values == null ? List.of() : List.copyOf(values);
  }

  private static List<String> lowered(List<String> values) {
    if (values == null) return List.of();
    return values.stream()
        .filter(v -> v != null)
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .filter(v -> !v.isEmpty())
        .toList();
  }

  private static class PersonaConfig {
    public String key;
    public String name;
    public String title;
    public String profession;
    public String voice;
    public List<String> traits;
    public List<String> goals;
    public List<String> forbiddenTopics;
    public List<String> quirks;
    public List<String> moods;
    public List<String> aliases;
    public Double rumorBias;
    public List<String> defaultTopics;
  }
}
