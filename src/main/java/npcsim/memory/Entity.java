package npcsim.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A node of the knowledge graph. The id is derived from type and name, so the same
 * (type, name) pair always resolves to the same entity.
 */
public record Entity(String id, EntityType type, String name, Map<String, Object> attributes, int createdAt) {

  public Entity {
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public String attribute(String key) {
    Object value = attributes.get(key);
    return value == null ? "" : value.toString();
  }

  public List<String> aliases() {
    Object value = attributes.get("aliases");
    if (!(value instanceof List<?> list)) return List.of();
    return list.stream()
        .filter(item -> item != null && !item.toString().isBlank())
        .map(Object::toString)
        .toList();
  }

  public static String idFor(EntityType type, String name) {
    return type.key() + ":" + normalizeName(name);
  }

  static String normalizeName(String name) {
    return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
  }
}
