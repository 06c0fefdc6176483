package npcsim.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Relationship(long seq, String sourceId, String targetId, RelationType type,
                           int createdAt, double weight, Map<String, Object> attributes) {

  public Relationship {
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public String attribute(String key) {
    Object value = attributes.get(key);
    return value == null ? "" : value.toString();
  }

  /** The endpoint on the other side of this edge, seen from {@code fromId}. */
  public String otherEnd(String fromId) {
    return sourceId.equals(fromId) ? targetId : sourceId;
  }
}
