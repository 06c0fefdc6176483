package npcsim.memory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {
  NPC,
  LOCATION,
  OBJECT,
  EVENT,
  CONCEPT,
  MEMORY;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EntityType fromKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Missing entity type");
    }
    return valueOf(key.trim().toUpperCase(Locale.ROOT));
  }
}
