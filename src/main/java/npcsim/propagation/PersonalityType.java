package npcsim.propagation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PersonalityType {
  GOSSIP,
  STOIC,
  NEUTRAL;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
