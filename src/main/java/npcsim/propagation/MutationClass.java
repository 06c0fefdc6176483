package npcsim.propagation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MutationClass {
  UNCHANGED,
  PARAPHRASED,
  MUTATED;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
