package npcsim.memory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum RelationType {
  REMEMBERS,
  MENTIONS,
  TOLD,
  WITNESSED,
  SUSPECTS,
  KNOWS,
  RELATED_TO;

  /** Edges that connect agents to each other or to shared events, walked when gathering hearsay. */
  public static final Set<RelationType> SOCIAL = EnumSet.of(TOLD, WITNESSED, KNOWS, SUSPECTS, RELATED_TO);

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String verb() {
    return switch (this) {
      case REMEMBERS -> "remembers";
      case MENTIONS -> "mentions";
      case TOLD -> "told";
      case WITNESSED -> "witnessed";
      case SUSPECTS -> "suspects";
      case KNOWS -> "knows";
      case RELATED_TO -> "is tied to";
    };
  }
}
