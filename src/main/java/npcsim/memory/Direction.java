package npcsim.memory;

public enum Direction {
  OUTGOING,
  INCOMING,
  BOTH
}
