package npcsim.core;

/** Emitted once per completed turn, after every write for that turn is visible. */
public record TurnEvent(DialogueTurn turn, WorldSnapshot world) {}
