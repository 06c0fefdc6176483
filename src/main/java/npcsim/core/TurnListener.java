package npcsim.core;

public interface TurnListener {
  void onTurn(TurnEvent event);

  /** Called after a reset replaced the session, before any turn of the new session. */
  default void onReset() {
  }
}
