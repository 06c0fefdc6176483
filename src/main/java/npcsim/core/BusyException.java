package npcsim.core;

/** A command was refused because the orchestrator is in the middle of other work. */
public class BusyException extends IllegalStateException {
  public BusyException(String message) {
    super(message);
  }
}
