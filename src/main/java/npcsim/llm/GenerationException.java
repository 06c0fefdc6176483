package npcsim.llm;

/** A dialogue generation attempt produced nothing usable. */
public class GenerationException extends Exception {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
