package npcsim.llm;

public class InvalidGenerationResponseException extends GenerationException {
  public InvalidGenerationResponseException(String message) {
    super(message);
  }

  public InvalidGenerationResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
