package npcsim.llm;

import java.time.Duration;

public class GenerationTimeoutException extends GenerationException {
  public GenerationTimeoutException(Duration timeout) {
    super("Generation timed out after " + timeout.toMillis() + " ms");
  }
}
