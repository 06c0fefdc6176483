package npcsim.llm;

/** Per-call overrides; a null field falls back to the client's configured value. */
public class LLMRequestOptions {
  private final Integer numPredict;
  private final Double temperature;

  public LLMRequestOptions(Integer numPredict, Double temperature) {
    this.numPredict = numPredict;
    this.temperature = temperature;
  }

  public Integer numPredict() {
    return numPredict;
  }

  public Double temperature() {
    return temperature;
  }

  public static LLMRequestOptions withNumPredict(int numPredict) {
    return new LLMRequestOptions(numPredict, null);
  }

  static int numPredictOr(LLMRequestOptions options, int fallback) {
    return options == null || options.numPredict == null ? fallback : options.numPredict;
  }

  static double temperatureOr(LLMRequestOptions options, double fallback) {
    return options == null || options.temperature == null ? fallback : options.temperature;
  }
}
