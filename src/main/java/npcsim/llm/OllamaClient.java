package npcsim.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** A local Ollama server in JSON mode via {@code /api/generate}. */
public class OllamaClient implements LLMClient {
  private final HttpClient http = HttpClient.newBuilder()
      .connectTimeout(Duration.ofSeconds(10))
      .build();
  private final ObjectMapper mapper = new ObjectMapper();
  private final URI endpoint;
  private final String model;   // e.g. "llama3.2:3b"
  private final int numPredict;
  private final double temperature;

  public OllamaClient(String baseUrl, String model, int numPredict, double temperature) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("Missing Ollama base URL");
    }
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("Missing Ollama model");
    }
    this.endpoint = URI.create(OpenRouterClient.stripSlash(baseUrl.trim()) + "/api/generate");
    this.model = model.trim();
    this.numPredict = numPredict;
    this.temperature = temperature;
  }

  @Override
  public String name() {
    return "ollama:" + model;
  }

  @Override
  public String generateJson(String systemPrompt, String prompt, LLMRequestOptions options) throws Exception {
    ObjectNode body = mapper.createObjectNode()
        .put("model", model)
        .put("prompt", prompt)
        .put("stream", false)
        .put("format", "json");
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      body.put("system", systemPrompt);
    }
    ObjectNode modelOptions = body.putObject("options");
    modelOptions.put("temperature", LLMRequestOptions.temperatureOr(options, temperature));
    int tokens = LLMRequestOptions.numPredictOr(options, numPredict);
    if (tokens > 0) modelOptions.put("num_predict", tokens);

    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .header("Content-Type", "application/json")
        .timeout(Duration.ofSeconds(120))
        .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
        .build();
    HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException("Ollama error " + response.statusCode() + ": " + response.body());
    }

    JsonNode reply = mapper.readTree(response.body()).get("response");
    if (reply == null || reply.isNull()) {
      throw new IOException("Ollama reply has no response field");
    }
    return JsonPayloads.extract(reply.asText());
  }
}
