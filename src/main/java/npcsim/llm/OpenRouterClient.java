package npcsim.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** OpenAI-compatible chat completions through OpenRouter. */
public class OpenRouterClient implements LLMClient {
  private static final int FALLBACK_MAX_TOKENS = 400;
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);

  private final HttpClient http = HttpClient.newBuilder()
      .connectTimeout(Duration.ofSeconds(10))
      .build();
  private final ObjectMapper mapper = new ObjectMapper();
  private final String apiKey;
  private final URI endpoint;
  private final String model;
  private final int maxTokens;
  private final double temperature;
  private final String referer;
  private final String title;

  public OpenRouterClient(String apiKey, String baseUrl, String model, int maxTokens, double temperature,
                          String referer, String title) {
    this.apiKey = require(apiKey, "API key");
    this.endpoint = URI.create(stripSlash(require(baseUrl, "base URL")) + "/chat/completions");
    this.model = require(model, "model");
    this.maxTokens = maxTokens;
    this.temperature = temperature;
    this.referer = referer == null ? "" : referer.trim();
    this.title = title == null ? "" : title.trim();
  }

  @Override
  public String name() {
    return "openrouter:" + model;
  }

  @Override
  public String generateJson(String systemPrompt, String prompt, LLMRequestOptions options) throws Exception {
    int tokens = LLMRequestOptions.numPredictOr(options, maxTokens);
    if (tokens <= 0) tokens = FALLBACK_MAX_TOKENS;
    double temp = LLMRequestOptions.temperatureOr(options, temperature);

    ObjectNode body = requestBody(systemPrompt, prompt, tokens, temp);
    HttpResponse<String> response = post(body);
    if (response.statusCode() >= 400 && response.statusCode() < 500 && body.has("response_format")) {
      // Some routed models reject response_format; ask again without it.
      body.remove("response_format");
      response = post(body);
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new IOException("OpenRouter error " + response.statusCode() + ": " + response.body());
    }

    JsonNode content = mapper.readTree(response.body()).path("choices").path(0).path("message").path("content");
    if (content.isMissingNode() || content.isNull()) {
      throw new IOException("OpenRouter reply has no choices[0].message.content");
    }
    return JsonPayloads.extract(content.asText());
  }

  private ObjectNode requestBody(String systemPrompt, String prompt, int tokens, double temp) {
    ObjectNode body = mapper.createObjectNode();
    body.put("model", model);
    ArrayNode messages = body.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", prompt);
    body.put("temperature", temp);
    body.put("max_tokens", tokens);
    body.putObject("response_format").put("type", "json_object");
    return body;
  }

  private HttpResponse<String> post(ObjectNode body) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
        .header("Authorization", "Bearer " + apiKey)
        .header("Content-Type", "application/json")
        .timeout(REQUEST_TIMEOUT)
        .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
    if (!referer.isEmpty()) builder.header("HTTP-Referer", referer);
    if (!title.isEmpty()) builder.header("X-Title", title);
    return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private static String require(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing OpenRouter " + what);
    }
    return value.trim();
  }

  static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
