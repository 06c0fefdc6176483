package npcsim.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import npcsim.core.BusyException;
import npcsim.core.ExperimentRun;
import npcsim.core.Orchestrator;
import npcsim.core.SimulationLogger;
import npcsim.core.StepOutcome;
import npcsim.memory.KnowledgeGraph;
import npcsim.propagation.PropagationStats;
import npcsim.propagation.PropagationTracker;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON over the JDK HTTP server for the presentation client. Clients poll {@code /events} and
 * {@code /log} with a {@code since} index instead of holding a socket open.
 */
public class PollingServer {
  private static final int MAX_STEPS_PER_REQUEST = 50;
  private static final int DEFAULT_EXPERIMENT_ROUNDS = 10;

  private final HttpServer server;
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final Orchestrator orchestrator;
  private final TurnFeed feed;
  private final LogStore logStore;
  private final Map<String, Object> publicConfig;
  private final ObjectMapper mapper = new ObjectMapper();

  public PollingServer(int port, Orchestrator orchestrator, TurnFeed feed, LogStore logStore,
                       Map<String, Object> publicConfig) throws IOException {
    this.orchestrator = orchestrator;
    this.feed = feed;
    this.logStore = logStore;
    this.publicConfig = publicConfig == null ? Map.of() : Map.copyOf(publicConfig);
    this.server = HttpServer.create(new InetSocketAddress(port), 0);
    this.server.setExecutor(executor);
    context("/", this::handleNotFound);
    context("/health", this::handleHealth);
    context("/state", this::handleState);
    context("/events", this::handleEvents);
    context("/run", this::handleRun);
    context("/loop/start", this::handleLoopStart);
    context("/loop/stop", this::handleLoopStop);
    context("/reset", this::handleReset);
    context("/graph", this::handleGraph);
    context("/graph/entity", this::handleGraphEntity);
    context("/experiment/inject", this::handleInject);
    context("/experiment/stats", this::handleExperimentStats);
    context("/experiment/timeline", this::handleExperimentTimeline);
    context("/experiment/report", this::handleExperimentReport);
    context("/experiment/step", this::handleExperimentStep);
    context("/experiment/run", this::handleExperimentRun);
    context("/log", this::handleLog);
    context("/config", this::handleConfig);
  }

  public void start() {
    server.start();
  }

  public void stop() {
    server.stop(0);
    executor.shutdownNow();
  }

  public int port() {
    return server.getAddress().getPort();
  }

  private void context(String path, HttpHandler handler) {
    server.createContext(path, exchange -> {
      try {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
          exchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
          exchange.getResponseHeaders().add("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
          exchange.getResponseHeaders().add("Access-Control-Allow-Headers", "Content-Type");
          exchange.sendResponseHeaders(204, -1);
          return;
        }
        handler.handle(exchange);
      } catch (BusyException e) {
        writeJson(exchange, 409, error(e.getMessage()));
      } catch (IllegalArgumentException e) {
        writeJson(exchange, 400, error(e.getMessage()));
      } catch (Exception e) {
        SimulationLogger.log("Server", exchange.getRequestMethod() + " " + exchange.getRequestURI() + " failed: " + e);
        writeJson(exchange, 500, error("Internal error: " + e.getMessage()));
      } finally {
        exchange.close();
      }
    });
  }

  private void handleNotFound(HttpExchange exchange) throws IOException {
    writeJson(exchange, 404, error("No route for " + exchange.getRequestURI().getPath()));
  }

  private void handleHealth(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "ok");
    payload.put("state", orchestrator.state());
    writeJson(exchange, 200, payload);
  }

  private void handleState(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    writeJson(exchange, 200, orchestrator.snapshot());
  }

  private void handleEvents(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    int since = parseIntParam(exchange.getRequestURI().getQuery(), "since", 0);
    TurnFeed.FeedSnapshot snap = feed.snapshotFrom(since);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("events", snap.events);
    payload.put("nextIndex", snap.nextIndex);
    writeJson(exchange, 200, payload);
  }

  private void handleRun(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    List<StepOutcome> outcomes = runSteps(exchange.getRequestURI());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("outcomes", outcomes);
    payload.put("state", orchestrator.snapshot());
    writeJson(exchange, statusFor(outcomes), payload);
  }

  private void handleLoopStart(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    boolean started = orchestrator.startLoop();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("started", started);
    payload.put("state", orchestrator.state());
    writeJson(exchange, 200, payload);
  }

  private void handleLoopStop(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    boolean stopped = orchestrator.stopLoop();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stopped", stopped);
    payload.put("state", orchestrator.state());
    writeJson(exchange, 200, payload);
  }

  private void handleReset(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    JsonNode body = readBody(exchange);
    String event = text(body, "event");
    List<String> roster = new ArrayList<>();
    JsonNode rosterNode = body.path("roster");
    if (rosterNode.isArray()) {
      for (JsonNode item : rosterNode) {
        if (item.isTextual() && !item.asText().isBlank()) roster.add(item.asText().trim());
      }
    }
    orchestrator.reset(event, roster.isEmpty() ? null : roster);
    writeJson(exchange, 200, orchestrator.snapshot());
  }

  private void handleGraph(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    writeJson(exchange, 200, orchestrator.graphStats());
  }

  private void handleGraphEntity(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    String query = exchange.getRequestURI().getRawQuery();
    String type = getParam(query, "type");
    String name = getParam(query, "name");
    if (type == null || name == null) {
      writeJson(exchange, 400, error("type and name are required"));
      return;
    }
    KnowledgeGraph.EntityContext context = orchestrator.entityContext(type, name);
    if (context == null) {
      writeJson(exchange, 404, error("Entity not found: " + type + ":" + name));
      return;
    }
    writeJson(exchange, 200, context);
  }

  private void handleInject(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    JsonNode body = readBody(exchange);
    String secret = text(body, "secret");
    String source = text(body, "source");
    if (secret == null || source == null) {
      writeJson(exchange, 400, error("secret and source are required"));
      return;
    }
    String experimentId = orchestrator.injectSecret(secret, source);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("experimentId", experimentId);
    payload.put("secret", secret);
    payload.put("source", source);
    payload.put("tracking", experimentId != null);
    writeJson(exchange, 200, payload);
  }

  private void handleExperimentStats(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    PropagationTracker tracker = orchestrator.tracker();
    writeJson(exchange, 200, tracker == null ? PropagationStats.inactive() : tracker.stats());
  }

  private void handleExperimentTimeline(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    PropagationTracker tracker = orchestrator.tracker();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("experiments", tracker == null ? List.of() : tracker.timeline());
    writeJson(exchange, 200, payload);
  }

  private void handleExperimentReport(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    PropagationTracker tracker = orchestrator.tracker();
    String report = tracker == null ? "# Information Propagation Report\n\nTracking is disabled.\n" : tracker.report();
    writeText(exchange, 200, "text/markdown; charset=utf-8", report);
  }

  private void handleExperimentStep(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    List<StepOutcome> outcomes = runSteps(exchange.getRequestURI());
    PropagationTracker tracker = orchestrator.tracker();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("outcomes", outcomes);
    payload.put("stats", tracker == null ? PropagationStats.inactive() : tracker.stats());
    writeJson(exchange, statusFor(outcomes), payload);
  }

  private void handleExperimentRun(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "POST")) return;
    PropagationTracker tracker = orchestrator.tracker();
    if (tracker == null) {
      writeJson(exchange, 409, error("Propagation tracking is disabled"));
      return;
    }
    JsonNode body = readBody(exchange);
    int rounds = DEFAULT_EXPERIMENT_ROUNDS;
    JsonNode roundsNode = body.get("rounds");
    if (roundsNode != null && !roundsNode.isNull()) {
      if (!roundsNode.canConvertToInt()) throw new IllegalArgumentException("rounds must be an integer");
      rounds = roundsNode.asInt();
    }
    if (rounds < 1 || rounds > MAX_STEPS_PER_REQUEST) {
      throw new IllegalArgumentException("rounds must be between 1 and " + MAX_STEPS_PER_REQUEST);
    }

    ExperimentRun run = orchestrator.runExperiment(text(body, "secret"), rounds);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("experimentId", run.experimentId());
    payload.put("secret", run.secret());
    payload.put("seedAgent", run.seedAgent());
    payload.put("rounds", run.rounds());
    payload.put("outcomes", run.outcomes());
    payload.put("stats", tracker.stats());
    payload.put("experiments", tracker.timeline());
    payload.put("report", tracker.report());
    writeJson(exchange, statusFor(run.outcomes()), payload);
  }

  private void handleLog(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    int since = parseIntParam(exchange.getRequestURI().getQuery(), "since", 0);
    LogStore.LogSnapshot snap = logStore.snapshotFrom(since);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("lines", snap.lines);
    payload.put("nextIndex", snap.nextIndex);
    writeJson(exchange, 200, payload);
  }

  private void handleConfig(HttpExchange exchange) throws IOException {
    if (!requireMethod(exchange, "GET")) return;
    Map<String, Object> payload = new LinkedHashMap<>(publicConfig);
    payload.put("roster", orchestrator.session().agents().keySet());
    payload.put("seedEvent", orchestrator.session().seedEvent());
    writeJson(exchange, 200, payload);
  }

  private List<StepOutcome> runSteps(URI uri) {
    int steps = parseIntParam(uri.getQuery(), "steps", 1);
    if (steps < 1 || steps > MAX_STEPS_PER_REQUEST) {
      throw new IllegalArgumentException("steps must be between 1 and " + MAX_STEPS_PER_REQUEST);
    }
    return orchestrator.runSteps(steps);
  }

  private static int statusFor(List<StepOutcome> outcomes) {
    if (outcomes.isEmpty()) return 200;
    StepOutcome last = outcomes.get(outcomes.size() - 1);
    return switch (last.status) {
      case COMPLETED -> 200;
      case BUSY -> 409;
      case FAILED -> 502;
    };
  }

  private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
    if (method.equalsIgnoreCase(exchange.getRequestMethod())) return true;
    exchange.getResponseHeaders().add("Allow", method);
    exchange.sendResponseHeaders(405, -1);
    return false;
  }

  private JsonNode readBody(HttpExchange exchange) throws IOException {
    byte[] body = exchange.getRequestBody().readAllBytes();
    if (body.length == 0) return mapper.createObjectNode();
    JsonNode node;
    try {
      node = mapper.readTree(body);
    } catch (IOException e) {
      throw new IllegalArgumentException("Request body is not valid JSON");
    }
    if (node == null || !node.isObject()) throw new IllegalArgumentException("Request body must be a JSON object");
    return node;
  }

  private static String text(JsonNode body, String key) {
    JsonNode node = body.get(key);
    if (node == null || !node.isTextual() || node.asText().isBlank()) return null;
    return node.asText().trim();
  }

  private static Map<String, Object> error(String message) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("error", message == null ? "" : message);
    return payload;
  }

  private void writeJson(HttpExchange exchange, int status, Object payload) throws IOException {
    byte[] body = mapper.writeValueAsBytes(payload);
    send(exchange, status, "application/json; charset=utf-8", body);
  }

  private void writeText(HttpExchange exchange, int status, String contentType, String text) throws IOException {
    send(exchange, status, contentType, text.getBytes(StandardCharsets.UTF_8));
  }

  private static void send(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
    exchange.getResponseHeaders().add("Content-Type", contentType);
    exchange.getResponseHeaders().add("Cache-Control", "no-store");
    exchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private static int parseIntParam(String query, String key, int defaultValue) {
    String value = getParam(query, key);
    if (value == null) return defaultValue;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  private static String getParam(String query, String key) {
    if (query == null || query.isBlank()) return null;
    String[] pairs = query.split("&");
    for (String pair : pairs) {
      String[] parts = pair.split("=", 2);
      if (parts.length == 2 && parts[0].equals(key)) {
        return URLDecoder.decode(parts[1], StandardCharsets.UTF_8);
      }
    }
    return null;
  }
}
