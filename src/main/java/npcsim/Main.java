package npcsim;

import npcsim.agents.PersonaCatalog;
import npcsim.config.SimulationConfig;
import npcsim.config.WorldSeeder;
import npcsim.config.WorldVocabulary;
import npcsim.core.Orchestrator;
import npcsim.core.SimulationLogger;
import npcsim.llm.BoundedGenerator;
import npcsim.llm.DialogueGenerator;
import npcsim.llm.LLMClient;
import npcsim.llm.OllamaClient;
import npcsim.llm.OpenRouterClient;
import npcsim.llm.PromptBuilder;
import npcsim.llm.PromptingGenerator;
import npcsim.llm.TemplateGenerator;
import npcsim.propagation.LexicalSimilarity;
import npcsim.propagation.PropagationTracker;
import npcsim.web.LogStore;
import npcsim.web.LogTeeOutputStream;
import npcsim.web.PollingServer;
import npcsim.web.TurnFeed;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

public class Main {
  public static void main(String[] args) throws Exception {
    SimulationConfig config = SimulationConfig.load();
    LogStore logStore = new LogStore();
    PrintStream originalOut = System.out;
    System.setOut(new PrintStream(new LogTeeOutputStream(originalOut, logStore), true, StandardCharsets.UTF_8));
    PrintStream originalErr = System.err;
    System.setErr(new PrintStream(new LogTeeOutputStream(originalErr, logStore), true, StandardCharsets.UTF_8));

    PersonaCatalog catalog = PersonaCatalog.load(config.personasPath());
    WorldVocabulary vocabulary = WorldVocabulary.load(config.worldPath());
    SimulationLogger.log("[Config] " + catalog.keys().size() + " personas, " + vocabulary.size()
        + " world terms, provider " + config.provider());

    BoundedGenerator generator = new BoundedGenerator(buildGenerator(config),
        Duration.ofSeconds(config.generationTimeoutSeconds()));
    WorldSeeder seeder = new WorldSeeder(catalog, vocabulary, generator, config.retrieval(),
        config.dynamics(), config.seederSettings());
    Orchestrator orchestrator = new Orchestrator(seeder, config.orchestrator(), null, null);
    if (config.propagationEnabled()) {
      orchestrator.attachTracker(new PropagationTracker(config.propagation(), new LexicalSimilarity()));
    }
    TurnFeed feed = new TurnFeed(500);
    orchestrator.addListener(feed);

    Map<String, Object> publicConfig = new LinkedHashMap<>();
    publicConfig.put("provider", config.provider());
    publicConfig.put("model", config.provider().equals("template") ? "template" : config.model());
    publicConfig.put("loopDelayMs", config.orchestrator().loopDelayMs());
    publicConfig.put("propagationEnabled", config.propagationEnabled());
    publicConfig.put("personas", catalog.keys());

    PollingServer pollingServer = new PollingServer(config.serverPort(), orchestrator, feed, logStore, publicConfig);
    pollingServer.start();
    SimulationLogger.log("[Server] Live feed at http://localhost:" + pollingServer.port());
    SimulationLogger.log("[World] \"" + orchestrator.session().seedEvent() + "\" with "
        + String.join(", ", orchestrator.session().agents().keySet()));

    if (config.loopAutostart()) {
      orchestrator.startLoop();
    }

    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      SimulationLogger.log("[Server] Shutting down.");
      orchestrator.shutdown();
      pollingServer.stop();
      generator.close();
      stopped.countDown();
    }, "shutdown"));
    stopped.await();
  }

  static DialogueGenerator buildGenerator(SimulationConfig config) {
    LLMClient client;
    switch (config.provider()) {
      case "openrouter" -> client = new OpenRouterClient(
          config.openRouterApiKey(),
          config.openRouterBaseUrl(),
          config.model(),
          config.numPredict(),
          config.temperature(),
          config.openRouterHttpReferer(),
          config.openRouterXTitle());
      case "ollama" -> client = new OllamaClient(
          config.ollamaBaseUrl(),
          config.model(),
          config.numPredict(),
          config.temperature());
      default -> {
        return new TemplateGenerator(config.randomSeed());
      }
    }
    return new PromptingGenerator(client, new PromptBuilder());
  }
}
