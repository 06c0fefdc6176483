package npcsim.config;

import npcsim.core.OrchestratorSettings;
import npcsim.core.WorldDynamics;
import npcsim.memory.RetrievalSettings;
import npcsim.propagation.PropagationSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

/**
 * Settings read from {@code config.properties} in the working directory, overridden by
 * {@code NPC_*} environment variables. Every key has a default so the simulation starts offline
 * with the template generator.
 */
public class SimulationConfig {
  public static final List<String> DEFAULT_RUMOR_SEEDS = List.of(
      "Vault door left ajar last night.",
      "Supply caravan spotted smoke near the marsh.",
      "Guard captain seen bribing the tax clerk.",
      "Somebody swapped the shop ledgers with counterfeits.",
      "A wyvern shadow skimmed over the market at dawn.");

  private final String provider;
  private final String openRouterApiKey;
  private final String openRouterBaseUrl;
  private final String openRouterHttpReferer;
  private final String openRouterXTitle;
  private final String ollamaBaseUrl;
  private final String model;
  private final double temperature;
  private final int numPredict;
  private final int generationTimeoutSeconds;
  private final int serverPort;
  private final boolean loopAutostart;
  private final long randomSeed;
  private final String personasPath;
  private final String worldPath;
  private final List<String> rumorSeeds;
  private final int rosterSize;
  private final List<String> rosterPool;
  private final int historyLimit;
  private final double moodDriftRate;
  private final boolean propagationEnabled;
  private final RetrievalSettings retrieval;
  private final PropagationSettings propagation;
  private final WorldDynamics dynamics;
  private final OrchestratorSettings orchestrator;

  private SimulationConfig(Properties props) {
    this.provider = getValue(props, "llm.provider", "template", "NPC_MODEL_PROVIDER").trim().toLowerCase(Locale.ROOT);
    this.openRouterApiKey = getValue(props, "openrouter.api_key", "", "NPC_OPENROUTER_API_KEY", "OPENROUTER_API_KEY");
    this.openRouterBaseUrl = getValue(props, "openrouter.base_url", "https://openrouter.ai/api/v1", "NPC_OPENROUTER_BASE_URL");
    this.openRouterHttpReferer = getValue(props, "openrouter.http_referer", "", "NPC_OPENROUTER_HTTP_REFERER");
    this.openRouterXTitle = getValue(props, "openrouter.x_title", "npcsim", "NPC_OPENROUTER_X_TITLE");
    this.ollamaBaseUrl = getValue(props, "ollama.base_url", "http://localhost:11434", "NPC_OLLAMA_BASE_URL");
    this.model = getValue(props, "model", "google/gemini-2.0-flash-exp:free", "NPC_MODEL");
    this.temperature = getDoubleValue(props, "temperature", "NPC_TEMPERATURE", 0.7);
    this.numPredict = getIntValue(props, "num_predict", "NPC_NUM_PREDICT", 400);
    this.generationTimeoutSeconds = getIntValue(props, "generation.timeout_seconds", "NPC_GENERATION_TIMEOUT_SECONDS", 30);
    this.serverPort = getIntValue(props, "server.port", "NPC_SERVER_PORT", 8000);
    this.loopAutostart = getBoolValue(props, "loop.autostart", "NPC_LOOP_AUTOSTART", false);
    this.randomSeed = getIntValue(props, "rng.seed", "NPC_RNG_SEED", 42);
    this.personasPath = getValue(props, "personas.path", "", "NPC_PERSONAS_PATH");
    this.worldPath = getValue(props, "world.path", "", "NPC_WORLD_PATH");

    List<String> seeds = splitList(getValue(props, "rumor.seeds", "", "NPC_RUMOR_SEEDS"), "\\|");
    this.rumorSeeds = seeds.isEmpty() ? DEFAULT_RUMOR_SEEDS : seeds;
    this.rosterSize = getIntValue(props, "roster.size", "NPC_PARTY_SIZE", 3);
    this.rosterPool = splitList(getValue(props, "roster.pool", "", "NPC_PERSONA_POOL"), "[|,]");
    this.historyLimit = getIntValue(props, "history.limit", "NPC_HISTORY_LIMIT", 50);
    this.moodDriftRate = getDoubleValue(props, "mood.drift_rate", "NPC_MOOD_DRIFT_RATE", 0.35);
    this.propagationEnabled = getBoolValue(props, "propagation.enabled", "NPC_PROPAGATION_ENABLED", true);

    RetrievalSettings retrievalDefaults = RetrievalSettings.defaults();
    this.retrieval = new RetrievalSettings(
        getIntValue(props, "retrieval.max_hops", "NPC_RETRIEVAL_MAX_HOPS", retrievalDefaults.maxHops()),
        getIntValue(props, "retrieval.max_results", "NPC_RETRIEVAL_MAX_RESULTS", retrievalDefaults.maxResults()),
        getDoubleValue(props, "retrieval.weight.overlap", "NPC_RETRIEVAL_WEIGHT_OVERLAP", retrievalDefaults.overlapWeight()),
        getDoubleValue(props, "retrieval.weight.path", "NPC_RETRIEVAL_WEIGHT_PATH", retrievalDefaults.pathWeight()),
        getDoubleValue(props, "retrieval.weight.recency", "NPC_RETRIEVAL_WEIGHT_RECENCY", retrievalDefaults.recencyWeight()),
        getDoubleValue(props, "retrieval.recency_decay", "NPC_RETRIEVAL_RECENCY_DECAY", retrievalDefaults.recencyDecay()));

    PropagationSettings propagationDefaults = PropagationSettings.defaults();
    List<String> gossip = splitList(getValue(props, "propagation.gossip_traits", "", "NPC_GOSSIP_TRAITS"), ",");
    List<String> stoic = splitList(getValue(props, "propagation.stoic_traits", "", "NPC_STOIC_TRAITS"), ",");
    this.propagation = new PropagationSettings(
        getDoubleValue(props, "propagation.trace_threshold", "NPC_TRACE_THRESHOLD", propagationDefaults.traceThreshold()),
        getDoubleValue(props, "propagation.unchanged_threshold", "NPC_UNCHANGED_THRESHOLD", propagationDefaults.unchangedThreshold()),
        getDoubleValue(props, "propagation.paraphrased_threshold", "NPC_PARAPHRASED_THRESHOLD", propagationDefaults.paraphrasedThreshold()),
        gossip.isEmpty() ? propagationDefaults.gossipTraits() : Set.copyOf(gossip),
        stoic.isEmpty() ? propagationDefaults.stoicTraits() : Set.copyOf(stoic));

    WorldDynamics worldDefaults = WorldDynamics.defaults();
    this.dynamics = new WorldDynamics(
        getDoubleValue(props, "world.heat_baseline", "NPC_HEAT_BASELINE", worldDefaults.heatBaseline()),
        getDoubleValue(props, "world.heat_decay", "NPC_HEAT_DECAY", worldDefaults.heatDecay()),
        getDoubleValue(props, "world.guard_baseline", "NPC_GUARD_BASELINE", worldDefaults.guardBaseline()),
        getDoubleValue(props, "world.guard_gain", "NPC_GUARD_GAIN", worldDefaults.guardGain()),
        getDoubleValue(props, "world.high_intensity", "NPC_HIGH_INTENSITY", worldDefaults.highIntensity()),
        getDoubleValue(props, "world.price_gain", "NPC_PRICE_GAIN", worldDefaults.priceGain()),
        worldDefaults.rumorLogLimit(),
        worldDefaults.beatLimit());

    OrchestratorSettings orchestratorDefaults = OrchestratorSettings.defaults();
    this.orchestrator = new OrchestratorSettings(
        orchestratorDefaults.promptHistoryTurns(),
        getIntValue(props, "loop.delay_ms", "NPC_DIALOGUE_DELAY_MS", (int) orchestratorDefaults.loopDelayMs()),
        getDoubleValue(props, "selection.pending_bias", "NPC_PENDING_BIAS", orchestratorDefaults.pendingBias()),
        orchestratorDefaults.listenerMemories());
  }

  public String provider() { return provider; }
  public String openRouterApiKey() { return openRouterApiKey; }
  public String openRouterBaseUrl() { return openRouterBaseUrl; }
  public String openRouterHttpReferer() { return openRouterHttpReferer; }
  public String openRouterXTitle() { return openRouterXTitle; }
  public String ollamaBaseUrl() { return ollamaBaseUrl; }
  public String model() { return model; }
  public double temperature() { return temperature; }
  public int numPredict() { return numPredict; }
  public int generationTimeoutSeconds() { return generationTimeoutSeconds; }
  public int serverPort() { return serverPort; }
  public boolean loopAutostart() { return loopAutostart; }
  public long randomSeed() { return randomSeed; }
  public String personasPath() { return personasPath; }
  public String worldPath() { return worldPath; }
  public List<String> rumorSeeds() { return rumorSeeds; }
  public int rosterSize() { return rosterSize; }
  public List<String> rosterPool() { return rosterPool; }
  public int historyLimit() { return historyLimit; }
  public double moodDriftRate() { return moodDriftRate; }
  public boolean propagationEnabled() { return propagationEnabled; }
  public RetrievalSettings retrieval() { return retrieval; }
  public PropagationSettings propagation() { return propagation; }
  public WorldDynamics dynamics() { return dynamics; }
  public OrchestratorSettings orchestrator() { return orchestrator; }

  public WorldSeeder.Settings seederSettings() {
    return new WorldSeeder.Settings(rumorSeeds, rosterSize, rosterPool, historyLimit, moodDriftRate, randomSeed);
  }

  public static SimulationConfig load() throws IOException {
    return load(Path.of("config.properties"));
  }

  public static SimulationConfig load(Path path) throws IOException {
    Properties props = new Properties();
    if (path != null && Files.exists(path)) {
      try (InputStream in = Files.newInputStream(path)) {
        props.load(in);
      }
    }
    return fromProperties(props);
  }

  public static SimulationConfig fromProperties(Properties props) {
    SimulationConfig config = new SimulationConfig(props == null ? new Properties() : props);
    if (config.provider.equals("openrouter") && config.openRouterApiKey.isBlank()) {
      throw new IllegalStateException("Missing OpenRouter API key (set NPC_OPENROUTER_API_KEY or OPENROUTER_API_KEY)");
    }
    if (!List.of("template", "openrouter", "ollama").contains(config.provider)) {
      throw new IllegalStateException("Unknown llm.provider: " + config.provider);
    }
    return config;
  }

  private static String getValue(Properties props, String key, String defaultValue, String... envKeys) {
    for (String envKey : envKeys) {
      if (envKey == null || envKey.isBlank()) continue;
      String env = System.getenv(envKey);
      if (env != null && !env.isBlank()) return env;
    }
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) return value.trim();
    return defaultValue;
  }

  private static int getIntValue(Properties props, String key, String envKey, int defaultValue) {
    return getParsed(props, key, envKey, defaultValue, Integer::parseInt);
  }

  private static double getDoubleValue(Properties props, String key, String envKey, double defaultValue) {
    return getParsed(props, key, envKey, defaultValue, Double::parseDouble);
  }

  private static boolean getBoolValue(Properties props, String key, String envKey, boolean defaultValue) {
    return getParsed(props, key, envKey, defaultValue, Boolean::parseBoolean);
  }

  private static <T> T getParsed(Properties props, String key, String envKey, T defaultValue, Function<String, T> parser) {
    String raw = getValue(props, key, "", envKey);
    if (raw.isBlank()) return defaultValue;
    try {
      return parser.apply(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Invalid value for " + key + ": " + raw, e);
    }
  }

  private static List<String> splitList(String raw, String separatorRegex) {
    if (raw == null || raw.isBlank()) return List.of();
    return Arrays.stream(raw.split(separatorRegex))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
