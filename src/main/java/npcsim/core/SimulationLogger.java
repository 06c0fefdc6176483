package npcsim.core;

/**
 * Process-wide log sink. Lines go to stdout, which Main tees into the log store served over HTTP,
 * so every tagged line shows up in both places.
 */
public final class SimulationLogger {
  private SimulationLogger() {}

  public static void log(String line) {
    System.out.println(line);
  }

  public static void log(String tag, String message) {
    log("[" + tag + "] " + message);
  }
}
