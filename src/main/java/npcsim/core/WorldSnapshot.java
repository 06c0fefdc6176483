package npcsim.core;

import java.util.List;

public record WorldSnapshot(double rumorHeat, double guardAlertLevel, double shopPriceModifier, String lastEvent,
                            String currentThread, List<RumorEntry> rumorLog, List<String> recentBeats) {

  public record RumorEntry(String speaker, String content, String delta) {}
}
