package npcsim.core;

/**
 * How one turn's rumor delta moves the world. Heat relaxes toward its baseline before the delta
 * is added; guard alert reacts twice as hard to intense rumors; prices drift within [0.5, 1.5].
 */
public record WorldDynamics(double heatBaseline, double heatDecay, double guardBaseline, double guardGain,
                            double highIntensity, double priceGain, int rumorLogLimit, int beatLimit) {

  public WorldDynamics {
    if (heatDecay < 0 || heatDecay > 1) throw new IllegalArgumentException("heatDecay must be within [0, 1]");
    if (rumorLogLimit < 1 || beatLimit < 1) throw new IllegalArgumentException("log limits must be positive");
  }

  public static WorldDynamics defaults() {
    return new WorldDynamics(0.0, 0.1, 0.2, 0.3, 0.25, 0.1, 10, 10);
  }

  double nextHeat(double heat, double delta) {
    return clamp(heat + (heatBaseline - heat) * heatDecay + delta, 0.0, 1.0);
  }

  double nextGuard(double guard, double delta) {
    double gain = delta >= highIntensity ? guardGain * 2 : guardGain;
    return clamp(guard + delta * gain, 0.0, 1.0);
  }

  double nextPrice(double price, double delta) {
    return clamp(price + delta * priceGain, 0.5, 1.5);
  }

  static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
