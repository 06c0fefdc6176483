package npcsim.core;

import java.util.List;

/** Builds a fresh, seed-only session. Null arguments fall back to the factory's defaults. */
public interface SessionFactory {
  Session create(String seedEvent, List<String> rosterKeys);
}
