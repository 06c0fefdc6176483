package npcsim.core;

import java.util.List;

public record AgentView(String id, String key, String name, String title, String profession,
                        List<String> traits, String mood, double valence) {}
