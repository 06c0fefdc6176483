package npcsim.memory;

import java.util.List;

/** One scored entry of a context bundle, with the provenance line shown to the model. */
public record RetrievedMemory(String memoryId, String content, String holderId, double score,
                              int pathLength, int createdAt, List<String> mentions, String provenance) {

  public RetrievedMemory {
    mentions = mentions == null ? List.of() : List.copyOf(mentions);
  }

  public boolean hearsay() {
    return pathLength > 1;
  }

  public String render() {
    return provenance + ": \"" + content + "\"";
  }
}
