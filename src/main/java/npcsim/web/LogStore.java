package npcsim.web;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Console lines captured for the {@code /log} endpoint. Indices are absolute, so a client polling
 * with {@code since} keeps its place after old lines are dropped.
 */
public class LogStore {
  private final int maxLines;
  private final List<String> lines = new ArrayList<>();
  private int dropped = 0;

  public LogStore() {
    this(5000);
  }

  public LogStore(int maxLines) {
    if (maxLines < 1) throw new IllegalArgumentException("maxLines must be positive");
    this.maxLines = maxLines;
  }

  public synchronized void addLine(String line) {
    if (line == null) return;
    lines.add(line);
    if (lines.size() > maxLines) {
      int excess = lines.size() - maxLines;
      lines.subList(0, excess).clear();
      dropped += excess;
    }
  }

  public synchronized LogSnapshot snapshotFrom(int startIndex) {
    int relative = Math.max(0, Math.min(startIndex - dropped, lines.size()));
    List<String> slice = new ArrayList<>(lines.subList(relative, lines.size()));
    return new LogSnapshot(Collections.unmodifiableList(slice), dropped + lines.size());
  }

  public synchronized String lastLine() {
    if (lines.isEmpty()) return "";
    return lines.get(lines.size() - 1);
  }

  public static class LogSnapshot {
    public final List<String> lines;
    public final int nextIndex;

    public LogSnapshot(List<String> lines, int nextIndex) {
      this.lines = lines;
      this.nextIndex = nextIndex;
    }
  }
}
