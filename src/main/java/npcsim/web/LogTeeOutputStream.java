package npcsim.web;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/** Passes bytes through to {@code primary} and hands each completed UTF-8 line to the log store. */
public class LogTeeOutputStream extends OutputStream {
  private final OutputStream primary;
  private final LogStore logStore;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  public LogTeeOutputStream(OutputStream primary, LogStore logStore) {
    this.primary = primary;
    this.logStore = logStore;
  }

  @Override
  public synchronized void write(int b) throws IOException {
    primary.write(b);
    capture((byte) b);
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) throws IOException {
    primary.write(b, off, len);
    for (int i = off; i < off + len; i++) {
      capture(b[i]);
    }
  }

  @Override
  public void flush() throws IOException {
    primary.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    if (buffer.size() > 0) flushLine();
    primary.close();
  }

  private void capture(byte b) {
    if (b == '\r') return;
    if (b == '\n') {
      flushLine();
    } else {
      buffer.write(b);
    }
  }

  private void flushLine() {
    String line = buffer.toString(StandardCharsets.UTF_8);
    buffer.reset();
    logStore.addLine(line);
  }
}
