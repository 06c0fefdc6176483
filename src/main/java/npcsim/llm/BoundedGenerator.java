package npcsim.llm;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Puts a wall-clock limit on another generator. A call that outlives the timeout is cancelled
 * and reported as {@link GenerationTimeoutException}.
 */
public class BoundedGenerator implements DialogueGenerator, AutoCloseable {
  private static final AtomicInteger THREADS = new AtomicInteger();

  private final DialogueGenerator delegate;
  private final Duration timeout;
  private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
    Thread thread = new Thread(runnable, "generation-" + THREADS.incrementAndGet());
    thread.setDaemon(true);
    return thread;
  });

  public BoundedGenerator(DialogueGenerator delegate, Duration timeout) {
    if (delegate == null) throw new IllegalArgumentException("Delegate generator is required");
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Timeout must be positive");
    }
    this.delegate = delegate;
    this.timeout = timeout;
  }

  @Override
  public String name() {
    return delegate.name();
  }

  public Duration timeout() {
    return timeout;
  }

  @Override
  public String generate(GenerationRequest request, LLMRequestOptions options) throws GenerationException {
    Future<String> future = executor.submit(() -> delegate.generate(request, options));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new GenerationTimeoutException(timeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new GenerationException("Interrupted while waiting for " + delegate.name(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof GenerationException generationException) {
        throw generationException;
      }
      throw new InvalidGenerationResponseException("Generator failed: " + cause, cause);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
