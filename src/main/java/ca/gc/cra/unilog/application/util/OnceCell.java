package ca.gc.cra.unilog.application.util;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Run-once lazy cell.
 *
 * <p>Concurrent first callers of {@link #getOrInit(Supplier)} race to install an attempt; exactly one runs the
 * supplier and every caller that joined that attempt observes the same value or the same exception. A failed
 * attempt is cleared so a later caller may try again. Once a value is set it never changes.</p>
 *
 * <p>Publication goes through {@link CompletableFuture}, so everything the supplier did happens-before any
 * caller that observes the value.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public final class OnceCell<T> {
  private final AtomicReference<CompletableFuture<T>> attempt = new AtomicReference<>();

  /**
   * Returns the value, running {@code initializer} if no attempt has succeeded or is in flight.
   *
   * @param initializer value supplier; must not return {@code null}
   * @return the initialized value
   * @throws RuntimeException the exception thrown by the attempt this caller joined
   */
  public T getOrInit(Supplier<? extends T> initializer) {
    Objects.requireNonNull(initializer, "initializer");
    while (true) {
      CompletableFuture<T> current = attempt.get();
      if (current != null) {
        return join(current);
      }
      CompletableFuture<T> mine = new CompletableFuture<>();
      if (!attempt.compareAndSet(null, mine)) {
        continue;
      }
      try {
        T value = Objects.requireNonNull(initializer.get(), "initializer returned null");
        mine.complete(value);
        return value;
      } catch (RuntimeException | Error ex) {
        attempt.compareAndSet(mine, null);
        mine.completeExceptionally(ex);
        throw ex;
      }
    }
  }

  /**
   * Returns the value when initialization has completed successfully.
   *
   * @return value, or empty while uninitialized, in flight, or after a failed attempt
   */
  public Optional<T> get() {
    CompletableFuture<T> current = attempt.get();
    if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
      return Optional.empty();
    }
    return Optional.of(current.join());
  }

  /**
   * Returns whether a value has been set.
   *
   * @return {@code true} after a successful initialization
   */
  public boolean isInitialized() {
    return get().isPresent();
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }
}
