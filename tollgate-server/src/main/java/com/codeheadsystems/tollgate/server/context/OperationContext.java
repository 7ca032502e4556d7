package com.codeheadsystems.tollgate.server.context;

import com.codeheadsystems.tollgate.server.exception.OperationCancelledException;
import com.codeheadsystems.tollgate.server.exception.TokenStoreException;
import com.codeheadsystems.tollgate.server.exception.TokenStoreTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline and cancellation signal supplied by the caller of a store-facing operation.
 * <p>
 * Every store call made on behalf of the caller is awaited through {@link #await}, which
 * cancels the in-flight call and throws instead of blocking past the deadline or after
 * {@link #cancel()}. One context may span several calls, e.g. a whole request.
 * <p>
 * Failures of the store call itself propagate unchanged if they are unchecked, otherwise they
 * are wrapped in {@link TokenStoreException}.
 */
public final class OperationContext {

  private static final OperationContext BACKGROUND =
      new OperationContext(null, Clock.systemUTC(), false);

  private final Instant deadline;
  private final Clock clock;
  private final boolean cancellable;
  // Calls currently awaited; each is removed again when its await returns.
  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
  private volatile boolean cancelled;

  private OperationContext(Instant deadline, Clock clock, boolean cancellable) {
    this.deadline = deadline;
    this.clock = clock;
    this.cancellable = cancellable;
  }

  /**
   * A context with no deadline that can never be cancelled.
   *
   * @return the shared background context
   */
  public static OperationContext background() {
    return BACKGROUND;
  }

  /**
   * A cancellable context with no deadline.
   *
   * @return a new context
   */
  public static OperationContext cancellable() {
    return new OperationContext(null, Clock.systemUTC(), true);
  }

  /**
   * A cancellable context that expires {@code timeout} from now.
   *
   * @param timeout time allowed for all calls made through this context
   * @return a new context
   */
  public static OperationContext withTimeout(Duration timeout) {
    Clock clock = Clock.systemUTC();
    return new OperationContext(clock.instant().plus(timeout), clock, true);
  }

  /**
   * A cancellable context that expires at {@code deadline} as measured by {@code clock}.
   *
   * @param deadline the deadline
   * @param clock    the clock the deadline is measured against
   * @return a new context
   */
  public static OperationContext withDeadline(Instant deadline, Clock clock) {
    return new OperationContext(deadline, clock, true);
  }

  /**
   * Cancels this context and every store call currently awaited through it.
   *
   * @throws UnsupportedOperationException on the background context
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("The background context cannot be cancelled");
    }
    cancelled = true;
    inFlight.forEach(operation -> operation.cancel(true));
  }

  public boolean isCancelled() {
    return cancelled;
  }

  int inFlightCount() {
    return inFlight.size();
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * Time left before the deadline, negative once it has passed.
   *
   * @return remaining time, empty when there is no deadline
   */
  public Optional<Duration> remaining() {
    return deadline().map(d -> Duration.between(clock.instant(), d));
  }

  /**
   * Waits for a store call, honouring this context's deadline and cancellation.
   *
   * @param operation     the in-flight store call
   * @param operationName name used in exception messages
   * @param <T>           result type
   * @return the call's result
   * @throws TokenStoreTimeoutException  if the deadline passes first
   * @throws OperationCancelledException if the context is cancelled or the thread interrupted
   */
  public <T> T await(CompletableFuture<T> operation, String operationName) {
    if (cancellable) {
      inFlight.add(operation);
    }
    try {
      if (cancelled) {
        operation.cancel(true);
        throw new OperationCancelledException(operationName);
      }
      if (deadline == null) {
        return operation.get();
      }
      long nanos = remaining().orElseThrow().toNanos();
      if (nanos <= 0) {
        operation.cancel(true);
        throw new TokenStoreTimeoutException(operationName);
      }
      return operation.get(nanos, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      operation.cancel(true);
      throw new TokenStoreTimeoutException(operationName);
    } catch (CancellationException e) {
      throw new OperationCancelledException(operationName);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      operation.cancel(true);
      throw new OperationCancelledException(operationName);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new TokenStoreException("Token store operation failed: " + operationName, cause);
    } finally {
      if (cancellable) {
        inFlight.remove(operation);
      }
    }
  }
}
