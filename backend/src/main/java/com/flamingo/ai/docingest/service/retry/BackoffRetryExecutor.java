package com.flamingo.ai.docingest.service.retry;

import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.exception.SizeExceededException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs embedding and vector store calls with bounded exponential backoff.
 *
 * <p>Attempt {@code n} (0-based) that fails is followed by a wait of {@code baseDelay * 2^n}.
 * Before every retry the caller's liveness probe runs first; a probe failure counts as a failed
 * attempt. Once attempts are exhausted the last error is wrapped in {@link
 * BackendUnavailableException}, which callers must let propagate.
 *
 * <p>Size classification ({@link SizeExceededException}) and argument errors are never retried.
 */
@Component
@Slf4j
public class BackoffRetryExecutor {

  private final RetryRegistry retryRegistry;
  private final MeterRegistry meterRegistry;

  public BackoffRetryExecutor(IngestionConfig config, MeterRegistry meterRegistry) {
    IngestionConfig.Retry settings = config.getRetry();
    if (settings.getMaxAttempts() < 1) {
      throw new IllegalArgumentException(
          "ingestion.retry.max-attempts must be >= 1: " + settings.getMaxAttempts());
    }
    this.meterRegistry = meterRegistry;

    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getBaseDelay(), 2.0))
            .retryOnException(BackoffRetryExecutor::isRetryable)
            .build();
    this.retryRegistry = RetryRegistry.of(retryConfig);
    this.retryRegistry
        .getEventPublisher()
        .onEntryAdded(event -> registerListeners(event.getAddedEntry()));
  }

  /**
   * Runs {@code call} without a liveness probe.
   *
   * @see #execute(String, Callable, Runnable)
   */
  public <T> T execute(String operation, Callable<T> call) {
    return execute(operation, call, null);
  }

  /**
   * Runs {@code call}, retrying transient failures.
   *
   * @param operation name used for logs, metrics and the terminal error
   * @param call the backend call
   * @param livenessProbe lightweight check run before each retry, may be {@code null}
   * @return the call result
   * @throws BackendUnavailableException when every attempt failed
   */
  public <T> T execute(String operation, Callable<T> call, Runnable livenessProbe) {
    Retry retry = retryRegistry.retry(operation);
    AtomicInteger attempts = new AtomicInteger();
    Callable<T> attempt =
        () -> {
          if (attempts.getAndIncrement() > 0 && livenessProbe != null) {
            livenessProbe.run();
          }
          return call.call();
        };

    try {
      return Retry.decorateCallable(retry, attempt).call();
    } catch (RuntimeException e) {
      if (!isRetryable(e) || e instanceof BackendUnavailableException) {
        throw e;
      }
      throw exhausted(operation, attempts.get(), e);
    } catch (Exception e) {
      throw exhausted(operation, attempts.get(), e);
    }
  }

  private BackendUnavailableException exhausted(String operation, int attempts, Exception cause) {
    meterRegistry.counter("backend.exhausted", "operation", operation).increment();
    log.error(
        "Backend operation '{}' failed after {} attempt(s): {}",
        operation,
        attempts,
        cause.getMessage());
    return new BackendUnavailableException(operation, attempts, cause);
  }

  private void registerListeners(Retry retry) {
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("backend.retry", "operation", retry.getName()).increment();
              log.warn(
                  "Backend operation '{}' failed (attempt {}), retrying in {} ms: {}",
                  retry.getName(),
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() == null
                      ? "unknown"
                      : event.getLastThrowable().getMessage());
            });
  }

  static boolean isRetryable(Throwable throwable) {
    return !(throwable instanceof SizeExceededException)
        && !(throwable instanceof IllegalArgumentException);
  }
}
