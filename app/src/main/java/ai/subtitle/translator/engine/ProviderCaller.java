package ai.subtitle.translator.engine;

import ai.subtitle.translator.translate.ProviderException;
import ai.subtitle.translator.translate.TranslatedUnit;
import ai.subtitle.translator.translate.TranslationProvider;
import ai.subtitle.translator.translate.TranslationRequest;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a request through the ordered provider list. Each provider gets up to
 * {@link RetryPolicy#maxAttempts()} attempts; rate-limited attempts back off exponentially with
 * jitter before the next one. Calls run on a dedicated thread so that the per-call timeout can be
 * enforced.
 */
public class ProviderCaller implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderCaller.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final List<TranslationProvider> providers;
    private final RetryPolicy policy;
    private final AtomicInteger callCount = new AtomicInteger();
    private ExecutorService executor;

    public ProviderCaller(List<TranslationProvider> providers, RetryPolicy policy) {
        Objects.requireNonNull(providers, "providers");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one translation provider is required");
        }
        this.providers = List.copyOf(providers);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.executor = newExecutor();
    }

    /**
     * Translates the request, falling back through the providers in order.
     *
     * @throws ProviderException when every attempt of every provider failed
     */
    public List<TranslatedUnit> call(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        ProviderException lastFailure = null;
        for (TranslationProvider provider : providers) {
            for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
                try {
                    List<TranslatedUnit> result = invoke(provider, request);
                    validate(request, result);
                    return result;
                } catch (ProviderException ex) {
                    lastFailure = ex;
                    LOGGER.warn("Provider {} attempt {}/{} failed for units {}: {}",
                            provider.name(), attempt + 1, policy.maxAttempts(), request.unitIds(), ex.getMessage());
                    if (Thread.currentThread().isInterrupted()) {
                        throw ex;
                    }
                    if (attempt < policy.maxAttempts() - 1) {
                        Optional<Duration> delay = calculateRetryDelay(ex, attempt);
                        if (delay.isPresent()) {
                            waitBeforeRetry(provider, delay.get(), ex);
                        }
                    }
                }
            }
            LOGGER.warn("Provider {} exhausted {} attempts for units {}", provider.name(), policy.maxAttempts(), request.unitIds());
        }
        throw new ProviderException("All providers failed for units " + request.unitIds(), lastFailure);
    }

    /**
     * Number of provider invocations made so far, retries included.
     */
    public int callCount() {
        return callCount.get();
    }

    public List<TranslationProvider> providers() {
        return providers;
    }

    @Override
    public synchronized void close() {
        executor.shutdownNow();
    }

    private List<TranslatedUnit> invoke(TranslationProvider provider, TranslationRequest request) {
        callCount.incrementAndGet();
        Future<List<TranslatedUnit>> future = submit(provider, request);
        try {
            return future.get(policy.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            replaceExecutor();
            throw new ProviderException("Call timed out after " + policy.callTimeout().toSeconds() + " seconds", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for provider " + provider.name(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ProviderException providerException) {
                throw providerException;
            }
            String message = cause == null ? ex.getMessage() : cause.getMessage();
            throw new ProviderException("Provider " + provider.name() + " failed: " + message, cause == null ? ex : cause);
        }
    }

    private synchronized Future<List<TranslatedUnit>> submit(TranslationProvider provider, TranslationRequest request) {
        return executor.submit(() -> provider.translate(request));
    }

    // A timed-out call may ignore interruption; later calls get a fresh thread.
    private synchronized void replaceExecutor() {
        executor.shutdownNow();
        executor = newExecutor();
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private void validate(TranslationRequest request, List<TranslatedUnit> result) {
        if (result == null) {
            throw new ProviderException("Provider returned no result");
        }
        List<Integer> expected = request.unitIds();
        if (result.size() != expected.size()) {
            throw new ProviderException("Expected %d units but received %d".formatted(expected.size(), result.size()));
        }
        for (int i = 0; i < expected.size(); i++) {
            TranslatedUnit unit = result.get(i);
            if (unit.unitId() != expected.get(i)) {
                throw new ProviderException("Expected unit %d at position %d but received unit %d"
                        .formatted(expected.get(i), i, unit.unitId()));
            }
            if (unit.text().isBlank()) {
                throw new ProviderException("Blank translation for unit " + unit.unitId());
            }
        }
    }

    private void waitBeforeRetry(TranslationProvider provider, Duration delay, ProviderException failure) {
        if (delay.isZero()) {
            return;
        }
        LOGGER.warn("Provider {} rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms", provider.name(), delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Provider retry interrupted");
            throw failure;
        }
    }

    Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, then scaled by 1 +/- jitter
        long baseDelaySeconds = policy.initialBackoffSeconds() * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, policy.maxBackoffSeconds());
        if (cappedDelaySeconds == 0) {
            return Optional.of(Duration.ZERO);
        }
        double jitterMultiplier = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * policy.jitterFactor();
        long finalDelayMillis = Math.max(1000L, (long) (cappedDelaySeconds * 1000L * jitterMultiplier));
        return Optional.of(Duration.ofMillis(finalDelayMillis));
    }

    static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    long millis = Math.max(0, (long) (seconds * 1000));
                    return Optional.of(Duration.ofMillis(millis));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}
