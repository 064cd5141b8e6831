package com.adlanda.recommender.provider;

import com.adlanda.recommender.exception.EmbeddingUnavailableException;
import com.adlanda.recommender.exception.ProviderFatalException;
import com.adlanda.recommender.exception.ProviderTransientException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns text into vectors using an ordered list of providers.
 *
 * Each provider receives the input in chunks no larger than its batch limit.
 * A chunk call is bounded by a timeout and retried once with exponential
 * backoff on a transient error; if it still fails, the whole input moves to the
 * next provider. Fatal errors are rethrown without failover.
 */
public class EmbeddingProviderChain {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviderChain.class);

    private static final int MAX_ATTEMPTS_PER_CHUNK = 2;

    private final List<EmbeddingProvider> providers;
    private final Map<String, Retry> retries = new LinkedHashMap<>();
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public EmbeddingProviderChain(List<EmbeddingProvider> providers, Duration timeout, Duration retryBackoff) {
        this.providers = List.copyOf(providers);
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(MAX_ATTEMPTS_PER_CHUNK)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retryBackoff, 2.0))
                .retryExceptions(ProviderTransientException.class)
                .ignoreExceptions(ProviderFatalException.class)
                .build();
        for (EmbeddingProvider provider : this.providers) {
            retries.put(provider.name(), Retry.of("embedding-" + provider.name(), retryConfig));
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "embedding-call-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Embeds a single text.
     */
    public float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }

    /**
     * Embeds each text, preserving order and count.
     *
     * @throws ProviderFatalException         if the input is invalid or a provider rejects it
     * @throws EmbeddingUnavailableException  if every provider failed transiently
     */
    public List<float[]> embed(List<String> texts) {
        validate(texts);

        if (providers.isEmpty()) {
            throw new EmbeddingUnavailableException("No embedding providers configured");
        }

        ProviderTransientException lastFailure = null;
        for (EmbeddingProvider provider : providers) {
            try {
                List<float[]> vectors = embedWith(provider, texts);
                if (lastFailure != null) {
                    log.info("Embedded {} texts with fallback provider {}", texts.size(), provider.name());
                }
                return vectors;
            } catch (ProviderTransientException e) {
                log.warn("Embedding provider {} unavailable, trying next: {}", provider.name(), e.getMessage());
                lastFailure = e;
            }
        }

        throw new EmbeddingUnavailableException("All embedding providers failed", lastFailure);
    }

    /**
     * Names of the configured providers, in priority order.
     */
    public List<String> providerNames() {
        return providers.stream().map(EmbeddingProvider::name).toList();
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private List<float[]> embedWith(EmbeddingProvider provider, List<String> texts) {
        int chunkSize = Math.max(1, provider.maxBatchSize());
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += chunkSize) {
            List<String> chunk = texts.subList(start, Math.min(start + chunkSize, texts.size()));
            vectors.addAll(embedChunk(provider, chunk));
        }
        return vectors;
    }

    private List<float[]> embedChunk(EmbeddingProvider provider, List<String> chunk) {
        Retry retry = retries.get(provider.name());
        return Retry.decorateSupplier(retry, () -> timedCall(provider, chunk)).get();
    }

    private List<float[]> timedCall(EmbeddingProvider provider, List<String> chunk) {
        List<String> input = List.copyOf(chunk);
        List<float[]> vectors;
        try {
            // cancel(true) on timeout must reach the worker thread
            vectors = timeLimiter.executeFutureSupplier(() -> executor.submit(() -> provider.embed(input)));
        } catch (ProviderTransientException | ProviderFatalException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new ProviderTransientException(provider.name() + " timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderTransientException(provider.name() + " call interrupted", e);
        } catch (Exception e) {
            throw new ProviderTransientException(provider.name() + " call failed: " + e.getMessage(), e);
        }

        if (vectors == null || vectors.size() != input.size()) {
            throw new ProviderTransientException(provider.name() + " returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + input.size() + " texts");
        }
        return vectors;
    }

    private void validate(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new ProviderFatalException("At least one text is required");
        }
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new ProviderFatalException("Text at position " + i + " is empty");
            }
        }
    }
}
