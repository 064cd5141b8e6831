package com.adlanda.recommender.provider;

import com.adlanda.recommender.exception.EmbeddingUnavailableException;
import com.adlanda.recommender.exception.ProviderFatalException;
import com.adlanda.recommender.exception.ProviderTransientException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for EmbeddingProviderChain.
 * Covers failover, retry, chunking and timeouts.
 */
class EmbeddingProviderChainTest {

    private EmbeddingProviderChain chain;

    @AfterEach
    void tearDown() {
        if (chain != null) {
            chain.shutdown();
        }
    }

    @Test
    void embed_primarySucceeds_fallbackNotCalled() {
        FakeProvider primary = FakeProvider.returning("primary", 1f);
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = chainOf(primary, fallback);

        List<float[]> vectors = chain.embed(List.of("a", "b"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)[0]).isEqualTo(1f);
        assertThat(fallback.calls).isEmpty();
    }

    @Test
    void embed_primaryTransient_failsOverToFallback() {
        FakeProvider primary = FakeProvider.failing("primary", () -> new ProviderTransientException("503"));
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = chainOf(primary, fallback);

        List<float[]> vectors = chain.embed(List.of("a", "b"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors).allSatisfy(v -> assertThat(v[0]).isEqualTo(2f));
        assertThat(primary.calls).hasSize(2);
    }

    @Test
    void embed_transientChunkFailure_retriedOnceOnSameProvider() {
        List<Integer> attempts = Collections.synchronizedList(new ArrayList<>());
        FakeProvider primary = new FakeProvider("primary", 100, texts -> {
            attempts.add(texts.size());
            if (attempts.size() == 1) {
                throw new ProviderTransientException("rate limited");
            }
            return vectors(texts.size(), 1f);
        });
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = chainOf(primary, fallback);

        List<float[]> vectors = chain.embed(List.of("a"));

        assertThat(vectors.get(0)[0]).isEqualTo(1f);
        assertThat(attempts).hasSize(2);
        assertThat(fallback.calls).isEmpty();
    }

    @Test
    void embed_fatalError_isNotFailedOver() {
        FakeProvider primary = FakeProvider.failing("primary", () -> new ProviderFatalException("bad input"));
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = chainOf(primary, fallback);

        assertThatThrownBy(() -> chain.embed(List.of("a")))
                .isInstanceOf(ProviderFatalException.class)
                .hasMessageContaining("bad input");
        assertThat(primary.calls).hasSize(1);
        assertThat(fallback.calls).isEmpty();
    }

    @Test
    void embed_allProvidersFail_throwsEmbeddingUnavailable() {
        chain = chainOf(
                FakeProvider.failing("primary", () -> new ProviderTransientException("timeout")),
                FakeProvider.failing("fallback", () -> new ProviderTransientException("503")));

        assertThatThrownBy(() -> chain.embed(List.of("a")))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasCauseInstanceOf(ProviderTransientException.class);
    }

    @Test
    void embed_noProviders_throwsEmbeddingUnavailable() {
        chain = new EmbeddingProviderChain(List.of(), Duration.ofSeconds(1), Duration.ofMillis(1));

        assertThatThrownBy(() -> chain.embed(List.of("a")))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void embed_largeInput_chunkedByProviderLimit() {
        FakeProvider primary = new FakeProvider("primary", 2, texts -> {
            List<float[]> out = new ArrayList<>();
            for (String text : texts) {
                out.add(new float[]{Float.parseFloat(text)});
            }
            return out;
        });
        chain = chainOf(primary);

        List<float[]> vectors = chain.embed(List.of("1", "2", "3", "4", "5"));

        assertThat(primary.calls).containsExactly(2, 2, 1);
        assertThat(vectors).extracting(v -> v[0]).containsExactly(1f, 2f, 3f, 4f, 5f);
    }

    @Test
    void embed_wrongVectorCount_treatedAsTransient() {
        FakeProvider primary = new FakeProvider("primary", 100, texts -> vectors(1, 1f));
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = chainOf(primary, fallback);

        List<float[]> vectors = chain.embed(List.of("a", "b", "c"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors.get(0)[0]).isEqualTo(2f);
    }

    @Test
    void embed_hungProvider_timesOutAndFailsOver() {
        FakeProvider primary = new FakeProvider("primary", 100, texts -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return vectors(texts.size(), 1f);
        });
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = new EmbeddingProviderChain(List.of(primary, fallback), Duration.ofMillis(100), Duration.ofMillis(1));

        List<float[]> vectors = chain.embed(List.of("a"));

        assertThat(vectors.get(0)[0]).isEqualTo(2f);
    }

    @Test
    void embed_timedOutCall_interruptsWorkerThread() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        FakeProvider primary = new FakeProvider("primary", 100, texts -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return vectors(texts.size(), 1f);
        });
        FakeProvider fallback = FakeProvider.returning("fallback", 2f);
        chain = new EmbeddingProviderChain(List.of(primary, fallback), Duration.ofMillis(100), Duration.ofMillis(1));

        chain.embed(List.of("a"));

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void embed_blankText_throwsFatal() {
        FakeProvider primary = FakeProvider.returning("primary", 1f);
        chain = chainOf(primary);

        assertThatThrownBy(() -> chain.embed(List.of("ok", " ")))
                .isInstanceOf(ProviderFatalException.class);
        assertThat(primary.calls).isEmpty();
    }

    @Test
    void embed_emptyInput_throwsFatal() {
        chain = chainOf(FakeProvider.returning("primary", 1f));

        assertThatThrownBy(() -> chain.embed(List.of()))
                .isInstanceOf(ProviderFatalException.class);
    }

    private static EmbeddingProviderChain chainOf(EmbeddingProvider... providers) {
        return new EmbeddingProviderChain(List.of(providers), Duration.ofSeconds(2), Duration.ofMillis(1));
    }

    private static List<float[]> vectors(int count, float value) {
        List<float[]> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new float[]{value, 0f});
        }
        return out;
    }

    private static final class FakeProvider implements EmbeddingProvider {
        private final String name;
        private final int maxBatchSize;
        private final Function<List<String>, List<float[]>> behaviour;
        final List<Integer> calls = Collections.synchronizedList(new ArrayList<>());

        FakeProvider(String name, int maxBatchSize, Function<List<String>, List<float[]>> behaviour) {
            this.name = name;
            this.maxBatchSize = maxBatchSize;
            this.behaviour = behaviour;
        }

        static FakeProvider returning(String name, float value) {
            return new FakeProvider(name, 100, texts -> vectors(texts.size(), value));
        }

        static FakeProvider failing(String name, java.util.function.Supplier<RuntimeException> error) {
            return new FakeProvider(name, 100, texts -> {
                throw error.get();
            });
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int maxBatchSize() {
            return maxBatchSize;
        }

        @Override
        public List<float[]> embed(List<String> texts) {
            calls.add(texts.size());
            return behaviour.apply(texts);
        }
    }
}
