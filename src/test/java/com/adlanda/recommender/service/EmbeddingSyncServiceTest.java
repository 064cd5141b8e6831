package com.adlanda.recommender.service;

import com.adlanda.recommender.MutableClock;
import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.health.SyncHealthIndicator;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.ScoredItem;
import com.adlanda.recommender.model.SyncError;
import com.adlanda.recommender.model.SyncResult;
import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.provider.RecordingEmbeddingProvider;
import com.adlanda.recommender.repository.InMemoryCatalogStore;
import com.adlanda.recommender.repository.InMemoryVectorIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.adlanda.recommender.repository.InMemoryCatalogStore.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for EmbeddingSyncService.
 * Runs against the in-memory index and catalog with a deterministic provider.
 */
class EmbeddingSyncServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryCatalogStore catalog;
    private InMemoryVectorIndex index;
    private RecordingEmbeddingProvider provider;
    private EmbeddingProviderChain chain;
    private RecommenderProperties properties;
    private SyncHealthIndicator health;
    private MutableClock clock;
    private EmbeddingSyncService service;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalogStore();
        index = new InMemoryVectorIndex();
        provider = new RecordingEmbeddingProvider();
        chain = new EmbeddingProviderChain(List.of(provider), Duration.ofSeconds(5), Duration.ofMillis(1));
        properties = new RecommenderProperties();
        properties.getSync().setBatchDelay(Duration.ZERO);
        health = new SyncHealthIndicator();
        clock = new MutableClock(T0);
        service = new EmbeddingSyncService(catalog, index, chain, new EmbeddingTextBuilder(),
                new ContentHashService(), properties, health, clock);
    }

    @AfterEach
    void tearDown() {
        chain.shutdown();
    }

    @Test
    void sync_emptyIndex_embedsEveryItem() {
        catalog.add(item("1", "Math Olympiad Scholarship"))
                .add(item("2", "Art Grant"))
                .add(item("3", "Coding Bootcamp"));

        SyncResult result = service.sync();

        assertThat(result.created()).isEqualTo(3);
        assertThat(result.deleted()).isZero();
        assertThat(result.errors()).isEmpty();
        assertThat(index.listIds()).containsExactlyInAnyOrder("1", "2", "3");
    }

    @Test
    void sync_twiceWithoutChanges_secondRunDoesNothing() {
        catalog.add(item("1", "Math Olympiad Scholarship")).add(item("2", "Art Grant"));
        service.sync();
        provider.reset();

        SyncResult second = service.sync();

        assertThat(second.created()).isZero();
        assertThat(second.deleted()).isZero();
        assertThat(second.updated()).isZero();
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void sync_withoutErrors_indexMatchesCatalogExactly() {
        catalog.add(item("1", "One")).add(item("2", "Two")).add(item("3", "Three"));
        service.sync();
        catalog.remove("2");
        catalog.add(item("4", "Four"));

        SyncResult result = service.sync();

        assertThat(result.errors()).isEmpty();
        Set<String> catalogIds = catalog.getAll().stream().map(CatalogItem::id).collect(Collectors.toSet());
        assertThat(index.listIds()).isEqualTo(catalogIds);
    }

    @Test
    void sync_120ItemsWithBatchSize50_issuesThreeBatches() {
        properties.getSync().setBatchSize(50);
        for (int i = 0; i < 120; i++) {
            catalog.add(item("item-" + i, "Opportunity number " + i));
        }

        SyncResult result = service.sync();

        assertThat(provider.calls()).containsExactly(50, 50, 20);
        assertThat(result.batches()).isEqualTo(3);
        assertThat(result.created()).isEqualTo(120);
        assertThat(index.count()).isEqualTo(120);
    }

    @Test
    void sync_removedItem_isDeletedAndOthersUntouched() {
        catalog.add(item("A", "Math Olympiad Scholarship")).add(item("B", "Art Grant"));
        service.sync();
        assertThat(index.listIds()).containsExactlyInAnyOrder("A", "B");
        Instant firstWrite = index.find("A").map(EmbeddingRecord::updatedAt).orElseThrow();
        float[] artVector = index.find("B").map(EmbeddingRecord::vector).orElseThrow();

        catalog.remove("B");
        clock.advance(Duration.ofHours(1));
        SyncResult result = service.sync();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.created()).isZero();
        assertThat(index.query(artVector, 10, -1.0)).extracting(ScoredItem::itemId).doesNotContain("B");
        assertThat(index.find("A").map(EmbeddingRecord::updatedAt)).contains(firstWrite);
    }

    @Test
    void sync_editedItem_isReembedded() {
        catalog.add(item("1", "Art Grant"));
        service.sync();
        float[] before = index.find("1").map(EmbeddingRecord::vector).orElseThrow();

        catalog.add(item("1", "Art Grant for Sculptors"));
        SyncResult result = service.sync();

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
        assertThat(index.find("1").map(EmbeddingRecord::vector).orElseThrow()).isNotEqualTo(before);
        assertThat(index.find("1").map(r -> r.metadata().title())).contains("Art Grant for Sculptors");
    }

    @Test
    void sync_changeDetectionDisabled_leavesEditedItemAlone() {
        properties.getSync().setDetectChanges(false);
        catalog.add(item("1", "Art Grant"));
        service.sync();

        catalog.add(item("1", "Art Grant for Sculptors"));
        SyncResult result = service.sync();

        assertThat(result.created()).isZero();
        assertThat(index.find("1").map(r -> r.metadata().title())).contains("Art Grant");
    }

    @Test
    void sync_itemWithoutText_isSkippedNotEmbedded() {
        catalog.add(item("1", "Art Grant"));
        catalog.add(new CatalogItem("empty", " ", null, null, null, null, null, null, null, null, T0));

        SyncResult result = service.sync();

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.errors()).containsExactly(new SyncError("empty", EmbeddingSyncService.NO_TEXT_REASON));
        assertThat(index.listIds()).containsExactly("1");
    }

    @Test
    void sync_batchCallFails_retriesItemsIndividually() {
        catalog.add(item("1", "Art Grant"))
                .add(item("2", "Poison pill"))
                .add(item("3", "Coding Bootcamp"));
        provider.failWhen(batch -> batch.size() > 1 || batch.get(0).contains("Poison"));

        SyncResult result = service.sync();

        assertThat(result.created()).isEqualTo(2);
        assertThat(result.errors()).extracting(SyncError::itemId).containsExactly("2");
        assertThat(index.listIds()).containsExactlyInAnyOrder("1", "3");
    }

    @Test
    void sync_failedItem_doesNotAbortLaterBatches() {
        properties.getSync().setBatchSize(2);
        catalog.add(item("1", "Poison pill"))
                .add(item("2", "Art Grant"))
                .add(item("3", "Coding Bootcamp"))
                .add(item("4", "Math Olympiad"));
        provider.failWhen(batch -> batch.stream().anyMatch(text -> text.contains("Poison")));

        SyncResult result = service.sync();

        assertThat(result.created()).isEqualTo(3);
        assertThat(result.errors()).extracting(SyncError::itemId).containsExactly("1");
        assertThat(result.batches()).isEqualTo(2);
    }

    @Test
    void sync_catalogUnavailable_failsRunAndReportsDown() {
        catalog.setUnavailable(true);

        assertThatThrownBy(() -> service.sync()).isInstanceOf(StoreUnavailableException.class);
        assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void sync_completedRun_reportsUp() {
        catalog.add(item("1", "Art Grant"));

        service.sync();

        assertThat(health.health().getStatus()).isEqualTo(Status.UP);
        assertThat(health.health().getDetails()).containsEntry("created", 1);
    }

    @Test
    void forceResync_reembedsUnchangedItems() {
        catalog.add(item("1", "Art Grant")).add(item("2", "Math Olympiad"));
        service.sync();
        provider.reset();

        SyncResult result = service.forceResync();

        assertThat(result.created()).isEqualTo(2);
        assertThat(result.updated()).isEqualTo(2);
        assertThat(provider.calls()).containsExactly(2);
    }
}
