package com.adlanda.recommender.service;

import com.adlanda.recommender.MutableClock;
import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.CleanupResult;
import com.adlanda.recommender.model.EmbeddingStats;
import com.adlanda.recommender.model.ItemMetadata;
import com.adlanda.recommender.model.MaintenanceResult;
import com.adlanda.recommender.model.SyncResult;
import com.adlanda.recommender.repository.FeedbackEventRepository;
import com.adlanda.recommender.repository.InMemoryCatalogStore;
import com.adlanda.recommender.repository.InMemoryVectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.adlanda.recommender.repository.InMemoryCatalogStore.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-31T00:00:00Z");

    @Mock
    private EmbeddingSyncService syncService;

    @Mock
    private UserPreferenceService preferenceService;

    @Mock
    private FeedbackService feedbackService;

    @Mock
    private FeedbackEventRepository feedbackRepository;

    private InMemoryVectorIndex index;
    private InMemoryCatalogStore catalog;
    private MaintenanceService service;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        catalog = new InMemoryCatalogStore();
        service = new MaintenanceService(syncService, index, catalog, preferenceService, feedbackService,
                feedbackRepository, new RecommenderProperties(), new MutableClock(NOW));
    }

    @Test
    void collectStats_reportsCounts() {
        catalog.add(item("A", "Math")).add(item("B", "Art"));
        index.upsert("A", new float[]{1f}, metadata(), NOW);
        when(preferenceService.count()).thenReturn(4L);
        when(feedbackService.countPending()).thenReturn(7L);

        EmbeddingStats stats = service.collectStats();

        assertThat(stats.itemEmbeddings()).isEqualTo(1);
        assertThat(stats.catalogItems()).isEqualTo(2);
        assertThat(stats.userEmbeddings()).isEqualTo(4);
        assertThat(stats.pendingFeedback()).isEqualTo(7);
        assertThat(stats.collectedAt()).isEqualTo(NOW);
    }

    @Test
    void performMaintenance_syncFails_stillCollectsStats() {
        when(syncService.sync()).thenThrow(new StoreUnavailableException("catalog down", null));

        MaintenanceResult result = service.performMaintenance();

        assertThat(result.sync()).isNull();
        assertThat(result.stats()).isNotNull();
        assertThat(result.errors()).singleElement().asString().startsWith("sync:");
    }

    @Test
    void performMaintenance_bothStepsSucceed() {
        SyncResult sync = new SyncResult(1, 0, 0, 0, 1, List.of(), 3);
        when(syncService.sync()).thenReturn(sync);

        MaintenanceResult result = service.performMaintenance();

        assertThat(result.sync()).isEqualTo(sync);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void dailyCleanup_removesOrphansAndPurgesOldFeedback() {
        catalog.add(item("A", "Math"));
        index.upsert("A", new float[]{1f}, metadata(), NOW);
        index.upsert("gone", new float[]{1f}, metadata(), NOW);
        when(feedbackRepository.deleteProcessedBefore(NOW.minus(Duration.ofDays(30)))).thenReturn(12);

        CleanupResult result = service.dailyCleanup();

        assertThat(result.orphanedEmbeddingsRemoved()).isEqualTo(1);
        assertThat(result.feedbackPurged()).isEqualTo(12);
        assertThat(index.listIds()).containsExactly("A");
    }

    @Test
    void dailyCleanup_catalogDown_keepsIndexAndStillPurges() {
        index.upsert("A", new float[]{1f}, metadata(), NOW);
        catalog.setUnavailable(true);
        when(feedbackRepository.deleteProcessedBefore(any(Instant.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        CleanupResult result = service.dailyCleanup();

        assertThat(index.listIds()).containsExactly("A");
        assertThat(result.errors()).hasSize(2);
        verify(feedbackRepository).deleteProcessedBefore(any(Instant.class));
    }

    private static ItemMetadata metadata() {
        return new ItemMetadata("t", null, "STEM", null, null, null, "h");
    }
}
