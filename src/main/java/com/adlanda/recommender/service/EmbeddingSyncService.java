package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.health.SyncHealthIndicator;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.SyncError;
import com.adlanda.recommender.model.SyncResult;
import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.repository.CatalogStore;
import com.adlanda.recommender.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reconciles the vector index with the opportunity catalog.
 *
 * New items are embedded in batches, items whose embedding text changed are
 * re-embedded, and records whose item left the catalog are deleted. Per-item
 * failures are collected into the {@link SyncResult}; only a run that cannot
 * read the catalog or the index fails as a whole.
 *
 * Runs are serialized. Concurrent readers may observe a partially synced index.
 */
@Service
public class EmbeddingSyncService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSyncService.class);

    static final String NO_TEXT_REASON = "no embeddable text";

    private final CatalogStore catalogStore;
    private final VectorIndex vectorIndex;
    private final EmbeddingProviderChain providerChain;
    private final EmbeddingTextBuilder textBuilder;
    private final ContentHashService hashService;
    private final RecommenderProperties properties;
    private final SyncHealthIndicator healthIndicator;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();

    public EmbeddingSyncService(CatalogStore catalogStore,
                                VectorIndex vectorIndex,
                                EmbeddingProviderChain providerChain,
                                EmbeddingTextBuilder textBuilder,
                                ContentHashService hashService,
                                RecommenderProperties properties,
                                SyncHealthIndicator healthIndicator,
                                Clock clock) {
        this.catalogStore = catalogStore;
        this.vectorIndex = vectorIndex;
        this.providerChain = providerChain;
        this.textBuilder = textBuilder;
        this.hashService = hashService;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
        this.clock = clock;
    }

    /**
     * Brings the index into agreement with the catalog.
     *
     * @throws StoreUnavailableException if the catalog or index cannot be listed
     */
    public SyncResult sync() {
        return runExclusively(false);
    }

    /**
     * Re-embeds every catalog item regardless of its stored snapshot, and
     * removes orphaned records.
     */
    public SyncResult forceResync() {
        return runExclusively(true);
    }

    private SyncResult runExclusively(boolean force) {
        runLock.lock();
        try {
            return run(force);
        } finally {
            runLock.unlock();
        }
    }

    private SyncResult run(boolean force) {
        long startMillis = clock.millis();
        log.info("Starting embedding sync{}...", force ? " (forced)" : "");

        List<CatalogItem> catalog;
        Set<String> indexedIds;
        Map<String, String> indexedHashes;
        try {
            catalog = catalogStore.getAll();
            indexedIds = vectorIndex.listIds();
            indexedHashes = properties.getSync().isDetectChanges() ? vectorIndex.listContentHashes() : Map.of();
        } catch (RuntimeException e) {
            log.error("Embedding sync could not start: {}", e.getMessage(), e);
            healthIndicator.markUnhealthy(e.getMessage());
            if (e instanceof StoreUnavailableException) {
                throw e;
            }
            throw new StoreUnavailableException("Embedding sync could not start: " + e.getMessage(), e);
        }

        SyncPlan plan = plan(catalog, indexedIds, indexedHashes, force);
        List<SyncError> errors = new ArrayList<>(plan.errors());
        log.info("Sync plan: {} to create, {} to update, {} to delete, {} skipped",
                plan.toCreate().size() - plan.updates().size(), plan.updates().size(),
                plan.toDelete().size(), plan.skipped());

        BatchOutcome outcome = embedAll(plan.toCreate(), plan.updates(), errors);
        int deleted = deleteAll(plan.toDelete(), errors);

        SyncResult result = new SyncResult(
                outcome.created(),
                outcome.updated(),
                deleted,
                plan.skipped(),
                outcome.batches(),
                List.copyOf(errors),
                clock.millis() - startMillis
        );

        log.info("Embedding sync complete: created={}, updated={}, deleted={}, skipped={}, batches={}, errors={}, {}ms",
                result.created(), result.updated(), result.deleted(), result.skipped(),
                result.batches(), result.errors().size(), result.durationMs());
        healthIndicator.markHealthy(result);
        return result;
    }

    private SyncPlan plan(List<CatalogItem> catalog, Set<String> indexedIds,
                          Map<String, String> indexedHashes, boolean force) {
        Map<String, PendingItem> toCreate = new LinkedHashMap<>();
        Set<String> updates = new HashSet<>();
        Set<String> catalogIds = new HashSet<>();
        List<SyncError> errors = new ArrayList<>();
        int skipped = 0;

        for (CatalogItem item : catalog) {
            if (!catalogIds.add(item.id())) {
                log.warn("Duplicate catalog id {}, keeping first occurrence", item.id());
                continue;
            }

            String text = textBuilder.forItem(item);
            if (text.isEmpty()) {
                log.warn("No content to embed for opportunity {}", item.id());
                errors.add(new SyncError(item.id(), NO_TEXT_REASON));
                skipped++;
                continue;
            }

            String hash = hashService.computeHash(text);
            if (!indexedIds.contains(item.id())) {
                toCreate.put(item.id(), new PendingItem(item, text, hash));
            } else if (force || changed(item.id(), hash, indexedHashes)) {
                log.debug("Opportunity {} changed, re-embedding", item.id());
                toCreate.put(item.id(), new PendingItem(item, text, hash));
                updates.add(item.id());
            }
        }

        Set<String> toDelete = new HashSet<>(indexedIds);
        toDelete.removeAll(catalogIds);

        return new SyncPlan(List.copyOf(toCreate.values()), updates, toDelete, skipped, errors);
    }

    private boolean changed(String itemId, String hash, Map<String, String> indexedHashes) {
        if (!properties.getSync().isDetectChanges()) {
            return false;
        }
        return !hash.equals(indexedHashes.get(itemId));
    }

    private BatchOutcome embedAll(List<PendingItem> pending, Set<String> updates, List<SyncError> errors) {
        int batchSize = properties.getSync().getBatchSize();
        Duration delay = properties.getSync().getBatchDelay();
        int created = 0;
        int updated = 0;
        int batches = 0;

        for (int start = 0; start < pending.size(); start += batchSize) {
            List<PendingItem> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));

            if (start > 0 && !pause(delay)) {
                for (PendingItem item : pending.subList(start, pending.size())) {
                    errors.add(new SyncError(item.item().id(), "sync interrupted"));
                }
                break;
            }

            batches++;
            log.debug("Processing batch {} ({} items)", batches, batch.size());
            List<String> stored = embedBatch(batch, errors);
            created += stored.size();
            updated += (int) stored.stream().filter(updates::contains).count();
        }

        return new BatchOutcome(created, updated, batches);
    }

    /**
     * Embeds one batch with a single provider call, falling back to one call per
     * item when the batch call fails.
     *
     * @return Ids that were upserted
     */
    private List<String> embedBatch(List<PendingItem> batch, List<SyncError> errors) {
        List<float[]> vectors;
        try {
            vectors = providerChain.embed(batch.stream().map(PendingItem::text).toList());
        } catch (RuntimeException e) {
            log.warn("Batch embedding failed ({}), retrying {} items individually", e.getMessage(), batch.size());
            return embedIndividually(batch, errors);
        }

        List<String> stored = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            if (store(batch.get(i), vectors.get(i), errors)) {
                stored.add(batch.get(i).item().id());
            }
        }
        return stored;
    }

    private List<String> embedIndividually(List<PendingItem> batch, List<SyncError> errors) {
        List<String> stored = new ArrayList<>();
        for (PendingItem pending : batch) {
            float[] vector;
            try {
                vector = providerChain.embed(pending.text());
            } catch (RuntimeException e) {
                log.error("Failed to embed opportunity {}: {}", pending.item().id(), e.getMessage());
                errors.add(new SyncError(pending.item().id(), e.getMessage()));
                continue;
            }
            if (store(pending, vector, errors)) {
                stored.add(pending.item().id());
            }
        }
        return stored;
    }

    private boolean store(PendingItem pending, float[] vector, List<SyncError> errors) {
        CatalogItem item = pending.item();
        try {
            vectorIndex.upsert(item.id(), vector, item.toMetadata(pending.hash()), Instant.now(clock));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to store embedding for opportunity {}: {}", item.id(), e.getMessage());
            errors.add(new SyncError(item.id(), e.getMessage()));
            return false;
        }
    }

    private int deleteAll(Set<String> toDelete, List<SyncError> errors) {
        int deleted = 0;
        for (String itemId : toDelete) {
            try {
                if (vectorIndex.delete(itemId)) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete embedding for opportunity {}: {}", itemId, e.getMessage());
                errors.add(new SyncError(itemId, e.getMessage()));
            }
        }
        return deleted;
    }

    /**
     * @return false if interrupted
     */
    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Embedding sync interrupted between batches");
            return false;
        }
    }

    private record PendingItem(CatalogItem item, String text, String hash) {}

    private record SyncPlan(
            List<PendingItem> toCreate,
            Set<String> updates,
            Set<String> toDelete,
            int skipped,
            List<SyncError> errors
    ) {}

    private record BatchOutcome(int created, int updated, int batches) {}
}
