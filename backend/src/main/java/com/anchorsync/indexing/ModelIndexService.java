package com.anchorsync.indexing;

import com.anchorsync.domain.IndexedModelConfig;
import com.anchorsync.domain.IndexedModelConfigRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Which models this node indexes, and whether a model may be queried yet. The indexed set is loaded from
 * indexed_model_config on first use and kept in memory afterwards.
 */
@Service
@Slf4j
@EnableConfigurationProperties(IndexingProperties.class)
public class ModelIndexService {

    private final IndexedModelConfigRepository configRepository;
    private final IndexingProperties properties;
    private final ObjectProvider<SyncQueryApi> syncQueryApi;

    private List<String> indexedModels;

    public ModelIndexService(IndexedModelConfigRepository configRepository,
                             IndexingProperties properties,
                             ObjectProvider<SyncQueryApi> syncQueryApi) {
        this.configRepository = configRepository;
        this.properties = properties;
        this.syncQueryApi = syncQueryApi;
    }

    public synchronized List<String> indexedModels() {
        return List.copyOf(loaded());
    }

    /**
     * Starts indexing the given models. Already indexed models are accepted again unless their historical sync is
     * still pending.
     *
     * @throws ModelReindexException           if a model was indexed before and then stopped
     * @throws IndexQueryNotAvailableException if a model's historical sync is still pending
     */
    public synchronized void indexModels(Collection<String> models) {
        if (models == null || models.isEmpty()) {
            return;
        }
        Map<String, IndexedModelConfig> existing = configRepository.findAllById(models).stream()
                .collect(Collectors.toMap(IndexedModelConfig::getModel, Function.identity()));
        for (String model : models) {
            IndexedModelConfig config = existing.get(model);
            if (config != null && !config.isIndexed()) {
                throw new ModelReindexException(model);
            }
            assertNoOngoingSyncForModel(model);
        }
        Instant now = Instant.now();
        List<IndexedModelConfig> toSave = new ArrayList<>();
        for (String model : models) {
            log.info("Starting indexing for model {}", model);
            IndexedModelConfig config = existing.get(model);
            if (config == null) {
                config = new IndexedModelConfig(model, true, now, now);
            } else {
                config.setUpdatedAt(now);
            }
            toSave.add(config);
        }
        configRepository.saveAll(toSave);
        List<String> current = loaded();
        for (String model : models) {
            if (!current.contains(model)) {
                current.add(model);
            }
        }
    }

    public synchronized void stopIndexingModels(Collection<String> models) {
        if (models == null || models.isEmpty()) {
            return;
        }
        log.info("Stopping indexing for models: {}", String.join(",", models));
        Instant now = Instant.now();
        Map<String, IndexedModelConfig> existing = configRepository.findAllById(models).stream()
                .collect(Collectors.toMap(IndexedModelConfig::getModel, Function.identity()));
        List<IndexedModelConfig> toSave = new ArrayList<>();
        for (String model : models) {
            IndexedModelConfig config = existing.getOrDefault(model, new IndexedModelConfig(model, false, now, now));
            config.setIndexed(false);
            config.setUpdatedAt(now);
            toSave.add(config);
        }
        configRepository.saveAll(toSave);
        loaded().removeAll(models);
    }

    /**
     * @throws ModelNotIndexedException        if the model is not indexed
     * @throws IndexQueryNotAvailableException if its historical sync is pending and early queries are not allowed
     */
    public void assertModelQueryable(String model) {
        assertModelIsIndexed(model);
        assertNoOngoingSyncForModel(model);
    }

    public void assertModelIsIndexed(String model) {
        boolean indexed;
        synchronized (this) {
            indexed = loaded().contains(model);
        }
        if (!indexed) {
            log.debug("Query failed: model {} is not indexed on this node", model);
            throw new ModelNotIndexedException(model);
        }
    }

    public void assertNoOngoingSyncForModel(String model) {
        if (!properties.isAllowQueriesBeforeHistoricalSync() && !syncQueryApi.getObject().syncComplete(model)) {
            throw new IndexQueryNotAvailableException(model);
        }
    }

    private List<String> loaded() {
        if (indexedModels == null) {
            indexedModels = configRepository.findByIndexedTrueOrderByCreatedAtAsc().stream()
                    .map(IndexedModelConfig::getModel)
                    .collect(Collectors.toCollection(ArrayList::new));
            log.info("Loaded {} indexed model(s)", indexedModels.size());
        }
        return indexedModels;
    }
}
