package com.anchorsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface IndexedModelConfigRepository extends MongoRepository<IndexedModelConfig, String> {

    List<IndexedModelConfig> findByIndexedTrueOrderByCreatedAtAsc();
}
