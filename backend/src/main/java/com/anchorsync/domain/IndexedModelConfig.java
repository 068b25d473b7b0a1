package com.anchorsync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Index-store record for a model. A document with {@code indexed=false} marks a model that was indexed once and
 * then dropped; such a model cannot be indexed again.
 */
@Document(collection = "indexed_model_config")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexedModelConfig {

    @Id
    @EqualsAndHashCode.Include
    private String model;
    private boolean indexed;
    private Instant createdAt;
    private Instant updatedAt;
}
