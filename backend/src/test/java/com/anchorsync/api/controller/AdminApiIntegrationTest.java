package com.anchorsync.api.controller;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.domain.BlockHeader;
import com.anchorsync.domain.IndexedModelConfigRepository;
import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.QueuedJobRepository;
import com.anchorsync.domain.SyncQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Admin flow against a real Mongo with the engine not started: indexing a model persists its config and queues its
 * backfill, and the model stays unqueryable while that backfill is outstanding.
 */
@SpringBootTest(properties = "anchorsync.sync.start-block=100")
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AdminApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    QueuedJobRepository jobRepository;
    @Autowired
    IndexedModelConfigRepository configRepository;

    @MockBean
    ChainProvider chainProvider;

    @Test
    @DisplayName("POST /admin/models queues a backfill and the model waits for it")
    void indexModel_queuesBackfill() {
        when(chainProvider.getBlock(-20)).thenReturn(new BlockHeader(500, "h500", "h499"));

        webTestClient.post().uri("/api/v1/admin/models")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"models\":[\"kjzl6hvfrbw6c5\"]}")
                .exchange()
                .expectStatus().isAccepted();

        assertThat(configRepository.findById("kjzl6hvfrbw6c5")).hasValueSatisfying(c -> assertThat(c.isIndexed()).isTrue());
        List<QueuedJob> pending = jobRepository.findByStateAndQueueInOrderByCreatedOnAsc(
                JobState.CREATED, List.of(SyncQueue.HISTORICAL));
        assertThat(pending).anySatisfy(job -> {
            assertThat(job.models()).containsExactly("kjzl6hvfrbw6c5");
            assertThat(job.getData().getFromBlock()).isEqualTo(100);
            assertThat(job.getData().getToBlock()).isEqualTo(500);
        });

        webTestClient.get().uri("/api/v1/admin/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.model == 'kjzl6hvfrbw6c5')].syncComplete").isEqualTo(false);

        webTestClient.get().uri("/api/v1/admin/models/kjzl6hvfrbw6c5/queryable")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("INDEX_QUERY_NOT_AVAILABLE");

        webTestClient.get().uri("/api/v1/admin/sync/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pendingSyncs[0].models[0]").isEqualTo("kjzl6hvfrbw6c5");
    }

    @Test
    @DisplayName("a stopped model cannot be indexed again")
    void stoppedModel_reindexRefused() {
        webTestClient.method(HttpMethod.DELETE).uri("/api/v1/admin/models")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"models\":[\"kjzl6stopped\"]}")
                .exchange()
                .expectStatus().isAccepted();

        webTestClient.post().uri("/api/v1/admin/models")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"models\":[\"kjzl6stopped\"]}")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("MODEL_REINDEX_REFUSED");
    }
}
