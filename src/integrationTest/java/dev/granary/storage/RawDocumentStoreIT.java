package dev.granary.storage;

import dev.granary.BaseIntegrationTest;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

class RawDocumentStoreIT extends BaseIntegrationTest {

    @Autowired
    private RawDocumentStore store;

    @Autowired
    private SourceConfigService sourceConfigService;

    private SourceConfig weather() {
        return sourceConfigService.getConfig("weather").orElseThrow();
    }

    @Test
    void storedDocumentIsFoundByContentHash() {
        byte[] content = "{\"temp\":21.5}".getBytes(StandardCharsets.UTF_8);

        RawDocument stored = store.storeRawDocument(content, weather(), UUID.randomUUID(), Map.of("region", "north"));

        assertThat(store.findByContentHash("weather", ContentHasher.sha256(content)))
                .map(RawDocument::getDocumentId)
                .contains(stored.getDocumentId());
        assertThat(store.findByDocumentId(stored.getDocumentId())).isPresent();
        verify(blobStorage).put(eq("raw-documents"), eq(stored.getBlobPath()), any(), eq("application/octet-stream"));
    }

    @Test
    void secondStoreOfSameContentReportsExistingDocument() {
        byte[] content = "{\"temp\":19.0}".getBytes(StandardCharsets.UTF_8);
        RawDocument first = store.storeRawDocument(content, weather(), UUID.randomUUID(), Map.of());

        assertThatThrownBy(() -> store.storeRawDocument(content, weather(), UUID.randomUUID(), Map.of()))
                .isInstanceOf(DuplicateDocumentException.class)
                .extracting(e -> ((DuplicateDocumentException) e).getExistingDocumentId())
                .isEqualTo(first.getDocumentId());
    }

    @Test
    void concurrentStoresOfSameContentPersistExactlyOnce() throws Exception {
        byte[] content = "{\"temp\":17.25}".getBytes(StandardCharsets.UTF_8);
        int writers = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<RawDocument>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return store.storeRawDocument(content, weather(), UUID.randomUUID(), Map.of());
                }));
            }
            start.countDown();

            int stored = 0;
            int duplicates = 0;
            for (Future<RawDocument> result : results) {
                try {
                    result.get();
                    stored++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(DuplicateDocumentException.class);
                    duplicates++;
                }
            }
            assertThat(stored).isEqualTo(1);
            assertThat(duplicates).isEqualTo(writers - 1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(jdbcTemplate.queryForObject(
                "SELECT count(*) FROM raw_documents WHERE source_id = 'weather'", Integer.class)).isEqualTo(1);
        verify(blobStorage, atLeastOnce()).put(anyString(), anyString(), any(), anyString());
    }
}
