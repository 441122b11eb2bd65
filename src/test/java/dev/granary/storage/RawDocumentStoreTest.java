package dev.granary.storage;

import dev.granary.fixture.SourceConfigBuilder;
import dev.granary.source.SourceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RawDocumentStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final byte[] CONTENT = "{\"reading\":42}".getBytes(StandardCharsets.UTF_8);
    private static final String HASH = ContentHasher.sha256(CONTENT);

    @Mock
    RawDocumentRepository repository;

    @Mock
    BlobStorageClient blobStorage;

    @Captor
    ArgumentCaptor<RawDocument> documentCaptor;

    RawDocumentStore store;

    SourceConfig config;

    UUID ingestionId;

    @BeforeEach
    void setUp() {
        store = new RawDocumentStore(repository, blobStorage, Clock.fixed(NOW, ZoneOffset.UTC));
        config = SourceConfigBuilder.blobTrigger().sourceId("quality-events").rawContainer("raw").build();
        ingestionId = UUID.randomUUID();
    }

    // --- Happy path ---

    @Test
    void storesBlobBeforeInsertingMetadata() {
        when(repository.findBySourceIdAndContentHash("quality-events", HASH)).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(RawDocument.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RawDocument stored = store.storeRawDocument(CONTENT, config, ingestionId, Map.of("farmer_id", "FRM-001"));

        String expectedPath = "quality-events/" + ingestionId + "/" + HASH;
        InOrder order = inOrder(blobStorage, repository);
        order.verify(blobStorage).put("raw", expectedPath, CONTENT, "application/json");
        order.verify(repository).saveAndFlush(documentCaptor.capture());

        RawDocument saved = documentCaptor.getValue();
        assertThat(saved.getBlobContainer()).isEqualTo("raw");
        assertThat(saved.getBlobPath()).isEqualTo(expectedPath);
        assertThat(saved.getContentHash()).isEqualTo(HASH);
        assertThat(saved.getSizeBytes()).isEqualTo(CONTENT.length);
        assertThat(saved.getStoredAt()).isEqualTo(NOW);
        assertThat(saved.getMetadata()).containsEntry("farmer_id", "FRM-001");
        assertThat(stored).isSameAs(saved);
    }

    @Test
    void storedDocumentExposesMetadataAsLinkageFields() {
        when(repository.findBySourceIdAndContentHash(anyString(), anyString())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(RawDocument.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Map<String, Object> document = store.storeRawDocument(CONTENT, config, ingestionId,
                Map.of("farmer_id", "FRM-001")).toEventDocument();

        assertThat(document)
                .containsEntry("source_id", "quality-events")
                .containsEntry("content_hash", HASH)
                .containsEntry("stored_at", NOW.toString())
                .containsEntry("linkage_fields", Map.of("farmer_id", "FRM-001"));
    }

    // --- Duplicates ---

    @Test
    void duplicateContentIsRejectedBeforeAnyWrite() {
        var existing = new RawDocument("quality-events", UUID.randomUUID(), "raw", HASH,
                "application/json", CONTENT.length, NOW, Map.of());
        when(repository.findBySourceIdAndContentHash("quality-events", HASH)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> store.storeRawDocument(CONTENT, config, ingestionId, Map.of()))
                .isInstanceOf(DuplicateDocumentException.class)
                .satisfies(e -> {
                    var duplicate = (DuplicateDocumentException) e;
                    assertThat(duplicate.getSourceId()).isEqualTo("quality-events");
                    assertThat(duplicate.getContentHash()).isEqualTo(HASH);
                });

        verifyNoInteractions(blobStorage);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void lostInsertRaceIsReportedAsDuplicate() {
        when(repository.findBySourceIdAndContentHash(anyString(), anyString())).thenReturn(Optional.empty());
        var uniqueViolation = new SQLException("duplicate key value violates unique constraint", "23505");
        when(repository.saveAndFlush(any(RawDocument.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement", uniqueViolation));

        assertThatThrownBy(() -> store.storeRawDocument(CONTENT, config, ingestionId, Map.of()))
                .isInstanceOf(DuplicateDocumentException.class)
                .extracting(e -> ((DuplicateDocumentException) e).getExistingDocumentId())
                .isNull();
    }

    // --- Failures ---

    @Test
    void otherInsertFailuresBecomeStorageException() {
        when(repository.findBySourceIdAndContentHash(anyString(), anyString())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(RawDocument.class)))
                .thenThrow(new QueryTimeoutException("statement timed out"));

        assertThatThrownBy(() -> store.storeRawDocument(CONTENT, config, ingestionId, Map.of()))
                .isInstanceOf(StorageException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void blobWriteFailureSkipsMetadataInsert() {
        when(repository.findBySourceIdAndContentHash(anyString(), anyString())).thenReturn(Optional.empty());
        doThrow(new StorageException("bucket unavailable", new IOException("connection reset")))
                .when(blobStorage).put(eq("raw"), anyString(), any(), anyString());

        assertThatThrownBy(() -> store.storeRawDocument(CONTENT, config, ingestionId, Map.of()))
                .isInstanceOf(StorageException.class)
                .hasMessage("bucket unavailable");

        verify(repository, never()).saveAndFlush(any());
    }

    // --- Content types ---

    @Test
    void contentTypeFollowsFileFormat() {
        assertThat(RawDocumentStore.contentTypeFor("JSON")).isEqualTo("application/json");
        assertThat(RawDocumentStore.contentTypeFor("zip")).isEqualTo("application/zip");
        assertThat(RawDocumentStore.contentTypeFor("csv")).isEqualTo("application/octet-stream");
        assertThat(RawDocumentStore.contentTypeFor(null)).isEqualTo("application/octet-stream");
    }
}
