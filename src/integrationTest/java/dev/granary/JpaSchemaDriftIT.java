package dev.granary;

import dev.granary.ingestion.IngestionJob;
import dev.granary.ingestion.IngestionJobEntity;
import dev.granary.ingestion.IngestionJobRepository;
import dev.granary.ingestion.JobStatus;
import dev.granary.source.TriggerMode;
import dev.granary.storage.RawDocument;
import dev.granary.storage.RawDocumentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private IngestionJobRepository ingestionJobRepository;

    @Autowired
    private RawDocumentRepository rawDocumentRepository;

    @Test
    void ingestionJobEntityRoundtripsAgainstFlywaySchema() {
        Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        IngestionJob job = IngestionJob.forBlob("quality-events", "quality-events", "FRM-001/doc.json",
                "0x8D1", 512, Map.of("farmer_id", "FRM-001"), "evt-1");

        ingestionJobRepository.saveAndFlush(new IngestionJobEntity(job, JobStatus.QUEUED, createdAt));
        IngestionJobEntity found = ingestionJobRepository.findById(job.ingestionId()).orElseThrow();

        assertThat(found.getIdempotencyKey()).isEqualTo("blob:FRM-001/doc.json#0x8D1");
        assertThat(found.getTriggerMode()).isEqualTo(TriggerMode.BLOB_TRIGGER);
        assertThat(found.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(found.getCreatedAt()).isEqualTo(createdAt);
        assertThat(found.toJob()).isEqualTo(job);
        assertThat(ingestionJobRepository.findByIdempotencyKey(job.idempotencyKey())).isPresent();
    }

    @Test
    void rawDocumentEntityRoundtripsAgainstFlywaySchema() {
        Instant storedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var document = new RawDocument("weather", UUID.randomUUID(), "raw-documents",
                "a".repeat(64), "application/json", 2048, storedAt,
                Map.of("region", "north", "location", Map.of("lat", 1.5)));

        RawDocument saved = rawDocumentRepository.saveAndFlush(document);
        RawDocument found = rawDocumentRepository.findById(saved.getDocumentId()).orElseThrow();

        assertThat(found.getDocumentId()).isNotNull();
        assertThat(found.getBlobPath()).isEqualTo("weather/" + document.getIngestionId() + "/" + "a".repeat(64));
        assertThat(found.getSizeBytes()).isEqualTo(2048);
        assertThat(found.getStoredAt()).isEqualTo(storedAt);
        assertThat(found.getMetadata()).containsEntry("region", "north");
        assertThat(rawDocumentRepository.findAllByIngestionId(document.getIngestionId())).hasSize(1);
    }
}
