package dev.granary.ingestion;

import dev.granary.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionQueueIT extends BaseIntegrationTest {

    @Autowired
    private IngestionQueue queue;

    private static IngestionJob job(String etag) {
        return IngestionJob.forBlob("quality-events", "quality-events", "FRM-001/doc.json", etag, 64,
                Map.of("farmer_id", "FRM-001"), null);
    }

    @Test
    void sameTriggerIsAdmittedOnce() {
        assertThat(queue.queueJob(job("0x1"))).isTrue();
        assertThat(queue.queueJob(job("0x1"))).isFalse();
        assertThat(queue.queueJob(job("0x2"))).isTrue();

        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM ingestion_jobs", Integer.class))
                .isEqualTo(2);
    }

    @Test
    void concurrentRedeliveriesAdmitExactlyOneJob() throws Exception {
        int deliveries = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(deliveries);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < deliveries; i++) {
                Callable<Boolean> delivery = () -> {
                    start.await();
                    return queue.queueJob(job("0xRACE"));
                };
                results.add(executor.submit(delivery));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void claimedJobMovesThroughLifecycle() {
        IngestionJob job = job("0x3");
        queue.queueJob(job);

        assertThat(queue.findPending(10)).extracting(IngestionJob::ingestionId).containsExactly(job.ingestionId());
        assertThat(queue.claim(job.ingestionId())).isTrue();
        assertThat(queue.claim(job.ingestionId())).isFalse();
        assertThat(queue.findPending(10)).isEmpty();

        UUID documentId = UUID.randomUUID();
        assertThat(queue.markStored(job.ingestionId(), documentId)).isTrue();

        IngestionJobEntity stored = queue.findByIngestionId(job.ingestionId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.STORED);
        assertThat(stored.getRawDocumentId()).isEqualTo(documentId);
        assertThat(stored.getProcessedAt()).isNotNull();
    }

    @Test
    void abandonedClaimIsRequeued() {
        IngestionJob job = job("0x4");
        queue.queueJob(job);
        assertThat(queue.claim(job.ingestionId())).isTrue();

        assertThat(queue.requeueExpiredClaims(Duration.ofMinutes(15))).isZero();

        jdbcTemplate.update("UPDATE ingestion_jobs SET claimed_at = now() - interval '1 hour' WHERE ingestion_id = ?",
                job.ingestionId());

        assertThat(queue.requeueExpiredClaims(Duration.ofMinutes(15))).isEqualTo(1);
        assertThat(queue.findPending(10)).extracting(IngestionJob::ingestionId).containsExactly(job.ingestionId());
        assertThat(queue.claim(job.ingestionId())).isTrue();
    }
}
