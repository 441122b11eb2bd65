package dev.granary.storage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link RawDocument} metadata records. */
public interface RawDocumentRepository extends JpaRepository<RawDocument, UUID> {

  Optional<RawDocument> findBySourceIdAndContentHash(String sourceId, String contentHash);

  List<RawDocument> findAllByIngestionId(UUID ingestionId);
}
