package dev.granary.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.ErrorResponseException;
import java.io.ByteArrayInputStream;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link BlobStorageClient} on top of MinIO (or any S3 compatible store). Containers map to
 * buckets; a missing bucket is created on first write.
 */
@Service
public class MinioBlobStorageClient implements BlobStorageClient {

    private static final Logger log = LoggerFactory.getLogger(MinioBlobStorageClient.class);

    private static final Set<String> BUCKET_EXISTS_CODES =
            Set.of("BucketAlreadyOwnedByYou", "BucketAlreadyExists");

    private final MinioClient minioClient;
    private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

    public MinioBlobStorageClient(MinioClient minioClient) {
        this.minioClient = minioClient;
    }

    @Override
    public void put(String container, String path, byte[] content, String contentType) {
        try {
            ensureBucket(container);
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(container)
                            .object(path)
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(contentType)
                            .build()
            );
            log.debug("Stored blob {}/{} ({} bytes)", container, path, content.length);
        } catch (Exception e) {
            throw new StorageException("Failed to write blob " + container + "/" + path, e);
        }
    }

    @Override
    public byte[] get(String container, String path) {
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(container)
                        .object(path)
                        .build())) {
            return response.readAllBytes();
        } catch (Exception e) {
            throw new StorageException("Failed to read blob " + container + "/" + path, e);
        }
    }

    private void ensureBucket(String bucket) throws Exception {
        if (knownBuckets.contains(bucket)) {
            return;
        }
        if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
            try {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created bucket {}", bucket);
            } catch (ErrorResponseException e) {
                // concurrent writers to a new container race on creation
                if (!BUCKET_EXISTS_CODES.contains(e.errorResponse().code())) {
                    throw e;
                }
                log.debug("Bucket {} created concurrently", bucket);
            }
        }
        knownBuckets.add(bucket);
    }
}
