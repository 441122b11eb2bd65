package dev.granary.config;

import io.minio.MinioClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the {@link MinioClient} backing blob storage, from {@code granary.minio.*}. */
@Configuration
public class MinioConfig {

    @Bean
    public MinioClient minioClient(
            @Value("${granary.minio.endpoint}") String endpoint,
            @Value("${granary.minio.access-key}") String accessKey,
            @Value("${granary.minio.secret-key}") String secretKey) {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
    }
}
