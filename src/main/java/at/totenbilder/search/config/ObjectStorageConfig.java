package at.totenbilder.search.config;

import at.totenbilder.search.common.support.LazyDependency;
import io.minio.BucketExistsArgs;
import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Object storage (R2 / any S3 compatible endpoint) client configuration
 */
@Configuration
public class ObjectStorageConfig {

    private static final Logger log = LoggerFactory.getLogger(ObjectStorageConfig.class);

    @Value("${minio.endpoint:}")
    private String serviceEndpoint;

    @Value("${minio.access-key:}")
    private String accessKeyId;

    @Value("${minio.secret-key:}")
    private String secretAccessKey;

    @Value("${minio.bucket-name:}")
    private String storageBucket;

    @Value("${minio.region:auto}")
    private String region;

    /**
     * Lazily created MinIO client. Missing credentials leave the object store unavailable
     * instead of failing the application start.
     */
    @Bean
    public LazyDependency<MinioClient> minioClientDependency() {
        return new LazyDependency<>("object-store", this::createClient);
    }

    private MinioClient createClient() throws Exception {
        if (isBlank(serviceEndpoint) || isBlank(accessKeyId) || isBlank(secretAccessKey) || isBlank(storageBucket)) {
            log.warn("Object store credentials are incomplete, object store disabled");
            throw new IllegalStateException("object store credentials missing");
        }
        MinioClient client = MinioClient.builder()
            .endpoint(serviceEndpoint)
            .credentials(accessKeyId, secretAccessKey)
            .region(region)
            .build();
        verifyBucket(client);
        return client;
    }

    /**
     * The bucket is owned elsewhere and never created here
     */
    private void verifyBucket(MinioClient client) throws Exception {
        boolean bucketExists = client.bucketExists(
            BucketExistsArgs.builder()
                .bucket(storageBucket)
                .build()
        );
        if (!bucketExists) {
            throw new IllegalStateException("bucket does not exist: " + storageBucket);
        }
        log.info("Bucket ready: {}", storageBucket);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
