package at.totenbilder.search.store;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.DependencyAware;
import at.totenbilder.search.common.support.LazyDependency;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.Result;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * Image object store on an S3 compatible bucket
 */
@Component
public class MinioImageObjectStore implements ImageObjectStore, DependencyAware {

    private static final Logger log = LoggerFactory.getLogger(MinioImageObjectStore.class);
    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final LazyDependency<MinioClient> clientDependency;
    private final String bucketName;

    public MinioImageObjectStore(LazyDependency<MinioClient> minioClientDependency,
                                 @Value("${minio.bucket-name:}") String bucketName) {
        this.clientDependency = minioClientDependency;
        this.bucketName = bucketName;
    }

    @Override
    public boolean isAvailable() {
        return clientDependency.isAvailable();
    }

    @Override
    public LazyDependency<?> dependency() {
        return clientDependency;
    }

    @Override
    public Iterable<String> listKeys(String prefix) {
        MinioClient client = clientDependency.get();
        Iterable<Result<Item>> results = client.listObjects(
            ListObjectsArgs.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .recursive(true)
                .build()
        );
        return () -> new Iterator<String>() {
            private final Iterator<Result<Item>> delegate = results.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public String next() {
                return unwrap(delegate.next()).objectName();
            }
        };
    }

    @Override
    public byte[] fetch(String key) {
        MinioClient client = clientDependency.get();
        try (GetObjectResponse response = client.getObject(
            GetObjectArgs.builder()
                .bucket(bucketName)
                .object(key)
                .build()
        )) {
            return response.readAllBytes();
        } catch (ErrorResponseException e) {
            if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                throw new ClientException("Image not found: " + key, e, SearchErrorCode.IMAGE_NOT_FOUND);
            }
            throw new ServiceException("Failed to fetch " + key + ": " + e.getMessage(), e,
                SearchErrorCode.OBJECT_STORE_ERROR);
        } catch (Exception e) {
            throw new ServiceException("Failed to fetch " + key + ": " + e.getMessage(), e,
                SearchErrorCode.OBJECT_STORE_ERROR);
        }
    }

    private Item unwrap(Result<Item> result) {
        try {
            return result.get();
        } catch (Exception e) {
            log.error("Object listing failed in bucket {}", bucketName, e);
            throw new ServiceException("Object listing failed: " + e.getMessage(), e,
                SearchErrorCode.OBJECT_STORE_ERROR);
        }
    }
}
