package at.totenbilder.search.service;

import at.totenbilder.search.client.ClipEncodingService;
import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.ImageKeys;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.IndexingSummary;
import at.totenbilder.search.dto.JobStatus;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.IndexedImage;
import at.totenbilder.search.store.ImageObjectStore;
import at.totenbilder.search.store.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Indexing pipeline: object store bytes to vector index points.
 *
 * <p>Point ids are derived from the canonical key, so repeated and concurrent runs overwrite
 * instead of duplicating. A point found under another id is overwritten in place.</p>
 */
@Service
public class ImageIndexingService {

    private static final Logger log = LoggerFactory.getLogger(ImageIndexingService.class);

    private final ImageObjectStore objectStore;
    private final VectorIndex vectorIndex;
    private final ClipEncodingService encodingService;
    private final ImageContentProcessor contentProcessor;
    private final BackgroundJobService jobService;
    private final ImageSearchProperties properties;

    public ImageIndexingService(ImageObjectStore objectStore,
                                VectorIndex vectorIndex,
                                ClipEncodingService encodingService,
                                ImageContentProcessor contentProcessor,
                                BackgroundJobService jobService,
                                ImageSearchProperties properties) {
        this.objectStore = objectStore;
        this.vectorIndex = vectorIndex;
        this.encodingService = encodingService;
        this.contentProcessor = contentProcessor;
        this.jobService = jobService;
        this.properties = properties;
    }

    /**
     * Queues a bulk run and returns immediately
     */
    public JobStatus submitIndexAll(boolean forceReindex) {
        return jobService.submit(JobStatus.Type.BULK_INDEXING, "force_reindex=" + forceReindex,
            () -> indexAll(forceReindex));
    }

    /**
     * Indexes every image under the storage prefix.
     *
     * <p>Without {@code forceReindex} keys that already have a point are skipped. Failures of a
     * single image are counted and logged; failures of the index itself abort the run.</p>
     */
    public IndexingSummary indexAll(boolean forceReindex) {
        requireDependencies();
        String prefix = properties.getStorage().getPrefix();
        List<String> extensions = properties.getIndexing().getSupportedExtensions();
        int batchSize = Math.max(1, properties.getIndexing().getBatchSize());
        log.info("Bulk indexing started - prefix: {}, force_reindex: {}, batch size: {}",
            prefix, forceReindex, batchSize);

        IndexingSummary summary = new IndexingSummary();
        List<ImagePoint> buffer = new ArrayList<>(batchSize);
        int flushed = 0;

        for (String key : objectStore.listKeys(prefix)) {
            if (!ImageKeys.isIndexableImage(prefix, key, extensions)) {
                continue;
            }
            Optional<ImagePoint> existing = vectorIndex.findByFilename(key, false);
            if (existing.isPresent() && !forceReindex) {
                summary.setSkipped(summary.getSkipped() + 1);
                continue;
            }

            try {
                byte[] content = loadImage(key);
                buffer.add(toPoint(key, content, existing));
                summary.setProcessed(summary.getProcessed() + 1);
            } catch (Exception e) {
                summary.setFailed(summary.getFailed() + 1);
                log.warn("Indexing {} failed: {}", key, e.getMessage());
                continue;
            }

            if (buffer.size() >= batchSize) {
                flushed += flush(buffer);
                log.info("Progress - upserted: {}, skipped: {}, failed: {}",
                    flushed, summary.getSkipped(), summary.getFailed());
            }
        }
        flushed += flush(buffer);

        log.info("Bulk indexing finished - processed: {}, skipped: {}, failed: {}, upserted: {}",
            summary.getProcessed(), summary.getSkipped(), summary.getFailed(), flushed);
        return summary;
    }

    /**
     * Indexes exactly one image and writes it immediately, overwriting any existing point.
     *
     * @param filename bare or prefixed filename
     * @return the canonical key that was indexed
     * @throws ClientException IMAGE_NOT_FOUND when the image cannot be loaded
     * @throws ServiceException INDEXING_FAILED on any other failure
     */
    public String indexOne(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ClientException("filename is required", SearchErrorCode.PARAM_EMPTY);
        }
        requireDependencies();
        String key = ImageKeys.canonical(properties.getStorage().getPrefix(), filename.trim());

        byte[] content;
        try {
            content = loadImage(key);
        } catch (Exception e) {
            throw new ClientException("Image '" + key + "' could not be loaded: " + e.getMessage(), e,
                SearchErrorCode.IMAGE_NOT_FOUND);
        }

        try {
            Optional<ImagePoint> existing = vectorIndex.findByFilename(key, false);
            vectorIndex.upsert(List.of(toPoint(key, content, existing)));
        } catch (Exception e) {
            throw new ServiceException("Indexing '" + key + "' failed: " + e.getMessage(), e,
                SearchErrorCode.INDEXING_FAILED);
        }
        log.info("Indexed single image: {}", key);
        return key;
    }

    private byte[] loadImage(String key) {
        byte[] content = objectStore.fetch(key);
        contentProcessor.requireImage(key, content);
        return content;
    }

    private ImagePoint toPoint(String key, byte[] content, Optional<ImagePoint> existing) {
        float[] embedding = encodingService.encodeImage(content);
        IndexedImage image = new IndexedImage(key, embedding);
        image.setOcrText(contentProcessor.extractText(key, content));

        String pointId = ImageKeys.pointId(key);
        if (existing.isPresent()) {
            // keep the synced metadata and a legacy id if there is one
            pointId = existing.get().getId();
            IndexedImage previous = existing.get().getImage();
            image.setNid(previous.getNid());
            image.setDelta(previous.getDelta());
        }
        return new ImagePoint(pointId, image);
    }

    private int flush(List<ImagePoint> buffer) {
        if (buffer.isEmpty()) {
            return 0;
        }
        int size = buffer.size();
        vectorIndex.upsert(new ArrayList<>(buffer));
        buffer.clear();
        return size;
    }

    private void requireDependencies() {
        if (!objectStore.isAvailable()) {
            throw new ServiceException("Object store unavailable", SearchErrorCode.DEPENDENCY_UNAVAILABLE);
        }
        if (!vectorIndex.isAvailable()) {
            throw new ServiceException("Vector index unavailable", SearchErrorCode.DEPENDENCY_UNAVAILABLE);
        }
        if (!encodingService.isAvailable()) {
            throw new ServiceException("Embedding model unavailable", SearchErrorCode.DEPENDENCY_UNAVAILABLE);
        }
    }
}
