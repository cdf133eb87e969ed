package at.totenbilder.search.service;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.ImageKeys;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.ReconciliationReport;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ScanPage;
import at.totenbilder.search.repository.ImageRecordRepository;
import at.totenbilder.search.store.ImageObjectStore;
import at.totenbilder.search.store.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * Three-way diff of the metadata table, the vector index and the object store.
 *
 * <p>All key sets are normalised to canonical keys before comparing. The object store
 * is optional: without it the report still carries the metadata/index difference.</p>
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final ImageRecordRepository imageRecordRepository;
    private final VectorIndex vectorIndex;
    private final ImageObjectStore objectStore;
    private final ImageSearchProperties properties;

    public ReconciliationService(ImageRecordRepository imageRecordRepository,
                                 VectorIndex vectorIndex,
                                 ImageObjectStore objectStore,
                                 ImageSearchProperties properties) {
        this.imageRecordRepository = imageRecordRepository;
        this.vectorIndex = vectorIndex;
        this.objectStore = objectStore;
        this.properties = properties;
    }

    /**
     * Computes the report from fresh reads of all three stores.
     *
     * @throws ServiceException when the metadata table or the vector index cannot be read
     */
    public ReconciliationReport reconcile() {
        String prefix = properties.getStorage().getPrefix();
        log.info("Reconciliation started");

        Set<String> metadataKeys = loadMetadataKeys(prefix);
        Set<String> indexedKeys = loadIndexedKeys();

        if (!objectStore.isAvailable()) {
            log.warn("Object store unavailable, reconciliation limited to metadata vs index");
            ReconciliationReport report = diff(metadataKeys, indexedKeys, null);
            logReport(report);
            return report;
        }

        Set<String> objectKeys = new HashSet<>();
        for (String key : objectStore.listKeys(prefix)) {
            objectKeys.add(key);
        }
        ReconciliationReport report = diff(metadataKeys, indexedKeys, objectKeys);
        logReport(report);
        return report;
    }

    /**
     * Pure diff of canonical key sets.
     *
     * @param objectKeys keys present in the object store, null when it was not consulted
     */
    static ReconciliationReport diff(Set<String> metadataKeys, Set<String> indexedKeys, Set<String> objectKeys) {
        Set<String> missingInIndex = new HashSet<>(metadataKeys);
        missingInIndex.removeAll(indexedKeys);

        Set<String> readyToIndex = new HashSet<>();
        Set<String> missingInObjectStore = new HashSet<>();
        if (objectKeys != null) {
            for (String key : missingInIndex) {
                if (objectKeys.contains(key)) {
                    readyToIndex.add(key);
                } else {
                    missingInObjectStore.add(key);
                }
            }
        }
        return new ReconciliationReport(metadataKeys.size(), indexedKeys.size(),
            missingInIndex, readyToIndex, missingInObjectStore, objectKeys != null);
    }

    private Set<String> loadMetadataKeys(String prefix) {
        Set<String> keys = new HashSet<>();
        try {
            for (String filename : imageRecordRepository.findAllFilenames()) {
                if (filename != null && !filename.isBlank()) {
                    keys.add(ImageKeys.canonical(prefix, filename));
                }
            }
        } catch (DataAccessException e) {
            throw new ServiceException("Reading image metadata failed: " + e.getMessage(), e,
                SearchErrorCode.METADATA_STORE_ERROR);
        }
        return keys;
    }

    private Set<String> loadIndexedKeys() {
        int pageSize = properties.getReconciliation().getScanPageSize();
        Set<String> keys = new HashSet<>();
        String cursor = null;
        int pages = 0;
        do {
            ScanPage page = vectorIndex.scan(cursor, pageSize);
            for (ImagePoint point : page.getPoints()) {
                String filename = point.filename();
                if (filename != null) {
                    keys.add(filename);
                }
            }
            cursor = page.getNextCursor();
            pages++;
        } while (cursor != null);
        log.debug("Index scan finished: {} pages, {} keys", pages, keys.size());
        return keys;
    }

    private void logReport(ReconciliationReport report) {
        log.info("Reconciliation done - metadata: {}, indexed: {}, missing in index: {}, ready: {}, "
                + "missing in object store: {}, object store checked: {}",
            report.getTotalMetadata(), report.getTotalIndexed(), report.getMissingInIndex().size(),
            report.getReadyToIndex().size(), report.getMissingInObjectStore().size(),
            report.isObjectStoreChecked());
    }
}
