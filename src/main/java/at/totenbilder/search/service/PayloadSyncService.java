package at.totenbilder.search.service;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.ImageKeys;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.JobStatus;
import at.totenbilder.search.dto.PayloadSyncSummary;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ImageRecord;
import at.totenbilder.search.repository.ImageRecordRepository;
import at.totenbilder.search.store.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Copies {@code nid} and {@code delta} from the metadata table into the payload of existing points.
 *
 * <p>Rows without a point are skipped, not failed: indexing may simply not have caught up yet.</p>
 */
@Service
public class PayloadSyncService {

    private static final Logger log = LoggerFactory.getLogger(PayloadSyncService.class);

    static final int PAGE_SIZE = 1000;

    private final ImageRecordRepository imageRecordRepository;
    private final VectorIndex vectorIndex;
    private final BackgroundJobService jobService;
    private final ImageSearchProperties properties;

    public PayloadSyncService(ImageRecordRepository imageRecordRepository,
                              VectorIndex vectorIndex,
                              BackgroundJobService jobService,
                              ImageSearchProperties properties) {
        this.imageRecordRepository = imageRecordRepository;
        this.vectorIndex = vectorIndex;
        this.jobService = jobService;
        this.properties = properties;
    }

    /**
     * Exactly one of a filename and {@code all} must be given.
     */
    public void validate(String filename, boolean all) {
        boolean hasFilename = filename != null && !filename.isBlank();
        if (hasFilename && all) {
            throw new ClientException("Specify either filename or all=true, not both", SearchErrorCode.PARAM_CONFLICT);
        }
        if (!hasFilename && !all) {
            throw new ClientException("Specify filename or all=true", SearchErrorCode.PARAM_EMPTY);
        }
    }

    /**
     * Validates, then queues the sync and returns immediately
     */
    public JobStatus submitSync(String filename, boolean all) {
        validate(filename, all);
        String description = all ? "all" : "filename=" + filename.trim();
        return jobService.submit(JobStatus.Type.PAYLOAD_SYNC, description, () -> sync(filename, all));
    }

    public PayloadSyncSummary sync(String filename, boolean all) {
        validate(filename, all);
        if (!vectorIndex.isAvailable()) {
            throw new ServiceException("Vector index unavailable", SearchErrorCode.DEPENDENCY_UNAVAILABLE);
        }

        PayloadSyncSummary summary = new PayloadSyncSummary();
        if (all) {
            log.info("Payload sync started for all rows");
            int pageNumber = 0;
            Page<ImageRecord> page;
            do {
                page = loadPage(pageNumber++);
                page.forEach(row -> syncRow(row, summary));
                log.info("Payload sync progress - rows: {}, success: {}, skipped: {}, errors: {}",
                    summary.getTotal(), summary.getSuccess(), summary.getSkipped(), summary.getErrors());
            } while (page.hasNext());
        } else {
            String name = filename.trim();
            List<ImageRecord> rows = loadRows(name);
            if (rows.isEmpty()) {
                log.warn("No metadata row for {}", name);
            }
            rows.forEach(row -> syncRow(row, summary));
        }

        log.info("Payload sync finished - rows: {}, success: {}, skipped: {}, errors: {}",
            summary.getTotal(), summary.getSuccess(), summary.getSkipped(), summary.getErrors());
        return summary;
    }

    private void syncRow(ImageRecord row, PayloadSyncSummary summary) {
        summary.setTotal(summary.getTotal() + 1);
        String key = ImageKeys.canonical(properties.getStorage().getPrefix(), row.getFilename());
        try {
            Optional<ImagePoint> point = vectorIndex.findByFilename(key, false);
            if (point.isEmpty()) {
                summary.setSkipped(summary.getSkipped() + 1);
                log.debug("Skipped {}: vector not found", key);
                return;
            }
            vectorIndex.setMetadataPayload(point.get().getId(), row.getNid(), row.getDelta());
            summary.setSuccess(summary.getSuccess() + 1);
        } catch (Exception e) {
            summary.setErrors(summary.getErrors() + 1);
            log.warn("Payload sync of {} failed: {}", key, e.getMessage());
        }
    }

    private Page<ImageRecord> loadPage(int pageNumber) {
        try {
            return imageRecordRepository.findAll(PageRequest.of(pageNumber, PAGE_SIZE, Sort.by("filename")));
        } catch (DataAccessException e) {
            throw new ServiceException("Reading image metadata failed: " + e.getMessage(), e,
                SearchErrorCode.METADATA_STORE_ERROR);
        }
    }

    private List<ImageRecord> loadRows(String filename) {
        String prefix = properties.getStorage().getPrefix();
        Set<String> spellings = new LinkedHashSet<>();
        spellings.add(ImageKeys.bare(prefix, filename));
        spellings.add(ImageKeys.canonical(prefix, filename));
        try {
            return imageRecordRepository.findByFilenameIn(spellings);
        } catch (DataAccessException e) {
            throw new ServiceException("Reading image metadata failed: " + e.getMessage(), e,
                SearchErrorCode.METADATA_STORE_ERROR);
        }
    }
}
