package at.totenbilder.search.store;

import at.totenbilder.search.dto.DeltaFilter;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ScanPage;
import at.totenbilder.search.model.ScoredImage;

import java.util.List;
import java.util.Optional;

/**
 * Vector index capabilities used by the pipeline and the search.
 * Store failures surface as {@link at.totenbilder.search.common.convention.exception.ServiceException}.
 */
public interface VectorIndex {

    /**
     * Whether the index could be reached and bootstrapped. Initialises it on first call.
     */
    boolean isAvailable();

    /**
     * Inserts or overwrites the points by id, in one request.
     */
    void upsert(List<ImagePoint> points);

    /**
     * Exact match on the {@code filename} payload field, first point only.
     *
     * @param withVector whether the stored embedding is returned
     */
    Optional<ImagePoint> findByFilename(String filename, boolean withVector);

    /**
     * One page of a full scan without vectors. Pass {@code null} to start a scan.
     */
    ScanPage scan(String cursor, int pageSize);

    /**
     * Overwrites {@code nid} and {@code delta} of one point, leaving the other payload fields untouched.
     */
    void setMetadataPayload(String pointId, Long nid, Double delta);

    /**
     * Nearest neighbours in descending similarity, after the delta filter, skipping {@code offset} hits.
     */
    List<ScoredImage> query(float[] vector, DeltaFilter filter, int limit, int offset);
}
