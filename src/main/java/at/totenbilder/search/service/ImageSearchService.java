package at.totenbilder.search.service;

import at.totenbilder.search.client.ClipEncodingService;
import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.ImageKeys;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.DeltaFilter;
import at.totenbilder.search.dto.ImageSearchResult;
import at.totenbilder.search.dto.SearchRequest;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ScoredImage;
import at.totenbilder.search.store.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Text-to-image and image-to-image search over the vector index.
 *
 * <p>Ranking is the index's own order, no re-ranking happens here.</p>
 */
@Service
public class ImageSearchService {

    private static final Logger log = LoggerFactory.getLogger(ImageSearchService.class);

    private final VectorIndex vectorIndex;
    private final ClipEncodingService encodingService;
    private final ImageSearchProperties properties;

    public ImageSearchService(VectorIndex vectorIndex,
                              ClipEncodingService encodingService,
                              ImageSearchProperties properties) {
        this.vectorIndex = vectorIndex;
        this.encodingService = encodingService;
        this.properties = properties;
    }

    /**
     * Runs a search. {@code similar} takes precedence over {@code query}; with neither the result is empty.
     *
     * @throws ClientException PARAM_INVALID for bad paging or filter values,
     *                         IMAGE_NOT_FOUND when the reference image has no point
     */
    public List<ImageSearchResult> search(SearchRequest request) {
        int limit = resolveLimit(request.getLimit());
        int offset = resolveOffset(request.getOffset());
        DeltaFilter filter = DeltaFilter.fromValue(request.getDelta());

        float[] queryVector;
        if (hasText(request.getSimilar())) {
            queryVector = referenceVector(request.getSimilar().trim());
            log.info("Similar search - reference: {}, delta: {}, limit: {}, offset: {}",
                request.getSimilar(), filter.value(), limit, offset);
        } else if (hasText(request.getQuery())) {
            queryVector = encodingService.encodeText(request.getQuery().trim());
            log.info("Text search - query: '{}', delta: {}, limit: {}, offset: {}",
                request.getQuery(), filter.value(), limit, offset);
        } else {
            return List.of();
        }

        List<ScoredImage> hits = vectorIndex.query(queryVector, filter, limit, offset);
        return hits.stream()
            .map(this::toResult)
            .collect(Collectors.toList());
    }

    /**
     * The reference image's stored vector, never a freshly computed one
     */
    private float[] referenceVector(String similar) {
        String key = ImageKeys.canonical(properties.getStorage().getPrefix(), similar);
        ImagePoint reference = vectorIndex.findByFilename(key, true)
            .orElseThrow(() -> new ClientException("Image '" + similar + "' not found",
                SearchErrorCode.IMAGE_NOT_FOUND));
        if (reference.getImage() == null || !reference.getImage().hasEmbedding()) {
            throw new ServiceException("Point of '" + key + "' has no stored vector",
                SearchErrorCode.SEARCH_SERVICE_ERROR);
        }
        return reference.getImage().getEmbedding();
    }

    private ImageSearchResult toResult(ScoredImage hit) {
        String filename = hit.getImage().getFilename();
        return new ImageSearchResult(filename, imageUrl(filename), roundScore(hit.getScore()));
    }

    String imageUrl(String filename) {
        String base = properties.getStorage().getPublicBaseUrl();
        if (base == null) {
            base = "";
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + filename;
    }

    static double roundScore(double score) {
        return Math.round(score * 1000d) / 1000d;
    }

    private int resolveLimit(Integer limit) {
        int maxLimit = properties.getSearch().getMaxLimit();
        int resolved = limit == null ? properties.getSearch().getDefaultLimit() : limit;
        if (resolved < 1 || resolved > maxLimit) {
            throw new ClientException("limit must be between 1 and " + maxLimit, SearchErrorCode.PARAM_INVALID);
        }
        return resolved;
    }

    private int resolveOffset(Integer offset) {
        int resolved = offset == null ? 0 : offset;
        if (resolved < 0) {
            throw new ClientException("offset must not be negative", SearchErrorCode.PARAM_INVALID);
        }
        return resolved;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
