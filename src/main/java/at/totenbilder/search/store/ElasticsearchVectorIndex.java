package at.totenbilder.search.store;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.DependencyAware;
import at.totenbilder.search.common.support.LazyDependency;
import at.totenbilder.search.dto.DeltaFilter;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.IndexedImage;
import at.totenbilder.search.model.ScanPage;
import at.totenbilder.search.model.ScoredImage;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.Time;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.ClearScrollRequest;
import co.elastic.clients.elasticsearch.core.ScrollRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.ResponseBody;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.JsonData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Vector index on one Elasticsearch index: 512 dimensional cosine dense vectors
 * plus a keyword {@code filename} field for exact-match lookups.
 */
@Component
public class ElasticsearchVectorIndex implements VectorIndex, DependencyAware {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchVectorIndex.class);
    private static final String SCROLL_KEEP_ALIVE = "2m";
    private static final int MAX_NUM_CANDIDATES = 10000;

    private final LazyDependency<ElasticsearchClient> clientDependency;
    private final String indexName;
    private final int dimension;
    private final int numCandidates;

    public ElasticsearchVectorIndex(ElasticsearchClient elasticsearchClient,
                                    @Value("${elasticsearch.index:totenbilder_images}") String indexName,
                                    @Value("${embedding.api.dimension:512}") int dimension,
                                    @Value("${image-search.search.num-candidates:100}") int numCandidates) {
        this.indexName = indexName;
        this.dimension = dimension;
        this.numCandidates = numCandidates;
        this.clientDependency = new LazyDependency<>("vector-index", () -> bootstrap(elasticsearchClient));
    }

    @Override
    public boolean isAvailable() {
        return clientDependency.isAvailable();
    }

    @Override
    public LazyDependency<?> dependency() {
        return clientDependency;
    }

    /**
     * Creates the index with its mapping if it does not exist yet
     */
    ElasticsearchClient bootstrap(ElasticsearchClient client) throws Exception {
        boolean exists = client.indices().exists(ExistsRequest.of(e -> e.index(indexName))).value();
        if (exists) {
            log.info("Vector index ready: {}", indexName);
            return client;
        }
        client.indices().create(CreateIndexRequest.of(c -> c
            .index(indexName)
            .mappings(m -> m
                .properties(IndexedImage.FIELD_FILENAME, p -> p.keyword(k -> k))
                .properties(IndexedImage.FIELD_OCR_TEXT, p -> p.text(t -> t))
                .properties(IndexedImage.FIELD_NID, p -> p.long_(l -> l))
                .properties(IndexedImage.FIELD_DELTA, p -> p.double_(d -> d))
                .properties(IndexedImage.FIELD_EMBEDDING, p -> p.denseVector(v -> v
                    .dims(dimension)
                    .index(true)
                    .similarity("cosine")
                ))
            )
        ));
        log.info("Created vector index {} ({} dims, cosine)", indexName, dimension);
        return client;
    }

    @Override
    public void upsert(List<ImagePoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        ElasticsearchClient client = clientDependency.get();
        List<BulkOperation> operations = points.stream()
            .map(this::createIndexOperation)
            .collect(Collectors.toList());

        BulkResponse response;
        try {
            response = client.bulk(BulkRequest.of(b -> b
                .operations(operations)
                .refresh(Refresh.WaitFor)
            ));
        } catch (Exception e) {
            throw new ServiceException("Upsert of " + points.size() + " points failed: " + e.getMessage(), e,
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }

        if (response.errors()) {
            int failed = handleBulkErrors(response);
            throw new ServiceException("Upsert failed for " + failed + " of " + points.size() + " points",
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public Optional<ImagePoint> findByFilename(String filename, boolean withVector) {
        ElasticsearchClient client = clientDependency.get();
        SearchRequest request = SearchRequest.of(s -> {
            s.index(indexName)
                .query(q -> q.term(t -> t.field(IndexedImage.FIELD_FILENAME).value(filename)))
                .size(1);
            if (!withVector) {
                s.source(src -> src.filter(f -> f.excludes(IndexedImage.FIELD_EMBEDDING)));
            }
            return s;
        });

        try {
            List<Hit<IndexedImage>> hits = client.search(request, IndexedImage.class).hits().hits();
            return hits.stream()
                .filter(hit -> hit.source() != null)
                .findFirst()
                .map(hit -> new ImagePoint(hit.id(), hit.source()));
        } catch (Exception e) {
            throw new ServiceException("Lookup of " + filename + " failed: " + e.getMessage(), e,
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public ScanPage scan(String cursor, int pageSize) {
        ElasticsearchClient client = clientDependency.get();
        try {
            ResponseBody<IndexedImage> body;
            if (cursor == null) {
                body = client.search(SearchRequest.of(s -> s
                    .index(indexName)
                    .scroll(Time.of(t -> t.time(SCROLL_KEEP_ALIVE)))
                    .size(pageSize)
                    .source(src -> src.filter(f -> f.includes(IndexedImage.FIELD_FILENAME)))
                ), IndexedImage.class);
            } else {
                body = client.scroll(ScrollRequest.of(s -> s
                    .scrollId(cursor)
                    .scroll(Time.of(t -> t.time(SCROLL_KEEP_ALIVE)))
                ), IndexedImage.class);
            }
            return toScanPage(client, body, pageSize);
        } catch (Exception e) {
            throw new ServiceException("Index scan failed: " + e.getMessage(), e,
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public void setMetadataPayload(String pointId, Long nid, Double delta) {
        ElasticsearchClient client = clientDependency.get();
        Map<String, Object> partial = new HashMap<>();
        partial.put(IndexedImage.FIELD_NID, nid);
        partial.put(IndexedImage.FIELD_DELTA, delta);
        try {
            client.update(UpdateRequest.<IndexedImage, Map<String, Object>>of(u -> u
                .index(indexName)
                .id(pointId)
                .doc(partial)
                .refresh(Refresh.WaitFor)
            ), IndexedImage.class);
        } catch (Exception e) {
            throw new ServiceException("Payload update of point " + pointId + " failed: " + e.getMessage(), e,
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public List<ScoredImage> query(float[] vector, DeltaFilter filter, int limit, int offset) {
        ElasticsearchClient client = clientDependency.get();
        // kNN never yields more than MAX_NUM_CANDIDATES hits, pages beyond that are empty
        if (offset >= MAX_NUM_CANDIDATES) {
            log.debug("Offset {} lies beyond the kNN window of {} hits", offset, MAX_NUM_CANDIDATES);
            return List.of();
        }
        int size = Math.min(limit, MAX_NUM_CANDIDATES - offset);
        long k = (long) offset + size;
        long candidates = Math.min(Math.max(k, numCandidates), MAX_NUM_CANDIDATES);
        List<Float> queryVector = toList(vector);
        Query filterQuery = deltaQuery(filter);

        SearchRequest request = SearchRequest.of(s -> {
            s.index(indexName);
            s.knn(knn -> {
                knn.field(IndexedImage.FIELD_EMBEDDING)
                    .queryVector(queryVector)
                    .k(k)
                    .numCandidates(candidates);
                if (filterQuery != null) {
                    knn.filter(filterQuery);
                }
                return knn;
            });
            s.from(offset);
            s.size(size);
            s.source(src -> src.filter(f -> f.excludes(IndexedImage.FIELD_EMBEDDING)));
            return s;
        });

        try {
            return client.search(request, IndexedImage.class).hits().hits().stream()
                .filter(hit -> hit.source() != null)
                .map(hit -> new ScoredImage(hit.id(), hit.score() == null ? 0d : hit.score(), hit.source()))
                .collect(Collectors.toList());
        } catch (Exception e) {
            throw new ServiceException("Vector query failed: " + e.getMessage(), e,
                SearchErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    /**
     * Filter clause for the delta payload field, null for {@link DeltaFilter#ALL}
     */
    static Query deltaQuery(DeltaFilter filter) {
        if (filter == null) {
            return null;
        }
        switch (filter) {
            case ZERO:
                return Query.of(q -> q.term(t -> t.field(IndexedImage.FIELD_DELTA).value(0d)));
            case POSITIVE:
                return Query.of(q -> q.range(r -> r.field(IndexedImage.FIELD_DELTA).gt(JsonData.of(0))));
            default:
                return null;
        }
    }

    private ScanPage toScanPage(ElasticsearchClient client, ResponseBody<IndexedImage> body, int pageSize)
            throws Exception {
        List<ImagePoint> points = new ArrayList<>();
        for (Hit<IndexedImage> hit : body.hits().hits()) {
            points.add(new ImagePoint(hit.id(), hit.source()));
        }
        String scrollId = body.scrollId();
        if (points.size() < pageSize) {
            if (scrollId != null) {
                client.clearScroll(ClearScrollRequest.of(c -> c.scrollId(scrollId)));
            }
            return new ScanPage(points, null);
        }
        return new ScanPage(points, scrollId);
    }

    private BulkOperation createIndexOperation(ImagePoint point) {
        return BulkOperation.of(op -> op.index(idx -> idx
            .index(indexName)
            .id(point.getId())
            .document(point.getImage())
        ));
    }

    private int handleBulkErrors(BulkResponse response) {
        int failed = 0;
        for (BulkResponseItem item : response.items()) {
            var error = item.error();
            if (error == null) {
                continue;
            }
            failed++;
            log.error("Upsert failed - point: {}, reason: {}", item.id(), error.reason());
        }
        return failed;
    }

    private List<Float> toList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float v : vector) {
            values.add(v);
        }
        return values;
    }
}
