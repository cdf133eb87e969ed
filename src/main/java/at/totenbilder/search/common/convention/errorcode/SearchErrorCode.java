package at.totenbilder.search.common.convention.errorcode;

/**
 * Error codes of the image search service.
 *
 * Code layout:
 * - 0: success
 * - A0xxx: client errors (parameters, API key, missing images)
 * - B0xxx: server errors (pipeline, dependencies)
 * - C0xxx: external store / model errors
 */
public enum SearchErrorCode implements IErrorCode {

    // ==================== general ====================
    SUCCESS("0", "OK"),

    SERVICE_ERROR("B0001", "Internal server error"),

    // ==================== parameters (A01xx) ====================
    PARAM_EMPTY("A0101", "Required parameter is missing"),

    PARAM_INVALID("A0102", "Invalid parameter"),

    /**
     * Mutually exclusive parameters were given together
     */
    PARAM_CONFLICT("A0103", "Conflicting parameters"),

    // ==================== access (A03xx) ====================
    API_KEY_INVALID("A0301", "Invalid API key"),

    // ==================== lookups (A04xx) ====================
    IMAGE_NOT_FOUND("A0401", "Image not found"),

    JOB_NOT_FOUND("A0402", "Job not found"),

    IMAGE_UNREADABLE("A0403", "Object is not a readable image"),

    // ==================== pipeline (B01xx) ====================
    INDEXING_FAILED("B0101", "Indexing failed"),

    SEARCH_SERVICE_ERROR("B0102", "Search failed"),

    RECONCILIATION_FAILED("B0103", "Reconciliation failed"),

    EMBEDDING_SERVICE_ERROR("B0104", "Embedding failed"),

    // ==================== availability (B02xx) ====================
    /**
     * A dependency failed to initialise and is not retried
     */
    DEPENDENCY_UNAVAILABLE("B0201", "Service unavailable"),

    // ==================== external (C0xxx) ====================
    VECTOR_INDEX_ERROR("C0101", "Vector index error"),

    OBJECT_STORE_ERROR("C0102", "Object store error"),

    METADATA_STORE_ERROR("C0103", "Metadata store error"),

    EMBEDDING_API_ERROR("C0104", "Embedding API error");

    private final String code;
    private final String message;

    SearchErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
