package at.totenbilder.search.dto;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;

/**
 * Filter on the denormalised {@code delta} payload field
 */
public enum DeltaFilter {

    /** No predicate */
    ALL("alle"),

    /** delta == 0 */
    ZERO("0"),

    /** delta > 0 */
    POSITIVE(">0");

    private final String value;

    DeltaFilter(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses the request value; null or blank means {@link #ALL}.
     *
     * @throws ClientException for any other value
     */
    public static DeltaFilter fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String trimmed = raw.trim();
        for (DeltaFilter filter : values()) {
            if (filter.value.equalsIgnoreCase(trimmed)) {
                return filter;
            }
        }
        throw new ClientException("Unsupported delta filter: " + raw, SearchErrorCode.PARAM_INVALID);
    }

    /**
     * Whether a payload delta passes this filter. A missing delta only passes {@link #ALL}.
     */
    public boolean matches(Double delta) {
        switch (this) {
            case ZERO:
                return delta != null && delta == 0d;
            case POSITIVE:
                return delta != null && delta > 0d;
            default:
                return true;
        }
    }
}
