package at.totenbilder.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document stored in the vector index: the embedding plus a denormalised copy of the metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexedImage {

    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_OCR_TEXT = "ocr_text";
    public static final String FIELD_NID = "nid";
    public static final String FIELD_DELTA = "delta";
    public static final String FIELD_EMBEDDING = "embedding";

    /** Canonical key, at most one point per value */
    @JsonProperty(FIELD_FILENAME)
    private String filename;

    @JsonProperty(FIELD_OCR_TEXT)
    private String ocrText;

    @JsonProperty(FIELD_NID)
    private Long nid;

    @JsonProperty(FIELD_DELTA)
    private Double delta;

    @JsonProperty(FIELD_EMBEDDING)
    private float[] embedding;

    public IndexedImage(String filename, float[] embedding) {
        this.filename = filename;
        this.embedding = embedding;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
