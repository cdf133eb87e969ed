package at.totenbilder.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nearest-neighbour hit in index order
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoredImage {

    private String id;

    /** Native similarity score of the index */
    private double score;

    private IndexedImage image;
}
