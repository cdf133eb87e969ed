package at.totenbilder.search.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tally of one bulk indexing run. Failed items are neither processed nor skipped
 * and are picked up again by the next run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexingSummary {

    private int processed;

    private int skipped;

    private int failed;
}
