package at.totenbilder.search.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tally of one payload sync run. {@code skipped} counts rows without a point yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayloadSyncSummary {

    private int total;

    private int success;

    private int skipped;

    private int errors;
}
