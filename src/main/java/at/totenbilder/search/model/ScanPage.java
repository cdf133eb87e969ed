package at.totenbilder.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of a full index scan. {@code nextCursor} is null on the last page.
 */
@Data
@AllArgsConstructor
public class ScanPage {

    private List<ImagePoint> points;

    private String nextCursor;

    public boolean hasNext() {
        return nextCursor != null;
    }
}
