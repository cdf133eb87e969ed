package at.totenbilder.search.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Search parameters. {@code similar} (a canonical key) takes precedence over {@code query}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    private String query;

    private String similar;

    @Min(1)
    private Integer limit;

    @Min(0)
    private Integer offset;

    /** "alle", "0" or ">0" */
    private String delta;
}
