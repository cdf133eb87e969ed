package at.totenbilder.search.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

    /** Re-embed keys that already have a point */
    @JsonProperty("force_reindex")
    @JsonAlias("forceReindex")
    private boolean forceReindex;
}
