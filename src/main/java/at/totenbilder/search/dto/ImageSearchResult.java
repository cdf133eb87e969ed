package at.totenbilder.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageSearchResult {

    private String filename;

    @JsonProperty("image_url")
    private String imageUrl;

    /** Rounded to 3 decimals */
    private double score;
}
