package at.totenbilder.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point of the vector index: id plus stored document
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImagePoint {

    private String id;

    private IndexedImage image;

    public String filename() {
        return image == null ? null : image.getFilename();
    }
}
