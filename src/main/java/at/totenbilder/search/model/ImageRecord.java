package at.totenbilder.search.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Image metadata row. Owned by the CMS, read-only here.
 * {@code filename} may be stored with or without the storage prefix.
 */
@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "totenbilder_bilder")
public class ImageRecord {

    @Id
    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "nid")
    private Long nid;

    @Column(name = "delta")
    private Double delta;
}
