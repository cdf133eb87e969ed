package at.totenbilder.search.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exactly one of {@code filename} and {@code all} must be set
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayloadUpdateRequest {

    private String filename;

    private boolean all;
}
