package at.totenbilder.search.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Three-way diff between the metadata table, the vector index and the object store.
 * Computed on demand, never persisted.
 *
 * <p>{@code readyToIndex} and {@code missingInObjectStore} partition {@code missingInIndex}.
 * When the object store could not be consulted both are empty and {@code objectStoreChecked} is false.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    private int totalMetadata;

    private int totalIndexed;

    private Set<String> missingInIndex;

    private Set<String> readyToIndex;

    private Set<String> missingInObjectStore;

    private boolean objectStoreChecked;
}
