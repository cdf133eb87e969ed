package at.totenbilder.search.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response of the reconciliation endpoint: counts plus bounded, sorted samples
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReconciliationSummary {

    private int totalMetadata;
    private int totalIndexed;
    private int totalMissingInIndex;
    private int readyToIndexCount;
    private int missingInObjectStoreCount;
    private boolean objectStoreChecked;

    private List<String> readyToIndexFiles;
    private List<String> missingInObjectStoreFiles;
    /** Only filled when the object store was not checked */
    private List<String> missingInIndexFiles;

    public static ReconciliationSummary of(ReconciliationReport report, int sampleLimit) {
        ReconciliationSummary summary = new ReconciliationSummary();
        summary.setTotalMetadata(report.getTotalMetadata());
        summary.setTotalIndexed(report.getTotalIndexed());
        summary.setTotalMissingInIndex(report.getMissingInIndex().size());
        summary.setReadyToIndexCount(report.getReadyToIndex().size());
        summary.setMissingInObjectStoreCount(report.getMissingInObjectStore().size());
        summary.setObjectStoreChecked(report.isObjectStoreChecked());
        summary.setReadyToIndexFiles(sample(report.getReadyToIndex(), sampleLimit));
        summary.setMissingInObjectStoreFiles(sample(report.getMissingInObjectStore(), sampleLimit));
        summary.setMissingInIndexFiles(report.isObjectStoreChecked()
            ? List.of()
            : sample(report.getMissingInIndex(), sampleLimit));
        return summary;
    }

    private static List<String> sample(Collection<String> keys, int limit) {
        return keys.stream()
            .sorted()
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }
}
