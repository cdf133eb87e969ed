package at.totenbilder.search.dto;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class ReconciliationSummaryTest {

    @Test
    public void samplesAreSortedAndBounded() {
        ReconciliationReport report = new ReconciliationReport(4, 1,
            Set.of("t/d.jpg", "t/c.jpg", "t/b.jpg"),
            Set.of("t/d.jpg", "t/b.jpg"),
            Set.of("t/c.jpg"),
            true);

        ReconciliationSummary summary = ReconciliationSummary.of(report, 1);

        assertThat(summary.getTotalMissingInIndex()).isEqualTo(3);
        assertThat(summary.getReadyToIndexCount()).isEqualTo(2);
        assertThat(summary.getReadyToIndexFiles()).containsExactly("t/b.jpg");
        assertThat(summary.getMissingInObjectStoreFiles()).containsExactly("t/c.jpg");
        assertThat(summary.getMissingInIndexFiles()).isEmpty();
        assertThat(summary.isObjectStoreChecked()).isTrue();
    }

    @Test
    public void unpartitionedReportListsMissingKeys() {
        ReconciliationReport report = new ReconciliationReport(2, 0,
            Set.of("t/b.jpg", "t/a.jpg"), Set.of(), Set.of(), false);

        ReconciliationSummary summary = ReconciliationSummary.of(report, 500);

        assertThat(summary.isObjectStoreChecked()).isFalse();
        assertThat(summary.getMissingInIndexFiles()).containsExactly("t/a.jpg", "t/b.jpg");
        assertThat(summary.getReadyToIndexFiles()).isEmpty();
    }
}
