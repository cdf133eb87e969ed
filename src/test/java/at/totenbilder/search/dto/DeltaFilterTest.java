package at.totenbilder.search.dto;

import at.totenbilder.search.common.convention.exception.ClientException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeltaFilterTest {

    @Test
    public void parsesRequestValues() {
        assertThat(DeltaFilter.fromValue(null)).isEqualTo(DeltaFilter.ALL);
        assertThat(DeltaFilter.fromValue(" ")).isEqualTo(DeltaFilter.ALL);
        assertThat(DeltaFilter.fromValue("alle")).isEqualTo(DeltaFilter.ALL);
        assertThat(DeltaFilter.fromValue("0")).isEqualTo(DeltaFilter.ZERO);
        assertThat(DeltaFilter.fromValue(">0")).isEqualTo(DeltaFilter.POSITIVE);
    }

    @Test
    public void rejectsUnknownValues() {
        assertThatThrownBy(() -> DeltaFilter.fromValue("<0"))
            .isInstanceOf(ClientException.class)
            .hasMessageContaining("<0");
    }

    @Test
    public void matchesDeltaValues() {
        assertThat(DeltaFilter.ZERO.matches(0d)).isTrue();
        assertThat(DeltaFilter.ZERO.matches(2d)).isFalse();
        assertThat(DeltaFilter.ZERO.matches(null)).isFalse();
        assertThat(DeltaFilter.POSITIVE.matches(0.5)).isTrue();
        assertThat(DeltaFilter.POSITIVE.matches(0d)).isFalse();
        assertThat(DeltaFilter.POSITIVE.matches(-1d)).isFalse();
        assertThat(DeltaFilter.ALL.matches(null)).isTrue();
    }
}
