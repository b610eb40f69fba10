/* (C)2026 */
package com.ammann.attention.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TrendGranularityTest {

    @Test
    void bucketShapes() {
        assertThat(TrendGranularity.HOUR.bucketCount()).isEqualTo(24);
        assertThat(TrendGranularity.HOUR.bucketWidthMs()).isEqualTo(3_600_000L);
        assertThat(TrendGranularity.DAY.bucketCount()).isEqualTo(30);
        assertThat(TrendGranularity.DAY.bucketWidthMs()).isEqualTo(86_400_000L);
        assertThat(TrendGranularity.WEEK.bucketCount()).isEqualTo(12);
        assertThat(TrendGranularity.WEEK.bucketWidthMs()).isEqualTo(604_800_000L);
    }

    @Test
    void parsesParameterCaseInsensitively() {
        assertThat(TrendGranularity.fromParameter("hour")).isEqualTo(TrendGranularity.HOUR);
        assertThat(TrendGranularity.fromParameter(" Week ")).isEqualTo(TrendGranularity.WEEK);
    }

    @Test
    void blankParameterDefaultsToDay() {
        assertThat(TrendGranularity.fromParameter(null)).isEqualTo(TrendGranularity.DAY);
        assertThat(TrendGranularity.fromParameter("  ")).isEqualTo(TrendGranularity.DAY);
    }

    @Test
    void unknownParameterIsRejected() {
        assertThatThrownBy(() -> TrendGranularity.fromParameter("month"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
