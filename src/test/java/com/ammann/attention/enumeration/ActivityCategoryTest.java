/* (C)2026 */
package com.ammann.attention.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ActivityCategoryTest {

    @Test
    void declarationOrderIsTheTieBreakOrder() {
        assertThat(ActivityCategory.values())
                .containsExactly(
                        ActivityCategory.PRODUCTIVE,
                        ActivityCategory.NEUTRAL,
                        ActivityCategory.FRIVOLITY,
                        ActivityCategory.DRAINING,
                        ActivityCategory.EMERGENCY);
    }

    @Test
    void wireValueIsLowerCase() {
        assertThat(ActivityCategory.FRIVOLITY.wireValue()).isEqualTo("frivolity");
        assertThat(ActivityCategory.fromWireValue(" Productive ")).isEqualTo(ActivityCategory.PRODUCTIVE);
    }

    @Test
    void unknownOrBlankWireValueResolvesToNull() {
        assertThat(ActivityCategory.fromWireValue("gaming")).isNull();
        assertThat(ActivityCategory.fromWireValue("")).isNull();
        assertThat(ActivityCategory.fromWireValue(null)).isNull();
    }

    @Test
    void onlyFrivolityAndDrainingAreDistractions() {
        assertThat(ActivityCategory.FRIVOLITY.isDistraction()).isTrue();
        assertThat(ActivityCategory.DRAINING.isDistraction()).isTrue();
        assertThat(ActivityCategory.PRODUCTIVE.isDistraction()).isFalse();
        assertThat(ActivityCategory.NEUTRAL.isDistraction()).isFalse();
        assertThat(ActivityCategory.EMERGENCY.isDistraction()).isFalse();
    }

    @Test
    void serializesThroughJackson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(ActivityCategory.DRAINING)).isEqualTo("\"draining\"");
        assertThat(mapper.readValue("\"emergency\"", ActivityCategory.class))
                .isEqualTo(ActivityCategory.EMERGENCY);
    }
}
