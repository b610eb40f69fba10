/* (C)2026 */
package com.ammann.attention.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BehaviorEventTypeTest {

    @Test
    void resolvesWireValues() {
        assertThat(BehaviorEventType.fromWireValue("scroll")).isEqualTo(BehaviorEventType.SCROLL);
        assertThat(BehaviorEventType.fromWireValue("Idle_End")).isEqualTo(BehaviorEventType.IDLE_END);
        assertThat(BehaviorEventType.VISIBILITY.wireValue()).isEqualTo("visibility");
    }

    @Test
    void unknownValuesResolveToNull() {
        assertThat(BehaviorEventType.fromWireValue("hover")).isNull();
        assertThat(BehaviorEventType.fromWireValue(null)).isNull();
    }
}
