/* (C)2026 */
package com.ammann.attention.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.store.IntervalStore;
import com.ammann.attention.support.InMemoryIntervalStore;
import com.ammann.attention.support.TestDataFactory;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class DatabaseHealthCheckTest {

    @Test
    void reportsUpWithIntervalCount() {
        InMemoryIntervalStore store = new InMemoryIntervalStore();
        store.add(
                TestDataFactory.interval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:30:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE));

        HealthCheckResponse response = new DatabaseHealthCheck(store).call();

        assertThat(response.getName()).isEqualTo("database-health");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("activity-intervals")).isEqualTo(1L);
        assertThat(response.getData().get().get("performance-ok")).isEqualTo(true);
    }

    @Test
    void reportsDownWhenStoreFails() {
        IntervalStore store = mock(IntervalStore.class);
        when(store.countIntervals()).thenThrow(new IllegalStateException("Connection refused"));

        HealthCheckResponse response = new DatabaseHealthCheck(store).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get().get("error")).isEqualTo("Connection refused");
        assertThat(response.getData().get().get("database-accessible")).isEqualTo(false);
    }
}
