package com.hrsearch.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ComponentHealth")
class ComponentHealthTest {

    @Test
    @DisplayName("factories set status and message")
    void factories() {
        assertThat(ComponentHealth.healthy("employee-store", Map.of("employees", 8)))
                .isEqualTo(new ComponentHealth("employee-store", HealthStatus.HEALTHY, null, Map.of("employees", 8)));
        assertThat(ComponentHealth.degraded("employee-store", "empty", null).status())
                .isEqualTo(HealthStatus.DEGRADED);
        assertThat(ComponentHealth.unhealthy("rate-limiter", "broken").message()).isEqualTo("broken");
    }

    @Test
    @DisplayName("details are copied and never null")
    void detailsAreCopied() {
        Map<String, Object> details = new HashMap<>();
        details.put("trackedKeys", 3);

        ComponentHealth health = ComponentHealth.healthy("rate-limiter", details);
        details.put("trackedKeys", 4);

        assertThat(health.details()).containsEntry("trackedKeys", 3);
        assertThat(ComponentHealth.unhealthy("x", "y").details()).isEmpty();
    }
}
