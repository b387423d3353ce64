package com.hrsearch.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Nested
    @DisplayName("enforce()")
    class Enforce {

        @Test
        @DisplayName("passes when organizations match")
        void organizationsMatch() {
            assertThatCode(() -> TenantIsolationEnforcer.enforce("org_a", SampleEmployees.alice()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throws TenantMismatchException when organizations differ")
        void organizationsDiffer() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("org_b", SampleEmployees.alice()))
                    .isInstanceOf(TenantMismatchException.class)
                    .hasMessageContaining("org_a")
                    .hasMessageContaining("org_b");
        }

        @Test
        @DisplayName("comparison is case-sensitive")
        void caseSensitive() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("ORG_A", SampleEmployees.alice()))
                    .isInstanceOf(TenantMismatchException.class);
        }

        @Test
        @DisplayName("exception carries both organization IDs")
        void exceptionCarriesIds() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("org_b", SampleEmployees.alice()))
                    .isInstanceOfSatisfying(TenantMismatchException.class, e -> {
                        assertThat(e.expectedOrganizationId()).isEqualTo("org_b");
                        assertThat(e.actualOrganizationId()).isEqualTo("org_a");
                    });
        }
    }

    @Test
    @DisplayName("enforceAll() rejects a list with one foreign record")
    void enforceAllRejectsForeignRecord() {
        List<Employee> mixed = SampleEmployees.all().subList(4, 6);

        assertThatThrownBy(() -> TenantIsolationEnforcer.enforceAll("org_a", mixed))
                .isInstanceOf(TenantMismatchException.class);
    }
}
