package com.hrsearch.employeesearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrsearch.employeesearch.config.SearchProperties;
import com.hrsearch.employeesearch.config.ServiceProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

/**
 * Integration tests for the employee search service over MockMvc.
 *
 * <p>The rate limiter bean is shared by every test in the cached context, so each test searches
 * under its own client key.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Employee Search Application")
class EmployeeSearchApplicationTest {

    private static final String SEARCH = "/api/v1/employees/search";

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private static MockHttpServletRequestBuilder search(String path, String clientKey) {
        return get(path).header("X-Client-IP", clientKey);
    }

    private static String newClient() {
        return "test-" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("context")
    class Context {

        @Test
        @DisplayName("properties are loaded from the test profile")
        void propertiesAreLoaded() {
            var service = context.getBean(ServiceProperties.class);
            var search = context.getBean(SearchProperties.class);

            assertThat(service.name()).isEqualTo("employee-search-test");
            assertThat(service.environment()).isEqualTo("test");
            assertThat(search.rateLimit().maxRequests()).isEqualTo(5);
            assertThat(search.organizations()).containsKeys("org_a", "org_b", "org_c", "org_hidden");
        }

        @Test
        @DisplayName("actuator health reports the directory component")
        void actuatorHealth() throws Exception {
            mockMvc.perform(get("/actuator/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.components.directory.status").value("UP"))
                    .andExpect(jsonPath("$.components.directory.details['employee-store'].details.employees")
                            .value(8));
        }
    }

    @Nested
    @DisplayName("successful searches")
    class Successful {

        @Test
        @DisplayName("org_a without filters returns five records with exactly the configured keys in order")
        void orgAWithoutFilters() throws Exception {
            String body = mockMvc.perform(search(SEARCH, newClient()).param("organization_id", "org_a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(5))
                    .andExpect(jsonPath("$.employees[*]", everyItem(not(hasKey("salary")))))
                    .andReturn().getResponse().getContentAsString();

            var parsed = objectMapper.readValue(body,
                    new TypeReference<LinkedHashMap<String, List<LinkedHashMap<String, Object>>>>() {});
            assertThat(parsed.get("employees")).allSatisfy(row -> assertThat(row.keySet()).containsExactly(
                    "id", "first_name", "last_name", "email", "phone", "department", "position",
                    "location", "status"));
        }

        @Test
        @DisplayName("name filter returns Charlie Brown")
        void nameFilter() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "org_a")
                            .param("name", "Charlie Brown"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(1))
                    .andExpect(jsonPath("$.employees[0].first_name").value("Charlie"))
                    .andExpect(jsonPath("$.employees[0].last_name").value("Brown"));
        }

        @Test
        @DisplayName("repeated status parameters match any listed status")
        void repeatedStatus() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "org_a")
                            .param("status", "Active")
                            .param("status", "Not started"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(4));
        }

        @Test
        @DisplayName("a comma inside one status value is part of that value")
        void commaInStatusValue() throws Exception {
            mockMvc.perform(search("/search", newClient())
                            .param("organization_id", "org_a")
                            .param("status", "Active,Terminated"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(0));
        }

        @Test
        @DisplayName("cross-tenant name search returns an empty list")
        void crossTenant() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "org_a")
                            .param("name", "Frank White"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(0));
        }

        @Test
        @DisplayName("empty filter values are ignored")
        void emptyFilters() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "org_b")
                            .param("name", "")
                            .param("department", ""))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(3))
                    .andExpect(jsonPath("$.employees[0]", not(hasKey("email"))));
        }

        @Test
        @DisplayName("legacy /search path serves the same results")
        void legacyPath() throws Exception {
            mockMvc.perform(search("/search", newClient())
                            .param("organization_id", "org_b")
                            .param("location", "london"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(2));
        }

        @Test
        @DisplayName("organization configured with no columns is known, not 404")
        void emptyColumnsIsKnown() throws Exception {
            mockMvc.perform(search(SEARCH, newClient()).param("organization_id", "org_hidden"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.employees.length()").value(0));
        }

        @Test
        @DisplayName("correlation ID is echoed on responses")
        void correlationIdEchoed() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "org_a")
                            .header("X-Correlation-ID", "cid-search-1"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-Correlation-ID", "cid-search-1"));
        }
    }

    @Nested
    @DisplayName("rejected searches")
    class Rejected {

        @Test
        @DisplayName("unknown organization yields 404 with the organization in the detail")
        void unknownOrganization() throws Exception {
            mockMvc.perform(search(SEARCH, newClient())
                            .param("organization_id", "nonexistent_org")
                            .header("X-Correlation-ID", "cid-404"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.detail")
                            .value("Organization 'nonexistent_org' not found or no display columns configured."))
                    .andExpect(jsonPath("$.correlationId").value("cid-404"))
                    .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("missing organization_id yields 422")
        void missingOrganization() throws Exception {
            mockMvc.perform(search(SEARCH, newClient()))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.detail").value("Field required: organization_id"));
        }

        @Test
        @DisplayName("blank organization_id yields 422")
        void blankOrganization() throws Exception {
            mockMvc.perform(search(SEARCH, newClient()).param("organization_id", "  "))
                    .andExpect(status().isUnprocessableEntity());
        }

        @Test
        @DisplayName("sixth request from one client yields 429 with Retry-After; other clients are unaffected")
        void rateLimited() throws Exception {
            String client = newClient();
            for (int i = 0; i < 5; i++) {
                mockMvc.perform(search(SEARCH, client).param("organization_id", "org_a"))
                        .andExpect(status().isOk());
            }

            mockMvc.perform(search(SEARCH, client).param("organization_id", "org_a"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().exists("Retry-After"))
                    .andExpect(jsonPath("$.detail").value(
                            "Too many requests. Please try again after 60 seconds. Limit is 5 requests per 60 seconds."));

            mockMvc.perform(search(SEARCH, newClient()).param("organization_id", "org_a"))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("unknown-organization requests count against the quota")
        void unknownOrganizationCountsAgainstQuota() throws Exception {
            String client = newClient();
            for (int i = 0; i < 5; i++) {
                mockMvc.perform(search(SEARCH, client).param("organization_id", "nonexistent_org"))
                        .andExpect(status().isNotFound());
            }

            mockMvc.perform(search(SEARCH, client).param("organization_id", "org_a"))
                    .andExpect(status().isTooManyRequests());
        }
    }
}
