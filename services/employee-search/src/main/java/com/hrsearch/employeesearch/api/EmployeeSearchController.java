package com.hrsearch.employeesearch.api;

import com.hrsearch.employeesearch.domain.EmployeeSearchService;
import com.hrsearch.employeesearch.domain.SearchOutcome;
import com.hrsearch.employeesearch.domain.SearchRequest;
import com.hrsearch.employeesearch.infrastructure.web.ClientKeyResolver;
import com.hrsearch.employeesearch.infrastructure.web.OrganizationNotFoundException;
import com.hrsearch.employeesearch.infrastructure.web.RateLimitExceededException;
import com.hrsearch.observability.CorrelationContextHolder;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.List;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP binding for {@link EmployeeSearchService}.
 *
 * <p>Served at {@code /api/v1/employees/search} and, for existing clients, at {@code /search}.
 * Query parameters use the directory's snake_case names; {@code status} may repeat. Each
 * {@code status} value is read raw from the request so a comma inside a value is never split.
 */
@RestController
public class EmployeeSearchController {

    static final String ORGANIZATION_ID_PARAM = "organization_id";
    static final String STATUS_PARAM = "status";

    private final EmployeeSearchService searchService;
    private final ClientKeyResolver clientKeyResolver;

    public EmployeeSearchController(
            EmployeeSearchService searchService, ClientKeyResolver clientKeyResolver) {
        this.searchService = searchService;
        this.clientKeyResolver = clientKeyResolver;
    }

    @GetMapping({"/api/v1/employees/search", "/search"})
    public SearchResponse search(
            @RequestParam(name = ORGANIZATION_ID_PARAM, required = false) String organizationId,
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "department", required = false) String department,
            @RequestParam(name = "location", required = false) String location,
            @RequestParam(name = "position", required = false) String position,
            HttpServletRequest httpRequest)
            throws MissingServletRequestParameterException {

        if (organizationId == null || organizationId.isBlank()) {
            throw new MissingServletRequestParameterException(ORGANIZATION_ID_PARAM, "String");
        }

        String[] statusValues = httpRequest.getParameterValues(STATUS_PARAM);
        List<String> statuses = statusValues == null ? null : Arrays.asList(statusValues);

        String clientKey = clientKeyResolver.resolve(httpRequest);
        CorrelationContextHolder.bindRequest(organizationId, clientKey);

        var request =
                new SearchRequest(
                        organizationId, name, department, location, position, statuses, clientKey);

        SearchOutcome outcome = searchService.search(request);
        if (outcome instanceof SearchOutcome.Admitted admitted) {
            return new SearchResponse(admitted.employees());
        }
        if (outcome instanceof SearchOutcome.RateLimited limited) {
            throw new RateLimitExceededException(limited);
        }
        if (outcome instanceof SearchOutcome.UnknownOrganization unknown) {
            throw new OrganizationNotFoundException(unknown.organizationId());
        }
        throw new IllegalStateException("Unhandled search outcome " + outcome);
    }
}
