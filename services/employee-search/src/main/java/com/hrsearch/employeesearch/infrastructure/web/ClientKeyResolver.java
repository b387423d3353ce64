package com.hrsearch.employeesearch.infrastructure.web;

import com.hrsearch.employeesearch.config.SearchProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Derives the rate-limit bucket for a request.
 *
 * <p>Uses the configured client-key header ({@code X-Client-IP} by default) when present and
 * non-blank, else the remote address, else {@link #UNKNOWN_CLIENT}. The header is trusted as-is;
 * deployments exposed directly to clients should strip it at the edge.
 */
@Component
public class ClientKeyResolver {

    public static final String UNKNOWN_CLIENT = "unknown_client";

    private final String headerName;

    public ClientKeyResolver(SearchProperties properties) {
        this.headerName = properties.clientKeyHeader();
    }

    public String resolve(HttpServletRequest request) {
        String header = request.getHeader(headerName);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return UNKNOWN_CLIENT;
    }
}
