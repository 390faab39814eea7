package com.jobcache.janitor.cleanup.api;

import com.jobcache.janitor.config.CleanupProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds permissive cross-origin headers to every API response, whether or not
 * the request carried an {@code Origin}. Preflight requests are answered here
 * with an empty 200.
 */
@Component
public class CleanupCorsFilter extends OncePerRequestFilter {
    private final CleanupProperties properties;

    public CleanupCorsFilter(CleanupProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
        throws ServletException, IOException {
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, properties.getCors().getAllowedOrigin());
        response.setHeader(
            HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS,
            String.join(", ", properties.getCors().getAllowedHeaders())
        );
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setStatus(HttpServletResponse.SC_OK);
            return;
        }
        chain.doFilter(request, response);
    }
}
