package com.foodtruck.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.exception.GlobalExceptionHandler;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.List;

/**
 * Resolves the bearer token of every request.
 *
 * <p>A valid token puts an {@link AuthenticatedUser} into the request attribute
 * {@link #PRINCIPAL_ATTRIBUTE}, which controllers read with
 * {@code @RequestAttribute}. Requests to a non-public endpoint without a valid
 * token are answered here with 401 and never reach a controller. Role checks
 * are left to {@link AccessPolicy}.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class AuthenticationFilter implements Filter {

    public static final String PRINCIPAL_ATTRIBUTE = "authenticatedUser";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

    private static final List<PublicEndpoint> PUBLIC_ENDPOINTS = List.of(
            new PublicEndpoint(HttpMethod.POST, "/api/auth/token"),
            new PublicEndpoint(HttpMethod.POST, "/api/setup"),
            new PublicEndpoint(HttpMethod.GET, "/api/products/**"),
            new PublicEndpoint(HttpMethod.GET, "/api/public/**"),
            new PublicEndpoint(HttpMethod.GET, "/actuator/health/**"));

    private final JwtTokenProvider jwtTokenProvider;
    private final ObjectMapper objectMapper;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String token = resolveToken(httpRequest);

        if (token != null && jwtTokenProvider.validateToken(token)) {
            httpRequest.setAttribute(PRINCIPAL_ATTRIBUTE, jwtTokenProvider.getAuthentication(token));
        } else if (!isPublic(httpRequest)) {
            log.warn("Rejected unauthenticated request: {} {}", httpRequest.getMethod(), pathOf(httpRequest));
            writeUnauthorized((HttpServletResponse) response);
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean isPublic(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        String path = pathOf(request);
        return PUBLIC_ENDPOINTS.stream().anyMatch(endpoint -> endpoint.matches(request.getMethod(), path));
    }

    private String pathOf(HttpServletRequest request) {
        return request.getRequestURI().substring(request.getContextPath().length());
    }

    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader("Authorization");
        if (StringUtils.hasText(bearer) && bearer.startsWith(BEARER_PREFIX)) {
            return bearer.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        ProblemDetail problem = GlobalExceptionHandler.toProblemDetail(
                ErrorCode.UNAUTHENTICATED, "Missing or invalid bearer token");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader("WWW-Authenticate", "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }

    private record PublicEndpoint(HttpMethod method, String pattern) {

        boolean matches(String requestMethod, String path) {
            return method.matches(requestMethod) && PATH_MATCHER.match(pattern, path);
        }
    }
}
