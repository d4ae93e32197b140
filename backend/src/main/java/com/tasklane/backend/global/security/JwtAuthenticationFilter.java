package com.tasklane.backend.global.security;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Set;

import com.tasklane.backend.modules.auth.application.InvalidTokenException;
import com.tasklane.backend.modules.auth.application.JwtTokenVerifier;
import com.tasklane.backend.modules.auth.application.SessionClaims;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * The single point where a bearer token becomes a {@link CallerIdentity}.
 *
 * <p>Protected requests end in one of two states: authenticated, with the identity set as
 * the security principal, or rejected with a 401 before any handler runs. Paths that
 * accept an optional credential fall through anonymously instead of being rejected.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    static final String ACCOUNT_ID_MDC_KEY = "accountId";

    static final Set<String> PUBLIC_PATHS = Set.of("/auth/register", "/auth/login", "/health", "/swagger-ui.html");
    static final List<String> PUBLIC_PATH_PREFIXES = List.of("/actuator/health", "/v3/api-docs", "/swagger-ui/");
    static final Set<String> OPTIONAL_AUTH_PATHS = Set.of("/auth/logout");

    private final JwtTokenVerifier tokenVerifier;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final Clock clock;

    public JwtAuthenticationFilter(
            JwtTokenVerifier tokenVerifier,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            Clock clock
    ) {
        this.tokenVerifier = tokenVerifier;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        boolean credentialOptional = OPTIONAL_AUTH_PATHS.contains(pathOf(request));
        String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (token == null) {
            reject(request, response, filterChain, credentialOptional, "missing bearer credential");
            return;
        }

        SessionClaims claims;
        try {
            claims = tokenVerifier.verify(token, clock.instant());
        } catch (InvalidTokenException ex) {
            reject(request, response, filterChain, credentialOptional, ex.getReason().name());
            return;
        }

        CallerIdentity identity = new CallerIdentity(claims.subject());
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(identity, null, List.of());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        MDC.put(ACCOUNT_ID_MDC_KEY, identity.accountId().toString());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(ACCOUNT_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = pathOf(request);
        return PUBLIC_PATHS.contains(path) || PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private void reject(HttpServletRequest request,
                        HttpServletResponse response,
                        FilterChain filterChain,
                        boolean credentialOptional,
                        String reason) throws ServletException, IOException {
        SecurityContextHolder.clearContext();
        if (credentialOptional) {
            filterChain.doFilter(request, response);
            return;
        }
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
        authenticationEntryPoint.commence(request, response, new BadCredentialsException(reason));
    }

    private static String extractBearerToken(String authorization) {
        if (authorization == null
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
