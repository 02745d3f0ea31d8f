package com.wpanther.licensing.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.exception.GlobalExceptionHandler.ErrorResponse;
import com.wpanther.licensing.exception.OperationFailedException;
import com.wpanther.licensing.exception.UnauthenticatedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;

/**
 * Runs the {@link AuthenticationPipeline} in front of the API. Failures are answered here
 * with the same JSON body the exception handler produces; successes leave the context on
 * the request and in the security context.
 */
@Slf4j
public class AuthenticationPipelineFilter extends OncePerRequestFilter {

    private static final RequestMatcher PUBLIC_ENDPOINTS = new OrRequestMatcher(
            AntPathRequestMatcher.antMatcher("/api/auth/login"),
            AntPathRequestMatcher.antMatcher("/api/auth/signup"));

    private final AuthenticationPipeline authenticationPipeline;
    private final ObjectMapper objectMapper;

    public AuthenticationPipelineFilter(AuthenticationPipeline authenticationPipeline, ObjectMapper objectMapper) {
        this.authenticationPipeline = authenticationPipeline;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PUBLIC_ENDPOINTS.matches(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        AuthorizationContext context;
        try {
            context = authenticationPipeline.authenticate(request);
        } catch (UnauthenticatedException e) {
            log.warn("Unauthenticated request: method={}, uri={}, message={}",
                    request.getMethod(), request.getRequestURI(), e.getMessage());
            writeError(response, HttpStatus.UNAUTHORIZED, e.getMessage(), null);
            return;
        } catch (ForbiddenException e) {
            log.warn("Forbidden request: method={}, uri={}, message={}",
                    request.getMethod(), request.getRequestURI(), e.getMessage());
            writeError(response, HttpStatus.FORBIDDEN, e.getMessage(), e.getReason());
            return;
        } catch (OperationFailedException e) {
            log.error("Authentication failed: method={}, uri={}", request.getMethod(), request.getRequestURI(), e);
            writeError(response, HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), null);
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected authentication error: method={}, uri={}", request.getMethod(), request.getRequestURI(), e);
            writeError(response, HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null);
            return;
        }

        request.setAttribute(AuthorizationContext.REQUEST_ATTRIBUTE, context);
        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(new AuthorizationContextAuthentication(context));
        SecurityContextHolder.setContext(securityContext);
        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    private void writeError(HttpServletResponse response, HttpStatus status, String message, String reason)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
                new ErrorResponse(message, status.value(), Instant.now(), reason));
    }
}
