package com.atrium.portfolio.infrastructure.web;

import com.atrium.access.PrincipalResolver;
import com.atrium.security.BearerTokenExtractor;
import com.atrium.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the caller of every protected endpoint before its arguments are bound.
 *
 * <p>A missing, malformed or rejected bearer token ends the request with 401 through
 * {@link GlobalExceptionHandler}, so body and parameter validation only ever run for an
 * authenticated caller. The resolved {@link Principal} is stored under
 * {@link #PRINCIPAL_ATTRIBUTE} for the controllers.
 *
 * <p>Only controller methods are guarded; unknown paths still answer 404.
 */
@Component
public class BearerAuthenticationInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "atrium.principal";

    private final PrincipalResolver resolver;

    public BearerAuthenticationInterceptor(PrincipalResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        String token = BearerTokenExtractor.require(request.getHeader(HttpHeaders.AUTHORIZATION));
        Principal principal = resolver.resolve(token);
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        return true;
    }
}
