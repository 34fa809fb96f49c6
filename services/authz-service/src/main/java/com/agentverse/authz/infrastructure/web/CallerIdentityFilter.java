package com.agentverse.authz.infrastructure.web;

import com.agentverse.authz.config.AuthzProperties;
import com.agentverse.authz.domain.service.UserService;
import com.agentverse.observability.CorrelationContextHolder;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.CallerIdentityMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Builds the {@link CallerIdentity} of an API request from the claim headers set by the
 * gateway, which has already verified the caller's token.
 *
 * <p>Requests without {@code X-Caller-Id} pass through without an identity; endpoints that
 * need one reject them through {@link CallerIdentityArgumentResolver}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CallerIdentityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityFilter.class);

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_NAME_HEADER = "X-Caller-Name";
    public static final String CALLER_EMAIL_HEADER = "X-Caller-Email";
    public static final String CALLER_ROLES_HEADER = "X-Caller-Roles";

    /** Request attribute holding the resolved identity. */
    public static final String IDENTITY_ATTRIBUTE = CallerIdentity.class.getName();

    private final AuthzProperties properties;
    private final UserService userService;

    public CallerIdentityFilter(AuthzProperties properties, UserService userService) {
        this.properties = properties;
        this.userService = userService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(request.getContextPath() + "/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String callerId = request.getHeader(CALLER_ID_HEADER);
        if (callerId != null && !callerId.isBlank()) {
            Map<String, Object> claims = new HashMap<>();
            claims.put(CallerIdentityMapper.CLAIM_OBJECT_ID, callerId);
            claims.put(CallerIdentityMapper.CLAIM_NAME, request.getHeader(CALLER_NAME_HEADER));
            claims.put(CallerIdentityMapper.CLAIM_EMAIL, request.getHeader(CALLER_EMAIL_HEADER));
            claims.put(CallerIdentityMapper.CLAIM_ROLES, request.getHeader(CALLER_ROLES_HEADER));
            CallerIdentity identity = CallerIdentityMapper.fromClaims(claims, properties.superadminRole());

            request.setAttribute(IDENTITY_ATTRIBUTE, identity);
            CorrelationContextHolder.bindSubject(identity.subjectId());
            syncProfile(identity);
        }
        filterChain.doFilter(request, response);
    }

    private void syncProfile(CallerIdentity identity) {
        try {
            userService.sync(identity);
        } catch (RuntimeException e) {
            // the profile is display data only; the request proceeds
            log.warn("Could not sync profile of {}: {}", identity.subjectId(), e.getMessage());
        }
    }
}
