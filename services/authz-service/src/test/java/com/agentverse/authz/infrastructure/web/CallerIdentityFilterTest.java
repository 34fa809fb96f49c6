package com.agentverse.authz.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.agentverse.authz.config.AuthzProperties;
import com.agentverse.authz.domain.error.UnavailableException;
import com.agentverse.authz.domain.service.UserService;
import com.agentverse.observability.CorrelationContext;
import com.agentverse.observability.CorrelationContextHolder;
import com.agentverse.security.CallerIdentity;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CallerIdentityFilter")
class CallerIdentityFilterTest {

    private UserService userService;
    private CallerIdentityFilter filter;

    @BeforeEach
    void setUp() {
        userService = mock(UserService.class);
        AuthzProperties properties = new AuthzProperties("agentverse-superadmin", null, null, null, null, null);
        filter = new CallerIdentityFilter(properties, userService);
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static MockHttpServletRequest api() {
        return new MockHttpServletRequest("GET", "/api/v1/me/agents");
    }

    @Test
    @DisplayName("builds the identity from claim headers and syncs the profile")
    void buildsIdentity() throws Exception {
        MockHttpServletRequest request = api();
        request.addHeader("X-Caller-Id", "oid-1");
        request.addHeader("X-Caller-Name", "Ada");
        request.addHeader("X-Caller-Email", "ada@example.com");
        request.addHeader("X-Caller-Roles", "agentverse-user, agentverse-superadmin");
        CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
        AtomicReference<String> boundSubject = new AtomicReference<>();
        FilterChain chain = (req, resp) ->
                boundSubject.set(CorrelationContextHolder.get().map(CorrelationContext::subjectId).orElse(null));

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        CallerIdentity identity = (CallerIdentity) request.getAttribute(CallerIdentityFilter.IDENTITY_ATTRIBUTE);
        assertThat(identity.subjectId()).isEqualTo("oid-1");
        assertThat(identity.displayName()).isEqualTo("Ada");
        assertThat(identity.superadmin()).isTrue();
        assertThat(boundSubject.get()).isEqualTo("oid-1");
        verify(userService).sync(identity);
    }

    @Test
    @DisplayName("roles without the configured superadmin role give a regular caller")
    void regularCaller() throws Exception {
        MockHttpServletRequest request = api();
        request.addHeader("X-Caller-Id", "oid-2");
        request.addHeader("X-Caller-Roles", "agentverse-user");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        CallerIdentity identity = (CallerIdentity) request.getAttribute(CallerIdentityFilter.IDENTITY_ATTRIBUTE);
        assertThat(identity.superadmin()).isFalse();
    }

    @Test
    @DisplayName("requests without a caller id pass through without an identity")
    void anonymous() throws Exception {
        MockHttpServletRequest request = api();

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(request.getAttribute(CallerIdentityFilter.IDENTITY_ATTRIBUTE)).isNull();
        verifyNoInteractions(userService);
    }

    @Test
    @DisplayName("a failed profile sync does not fail the request")
    void syncFailure() throws Exception {
        when(userService.sync(any())).thenThrow(new UnavailableException("store down"));
        MockHttpServletRequest request = api();
        request.addHeader("X-Caller-Id", "oid-3");
        AtomicReference<Boolean> reached = new AtomicReference<>(false);

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> reached.set(true));

        assertThat(reached.get()).isTrue();
    }

    @Test
    @DisplayName("non-API paths are not filtered")
    void skipsNonApi() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        request.addHeader("X-Caller-Id", "oid-4");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(request.getAttribute(CallerIdentityFilter.IDENTITY_ATTRIBUTE)).isNull();
    }
}
