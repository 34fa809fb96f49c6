package com.agentverse.authz;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.agentverse.authz.config.ServiceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

/**
 * Full context over the in-memory store and Caffeine cache, driven through MockMvc with
 * gateway identity headers.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Authz Service Application")
class AuthzServiceApplicationTest {

    private static final String SUPERADMIN_ROLE = "agentverse-superadmin";

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("Service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(ServiceProperties.class);
        assertThat(props.name()).isEqualTo("authz-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("Service info endpoint returns name and policy without an identity")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("authz-service-test"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.policy['access-agent']").value("user"))
                .andExpect(jsonPath("$.policy['manage-members']").value("admin"));
    }

    @Test
    @DisplayName("Actuator health includes the permission cache")
    void health() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.permissionCache.status").value("UP"));
    }

    @Test
    @DisplayName("Permission cache size is published as a gauge")
    void cacheGauges() {
        MeterRegistry registry = context.getBean(MeterRegistry.class);

        assertThat(registry.get("authz.cache.size").gauge().value()).isGreaterThanOrEqualTo(0);
        assertThat(registry.get("authz.cache.generations").gauge().value()).isGreaterThanOrEqualTo(0);
    }

    @Test
    @DisplayName("Correlation ID header is set on responses")
    void correlationIdHeader() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(result ->
                        assertThat(result.getResponse().getHeader("X-Correlation-ID")).isNotBlank());
    }

    @Test
    @DisplayName("API calls without a caller identity are rejected with 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/v1/me/agents"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthenticated"));
    }

    @Test
    @DisplayName("Regular callers cannot create groups or use admin endpoints")
    void regularCallerForbidden() throws Exception {
        mockMvc.perform(as(post("/api/v1/groups"), "mallory", false)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Nope\"}"))
                .andExpect(status().isForbidden());
        mockMvc.perform(as(get("/api/v1/admin/groups"), "mallory", false))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Validation errors map to 400 problem details")
    void validation() throws Exception {
        mockMvc.perform(as(post("/api/v1/groups"), "root", true)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    @DisplayName("Group, membership, agent and permission flow end to end")
    void endToEnd() throws Exception {
        String groupId = read(mockMvc.perform(as(post("/api/v1/groups"), "root", true)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Research\",\"initialAdminId\":\"alice\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Research"))).path("id").asText();

        mockMvc.perform(as(post("/api/v1/groups/" + groupId + "/members"), "alice", false)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"bob\",\"role\":\"user\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("user"));

        String agentId = read(mockMvc.perform(as(post("/api/v1/agents"), "alice", false)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalId\":\"e2e-agent\",\"name\":\"Helper\",\"groupId\":\"" + groupId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.groups[0].id").value(groupId))).path("id").asText();

        mockMvc.perform(as(get("/api/v1/permissions/check"), "bob", false)
                        .param("userId", "bob")
                        .param("agentId", agentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.role").value("user"))
                .andExpect(jsonPath("$.groupId").value(groupId));

        mockMvc.perform(as(get("/api/v1/me/agents"), "bob", false))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(agentId));

        mockMvc.perform(as(get("/api/v1/permissions/groups/" + groupId + "/role"), "bob", false))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("user"));

        mockMvc.perform(as(delete("/api/v1/groups/" + groupId + "/agents/" + agentId), "alice", false))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));

        mockMvc.perform(as(get("/api/v1/permissions/check"), "bob", false)
                        .param("userId", "bob")
                        .param("agentId", agentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false));
    }

    @Test
    @DisplayName("Removing the last admin is a 409 with a machine-readable code")
    void lastAdminConflict() throws Exception {
        String groupId = read(mockMvc.perform(as(post("/api/v1/groups"), "root", true)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Solo\",\"initialAdminId\":\"carol\"}"))
                .andExpect(status().isCreated())).path("id").asText();

        mockMvc.perform(as(delete("/api/v1/groups/" + groupId + "/members/carol"), "carol", false))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("last_admin"));
    }

    private static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String subject,
                                                    boolean superadmin) {
        request.header("X-Caller-Id", subject).header("X-Caller-Name", "User " + subject);
        if (superadmin) {
            request.header("X-Caller-Roles", SUPERADMIN_ROLE);
        }
        return request;
    }

    private JsonNode read(ResultActions actions) throws Exception {
        return objectMapper.readTree(actions.andReturn().getResponse().getContentAsString());
    }
}
