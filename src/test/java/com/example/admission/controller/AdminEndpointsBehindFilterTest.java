package com.example.admission.controller;

import com.example.admission.config.LimitRegistry;
import com.example.admission.config.RateLimiterProperties;
import com.example.admission.filter.CallerIdentifierResolver;
import com.example.admission.filter.RateLimitingFilter;
import com.example.admission.model.Tier;
import com.example.admission.service.DefaultTierResolver;
import com.example.admission.service.RateLimitStatusService;
import com.example.admission.service.RateLimiterService;
import com.example.admission.service.TierResolver;
import com.example.admission.store.CounterKeys;
import com.example.admission.store.InMemoryCounterStore;
import com.example.admission.support.MutableClock;
import com.example.admission.support.TestRegistries;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Admin endpoints served through the rate limiting filter, as in a deployment.
 */
class AdminEndpointsBehindFilterTest {

    private static final String ADMIN_TOKEN = "s3cret";
    private static final String CALLER = "ip:127.0.0.1";

    private MutableClock clock;
    private InMemoryCounterStore store;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atSecondsPastMidnight(10);
        store = new InMemoryCounterStore(new CounterKeys("rate_limit", 2), clock);
        LimitRegistry registry = TestRegistries.standard().build();
        RateLimiterProperties properties = new RateLimiterProperties();
        properties.setAdminToken(ADMIN_TOKEN);
        TierResolver tierResolver = new DefaultTierResolver(Tier.FREE);
        CallerIdentifierResolver identifierResolver = new CallerIdentifierResolver();

        RateLimitingFilter filter = new RateLimitingFilter(
                new RateLimiterService(store, registry, properties, clock),
                registry, identifierResolver, tierResolver, new ObjectMapper());
        RateLimitAdminController controller = new RateLimitAdminController(
                new RateLimitStatusService(store, registry, properties, clock),
                identifierResolver, tierResolver, properties);

        mockMvc = MockMvcBuilders.standaloneSetup(controller, new LoginEndpoint())
                .addFilters(filter)
                .build();
    }

    @Test
    void viewingOwnQuotaDoesNotConsumeIt() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/api/v1/rate-limit/me").param("category", "inference"))
                    .andExpect(status().isOk())
                    .andExpect(header().doesNotExist("X-RateLimit-Limit-Minute"))
                    .andExpect(jsonPath("$.status.counts.minute").value(0));
        }

        assertThat(store.peekAll(CALLER, "inference", clock.instant()).getMinute()).isZero();
    }

    @Test
    void statusLookupsDoNotConsumeQuota() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/api/v1/rate-limit/status")
                            .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                            .param("identifier", CALLER))
                    .andExpect(status().isOk());
        }

        assertThat(store.peekAll(CALLER, "inference", clock.instant()).getDay()).isZero();
    }

    @Test
    void exhaustedCallerCannotResetItself() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/api/v1/auth/login")).andExpect(status().isOk());
        }
        mockMvc.perform(get("/api/v1/auth/login")).andExpect(status().isTooManyRequests());

        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"" + CALLER + "\",\"category\":\"auth\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/auth/login")).andExpect(status().isTooManyRequests());
    }

    @Test
    void adminResetRestoresQuota() throws Exception {
        for (int i = 0; i < 6; i++) {
            mockMvc.perform(get("/api/v1/auth/login"));
        }

        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"" + CALLER + "\",\"category\":\"auth\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(true));

        mockMvc.perform(get("/api/v1/auth/login"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Remaining-Minute", "4"));
    }

    @RestController
    static class LoginEndpoint {

        @GetMapping("/api/v1/auth/login")
        public String login() {
            return "ok";
        }
    }
}
