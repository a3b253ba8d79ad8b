package com.example.admission.controller;

import com.example.admission.config.LimitRegistry;
import com.example.admission.config.RateLimiterProperties;
import com.example.admission.filter.CallerIdentifierResolver;
import com.example.admission.model.Tier;
import com.example.admission.service.DefaultTierResolver;
import com.example.admission.service.RateLimitStatusService;
import com.example.admission.service.RateLimiterService;
import com.example.admission.store.CounterKeys;
import com.example.admission.store.CounterStore;
import com.example.admission.store.InMemoryCounterStore;
import com.example.admission.support.MutableClock;
import com.example.admission.support.TestRegistries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RateLimitAdminControllerTest {

    private static final String ADMIN_TOKEN = "s3cret";

    private MutableClock clock;
    private LimitRegistry registry;
    private RateLimiterProperties properties;
    private InMemoryCounterStore store;
    private RateLimiterService rateLimiterService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atSecondsPastMidnight(10);
        registry = TestRegistries.standard().build();
        properties = new RateLimiterProperties();
        properties.setAdminToken(ADMIN_TOKEN);
        store = new InMemoryCounterStore(new CounterKeys("rate_limit", 2), clock);
        rateLimiterService = new RateLimiterService(store, registry, properties, clock);
        mockMvc = buildMockMvc(store);
    }

    private MockMvc buildMockMvc(CounterStore counterStore) {
        RateLimitStatusService statusService = new RateLimitStatusService(counterStore, registry, properties, clock);
        RateLimitAdminController controller = new RateLimitAdminController(
                statusService, new CallerIdentifierResolver(), new DefaultTierResolver(Tier.FREE), properties);
        return MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void statusReturnsCountsWithoutConsumingQuota() throws Exception {
        rateLimiterService.check("user:7", "auth", Tier.FREE);
        rateLimiterService.check("user:7", "auth", Tier.FREE);

        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/api/v1/rate-limit/status")
                            .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                            .param("identifier", "user:7")
                            .param("category", "auth")
                            .param("tier", "free"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.category").value("auth"))
                    .andExpect(jsonPath("$.tier").value("FREE"))
                    .andExpect(jsonPath("$.counts.minute").value(2))
                    .andExpect(jsonPath("$.limits.requestsPerMinute").value(5))
                    .andExpect(jsonPath("$.usagePercentages.minute").value(40.0))
                    .andExpect(jsonPath("$.storeAvailable").value(true));
        }
    }

    @Test
    void statusFallsBackForUnknownCategoryAndTier() throws Exception {
        mockMvc.perform(get("/api/v1/rate-limit/status")
                            .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .param("identifier", "ip:10.0.0.1")
                        .param("category", "nope")
                        .param("tier", "platinum"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("inference"))
                .andExpect(jsonPath("$.tier").value("FREE"))
                .andExpect(jsonPath("$.counts.minute").value(0));
    }

    @Test
    void resetClearsCounters() throws Exception {
        rateLimiterService.check("user:7", "auth", Tier.FREE);

        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"user:7\",\"category\":\"auth\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(true))
                .andExpect(jsonPath("$.identifier").value("user:7"))
                .andExpect(jsonPath("$.category").value("auth"));

        assertThat(store.peekAll("user:7", "auth", clock.instant()).getMinute()).isZero();

        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"user:7\",\"category\":\"auth\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(false));
    }

    @Test
    void resetRequiresIdentifier() throws Exception {
        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\" \",\"category\":\"auth\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resetWithoutAdminTokenIsForbidden() throws Exception {
        rateLimiterService.check("ip:127.0.0.1", "auth", Tier.FREE);

        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"ip:127.0.0.1\",\"category\":\"auth\"}"))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/v1/rate-limit/reset")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, "guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"ip:127.0.0.1\",\"category\":\"auth\"}"))
                .andExpect(status().isForbidden());

        assertThat(store.peekAll("ip:127.0.0.1", "auth", clock.instant()).getMinute()).isEqualTo(1);
    }

    @Test
    void statusOfOtherCallersRequiresAdminToken() throws Exception {
        mockMvc.perform(get("/api/v1/rate-limit/status").param("identifier", "user:7"))
                .andExpect(status().isForbidden());
    }

    @Test
    void administrationIsDisabledWithoutConfiguredToken() throws Exception {
        properties.setAdminToken(null);
        mockMvc = buildMockMvc(store);

        mockMvc.perform(get("/api/v1/rate-limit/status")
                        .header(RateLimitAdminController.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                        .param("identifier", "user:7"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/rate-limit/health"))
                .andExpect(status().isOk());
    }

    @Test
    void healthReportsStoreAndConfiguration() throws Exception {
        mockMvc.perform(get("/api/v1/rate-limit/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.storeReachable").value(true))
                .andExpect(jsonPath("$.storeType").value("memory"))
                .andExpect(jsonPath("$.failOpen").value(true))
                .andExpect(jsonPath("$.categoriesConfigured", hasItems("inference", "auth")));
    }

    @Test
    void healthIs503WhenStoreUnreachable() throws Exception {
        CounterStore down = mock(CounterStore.class);
        when(down.isReachable()).thenReturn(false);
        when(down.type()).thenReturn("redis");
        mockMvc = buildMockMvc(down);

        mockMvc.perform(get("/api/v1/rate-limit/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.storeReachable").value(false));
    }

    @Test
    void meDescribesTheCallingIdentifier() throws Exception {
        rateLimiterService.check("ip:198.51.100.9", "inference", Tier.FREE);

        mockMvc.perform(get("/api/v1/rate-limit/me").header("X-Forwarded-For", "198.51.100.9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status.identifier").value("ip:198.51.100.9"))
                .andExpect(jsonPath("$.status.counts.minute").value(1))
                .andExpect(jsonPath("$.summary", containsString("Rate limit status for free tier:")))
                .andExpect(jsonPath("$.summary", containsString("- Minute: 1/3 (33.3%)")));

        assertThat(store.peekAll("ip:198.51.100.9", "inference", clock.instant()).getMinute()).isEqualTo(1);
    }
}
