package com.example.admission.config;

import com.example.admission.model.LimitConfig;
import com.example.admission.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binds the shipped application.yml and checks the resulting limit table.
 */
class RateLimiterPropertiesTest {

    private RateLimiterProperties properties;

    @BeforeEach
    void bindApplicationYaml() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        properties = new Binder(ConfigurationPropertySources.from(sources))
                .bind("rate-limiter", RateLimiterProperties.class)
                .get();
    }

    @Test
    void bindsScalarSettings() {
        assertThat(properties.isFailOpenOnRedisError()).isTrue();
        assertThat(properties.getStore()).isEqualTo(RateLimiterProperties.StoreType.REDIS);
        assertThat(properties.getKeyPrefix()).isEqualTo("rate_limit");
        assertThat(properties.getExpiryMultiplier()).isEqualTo(2);
        assertThat(properties.getDefaultTier()).isEqualTo(Tier.FREE);
        assertThat(properties.getMemoryEvictionInterval()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void buildsRegistryWithShippedTable() {
        LimitRegistry registry = LimitRegistry.from(properties);

        assertThat(registry.categories())
                .containsExactlyInAnyOrder("inference", "auth", "prompt_history", "feedback", "cache");
        assertThat(registry.limitsFor("auth", Tier.FREE)).isEqualTo(new LimitConfig(5, 20, 100, 3));
        assertThat(registry.limitsFor("inference", Tier.ENTERPRISE)).isEqualTo(new LimitConfig(200, 5000, 25000, 20));
        assertThat(registry.classify("/api/v1/prompt-history/123")).isEqualTo("prompt_history");
        assertThat(registry.classify("/api/v1/cache/clear")).isEqualTo("cache");
        assertThat(registry.isBypassed("/openapi.json")).isTrue();
        assertThat(registry.isBypassed("/api/v1/rate-limit/health")).isTrue();
        assertThat(registry.isBypassed("/api/v1/rate-limit/me")).isTrue();
        assertThat(registry.isBypassed("/api/v1/rate-limit/status")).isTrue();
    }

    @Test
    void higherTiersNeverGetTighterLimits() {
        LimitRegistry registry = LimitRegistry.from(properties);

        for (String category : registry.categories()) {
            LimitConfig previous = null;
            for (Tier tier : Tier.values()) {
                LimitConfig current = registry.limitsFor(category, tier);
                if (previous != null) {
                    assertThat(current.isAtLeast(previous))
                            .as("%s %s", category, tier)
                            .isTrue();
                }
                previous = current;
            }
        }
    }
}
