package com.example.admission.config;

import com.example.admission.store.CounterKeys;
import com.example.admission.store.CounterStore;
import com.example.admission.store.InMemoryCounterStore;
import com.example.admission.store.RedisCounterStore;
import com.example.admission.service.DefaultTierResolver;
import com.example.admission.service.TierResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.List;

/**
 * Wires the limit table, the counter store selected by {@code rate-limiter.store} and the
 * tier lookup.
 */
@Configuration
public class AdmissionConfig {

    private static final Logger log = LoggerFactory.getLogger(AdmissionConfig.class);

    @Bean
    public LimitRegistry limitRegistry(RateLimiterProperties properties) {
        LimitRegistry registry = LimitRegistry.from(properties);
        log.info("Rate limits loaded for categories {} (default category={}, default tier={})",
                registry.categories(), registry.defaultCategory(), registry.defaultTier());
        return registry;
    }

    @Bean
    public CounterKeys counterKeys(RateLimiterProperties properties) {
        return new CounterKeys(properties.getKeyPrefix(), properties.getExpiryMultiplier());
    }

    @Bean
    public CounterStore counterStore(
            RateLimiterProperties properties,
            CounterKeys counterKeys,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            DefaultRedisScript<List> windowCounterScript,
            Clock clock
    ) {
        if (properties.getStore() == RateLimiterProperties.StoreType.MEMORY) {
            return new InMemoryCounterStore(counterKeys, clock);
        }
        log.info("Using Redis rate limit counters with key prefix {}", properties.getKeyPrefix());
        return new RedisCounterStore(redisTemplate.getObject(), windowCounterScript, counterKeys, clock);
    }

    /**
     * Every caller gets the default tier until a tier lookup bean is provided.
     */
    @Bean
    @ConditionalOnMissingBean(TierResolver.class)
    public TierResolver tierResolver(RateLimiterProperties properties) {
        log.info("No TierResolver configured, all callers use tier {}", properties.getDefaultTier());
        return new DefaultTierResolver(properties.getDefaultTier());
    }
}
