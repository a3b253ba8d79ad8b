package com.example.admission.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.List;

@Configuration
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Lua script incrementing the minute, hour and day counters in one atomic step.
     * <p>
     * Loaded once at startup and cached by Spring/Data Redis.
     */
    @Bean
    public DefaultRedisScript<List> windowCounterScript() {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/window_counter.lua"));
        script.setResultType(List.class);
        return script;
    }

    /**
     * Clock bean for window arithmetic.
     * <p>
     * Using UTC clock for consistent window boundaries across distributed instances.
     * Can be overridden in tests with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
