package com.nrqlbridge.service.core.config;

import com.nrqlbridge.service.core.metrics.QueryMetrics;
import com.nrqlbridge.service.core.metrics.QueryMetricsRegistry;
import com.nrqlbridge.service.core.ratelimit.RateLimiter;
import com.nrqlbridge.service.core.ratelimit.TokenBucketRateLimiter;
import com.nrqlbridge.service.core.settings.ConnectionSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfiguration {

    @Bean
    public RateLimiter nrqlRateLimiter(BridgeProperties props) {
        BridgeProperties.RateLimit rateLimit = props.getRateLimit();
        if (!rateLimit.isEnabled()) {
            log.info("NRQL rate limiting disabled");
            return RateLimiter.UNLIMITED;
        }
        log.info("NRQL rate limit: {} query/s, burst {}", rateLimit.getRate(), rateLimit.getCapacity());
        return new TokenBucketRateLimiter(rateLimit.getRate(), rateLimit.getCapacity());
    }

    @Bean
    public QueryMetrics nrqlQueryMetrics(BridgeProperties props) {
        return props.getMetrics().isEnabled() ? new QueryMetricsRegistry() : QueryMetrics.NOOP;
    }

    @Bean
    public ConnectionSettings connectionSettings(BridgeProperties props) {
        BridgeProperties.Connection connection = props.getConnection();
        return new ConnectionSettings(connection.getApiKey(), connection.getAccountId());
    }
}
