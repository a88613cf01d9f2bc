package com.strata.config;

import com.strata.query.QueryOverrides;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wiring for the backend client: HTTP connection, query worker pool, clock
 * and the default request overrides.
 */
@Configuration
public class GatewayConfig {
    private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);

    @Value("${strata.gateway.url:http://localhost:1218}")
    private String url;

    @Value("${strata.gateway.connect-timeout-ms:1000}")
    private int connectTimeoutMs;

    @Value("${strata.gateway.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Value("${strata.gateway.pool-size:10}")
    private int poolSize;

    @Value("${strata.gateway.queue-size:1000}")
    private int queueSize;

    @Value("${strata.gateway.max-in-memory-bytes:16777216}")
    private int maxInMemoryBytes;

    @Value("${strata.gateway.consistent:false}")
    private boolean consistent;

    @Bean(name = "backendWebClient")
    public WebClient backendWebClient() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(readTimeoutMs));

        logger.info("Backend client initialized: {} (connectTimeout={}ms, readTimeout={}ms)",
            url, connectTimeoutMs, readTimeoutMs);
        return WebClient.builder()
            .baseUrl(url)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
            .build();
    }

    /**
     * Worker pool for concurrent backend queries, shared by all callers.
     */
    @Bean(name = "queryScheduler", destroyMethod = "dispose")
    public Scheduler queryScheduler() {
        return Schedulers.newBoundedElastic(poolSize, queueSize, "strata-query");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "defaultQueryOverrides")
    public QueryOverrides defaultQueryOverrides() {
        return QueryOverrides.consistent(consistent);
    }
}
