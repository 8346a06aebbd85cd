package com.numaansystems.custody.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.crypto.CredentialCipher;
import com.numaansystems.custody.lifecycle.TokenLifecycleManager;
import com.numaansystems.custody.ratelimit.FixedWindowRateLimiter;
import com.numaansystems.custody.ratelimit.RequestAdmission;
import com.numaansystems.custody.resource.GoogleResourceFetcher;
import com.numaansystems.custody.resource.ResourceFetcher;
import com.numaansystems.custody.security.AccessGate;
import com.numaansystems.custody.security.AddressAllowList;
import com.numaansystems.custody.state.ConsumedNonceLedger;
import com.numaansystems.custody.state.SignedStateCodec;
import com.numaansystems.custody.store.CredentialRecordRepository;
import com.numaansystems.custody.store.InMemoryCredentialRecordRepository;
import com.numaansystems.custody.store.JdbcCredentialRecordRepository;
import com.numaansystems.custody.store.TokenStore;
import com.numaansystems.custody.upstream.AuthorizationServerClient;
import com.numaansystems.custody.upstream.GoogleAuthorizationServerClient;
import com.numaansystems.custody.upstream.UpstreamHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the custody components from {@link CustodyProperties}.
 *
 * <p>Components are plain classes with constructor arguments; this is the
 * only place that reads configuration and decides which implementation is
 * used. Missing or malformed secrets fail the application context at
 * startup.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class CustodyConfig {

    private static final Logger logger = LoggerFactory.getLogger(CustodyConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialCipher credentialCipher(CustodyProperties properties) {
        return CredentialCipher.fromProperties(properties.crypto());
    }

    @Bean
    public SignedStateCodec signedStateCodec(CustodyProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new SignedStateCodec(properties.state().signingSecret(), objectMapper, clock);
    }

    @Bean
    public ConsumedNonceLedger consumedNonceLedger(CustodyProperties properties, Clock clock) {
        return new ConsumedNonceLedger(clock, properties.state().singleUse());
    }

    @Bean
    @ConditionalOnProperty(prefix = "custody.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public CredentialRecordRepository jdbcCredentialRecordRepository(JdbcTemplate jdbcTemplate) {
        logger.info("Using JDBC credential store");
        return new JdbcCredentialRecordRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "custody.store", name = "type", havingValue = "memory")
    public CredentialRecordRepository inMemoryCredentialRecordRepository() {
        logger.warn("Using in-memory credential store; credentials are lost on restart");
        return new InMemoryCredentialRecordRepository();
    }

    @Bean
    public TokenStore tokenStore(CredentialRecordRepository repository, CredentialCipher cipher) {
        return new TokenStore(repository, cipher);
    }

    @Bean
    public UpstreamHttpClient upstreamHttpClient(CustodyProperties properties) {
        CustodyProperties.Google google = properties.google();
        return new UpstreamHttpClient(google.connectTimeout(), google.responseTimeout());
    }

    @Bean
    public AuthorizationServerClient authorizationServerClient(CustodyProperties properties,
                                                               UpstreamHttpClient upstreamHttpClient,
                                                               ObjectMapper objectMapper) {
        if (!properties.google().isClientConfigured()) {
            logger.warn("Google client id/secret not configured; consent flows will fail until they are set");
        }
        return new GoogleAuthorizationServerClient(properties.google(), upstreamHttpClient, objectMapper);
    }

    @Bean
    public ResourceFetcher resourceFetcher(CustodyProperties properties,
                                           UpstreamHttpClient upstreamHttpClient,
                                           ObjectMapper objectMapper) {
        return new GoogleResourceFetcher(upstreamHttpClient, objectMapper, properties.google().resourceBaseUrls());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService custodyWorkers(CustodyProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.workerThreads()),
                new CustomizableThreadFactory("custody-worker-"));
    }

    @Bean
    public TokenLifecycleManager tokenLifecycleManager(CustodyProperties properties,
                                                       SignedStateCodec stateCodec,
                                                       ConsumedNonceLedger nonceLedger,
                                                       TokenStore tokenStore,
                                                       AuthorizationServerClient authorizationServerClient,
                                                       ExecutorService custodyWorkers,
                                                       Clock clock) {
        return new TokenLifecycleManager(
                properties.google(),
                properties.state().ttl(),
                properties.safetyMargin(),
                stateCodec,
                nonceLedger,
                tokenStore,
                authorizationServerClient,
                custodyWorkers,
                clock);
    }

    @Bean
    public FixedWindowRateLimiter fixedWindowRateLimiter(CustodyProperties properties, Clock clock) {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(clock, properties.rateLimit().window());
        limiter.scheduleSweeps(properties.rateLimit().sweepInterval());
        return limiter;
    }

    @Bean
    public RequestAdmission requestAdmission(CustodyProperties properties, FixedWindowRateLimiter limiter) {
        return new RequestAdmission(limiter, properties.rateLimit().maxPerKey(), properties.rateLimit().maxPerUser());
    }

    @Bean
    public AccessGate accessGate(CustodyProperties properties) {
        CustodyProperties.Internal internal = properties.internal();
        return new AccessGate(internal.apiKey(), AddressAllowList.parse(internal.allowedOrigins()));
    }
}
