package com.atrium.portfolio.config;

import com.atrium.access.CredentialAuthenticator;
import com.atrium.access.PrincipalResolver;
import com.atrium.access.RequestPipeline;
import com.atrium.audit.AuditEntryFactory;
import com.atrium.audit.AuditRecorder;
import com.atrium.identity.Argon2CredentialVerifier;
import com.atrium.identity.CredentialVerifier;
import com.atrium.identity.TokenCodec;
import com.atrium.observability.MetricFactory;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the access-control libraries to this service's store and configuration.
 *
 * <p>The signing key is derived once here from {@link TokenProperties} and lives only inside
 * the {@link TokenCodec} bean.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(TokenProperties properties, Clock clock) {
        var settings = properties.toSettings();
        log.info("Token codec configured: {}", settings);
        return new TokenCodec(settings, clock);
    }

    @Bean
    public CredentialVerifier credentialVerifier(PasswordProperties properties) {
        return new Argon2CredentialVerifier(properties.toSettings());
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AtriumProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public AuditRecorder auditRecorder(InMemoryPortfolioStore store, Clock clock) {
        return new AuditRecorder(store, new AuditEntryFactory(clock));
    }

    @Bean
    public PrincipalResolver principalResolver(
            TokenCodec codec, InMemoryPortfolioStore store, MetricFactory metrics) {
        return new PrincipalResolver(codec, store, metrics);
    }

    @Bean
    public CredentialAuthenticator credentialAuthenticator(
            InMemoryPortfolioStore store,
            CredentialVerifier verifier,
            TokenCodec codec,
            MetricFactory metrics) {
        return new CredentialAuthenticator(store, verifier, codec, metrics);
    }

    @Bean
    public RequestPipeline requestPipeline(
            PrincipalResolver resolver,
            InMemoryPortfolioStore store,
            AuditRecorder auditRecorder,
            MetricFactory metrics) {
        return new RequestPipeline(resolver, store, store, auditRecorder, metrics);
    }
}
