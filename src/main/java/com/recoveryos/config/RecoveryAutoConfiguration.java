package com.recoveryos.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.recoveryos.checkin.CheckinService;
import com.recoveryos.checkin.CheckinStore;
import com.recoveryos.consent.ConsentConfirmationListener;
import com.recoveryos.consent.ConsentService;
import com.recoveryos.consent.ConsentStore;
import com.recoveryos.consent.LoggingConsentConfirmationDispatcher;
import com.recoveryos.metrics.RecoveryMetrics;
import com.recoveryos.risk.DefaultRiskScorer;
import com.recoveryos.risk.RiskScorer;
import com.recoveryos.safety.ReflectionAuditor;
import com.recoveryos.security.filters.RateLimitFilter;
import com.recoveryos.security.ratelimit.ClientKeyStrategy;
import com.recoveryos.security.ratelimit.RateLimitProperties;
import com.recoveryos.security.ratelimit.RateLimitService;
import com.recoveryos.utils.DefaultClientKey;
import com.recoveryos.utils.SubjectPseudonymizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Builds the stores, the scorer and the reflection auditor once per
 * application context. Tests that need isolated state construct the classes
 * directly instead.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({RateLimitProperties.class, RecoveryProperties.class})
public class RecoveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Ticker rateLimitTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClientKeyStrategy clientKeyStrategy(RateLimitProperties properties) {
        if (properties.getClientKeySalt() == null || properties.getClientKeySalt().isBlank()) {
            log.warn("rate-limit.client-key-salt is empty; client keys are unsalted hashes");
        }
        return new DefaultClientKey(properties.getClientKeySalt());
    }

    @Bean
    @ConditionalOnMissingBean
    public SubjectPseudonymizer subjectPseudonymizer(RecoveryProperties properties) {
        return new SubjectPseudonymizer(properties.getPseudonymSalt());
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitService rateLimitService(RateLimitProperties properties, Ticker rateLimitTicker) {
        return new RateLimitService(rateLimitTicker, properties.idleEviction());
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinStore checkinStore() {
        return new CheckinStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsentStore consentStore() {
        return new ConsentStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskScorer riskScorer() {
        return new DefaultRiskScorer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryMetrics recoveryMetrics(
            ObjectProvider<MeterRegistry> meterRegistryProvider,
            CheckinStore checkinStore
    ) {
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        return new RecoveryMetrics(meterRegistry, checkinStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsentConfirmationListener consentConfirmationListener(SubjectPseudonymizer pseudonymizer) {
        return new LoggingConsentConfirmationDispatcher(pseudonymizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReflectionAuditor reflectionAuditor() {
        return new ReflectionAuditor();
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinService checkinService(
            CheckinStore store,
            RiskScorer scorer,
            RecoveryMetrics metrics,
            SubjectPseudonymizer pseudonymizer,
            ReflectionAuditor reflectionAuditor
    ) {
        return new CheckinService(store, scorer, metrics, pseudonymizer, reflectionAuditor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsentService consentService(
            ConsentStore store,
            ConsentConfirmationListener listener,
            RecoveryMetrics metrics
    ) {
        return new ConsentService(store, listener, metrics);
    }

    // Spring MVC already registers a "requestContextFilter" bean
    @Bean(name = "recoveryRequestContextFilter")
    public FilterRegistrationBean<RequestContextFilter> recoveryRequestContextFilter(ClientKeyStrategy clientKeyStrategy) {
        FilterRegistrationBean<RequestContextFilter> registration =
                new FilterRegistrationBean<>(new RequestContextFilter(clientKeyStrategy));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }

    @Bean(name = "recoveryRateLimitFilter")
    public FilterRegistrationBean<RateLimitFilter> recoveryRateLimitFilter(
            RateLimitProperties properties,
            RateLimitService service,
            ClientKeyStrategy clientKeyStrategy,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(properties, service, clientKeyStrategy, objectMapper));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
