package com.synthgov.autoconfigure;

import com.synthgov.core.GovernanceEngine;
import com.synthgov.core.advisory.AdvisoryNarrator;
import com.synthgov.core.advisory.GovernanceService;
import com.synthgov.core.advisory.SpringAiNarrator;
import com.synthgov.core.audit.AuditSink;
import com.synthgov.core.audit.InMemoryAuditSink;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.config.GovernanceProperties;
import com.synthgov.core.plugin.ModuleContext;
import com.synthgov.core.plugin.RuleModuleRegistry;
import com.synthgov.core.plugin.ThreatRuleModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for SynthGov.
 * Activated when {@code synthgov.enabled=true} (default).
 */
@AutoConfiguration
@ConditionalOnProperty(name = "synthgov.enabled", havingValue = "true", matchIfMissing = true)
@ComponentScan(basePackages = "com.synthgov.module")
@EnableConfigurationProperties
public class SynthGovAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SynthGovAutoConfiguration.class);

    static final String CHAT_CLIENT_CLASS = "org.springframework.ai.chat.client.ChatClient";

    @Bean
    @ConfigurationProperties(prefix = "synthgov")
    public GovernanceProperties governanceProperties() {
        return new GovernanceProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModuleContext moduleContext(GovernanceProperties properties) {
        return new ModuleContext(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleModuleRegistry ruleModuleRegistry(List<ThreatRuleModule> modules) {
        return new RuleModuleRegistry(modules);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatCatalog threatCatalog(RuleModuleRegistry registry, ModuleContext context) {
        return registry.buildCatalog(context);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock synthgovClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public GovernanceEngine governanceEngine(ThreatCatalog catalog, GovernanceProperties properties, Clock clock) {
        return new GovernanceEngine(catalog, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink(GovernanceProperties properties) {
        log.info("[SynthGov] Using InMemoryAuditSink (capacity {})", properties.getAudit().getCapacity());
        return new InMemoryAuditSink(properties.getAudit().getCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public AdvisoryNarrator advisoryNarrator(ApplicationContext applicationContext) {
        // Spring AI is optional; use its ChatClient only when the app defines one
        return new SpringAiNarrator(findChatClient(applicationContext));
    }

    @Bean
    @ConditionalOnMissingBean(name = "synthgovAdvisoryExecutor")
    public ThreadPoolTaskExecutor synthgovAdvisoryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("synthgov-advisory-");
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public GovernanceService governanceService(GovernanceEngine engine, AdvisoryNarrator narrator,
            AuditSink auditSink, GovernanceProperties properties,
            @Qualifier("synthgovAdvisoryExecutor") ThreadPoolTaskExecutor advisoryExecutor, Clock clock) {
        // the raw pool, so cancelling a timed-out narration interrupts its thread
        return new GovernanceService(engine, narrator, auditSink, properties,
                advisoryExecutor.getThreadPoolExecutor(), clock);
    }

    static Object findChatClient(ApplicationContext applicationContext) {
        ClassLoader classLoader = applicationContext.getClassLoader();
        if (!ClassUtils.isPresent(CHAT_CLIENT_CLASS, classLoader)) {
            return null;
        }
        try {
            Class<?> chatClientType = ClassUtils.forName(CHAT_CLIENT_CLASS, classLoader);
            return applicationContext.getBeanProvider(chatClientType).getIfAvailable();
        } catch (ClassNotFoundException | LinkageError e) {
            log.warn("[SynthGov] Spring AI ChatClient could not be loaded: {}", e.getMessage());
            return null;
        }
    }
}
