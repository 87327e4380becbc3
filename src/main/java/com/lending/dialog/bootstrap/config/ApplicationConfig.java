package com.lending.dialog.bootstrap.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lending.dialog.application.port.out.AuditSink;
import com.lending.dialog.application.port.out.DecisionPort;
import com.lending.dialog.application.port.out.LoanRecordStore;
import com.lending.dialog.application.port.out.MessagingPort;
import com.lending.dialog.application.port.out.SessionStore;
import com.lending.dialog.application.port.out.SupportPort;
import com.lending.dialog.application.service.DialogOrchestrator;
import com.lending.dialog.application.service.FieldValidator;
import com.lending.dialog.application.service.GatewayInvoker;
import com.lending.dialog.application.service.IdentityLockRegistry;
import com.lending.dialog.application.service.IntentRouter;
import com.lending.dialog.application.service.JourneyDefinition;
import com.lending.dialog.application.service.OfferPresentationPolicy;
import com.lending.dialog.application.service.PromptCatalog;
import com.lending.dialog.application.service.PromptFactory;
import com.lending.dialog.application.service.SessionLifecycleManager;
import com.lending.dialog.application.service.SupportKnowledgeBase;

/**
 * Application-level bean configuration.
 * <p>
 * Wires application services (core layer) with adapter implementations
 * via constructor injection, maintaining hexagonal architecture boundaries.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper configured for production use.
     * - Java 8 Time support (Instant, LocalDate)
     * - Lenient deserialization (ignore unknown properties)
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for decision and support gateway calls. A full queue is a
     * gateway failure, never a caller-runs fallback.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService gatewayExecutor(DialogProperties properties) {
        int poolSize = properties.getGateway().getPoolSize();
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(properties.getGateway().getQueueCapacity()),
                new ThreadFactory() {
                    private final AtomicInteger counter = new AtomicInteger(0);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "dialog-gateway-" + counter.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    // ─────────────────── Core services (no Spring annotations) ───────────────────

    @Bean
    public JourneyDefinition journeyDefinition() {
        return new JourneyDefinition();
    }

    @Bean
    public PromptCatalog promptCatalog() {
        return new PromptCatalog();
    }

    @Bean
    public FieldValidator fieldValidator(Clock clock, DialogProperties properties) {
        return new FieldValidator(clock,
                properties.getSession().getMinAge(),
                properties.getSession().getMaxAge());
    }

    @Bean
    public SessionLifecycleManager sessionLifecycleManager(DialogProperties properties) {
        return new SessionLifecycleManager(properties.getSession().getInactivityThreshold());
    }

    @Bean
    public IntentRouter intentRouter() {
        return new IntentRouter();
    }

    @Bean
    public SupportKnowledgeBase supportKnowledgeBase(PromptCatalog catalog) {
        return new SupportKnowledgeBase(catalog);
    }

    @Bean
    public PromptFactory promptFactory(PromptCatalog catalog, DialogProperties properties) {
        DialogProperties.Links links = properties.getLinks();
        return new PromptFactory(catalog,
                new PromptFactory.Links(links.getAgreementUrl(), links.getStatementUrl(), links.getAppUrl(),
                        links.getRepayUrl(), links.getSupportEmail()),
                properties.getOffers().getMaxOptionsPerPrompt());
    }

    @Bean
    public OfferPresentationPolicy offerPresentationPolicy(DialogProperties properties, AuditSink auditSink) {
        return new OfferPresentationPolicy(properties.getOffers().getPresentationCap(), auditSink);
    }

    @Bean
    public GatewayInvoker gatewayInvoker(ExecutorService gatewayExecutor, DialogProperties properties, Clock clock) {
        return new GatewayInvoker(gatewayExecutor, properties.getGateway().getTimeout(), clock);
    }

    @Bean
    public IdentityLockRegistry identityLockRegistry(DialogProperties properties) {
        return new IdentityLockRegistry(properties.getConcurrency().getLockTimeout());
    }

    /**
     * DialogOrchestrator, the core use-case implementation. The support
     * responder is optional and only present when the LLM is enabled.
     */
    @Bean
    public DialogOrchestrator dialogOrchestrator(
            SessionStore sessionStore,
            MessagingPort messagingPort,
            DecisionPort decisionPort,
            ObjectProvider<SupportPort> supportPort,
            AuditSink auditSink,
            LoanRecordStore loanRecordStore,
            JourneyDefinition journeyDefinition,
            FieldValidator fieldValidator,
            SessionLifecycleManager sessionLifecycleManager,
            IntentRouter intentRouter,
            SupportKnowledgeBase supportKnowledgeBase,
            PromptFactory promptFactory,
            OfferPresentationPolicy offerPresentationPolicy,
            GatewayInvoker gatewayInvoker,
            IdentityLockRegistry identityLockRegistry,
            Clock clock,
            DialogProperties properties) {
        return new DialogOrchestrator(
                sessionStore, messagingPort, decisionPort, supportPort.getIfAvailable(), auditSink,
                loanRecordStore, journeyDefinition, fieldValidator, sessionLifecycleManager, intentRouter,
                supportKnowledgeBase, promptFactory, offerPresentationPolicy, gatewayInvoker,
                identityLockRegistry, clock, properties.getSupport().getHandoffQueue());
    }
}
