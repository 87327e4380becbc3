package com.lending.dialog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.application.port.in.DialogOutcome;
import com.lending.dialog.application.port.out.AuditSink;
import com.lending.dialog.application.port.out.DecisionPort;
import com.lending.dialog.application.port.out.LoanRecordStore;
import com.lending.dialog.application.port.out.MessagingPort;
import com.lending.dialog.application.port.out.SupportPort;
import com.lending.dialog.domain.entity.BankDetails;
import com.lending.dialog.domain.entity.FinalDecision;
import com.lending.dialog.domain.entity.InboundEvent;
import com.lending.dialog.domain.entity.LoanRecord;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.PromptSpec;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;

@ExtendWith(MockitoExtension.class)
class DialogOrchestratorTest {

    private static final String ID = "+919800000001";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String HANDOFF_QUEUE = "test-support-queue";

    @Mock
    private MessagingPort messagingPort;

    @Mock
    private DecisionPort decisionPort;

    @Mock
    private SupportPort supportPort;

    @Mock
    private AuditSink auditSink;

    @Mock
    private LoanRecordStore loanRecordStore;

    private InMemorySessionStore store;
    private PromptCatalog catalog;
    private ExecutorService gatewayExecutor;
    private DialogOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemorySessionStore();
        catalog = new PromptCatalog();
        gatewayExecutor = Executors.newFixedThreadPool(2);

        orchestrator = new DialogOrchestrator(
                store, messagingPort, decisionPort, supportPort, auditSink, loanRecordStore,
                new JourneyDefinition(),
                new FieldValidator(clock, 18, 75),
                new SessionLifecycleManager(Duration.ofMinutes(30)),
                new IntentRouter(),
                new SupportKnowledgeBase(catalog),
                new PromptFactory(catalog, new PromptFactory.Links("https://x/agreement.pdf",
                        "https://x/statement.pdf", "https://x/app", "https://x/repay", "care@example.com"), 3),
                new OfferPresentationPolicy(3, auditSink),
                new GatewayInvoker(gatewayExecutor, Duration.ofSeconds(2), clock),
                new IdentityLockRegistry(Duration.ofSeconds(5)),
                clock,
                HANDOFF_QUEUE);
    }

    @AfterEach
    void tearDown() {
        gatewayExecutor.shutdownNow();
    }

    // ─────────────────── Onboarding ───────────────────

    @Test
    void testOnboarding_LoanEnglishConfirmName() {
        // When
        DialogOutcome started = orchestrator.handle(InboundEvent.text(ID, "loan", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.ADVANCED, started.kind());
        assertEquals(Journey.ONBOARDING, store.get(ID).getJourney());
        assertEquals(StepId.LANGUAGE_SELECT, store.get(ID).getCurrentStep());

        // When
        orchestrator.handle(InboundEvent.text(ID, "English", NOW));

        // Then
        assertEquals(Language.EN, store.get(ID).getLanguage());
        assertEquals(StepId.INTENT_CONFIRM, store.get(ID).getCurrentStep());

        // When
        orchestrator.handle(InboundEvent.option(ID, JourneyDefinition.OPTION_GET_LOAN, NOW));

        // Then
        assertEquals(StepId.NAME, store.get(ID).getCurrentStep());

        // When
        DialogOutcome named = orchestrator.handle(InboundEvent.text(ID, "  Jane   Doe ", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.ADVANCED, named.kind());
        assertEquals("Jane Doe", store.get(ID).getAnswers().get(Session.ANSWER_FULL_NAME));
        assertEquals(StepId.DOB, store.get(ID).getCurrentStep());
        assertEquals(List.of(PromptSpec.text(catalog.text(Language.EN, "ask_dob"))), named.prompts());
        assertEquals(4, store.saveCount());
    }

    @Test
    void testNegativeIncome_RepromptsWithHint() {
        // Given
        seed(Journey.ONBOARDING, StepId.INCOME, baseAnswers(false), Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "-500", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.VALIDATION_FAILED, outcome.kind());
        assertEquals(StepId.INCOME, store.get(ID).getCurrentStep());
        assertFalse(store.get(ID).getAnswers().containsKey(Session.ANSWER_MONTHLY_INCOME));
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "hint_non_positive")), outcome.prompts().get(0));
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "ask_salary")), outcome.prompts().get(1));
    }

    @Test
    void testConsentDeclined_RepromptsWithConsentHint() {
        // Given
        seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "consent_no", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.VALIDATION_FAILED, outcome.kind());
        assertEquals(StepId.CONSENT, store.get(ID).getCurrentStep());
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "hint_consent_required")), outcome.prompts().get(0));
        verifyNoInteractions(decisionPort);
    }

    @Test
    void testSameEventTwice_SamePrompts() {
        // Given
        Session seeded = seed(Journey.ONBOARDING, StepId.DOB, baseAnswers(false), Map.of(), List.of());
        InboundEvent event = InboundEvent.text(ID, "31-12-1995", NOW);

        // When
        DialogOutcome first = orchestrator.handle(event);
        store.put(seeded);
        DialogOutcome second = orchestrator.handle(event);

        // Then
        assertEquals(first.kind(), second.kind());
        assertEquals(first.prompts(), second.prompts());
        assertEquals(LocalDate.of(1995, 12, 31), store.get(ID).getAnswers().get(Session.ANSWER_DOB));
    }

    // ─────────────────── Gateway steps ───────────────────

    @Test
    void testConsentGiven_OffersGeneratedAndTruncated() {
        // Given
        seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), Map.of(), List.of());
        when(decisionPort.proposeOffers(any())).thenReturn(List.of(
                offer(1, "40000"), offer(2, "45000"), offer(3, "50000"), offer(4, "55000"), offer(5, "60000")));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "consent_yes", NOW));

        // Then
        Session saved = store.get(ID);
        assertEquals(DialogOutcome.Kind.ADVANCED, outcome.kind());
        assertEquals(StepId.OFFER_SELECTION, saved.getCurrentStep());
        assertEquals(3, saved.getOffers().size());
        assertTrue(saved.flag(Session.FLAG_CONSENT_GIVEN));
        assertTrue(saved.flag(Session.FLAG_OFFERS_GENERATED));
        verify(auditSink).record(eq(ID), eq(OfferPresentationPolicy.AUDIT_OFFERS_TRUNCATED),
                argThat(payload -> Integer.valueOf(5).equals(payload.get("returned"))), eq(NOW));
    }

    @Test
    void testNoOffers_RejectedBackToMenu() {
        // Given
        seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), Map.of(), List.of());
        when(decisionPort.proposeOffers(any())).thenReturn(List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "consent_yes", NOW));

        // Then
        assertEquals(Journey.NONE, store.get(ID).getJourney());
        assertTrue(outcome.prompts().contains(PromptSpec.text(catalog.text(Language.EN, "decision_rejected", "policy"))));
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_OFFERS_REJECTED), anyMap(), eq(NOW));
    }

    @Test
    void testGatewayFailure_SessionNotSaved() {
        // Given
        Session seeded = seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), Map.of(), List.of());
        when(decisionPort.proposeOffers(any())).thenThrow(new IllegalStateException("backend down"));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "consent_yes", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.GATEWAY_FAILED, outcome.kind());
        assertEquals(seeded, store.get(ID));
        assertEquals(0, store.saveCount());
        verify(messagingPort).sendPrompt(ID, PromptSpec.text(catalog.text(Language.EN, "try_again")));
    }

    @Test
    void testGatewayTimeout_NothingSavedOrSent() {
        // Given
        seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), Map.of(), List.of());
        when(decisionPort.proposeOffers(any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        InboundEvent event = new InboundEvent("evt-deadline", ID, null, "consent_yes", null, NOW,
                NOW.plusMillis(200));

        // When
        DialogOutcome outcome = orchestrator.handle(event);

        // Then
        assertEquals(DialogOutcome.Kind.TIMED_OUT, outcome.kind());
        assertEquals(0, store.saveCount());
        verifyNoInteractions(messagingPort);
    }

    @Test
    void testAgreementSigned_ApprovedLoanMovesToPostLoan() {
        // Given
        Map<String, Object> answers = baseAnswers(true);
        answers.put(Session.ANSWER_CHOSEN_OFFER, 2);
        answers.put(Session.ANSWER_BANK_DETAILS, new BankDetails("HDFC0001234", "123456789012"));
        Map<String, Boolean> flags = new HashMap<>();
        flags.put(Session.FLAG_CONSENT_GIVEN, true);
        flags.put(Session.FLAG_OFFERS_GENERATED, true);
        flags.put(Session.FLAG_OFFER_ACCEPTED, true);
        flags.put(Session.FLAG_KYC_COMPLETED, true);
        flags.put(Session.FLAG_SELFIE_RECEIVED, true);
        flags.put(Session.FLAG_NACH_COMPLETED, true);
        seed(Journey.ONBOARDING, StepId.AGREEMENT_ACK, answers, flags,
                List.of(offer(1, "40000"), offer(2, "46000"), offer(3, "54000")));
        when(decisionPort.finalDecision(eq(ID), anyMap())).thenReturn(
                FinalDecision.approved("REF-123456", new BigDecimal("46000"), new BigDecimal("21.0"), 9));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "agree_yes", NOW));

        // Then
        Session saved = store.get(ID);
        assertEquals(Journey.POST_LOAN, saved.getJourney());
        assertEquals(StepId.POST_LOAN_MENU, saved.getCurrentStep());
        assertTrue(saved.flag(Session.FLAG_AGREEMENT_SIGNED));
        assertTrue(saved.flag(Session.FLAG_DECISION_COMPLETE));
        assertTrue(saved.flag(Session.FLAG_LOAN_DISBURSED));
        assertTrue(outcome.prompts().contains(
                PromptSpec.text(catalog.text(Language.EN, "final_approval", "46,000", "REF-123456"))));
        verify(loanRecordStore).save(argThat(record -> record.isApproved()
                && "REF-123456".equals(record.getReferenceId())
                && "Jane Doe".equals(record.getFullName())));
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_DISBURSED), anyMap(), eq(NOW));
    }

    @Test
    void testOffersAlreadyGenerated_DecisionNotCalledAgain() {
        // Given
        Map<String, Boolean> flags = new HashMap<>();
        flags.put(Session.FLAG_OFFERS_GENERATED, true);
        seed(Journey.ONBOARDING, StepId.CONSENT, baseAnswers(true), flags,
                List.of(offer(1, "40000"), offer(2, "46000")));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, "consent_yes", NOW));

        // Then
        Session saved = store.get(ID);
        assertEquals(DialogOutcome.Kind.ADVANCED, outcome.kind());
        assertEquals(StepId.OFFER_SELECTION, saved.getCurrentStep());
        assertEquals(2, saved.getOffers().size());
        verify(decisionPort, never()).proposeOffers(any());
    }

    @Test
    void testDecisionAlreadyComplete_DecisionNotCalledAgain() {
        // Given
        Map<String, Object> answers = baseAnswers(true);
        answers.put(Session.ANSWER_CHOSEN_OFFER, 1);
        Map<String, Boolean> flags = new HashMap<>();
        flags.put(Session.FLAG_OFFERS_GENERATED, true);
        flags.put(Session.FLAG_DECISION_COMPLETE, true);
        flags.put(Session.FLAG_LOAN_DISBURSED, true);
        seed(Journey.ONBOARDING, StepId.AGREEMENT_ACK, answers, flags, List.of(offer(1, "40000")));

        // When
        orchestrator.handle(InboundEvent.option(ID, "agree_yes", NOW));

        // Then
        Session saved = store.get(ID);
        assertEquals(Journey.POST_LOAN, saved.getJourney());
        assertEquals(StepId.POST_LOAN_MENU, saved.getCurrentStep());
        verify(decisionPort, never()).finalDecision(anyString(), anyMap());
        verify(loanRecordStore, never()).save(any());
    }

    // ─────────────────── KYC ───────────────────

    @Test
    void testKycWithoutLoan_ReturnsToMenu() {
        // Given
        seed(Journey.NONE, null, Map.of(), Map.of(), List.of());

        // When
        orchestrator.handle(InboundEvent.text(ID, "kyc", NOW));

        // Then
        assertEquals(Journey.KYC, store.get(ID).getJourney());
        assertEquals(StepId.KYC_ACK, store.get(ID).getCurrentStep());

        // When
        orchestrator.handle(InboundEvent.option(ID, JourneyDefinition.OPTION_KYC_COMPLETE, NOW));

        // Then
        assertEquals(StepId.SELFIE_ACK, store.get(ID).getCurrentStep());
        assertTrue(store.get(ID).flag(Session.FLAG_KYC_COMPLETED));

        // When
        DialogOutcome finished = orchestrator.handle(InboundEvent.media(ID, "selfie-1", NOW));

        // Then
        assertEquals(Journey.NONE, store.get(ID).getJourney());
        assertNull(store.get(ID).getCurrentStep());
        assertTrue(store.get(ID).flag(Session.FLAG_SELFIE_RECEIVED));
        assertTrue(finished.prompts().contains(PromptSpec.text(catalog.text(Language.EN, "kyc_refreshed"))));
    }

    @Test
    void testKycWithLoan_MovesToPostLoan() {
        // Given
        seed(Journey.KYC, StepId.SELFIE_ACK, Map.of(), Map.of(Session.FLAG_KYC_COMPLETED, true), List.of());
        LoanRecord record = new LoanRecord(ID, "REF-654321", LoanRecord.STATUS_APPROVED, "Jane Doe",
                new BigDecimal("46000"), new BigDecimal("21.0"), 9, "Personal", "Salaried",
                new BigDecimal("50000"), null, NOW, NOW);
        when(loanRecordStore.find(ID)).thenReturn(Optional.of(record));

        // When
        DialogOutcome finished = orchestrator.handle(InboundEvent.media(ID, "selfie-2", NOW));

        // Then
        assertEquals(Journey.POST_LOAN, store.get(ID).getJourney());
        assertEquals(StepId.POST_LOAN_MENU, store.get(ID).getCurrentStep());
        assertTrue(finished.prompts().contains(PromptSpec.text(catalog.text(Language.EN, "kyc_refreshed"))));
    }

    // ─────────────────── Failures and resets ───────────────────

    @Test
    void testStoreFailure_Propagates() {
        // Given
        seed(Journey.ONBOARDING, StepId.NAME, new HashMap<>(), Map.of(), List.of());
        store.failSaves();

        // When / Then
        assertThrows(SessionStoreException.class,
                () -> orchestrator.handle(InboundEvent.text(ID, "Jane Doe", NOW)));
        verifyNoInteractions(messagingPort);
    }

    @Test
    void testStepOutsideJourney_ResetToMenu() {
        // Given
        seed(Journey.ONBOARDING, StepId.POST_LOAN_MENU, baseAnswers(false), Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "Jane Doe", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.STATE_RESET, outcome.kind());
        assertEquals(Journey.NONE, store.get(ID).getJourney());
        assertNull(store.get(ID).getCurrentStep());
        assertTrue(store.get(ID).getAnswers().isEmpty());
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_STATE_CORRUPTION), anyMap(), eq(NOW));
    }

    @Test
    void testUnreadableSession_ReplacedAtStoredVersion() {
        // Given
        store.makeUnreadable(7L);

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "hi", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.ADVANCED, outcome.kind());
        assertEquals(8L, store.get(ID).getVersion());
        assertEquals(Journey.NONE, store.get(ID).getJourney());
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_STATE_CORRUPTION), anyMap(), eq(NOW));
    }

    @Test
    void testStaleSession_ResetAfterThirtyOneMinutes() {
        // Given
        store.put(Session.reconstruct(ID, Journey.ONBOARDING, StepId.DOB, baseAnswers(false), Map.of(),
                Language.EN, List.of(), NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(31)), 3L));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "31-12-1995", NOW));

        // Then
        Session saved = store.get(ID);
        assertEquals(DialogOutcome.Kind.SESSION_RESET, outcome.kind());
        assertEquals(Journey.NONE, saved.getJourney());
        assertTrue(saved.getAnswers().isEmpty());
        assertEquals(Language.EN, saved.getLanguage());
        assertEquals(NOW, saved.getLastActivityAt());
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "session_reset")), outcome.prompts().get(0));
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_SESSION_RESET), anyMap(), eq(NOW));
    }

    @Test
    void testRecentSession_NotResetAfterTwentyNineMinutes() {
        // Given
        store.put(Session.reconstruct(ID, Journey.ONBOARDING, StepId.DOB, baseAnswers(false), Map.of(),
                Language.EN, List.of(), NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(29)), 3L));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "31-12-1995", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.ADVANCED, outcome.kind());
        assertEquals(StepId.EMPLOYMENT, store.get(ID).getCurrentStep());
    }

    @Test
    void testUnknownInputAtMenu_RoutingMiss() {
        // Given
        seed(Journey.NONE, null, new HashMap<>(), Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "what is this", NOW));

        // Then
        assertEquals(DialogOutcome.Kind.ROUTING_MISS, outcome.kind());
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "routing_miss")), outcome.prompts().get(0));
    }

    // ─────────────────── Support ───────────────────

    @Test
    void testSupportQuestion_KnowledgeBaseBeforeLlm() {
        // Given
        seed(Journey.SUPPORT, StepId.SUPPORT_QUERY, new HashMap<>(), Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.text(ID, "How do I pay my EMI?", NOW));

        // Then
        assertEquals(PromptSpec.text(catalog.text(Language.EN, "kb_emi")), outcome.prompts().get(0));
        assertEquals(Journey.SUPPORT, store.get(ID).getJourney());
        verifyNoInteractions(supportPort);
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_SUPPORT_ANSWER),
                argThat(payload -> "kb".equals(payload.get("source"))), eq(NOW));
    }

    @Test
    void testSupportQuestion_LlmAnswers() {
        // Given
        seed(Journey.SUPPORT, StepId.SUPPORT_QUERY, new HashMap<>(), Map.of(), List.of());
        when(supportPort.answer(anyString(), eq(Language.EN)))
                .thenReturn(Optional.of("You can update it from the profile screen of the app."));

        // When
        DialogOutcome outcome = orchestrator.handle(
                InboundEvent.text(ID, "Can I change my registered mobile number?", NOW));

        // Then
        assertEquals(PromptSpec.text("You can update it from the profile screen of the app."),
                outcome.prompts().get(0));
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_SUPPORT_ANSWER),
                argThat(payload -> "llm".equals(payload.get("source"))), eq(NOW));
    }

    @Test
    void testSupportQuestion_NoAnswerEscalates() {
        // Given
        seed(Journey.SUPPORT, StepId.SUPPORT_QUERY, new HashMap<>(), Map.of(), List.of());
        when(supportPort.answer(anyString(), eq(Language.EN))).thenReturn(Optional.empty());

        // When
        DialogOutcome outcome = orchestrator.handle(
                InboundEvent.text(ID, "Can I change my registered mobile number?", NOW));

        // Then
        PromptSpec escalation = outcome.prompts().get(0);
        assertEquals(PromptSpec.Kind.CHOICE, escalation.getKind());
        assertEquals(PromptFactory.OPTION_CONNECT_AGENT, escalation.getOptions().get(0).optionId());
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_SUPPORT_ESCALATION),
                argThat(payload -> "no_match".equals(payload.get("reason"))), eq(NOW));
    }

    @Test
    void testConnectAgent_HandoffAuditedAndBackToMenu() {
        // Given
        Map<String, Object> answers = new HashMap<>();
        answers.put(Session.ANSWER_SUPPORT_QUESTION, "Can I change my registered mobile number?");
        seed(Journey.SUPPORT, StepId.SUPPORT_QUERY, answers, Map.of(), List.of());

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, PromptFactory.OPTION_CONNECT_AGENT, NOW));

        // Then
        assertEquals(Journey.NONE, store.get(ID).getJourney());
        assertEquals(List.of(PromptSpec.text(catalog.text(Language.EN, "support_escalation_ack"))), outcome.prompts());
        verify(auditSink).record(eq(ID), eq(DialogOrchestrator.AUDIT_AGENT_HANDOFF),
                argThat(payload -> HANDOFF_QUEUE.equals(payload.get("queue"))), eq(NOW));
    }

    @Test
    void testSupportKeywordMidJourney_SwitchesToSupport() {
        // Given
        seed(Journey.ONBOARDING, StepId.INCOME, baseAnswers(false), Map.of(), List.of());

        // When
        orchestrator.handle(InboundEvent.text(ID, "help", NOW));

        // Then
        assertEquals(Journey.SUPPORT, store.get(ID).getJourney());
        assertEquals(StepId.SUPPORT_QUERY, store.get(ID).getCurrentStep());
        assertEquals("Jane Doe", store.get(ID).getAnswers().get(Session.ANSWER_FULL_NAME));
    }

    // ─────────────────── Post-loan ───────────────────

    @Test
    void testPostLoanView_ShowsStoredRecord() {
        // Given
        seed(Journey.POST_LOAN, StepId.POST_LOAN_MENU, baseAnswers(true),
                Map.of(Session.FLAG_LOAN_DISBURSED, true), List.of());
        LoanRecord record = new LoanRecord(ID, "REF-654321", LoanRecord.STATUS_APPROVED, "Jane Doe",
                new BigDecimal("46000"), new BigDecimal("21.0"), 9, "Personal", "Salaried",
                new BigDecimal("50000"), null, NOW, NOW);
        when(loanRecordStore.find(ID)).thenReturn(Optional.of(record));

        // When
        DialogOutcome outcome = orchestrator.handle(InboundEvent.option(ID, JourneyDefinition.OPTION_POST_VIEW, NOW));

        // Then
        assertTrue(outcome.prompts().get(0).getBody().contains("REF-654321"));
        assertEquals(Journey.POST_LOAN, store.get(ID).getJourney());
    }

    // ─────────────────── Concurrency ───────────────────

    @Test
    void testConcurrentEventsSameIdentity_Serialized() throws Exception {
        // Given
        ExecutorService callers = Executors.newFixedThreadPool(8);
        List<Callable<DialogOutcome>> tasks = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            tasks.add(() -> orchestrator.handle(InboundEvent.text(ID, "hi", NOW)));
        }

        // When
        List<Future<DialogOutcome>> results;
        try {
            results = callers.invokeAll(tasks);
        } finally {
            callers.shutdown();
        }

        // Then
        for (Future<DialogOutcome> result : results) {
            assertEquals(DialogOutcome.Kind.ADVANCED, result.get().kind());
        }
        assertEquals(40, store.saveCount());
        assertEquals(40L, store.get(ID).getVersion());
    }

    // ─────────────────── Helpers ───────────────────

    private Session seed(Journey journey, StepId step, Map<String, Object> answers, Map<String, Boolean> flags,
            List<Offer> offers) {
        Session session = Session.reconstruct(ID, journey, step, answers, flags, Language.EN, offers,
                NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofMinutes(1)), 3L);
        store.put(session);
        return session;
    }

    private static Map<String, Object> baseAnswers(boolean withIncome) {
        Map<String, Object> answers = new HashMap<>();
        answers.put(Session.ANSWER_FULL_NAME, "Jane Doe");
        answers.put(Session.ANSWER_DOB, LocalDate.of(1990, 5, 20));
        answers.put(Session.ANSWER_EMPLOYMENT, "Salaried");
        if (withIncome) {
            answers.put(Session.ANSWER_MONTHLY_INCOME, new BigDecimal("50000.00"));
            answers.put(Session.ANSWER_PURPOSE, "Personal");
        }
        return answers;
    }

    private static Offer offer(int index, String amount) {
        return new Offer(index, "OFFER" + index, new BigDecimal(amount), new BigDecimal("18.0"), 12,
                new BigDecimal("2.0"), new BigDecimal("3667"));
    }
}
