package com.lending.dialog.application.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.lending.dialog.application.exception.GatewayFailureException;
import com.lending.dialog.application.exception.GatewayTimeoutException;
import com.lending.dialog.application.exception.StateCorruptionException;
import com.lending.dialog.application.port.in.DialogOutcome;
import com.lending.dialog.application.port.in.HandleInboundEventUseCase;
import com.lending.dialog.application.port.out.AuditSink;
import com.lending.dialog.application.port.out.DecisionPort;
import com.lending.dialog.application.port.out.LoanRecordStore;
import com.lending.dialog.application.port.out.MessagingPort;
import com.lending.dialog.application.port.out.SessionStore;
import com.lending.dialog.application.port.out.SupportPort;
import com.lending.dialog.domain.entity.BankDetails;
import com.lending.dialog.domain.entity.FinalDecision;
import com.lending.dialog.domain.entity.InboundEvent;
import com.lending.dialog.domain.entity.JourneyStep;
import com.lending.dialog.domain.entity.LoanApplication;
import com.lending.dialog.domain.entity.LoanRecord;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.PromptOption;
import com.lending.dialog.domain.entity.PromptSpec;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.entity.ValidationResult;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;
import com.lending.dialog.domain.valueobject.ValidationError;

/**
 * Core use-case implementation: the dialog orchestration engine.
 * <p>
 * For every inbound event:
 * <ol>
 * <li><b>Load</b>: lock the identity, load or create the session</li>
 * <li><b>Check</b>: staleness reset, state invariant</li>
 * <li><b>Decide</b>: global switch, top-level routing, or step validation
 * and advance (running automatic gateway steps)</li>
 * <li><b>Persist</b>: save the next session, then emit prompts</li>
 * </ol>
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>SessionStore errors → rethrow (transport redelivers)</li>
 * <li>Gateway failure → nothing saved, "try again" prompt</li>
 * <li>Gateway timeout → nothing saved, nothing sent</li>
 * <li>Messaging and audit errors → log + continue (session already saved)</li>
 * </ul>
 */
public class DialogOrchestrator implements HandleInboundEventUseCase {

    private static final Logger log = Logger.getLogger(DialogOrchestrator.class.getName());

    static final String AUDIT_INBOUND = "inbound";
    static final String AUDIT_SESSION_RESET = "session_reset";
    static final String AUDIT_STATE_CORRUPTION = "state_corruption";
    static final String AUDIT_AGENT_HANDOFF = "agent_handoff";
    static final String AUDIT_SUPPORT_ANSWER = "support_answer";
    static final String AUDIT_SUPPORT_ESCALATION = "support_escalation";
    static final String AUDIT_OFFERS_REJECTED = "offers_rejected";
    static final String AUDIT_DISBURSED = "disbursed";
    static final String AUDIT_FINAL_REJECT = "final_reject";

    private static final String GATEWAY_DECISION = "decision";
    private static final String GATEWAY_SUPPORT = "support";

    private final SessionStore sessionStore;
    private final MessagingPort messagingPort;
    private final DecisionPort decisionPort;
    private final SupportPort supportPort;
    private final AuditSink auditSink;
    private final LoanRecordStore loanRecordStore;
    private final JourneyDefinition journeys;
    private final FieldValidator validator;
    private final SessionLifecycleManager lifecycle;
    private final IntentRouter router;
    private final SupportKnowledgeBase knowledgeBase;
    private final PromptFactory prompts;
    private final OfferPresentationPolicy offerPolicy;
    private final GatewayInvoker gateways;
    private final IdentityLockRegistry locks;
    private final Clock clock;
    private final String handoffQueue;

    /**
     * Constructor injection. {@code supportPort} may be null when no remote
     * support responder is configured.
     */
    public DialogOrchestrator(SessionStore sessionStore,
            MessagingPort messagingPort,
            DecisionPort decisionPort,
            SupportPort supportPort,
            AuditSink auditSink,
            LoanRecordStore loanRecordStore,
            JourneyDefinition journeys,
            FieldValidator validator,
            SessionLifecycleManager lifecycle,
            IntentRouter router,
            SupportKnowledgeBase knowledgeBase,
            PromptFactory prompts,
            OfferPresentationPolicy offerPolicy,
            GatewayInvoker gateways,
            IdentityLockRegistry locks,
            Clock clock,
            String handoffQueue) {
        if (sessionStore == null)
            throw new IllegalArgumentException("sessionStore cannot be null");
        if (messagingPort == null)
            throw new IllegalArgumentException("messagingPort cannot be null");
        if (decisionPort == null)
            throw new IllegalArgumentException("decisionPort cannot be null");
        if (auditSink == null)
            throw new IllegalArgumentException("auditSink cannot be null");
        if (loanRecordStore == null)
            throw new IllegalArgumentException("loanRecordStore cannot be null");
        if (journeys == null || validator == null || lifecycle == null || router == null)
            throw new IllegalArgumentException("journey services cannot be null");
        if (knowledgeBase == null || prompts == null || offerPolicy == null)
            throw new IllegalArgumentException("prompt services cannot be null");
        if (gateways == null || locks == null || clock == null)
            throw new IllegalArgumentException("gateways, locks and clock cannot be null");

        this.sessionStore = sessionStore;
        this.messagingPort = messagingPort;
        this.decisionPort = decisionPort;
        this.supportPort = supportPort;
        this.auditSink = auditSink;
        this.loanRecordStore = loanRecordStore;
        this.journeys = journeys;
        this.validator = validator;
        this.lifecycle = lifecycle;
        this.router = router;
        this.knowledgeBase = knowledgeBase;
        this.prompts = prompts;
        this.offerPolicy = offerPolicy;
        this.gateways = gateways;
        this.locks = locks;
        this.clock = clock;
        this.handoffQueue = handoffQueue;
    }

    @Override
    public DialogOutcome handle(InboundEvent event) {
        return locks.withLock(event.getIdentity(), () -> process(event));
    }

    // ─────────────────── Pipeline ───────────────────

    private DialogOutcome process(InboundEvent event) {
        long start = System.nanoTime();
        String identity = event.getIdentity();
        Instant now = event.getReceivedAt();

        log.info(String.format("action=process_start eventId=%s identity=%s", event.getEventId(), identity));

        // ── Step 1: LOAD ──
        Session loaded = load(identity, now);
        audit(identity, AUDIT_INBOUND, inboundPayload(event), now);

        // ── Step 2: DECIDE ──
        Turn turn;
        try {
            turn = decide(loaded, event, now);
        } catch (GatewayTimeoutException e) {
            log.warning(String.format("action=process_timed_out eventId=%s identity=%s error=%s",
                    event.getEventId(), identity, e.getMessage()));
            return new DialogOutcome(DialogOutcome.Kind.TIMED_OUT, List.of(), loaded);
        } catch (GatewayFailureException e) {
            log.log(Level.WARNING, String.format("action=gateway_failed eventId=%s identity=%s gateway=%s",
                    event.getEventId(), identity, e.getGateway()), e);
            List<PromptSpec> retry = List.of(prompts.text(loaded.getLanguage(), "try_again"));
            emit(identity, retry);
            return new DialogOutcome(DialogOutcome.Kind.GATEWAY_FAILED, retry, loaded);
        }

        // ── Step 3: PERSIST ──
        sessionStore.save(turn.session);

        // ── Step 4: EMIT ──
        emit(identity, turn.prompts);

        log.info(String.format(
                "action=process_complete eventId=%s identity=%s outcome=%s oldJourney=%s oldStep=%s newJourney=%s newStep=%s latency=%dms",
                event.getEventId(), identity, turn.kind,
                loaded.getJourney(), loaded.getCurrentStep(),
                turn.session.getJourney(), turn.session.getCurrentStep(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)));

        return new DialogOutcome(turn.kind, turn.prompts, turn.session);
    }

    private Session load(String identity, Instant now) {
        try {
            return sessionStore.load(identity).orElseGet(() -> {
                log.info(String.format("action=session_created identity=%s", identity));
                return Session.start(identity, now);
            });
        } catch (StateCorruptionException e) {
            log.log(Level.SEVERE, String.format("action=state_unreadable identity=%s error=%s",
                    identity, e.getMessage()), e);
            audit(identity, AUDIT_STATE_CORRUPTION, Map.of("reason", String.valueOf(e.getMessage())), now);
            return Session.start(identity, now).withVersion(e.getStoredVersion());
        }
    }

    private Turn decide(Session loaded, InboundEvent event, Instant now) {
        // ── Lifecycle ──
        SessionLifecycleManager.Check check = lifecycle.check(loaded, now);
        Session session = check.session();
        if (check.reset()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("journey", loaded.getJourney().name());
            payload.put("step", String.valueOf(loaded.getCurrentStep()));
            payload.put("last_activity_at", loaded.getLastActivityAt().toString());
            audit(session.getIdentity(), AUDIT_SESSION_RESET, payload, now);
            if (check.wasInJourney()) {
                Turn turn = new Turn(DialogOutcome.Kind.SESSION_RESET, session);
                turn.add(prompts.text(session.getLanguage(), "session_reset"));
                turn.addAll(prompts.topMenu(session));
                return turn;
            }
        }

        // ── Invariant ──
        if (!journeys.isValid(session.getJourney(), session.getCurrentStep())) {
            log.severe(String.format("action=state_corruption identity=%s journey=%s step=%s",
                    session.getIdentity(), session.getJourney(), session.getCurrentStep()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("journey", session.getJourney().name());
            payload.put("step", String.valueOf(session.getCurrentStep()));
            audit(session.getIdentity(), AUDIT_STATE_CORRUPTION, payload, now);
            Session reset = session.reset();
            Turn turn = new Turn(DialogOutcome.Kind.STATE_RESET, reset);
            turn.addAll(prompts.topMenu(reset));
            return turn;
        }

        // ── Global switches ──
        Optional<IntentRouter.GlobalSwitch> globalSwitch = router.globalSwitch(event);
        if (globalSwitch.isPresent()) {
            switch (globalSwitch.get()) {
                case SUPPORT:
                    return enterSupport(session);
                case LANGUAGE: {
                    Session cleared = session.withLanguage(null).toMenu();
                    Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, cleared);
                    turn.addAll(prompts.languageMenu());
                    return turn;
                }
                case MENU:
                    if (session.isInJourney()) {
                        Session menu = session.toMenu();
                        Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, menu);
                        turn.addAll(prompts.topMenu(menu));
                        return turn;
                    }
                    break;
            }
        }

        if (!session.isInJourney()) {
            return routeFromMenu(session, event, now);
        }

        JourneyStep step = journeys.stepOf(session.getJourney(), session.getCurrentStep())
                .orElseThrow(() -> new IllegalStateException("validated step vanished"));

        return switch (session.getJourney()) {
            case SUPPORT -> handleSupport(session, event, now);
            case POST_LOAN -> handlePostLoan(session, step, event);
            default -> handleStep(session, step, event, now);
        };
    }

    // ─────────────────── Top-level Routing ───────────────────

    private Turn routeFromMenu(Session session, InboundEvent event, Instant now) {
        IntentRouter.Routing routing = router.route(event, hasLoan(session));

        switch (routing.route()) {
            case LANGUAGE_CHOSEN: {
                Session updated = session.withLanguage(routing.language());
                Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, updated);
                turn.add(prompts.text(updated.getLanguage(), "language_changed"));
                turn.addAll(prompts.topMenu(updated));
                return turn;
            }
            case START_ONBOARDING: {
                JourneyStep first = journeys.firstStep(Journey.ONBOARDING).orElseThrow();
                Session started = session.clearApplication().enter(Journey.ONBOARDING, first.getId());
                log.info(String.format("action=journey_start identity=%s journey=%s", session.getIdentity(),
                        Journey.ONBOARDING));
                Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, started);
                turn.addAll(prompts.forStep(first, started));
                return turn;
            }
            case SUPPORT:
                return enterSupport(session);
            case KYC: {
                JourneyStep first = journeys.firstStep(Journey.KYC).orElseThrow();
                Session started = session.enter(Journey.KYC, first.getId());
                Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, started);
                turn.addAll(prompts.forStep(first, started));
                return turn;
            }
            case POST_LOAN: {
                JourneyStep menu = journeys.firstStep(Journey.POST_LOAN).orElseThrow();
                Session entered = session.enter(Journey.POST_LOAN, menu.getId());
                if (routing.optionId() != null) {
                    return applyPostLoanOption(entered, menu, routing.optionId());
                }
                Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, entered);
                turn.addAll(prompts.forStep(menu, entered));
                return turn;
            }
            case TOP_MENU: {
                Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session);
                turn.addAll(prompts.topMenu(session));
                return turn;
            }
            default: {
                log.fine(String.format("action=routing_miss identity=%s", session.getIdentity()));
                Turn turn = new Turn(DialogOutcome.Kind.ROUTING_MISS, session);
                if (session.getLanguage() != null) {
                    turn.add(prompts.text(session.getLanguage(), "routing_miss"));
                }
                turn.addAll(prompts.topMenu(session));
                return turn;
            }
        }
    }

    // ─────────────────── Step Handling ───────────────────

    private Turn handleStep(Session session, JourneyStep step, InboundEvent event, Instant now) {
        if (step.isAutomatic()) {
            Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session);
            runFrom(turn, step, event, now);
            return turn;
        }

        List<PromptOption> options = prompts.optionsFor(step, session);
        ValidationResult result = validator.validate(step.getFieldKind(), event.rawInput(),
                new FieldValidator.Context(options, event.getMediaId()));

        if (result.isValid() && step.isRequiresAffirmative() && Boolean.FALSE.equals(result.getValue())) {
            result = ValidationResult.invalid(Session.FLAG_CONSENT_GIVEN.equals(step.getTargetName())
                    ? ValidationError.CONSENT_REQUIRED
                    : ValidationError.AGREEMENT_REQUIRED);
        }

        if (!result.isValid()) {
            log.fine(String.format("action=validation_failed identity=%s step=%s error=%s",
                    session.getIdentity(), step.getId(), result.getError()));
            Turn turn = new Turn(DialogOutcome.Kind.VALIDATION_FAILED, session);
            turn.add(prompts.hint(session.getLanguage(), result.getError()));
            turn.addAll(prompts.forStep(step, session));
            return turn;
        }

        if (step.getId() == StepId.INTENT_CONFIRM
                && step.valueOf(result.getValue(String.class)).filter(JourneyDefinition.INTENT_SUPPORT::equals)
                        .isPresent()) {
            return enterSupport(session);
        }

        Session updated = write(session, step, result.getValue());
        Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, updated);
        step.getAcknowledgementKey().ifPresent(key -> turn.add(acknowledgement(updated, key)));
        advance(turn, step, event, now);
        return turn;
    }

    /**
     * Writes a validated value to the step's target and sets its completion flag.
     */
    private Session write(Session session, JourneyStep step, Object value) {
        Session updated = session;
        switch (step.getTarget()) {
            case ANSWER:
                if (!journeys.declaresField(session.getJourney(), step.getTargetName())) {
                    throw new IllegalArgumentException(step.getTargetName() + " is not declared by "
                            + session.getJourney());
                }
                updated = updated.withAnswer(step.getTargetName(), answerValue(session, step, value));
                break;
            case FLAG:
                updated = updated.withFlag(step.getTargetName(), Boolean.TRUE.equals(value));
                break;
            case LANGUAGE:
                updated = updated.withLanguage(Language.orDefault(
                        Language.fromCode(step.valueOf(String.valueOf(value)).orElse(null))));
                break;
            case NONE:
                break;
        }
        if (step.getCompletionFlag().isPresent()) {
            updated = updated.withFlag(step.getCompletionFlag().get(), true);
        }
        return updated;
    }

    private Object answerValue(Session session, JourneyStep step, Object value) {
        if (step.getId() == StepId.OFFER_SELECTION) {
            return session.getOffers().stream()
                    .filter(o -> o.optionId().equals(value))
                    .map(Offer::getIndex)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("validated offer option vanished: " + value));
        }
        if (step.hasStaticOptions() && value instanceof String) {
            return step.valueOf((String) value).orElse((String) value);
        }
        return value;
    }

    private PromptSpec acknowledgement(Session session, String key) {
        Object bank = session.getAnswers().get(Session.ANSWER_BANK_DETAILS);
        if (bank instanceof BankDetails && "bank_details_received".equals(key)) {
            return prompts.text(session.getLanguage(), key, ((BankDetails) bank).maskedAccountNumber());
        }
        return prompts.text(session.getLanguage(), key);
    }

    /**
     * Moves past {@code from}: prompts the next input step, runs automatic
     * steps, or finishes the journey.
     */
    private void advance(Turn turn, JourneyStep from, InboundEvent event, Instant now) {
        Optional<JourneyStep> next = journeys.nextStep(turn.session.getJourney(), from.getId());
        if (next.isEmpty()) {
            finishJourney(turn);
            return;
        }
        turn.session = turn.session.moveTo(next.get().getId());
        runFrom(turn, next.get(), event, now);
    }

    private void runFrom(Turn turn, JourneyStep step, InboundEvent event, Instant now) {
        if (!step.isAutomatic()) {
            turn.addAll(prompts.forStep(step, turn.session));
            return;
        }
        turn.addAll(prompts.forStep(step, turn.session));
        boolean proceed = switch (step.getEffect()) {
            case GENERATE_OFFERS -> generateOffers(turn, event, now);
            case FINAL_DECISION -> finalDecision(turn, event, now);
            case NONE -> true;
        };
        if (proceed) {
            advance(turn, step, event, now);
        }
    }

    // ─────────────────── Gateway Steps ───────────────────

    /**
     * @return false if the application was rejected and the journey left
     */
    private boolean generateOffers(Turn turn, InboundEvent event, Instant now) {
        Session session = turn.session;
        if (session.flag(Session.FLAG_OFFERS_GENERATED) && session.hasOffers()) {
            log.fine(String.format("action=offers_reused identity=%s", session.getIdentity()));
            return true;
        }

        LoanApplication application = LoanApplication.from(session, LocalDate.now(clock));
        List<Offer> offers = gateways.invoke(GATEWAY_DECISION,
                () -> decisionPort.proposeOffers(application), event.getDeadline());

        if (offers == null || offers.isEmpty()) {
            log.info(String.format("action=offers_rejected identity=%s", session.getIdentity()));
            audit(session.getIdentity(), AUDIT_OFFERS_REJECTED,
                    Map.of("monthly_income", application.getMonthlyIncome().toPlainString()), now);
            turn.add(prompts.text(session.getLanguage(), "decision_rejected", "policy"));
            turn.session = session.toMenu();
            return false;
        }

        List<Offer> shown = offerPolicy.present(session.getIdentity(), offers, now);
        turn.session = session.withOffers(shown).withFlag(Session.FLAG_OFFERS_GENERATED, true);
        log.info(String.format("action=offers_generated identity=%s count=%d", session.getIdentity(), shown.size()));
        return true;
    }

    /**
     * @return true to continue to the (terminal) successor
     */
    private boolean finalDecision(Turn turn, InboundEvent event, Instant now) {
        Session session = turn.session;
        if (session.flag(Session.FLAG_DECISION_COMPLETE)) {
            log.fine(String.format("action=decision_reused identity=%s", session.getIdentity()));
            return true;
        }

        LoanApplication application = LoanApplication.from(session, LocalDate.now(clock));
        FinalDecision decision = gateways.invoke(GATEWAY_DECISION,
                () -> decisionPort.finalDecision(session.getIdentity(), session.getAnswers()), event.getDeadline());
        if (decision == null) {
            throw new GatewayFailureException(GATEWAY_DECISION, "final decision missing for " + session.getIdentity());
        }

        saveLoanRecord(LoanRecord.of(application, decision, now));
        Language lang = session.getLanguage();
        Session updated = session.withFlag(Session.FLAG_DECISION_COMPLETE, true);

        if (decision.isApproved()) {
            updated = updated.withFlag(Session.FLAG_LOAN_DISBURSED, true);
            turn.add(prompts.text(lang, "final_approval",
                    PromptFactory.formatAmount(decision.getApprovedAmount()), decision.getReferenceId()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("amount", decision.getApprovedAmount().toPlainString());
            payload.put("reference", decision.getReferenceId());
            audit(session.getIdentity(), AUDIT_DISBURSED, payload, now);
        } else {
            String reason = decision.getReason() != null ? decision.getReason() : "internal policy";
            turn.add(prompts.text(lang, "final_reject", reason));
            audit(session.getIdentity(), AUDIT_FINAL_REJECT, Map.of("reason", reason), now);
        }
        log.info(String.format("action=final_decision identity=%s approved=%s ref=%s",
                session.getIdentity(), decision.isApproved(), decision.getReferenceId()));
        turn.session = updated;
        return true;
    }

    private void saveLoanRecord(LoanRecord record) {
        try {
            loanRecordStore.save(record);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, String.format("action=loan_record_save_failed identity=%s ref=%s error=%s",
                    record.getIdentity(), record.getReferenceId(), e.getMessage()), e);
        }
    }

    /**
     * Terminal handling: approved onboarding and KYC with a loan go to the
     * post-loan menu, everything else returns to the top-level menu.
     */
    private void finishJourney(Turn turn) {
        Session session = turn.session;
        Journey finished = session.getJourney();
        log.info(String.format("action=journey_complete identity=%s journey=%s", session.getIdentity(), finished));

        if (finished == Journey.KYC) {
            turn.add(prompts.text(session.getLanguage(), "kyc_refreshed"));
        }

        boolean toPostLoan = finished == Journey.ONBOARDING
                ? session.flag(Session.FLAG_LOAN_DISBURSED)
                : hasLoan(session);

        if (toPostLoan) {
            JourneyStep menu = journeys.firstStep(Journey.POST_LOAN).orElseThrow();
            turn.session = session.enter(Journey.POST_LOAN, menu.getId());
            turn.addAll(prompts.forStep(menu, turn.session));
        } else {
            turn.session = session.toMenu();
            if (finished != Journey.ONBOARDING) {
                turn.addAll(prompts.topMenu(turn.session));
            }
        }
    }

    // ─────────────────── Support ───────────────────

    private Turn enterSupport(Session session) {
        JourneyStep query = journeys.firstStep(Journey.SUPPORT).orElseThrow();
        Session entered = session.enter(Journey.SUPPORT, query.getId());
        Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, entered);
        turn.addAll(prompts.forStep(query, entered));
        return turn;
    }

    private Turn handleSupport(Session session, InboundEvent event, Instant now) {
        Language lang = session.getLanguage();
        String input = event.rawInput().trim();
        String identity = session.getIdentity();

        if (matchesOption(session, input, PromptFactory.OPTION_CONNECT_AGENT)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("question", String.valueOf(session.getAnswers().getOrDefault(Session.ANSWER_SUPPORT_QUESTION, "")));
            payload.put("queue", handoffQueue);
            audit(identity, AUDIT_AGENT_HANDOFF, payload, now);
            log.info(String.format("action=agent_handoff identity=%s queue=%s", identity, handoffQueue));
            Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session.toMenu());
            turn.add(prompts.text(lang, "support_escalation_ack"));
            return turn;
        }
        if (matchesOption(session, input, PromptFactory.OPTION_DOWNLOAD_APP)) {
            Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session);
            turn.add(prompts.appDownload(lang));
            turn.add(prompts.escalationChoice(lang, "support_closing", false));
            return turn;
        }
        if (matchesOption(session, input, PromptFactory.OPTION_SEND_EMAIL)) {
            Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session);
            turn.add(prompts.supportEmail(lang));
            turn.add(prompts.escalationChoice(lang, "support_closing", false));
            return turn;
        }

        JourneyStep query = journeys.firstStep(Journey.SUPPORT).orElseThrow();
        ValidationResult result = validator.validate(query.getFieldKind(), input, FieldValidator.Context.empty());
        if (!result.isValid()) {
            Turn turn = new Turn(DialogOutcome.Kind.VALIDATION_FAILED, session);
            turn.add(prompts.hint(lang, result.getError()));
            turn.addAll(prompts.forStep(query, session));
            return turn;
        }

        String question = result.getValue(String.class);
        Session updated = write(session, query, question);
        Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, updated);

        Optional<String> kbAnswer = knowledgeBase.answer(question, lang);
        if (kbAnswer.isPresent()) {
            answerSupport(turn, kbAnswer.get(), "kb", question, now);
            return turn;
        }
        if (supportPort != null) {
            Optional<String> remote = gateways.invoke(GATEWAY_SUPPORT,
                    () -> supportPort.answer(question, Language.orDefault(lang)), event.getDeadline());
            if (remote != null && remote.isPresent() && !remote.get().isBlank()) {
                answerSupport(turn, remote.get(), "llm", question, now);
                return turn;
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", "no_match");
        payload.put("question", question);
        audit(identity, AUDIT_SUPPORT_ESCALATION, payload, now);
        turn.add(prompts.escalationChoice(lang, "support_no_answer", true));
        return turn;
    }

    private void answerSupport(Turn turn, String answer, String source, String question, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", source);
        payload.put("question", question);
        audit(turn.session.getIdentity(), AUDIT_SUPPORT_ANSWER, payload, now);
        turn.add(PromptSpec.text(answer));
        turn.add(prompts.escalationChoice(turn.session.getLanguage(), "support_closing", false));
    }

    /**
     * True if the input is the option id or its localized label.
     */
    private boolean matchesOption(Session session, String input, String optionId) {
        if (input.equals(optionId)) {
            return true;
        }
        return input.equalsIgnoreCase(prompts.label(session.getLanguage(), optionId));
    }

    // ─────────────────── Post-loan ───────────────────

    private Turn handlePostLoan(Session session, JourneyStep menu, InboundEvent event) {
        List<PromptOption> options = prompts.optionsFor(menu, session);
        ValidationResult result = validator.validate(menu.getFieldKind(), event.rawInput(),
                FieldValidator.Context.withOptions(options));
        if (!result.isValid()) {
            Turn turn = new Turn(DialogOutcome.Kind.VALIDATION_FAILED, session);
            turn.add(prompts.hint(session.getLanguage(), result.getError()));
            turn.addAll(prompts.forStep(menu, session));
            return turn;
        }
        return applyPostLoanOption(session, menu, result.getValue(String.class));
    }

    private Turn applyPostLoanOption(Session session, JourneyStep menu, String optionId) {
        Language lang = session.getLanguage();
        if (JourneyDefinition.OPTION_POST_SUPPORT.equals(optionId)) {
            return enterSupport(session);
        }

        Turn turn = new Turn(DialogOutcome.Kind.ADVANCED, session);
        switch (optionId) {
            case JourneyDefinition.OPTION_POST_VIEW:
                turn.add(loanRecordStore.find(session.getIdentity())
                        .map(record -> prompts.loanSummary(lang, record))
                        .orElseGet(() -> prompts.text(lang, "post_loan_no_record")));
                break;
            case JourneyDefinition.OPTION_POST_DOWNLOAD:
                turn.add(prompts.statementDocument(lang));
                break;
            case JourneyDefinition.OPTION_POST_REPAY:
                turn.add(prompts.repaymentInfo(lang));
                break;
            default:
                log.warning(String.format("action=unknown_post_loan_option identity=%s option=%s",
                        session.getIdentity(), optionId));
        }
        turn.addAll(prompts.forStep(menu, session));
        return turn;
    }

    // ─────────────────── Helpers ───────────────────

    /**
     * A user has a loan if the session says so or a stored approved record exists.
     */
    private boolean hasLoan(Session session) {
        if (session.flag(Session.FLAG_LOAN_DISBURSED)) {
            return true;
        }
        try {
            return loanRecordStore.find(session.getIdentity()).map(LoanRecord::isApproved).orElse(false);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, String.format("action=loan_lookup_failed identity=%s error=%s",
                    session.getIdentity(), e.getMessage()), e);
            return false;
        }
    }

    private void emit(String identity, List<PromptSpec> outbound) {
        for (PromptSpec prompt : outbound) {
            try {
                messagingPort.sendPrompt(identity, prompt);
            } catch (RuntimeException e) {
                // Session is already saved; a lost prompt is re-sent on the user's next message
                log.log(Level.WARNING, String.format("action=send_failed identity=%s kind=%s error=%s",
                        identity, prompt.getKind(), e.getMessage()), e);
            }
        }
    }

    private void audit(String identity, String kind, Map<String, Object> payload, Instant timestamp) {
        try {
            auditSink.record(identity, kind, payload, timestamp);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, String.format("action=audit_failed identity=%s kind=%s error=%s",
                    identity, kind, e.getMessage()), e);
        }
    }

    private static Map<String, Object> inboundPayload(InboundEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", event.getEventId());
        if (event.getText() != null) {
            payload.put("text", event.getText());
        }
        if (event.hasOption()) {
            payload.put("option_id", event.getSelectedOptionId());
        }
        if (event.hasMedia()) {
            payload.put("media_id", event.getMediaId());
        }
        return payload;
    }

    /**
     * Mutable accumulator for one event: outcome kind, next session, prompts.
     */
    private static final class Turn {
        private final DialogOutcome.Kind kind;
        private Session session;
        private final List<PromptSpec> prompts = new ArrayList<>();

        private Turn(DialogOutcome.Kind kind, Session session) {
            this.kind = kind;
            this.session = session;
        }

        private void add(PromptSpec prompt) {
            prompts.add(prompt);
        }

        private void addAll(List<PromptSpec> more) {
            prompts.addAll(more);
        }
    }
}
