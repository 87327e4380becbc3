package com.lending.dialog.application.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.lending.dialog.domain.entity.JourneyStep;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.FieldKind;
import com.lending.dialog.domain.valueobject.InputKind;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.StepEffect;
import com.lending.dialog.domain.valueobject.StepId;

/**
 * Static step tables for every journey.
 * <p>
 * Transitions are data, not code: each {@link JourneyStep} names its
 * successor, so the orchestrator never hard-codes "after DOB comes
 * EMPLOYMENT".
 * </p>
 *
 * <pre>
 * ONBOARDING:
 *   LANGUAGE_SELECT → INTENT_CONFIRM → NAME → DOB → EMPLOYMENT → INCOME → PURPOSE
 *   → CONSENT → OFFER_GENERATION* → OFFER_SELECTION → KYC_ACK → SELFIE_ACK
 *   → BANK_DETAILS → NACH_ACK → AGREEMENT_ACK → FINAL_DECISION* → (terminal)
 * KYC:        KYC_ACK → SELFIE_ACK → (terminal)
 * SUPPORT:    SUPPORT_QUERY (re-entrant)
 * POST_LOAN:  POST_LOAN_MENU (re-entrant)
 *   * = automatic step with a gateway side effect
 * </pre>
 *
 * <p>
 * <b>Thread-safe:</b> immutable after construction.
 * </p>
 */
public class JourneyDefinition {

    public static final String OPTION_LANG_EN = "lang_en";
    public static final String OPTION_LANG_HI = "lang_hi";
    public static final String OPTION_GET_LOAN = "intent_get_loan";
    public static final String OPTION_SUPPORT = "intent_support";
    public static final String OPTION_KYC_COMPLETE = "kyc_complete";
    public static final String OPTION_NACH_COMPLETE = "nach_complete";
    public static final String OPTION_POST_VIEW = "post_view";
    public static final String OPTION_POST_DOWNLOAD = "post_download";
    public static final String OPTION_POST_REPAY = "post_repay";
    public static final String OPTION_POST_SUPPORT = "post_support";

    public static final String INTENT_APPLY = "apply";
    public static final String INTENT_SUPPORT = "support";

    private final Map<Journey, List<JourneyStep>> steps = new EnumMap<>(Journey.class);

    public JourneyDefinition() {
        steps.put(Journey.NONE, Collections.emptyList());
        steps.put(Journey.ONBOARDING, List.of(
                JourneyStep.builder(StepId.LANGUAGE_SELECT)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .language()
                        .option(OPTION_LANG_EN, "EN")
                        .option(OPTION_LANG_HI, "HI")
                        .prompt("language_prompt")
                        .next(StepId.INTENT_CONFIRM)
                        .build(),
                JourneyStep.builder(StepId.INTENT_CONFIRM)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .option(OPTION_GET_LOAN, INTENT_APPLY)
                        .option(OPTION_SUPPORT, INTENT_SUPPORT)
                        .prompt("main_offer_intro")
                        .next(StepId.NAME)
                        .build(),
                JourneyStep.builder(StepId.NAME)
                        .input(InputKind.FREE_TEXT, FieldKind.NAME)
                        .answer(Session.ANSWER_FULL_NAME)
                        .prompt("ask_name")
                        .next(StepId.DOB)
                        .build(),
                JourneyStep.builder(StepId.DOB)
                        .input(InputKind.FREE_TEXT, FieldKind.DATE)
                        .answer(Session.ANSWER_DOB)
                        .prompt("ask_dob")
                        .next(StepId.EMPLOYMENT)
                        .build(),
                JourneyStep.builder(StepId.EMPLOYMENT)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .answer(Session.ANSWER_EMPLOYMENT)
                        .option("emp_salaried", "Salaried")
                        .option("emp_self_employed", "Self-Employed")
                        .option("emp_others", "Others")
                        .prompt("ask_employment")
                        .next(StepId.INCOME)
                        .build(),
                JourneyStep.builder(StepId.INCOME)
                        .input(InputKind.FREE_TEXT, FieldKind.NUMERIC)
                        .answer(Session.ANSWER_MONTHLY_INCOME)
                        .prompt("ask_salary")
                        .next(StepId.PURPOSE)
                        .build(),
                JourneyStep.builder(StepId.PURPOSE)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .answer(Session.ANSWER_PURPOSE)
                        .option("purpose_personal", "Personal")
                        .option("purpose_education", "Education")
                        .option("purpose_medical", "Medical")
                        .option("purpose_home", "Home")
                        .option("purpose_travel", "Travel")
                        .option("purpose_others", "Others")
                        .prompt("ask_purpose")
                        .next(StepId.CONSENT)
                        .build(),
                JourneyStep.builder(StepId.CONSENT)
                        .input(InputKind.CHOICE, FieldKind.BOOLEAN)
                        .flag(Session.FLAG_CONSENT_GIVEN)
                        .option("consent_yes", "true")
                        .option("consent_no", "false")
                        .requiresAffirmative()
                        .prompt("ask_consent")
                        .next(StepId.OFFER_GENERATION)
                        .build(),
                JourneyStep.builder(StepId.OFFER_GENERATION)
                        .input(InputKind.NONE, FieldKind.NONE)
                        .effect(StepEffect.GENERATE_OFFERS)
                        .completes(Session.FLAG_OFFERS_GENERATED)
                        .prompt("decision_submit")
                        .next(StepId.OFFER_SELECTION)
                        .build(),
                JourneyStep.builder(StepId.OFFER_SELECTION)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .answer(Session.ANSWER_CHOSEN_OFFER)
                        .completes(Session.FLAG_OFFER_ACCEPTED)
                        .prompt("offers_prompt")
                        .next(StepId.KYC_ACK)
                        .build(),
                kycStep(StepId.SELFIE_ACK),
                selfieStep(StepId.BANK_DETAILS),
                JourneyStep.builder(StepId.BANK_DETAILS)
                        .input(InputKind.FREE_TEXT, FieldKind.BANK_DETAILS)
                        .answer(Session.ANSWER_BANK_DETAILS)
                        .prompt("ask_bank")
                        .acknowledge("bank_details_received")
                        .next(StepId.NACH_ACK)
                        .build(),
                JourneyStep.builder(StepId.NACH_ACK)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .option(OPTION_NACH_COMPLETE, "done")
                        .completes(Session.FLAG_NACH_COMPLETED)
                        .prompt("nach_prompt")
                        .next(StepId.AGREEMENT_ACK)
                        .build(),
                JourneyStep.builder(StepId.AGREEMENT_ACK)
                        .input(InputKind.CHOICE, FieldKind.BOOLEAN)
                        .flag(Session.FLAG_AGREEMENT_SIGNED)
                        .option("agree_yes", "true")
                        .option("agree_no", "false")
                        .requiresAffirmative()
                        .prompt("agreement_prompt")
                        .next(StepId.FINAL_DECISION)
                        .build(),
                JourneyStep.builder(StepId.FINAL_DECISION)
                        .input(InputKind.NONE, FieldKind.NONE)
                        .effect(StepEffect.FINAL_DECISION)
                        .completes(Session.FLAG_DECISION_COMPLETE)
                        .prompt("decision_final")
                        .build()));
        steps.put(Journey.KYC, List.of(
                kycStep(StepId.SELFIE_ACK),
                selfieStep(null)));
        steps.put(Journey.SUPPORT, List.of(
                JourneyStep.builder(StepId.SUPPORT_QUERY)
                        .input(InputKind.FREE_TEXT, FieldKind.TEXT)
                        .answer(Session.ANSWER_SUPPORT_QUESTION)
                        .reentrant()
                        .prompt("support_prompt")
                        .build()));
        steps.put(Journey.POST_LOAN, List.of(
                JourneyStep.builder(StepId.POST_LOAN_MENU)
                        .input(InputKind.CHOICE, FieldKind.CHOICE)
                        .option(OPTION_POST_VIEW, "view")
                        .option(OPTION_POST_DOWNLOAD, "download")
                        .option(OPTION_POST_REPAY, "repay")
                        .option(OPTION_POST_SUPPORT, "support")
                        .reentrant()
                        .prompt("post_loan_menu")
                        .build()));
        verifySuccessors();
    }

    private static JourneyStep kycStep(StepId next) {
        return JourneyStep.builder(StepId.KYC_ACK)
                .input(InputKind.CHOICE, FieldKind.CHOICE)
                .option(OPTION_KYC_COMPLETE, "done")
                .completes(Session.FLAG_KYC_COMPLETED)
                .prompt("ask_kyc")
                .acknowledge("kyc_completed")
                .next(next)
                .build();
    }

    private static JourneyStep selfieStep(StepId next) {
        return JourneyStep.builder(StepId.SELFIE_ACK)
                .input(InputKind.DOCUMENT, FieldKind.DOCUMENT)
                .completes(Session.FLAG_SELFIE_RECEIVED)
                .prompt("ask_selfie")
                .acknowledge("selfie_received")
                .next(next)
                .build();
    }

    private void verifySuccessors() {
        steps.forEach((journey, table) -> table.forEach(step -> step.getNext().ifPresent(next -> {
            if (stepOf(journey, next).isEmpty()) {
                throw new IllegalStateException("Step " + step.getId() + " of " + journey
                        + " points to unknown successor " + next);
            }
        })));
    }

    // ─────────────────── Lookups ───────────────────

    /**
     * @return ordered steps of a journey; empty for NONE
     */
    public List<JourneyStep> stepsOf(Journey journey) {
        return steps.getOrDefault(journey, Collections.emptyList());
    }

    /**
     * @return entry step, or empty for NONE
     */
    public Optional<JourneyStep> firstStep(Journey journey) {
        List<JourneyStep> table = stepsOf(journey);
        return table.isEmpty() ? Optional.empty() : Optional.of(table.get(0));
    }

    public Optional<JourneyStep> stepOf(Journey journey, StepId stepId) {
        if (stepId == null) {
            return Optional.empty();
        }
        return stepsOf(journey).stream().filter(s -> s.getId() == stepId).findFirst();
    }

    /**
     * Successor of a step.
     *
     * @return the next step, or empty when the step is terminal or re-entrant
     * @throws IllegalArgumentException if the step does not belong to the journey
     */
    public Optional<JourneyStep> nextStep(Journey journey, StepId stepId) {
        JourneyStep current = stepOf(journey, stepId)
                .orElseThrow(() -> new IllegalArgumentException(stepId + " is not a step of " + journey));
        return current.getNext().flatMap(next -> stepOf(journey, next));
    }

    /**
     * Session invariant check: the step belongs to the journey, or the journey
     * is NONE and there is no step.
     */
    public boolean isValid(Journey journey, StepId stepId) {
        if (journey == null) {
            return false;
        }
        if (journey == Journey.NONE) {
            return stepId == null;
        }
        return stepOf(journey, stepId).isPresent();
    }

    /**
     * @return true if some step of the journey writes {@code answers[field]}
     */
    public boolean declaresField(Journey journey, String field) {
        return stepsOf(journey).stream()
                .anyMatch(s -> s.getTarget() == JourneyStep.Target.ANSWER && s.getTargetName().equals(field));
    }
}
