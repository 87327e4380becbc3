package com.lending.dialog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.lending.dialog.domain.entity.JourneyStep;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.StepEffect;
import com.lending.dialog.domain.valueobject.StepId;

class JourneyDefinitionTest {

    private final JourneyDefinition journeys = new JourneyDefinition();

    @Test
    void testEveryJourneyTerminatesWithoutCycles() {
        for (Journey journey : Journey.values()) {
            if (journey == Journey.NONE) {
                continue;
            }
            // Given
            Set<StepId> visited = new HashSet<>();
            Optional<JourneyStep> step = journeys.firstStep(journey);

            // When
            while (step.isPresent()) {
                assertTrue(visited.add(step.get().getId()), "cycle at " + step.get().getId() + " in " + journey);
                step = journeys.nextStep(journey, step.get().getId());
            }

            // Then
            assertEquals(journeys.stepsOf(journey).size(), visited.size(), journey + " has unreachable steps");
        }
    }

    @Test
    void testOnboardingOrder() {
        // When
        JourneyStep first = journeys.firstStep(Journey.ONBOARDING).orElseThrow();

        // Then
        assertEquals(StepId.LANGUAGE_SELECT, first.getId());
        assertEquals(StepId.CONSENT, journeys.nextStep(Journey.ONBOARDING, StepId.PURPOSE).orElseThrow().getId());
        assertEquals(StepEffect.GENERATE_OFFERS,
                journeys.nextStep(Journey.ONBOARDING, StepId.CONSENT).orElseThrow().getEffect());
        assertTrue(journeys.nextStep(Journey.ONBOARDING, StepId.FINAL_DECISION).isEmpty());
    }

    @Test
    void testKycJourneyEndsAfterSelfie() {
        assertEquals(StepId.KYC_ACK, journeys.firstStep(Journey.KYC).orElseThrow().getId());
        assertTrue(journeys.nextStep(Journey.KYC, StepId.SELFIE_ACK).isEmpty());
    }

    @Test
    void testReentrantSteps() {
        assertTrue(journeys.firstStep(Journey.SUPPORT).orElseThrow().isReentrant());
        assertTrue(journeys.firstStep(Journey.POST_LOAN).orElseThrow().isReentrant());
        assertTrue(journeys.firstStep(Journey.NONE).isEmpty());
    }

    @Test
    void testIsValid() {
        assertTrue(journeys.isValid(Journey.NONE, null));
        assertFalse(journeys.isValid(Journey.NONE, StepId.NAME));
        assertTrue(journeys.isValid(Journey.ONBOARDING, StepId.BANK_DETAILS));
        assertFalse(journeys.isValid(Journey.ONBOARDING, StepId.POST_LOAN_MENU));
        assertFalse(journeys.isValid(Journey.KYC, StepId.NAME));
        assertFalse(journeys.isValid(Journey.SUPPORT, null));
        assertFalse(journeys.isValid(null, null));
    }

    @Test
    void testNextStep_UnknownStepRejected() {
        assertThrows(IllegalArgumentException.class, () -> journeys.nextStep(Journey.KYC, StepId.INCOME));
    }

    @Test
    void testDeclaresField() {
        assertTrue(journeys.declaresField(Journey.ONBOARDING, Session.ANSWER_MONTHLY_INCOME));
        assertTrue(journeys.declaresField(Journey.SUPPORT, Session.ANSWER_SUPPORT_QUESTION));
        assertFalse(journeys.declaresField(Journey.KYC, Session.ANSWER_FULL_NAME));
    }
}
