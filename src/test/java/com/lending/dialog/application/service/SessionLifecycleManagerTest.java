package com.lending.dialog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;

class SessionLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final SessionLifecycleManager lifecycle = new SessionLifecycleManager(Duration.ofMinutes(30));

    @Test
    void testTwentyNineMinutesIdle_KeptAndTouched() {
        // Given
        Session session = sessionIdleFor(Duration.ofMinutes(29));

        // When
        SessionLifecycleManager.Check check = lifecycle.check(session, NOW);

        // Then
        assertFalse(check.reset());
        assertEquals(StepId.INCOME, check.session().getCurrentStep());
        assertEquals(NOW, check.session().getLastActivityAt());
    }

    @Test
    void testThirtyOneMinutesIdle_ResetKeepsLanguage() {
        // Given
        Session session = sessionIdleFor(Duration.ofMinutes(31));

        // When
        SessionLifecycleManager.Check check = lifecycle.check(session, NOW);

        // Then
        assertTrue(check.reset());
        assertTrue(check.wasInJourney());
        assertEquals(Journey.NONE, check.session().getJourney());
        assertNull(check.session().getCurrentStep());
        assertTrue(check.session().getAnswers().isEmpty());
        assertEquals(Language.HI, check.session().getLanguage());
        assertEquals(session.getVersion(), check.session().getVersion());
    }

    @Test
    void testStaleAtMenu_NotInJourney() {
        // Given
        Session idle = Session.reconstruct("u1", Journey.NONE, null, Map.of(), Map.of(), Language.EN, List.of(),
                NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofHours(3)), 5L);

        // When
        SessionLifecycleManager.Check check = lifecycle.check(idle, NOW);

        // Then
        assertTrue(check.reset());
        assertFalse(check.wasInJourney());
    }

    private static Session sessionIdleFor(Duration idle) {
        return Session.reconstruct("u1", Journey.ONBOARDING, StepId.INCOME, Map.of(Session.ANSWER_FULL_NAME, "Jane"),
                Map.of(), Language.HI, List.of(), NOW.minus(Duration.ofHours(1)), NOW.minus(idle), 5L);
    }
}
